package com.acme.identity.capl.transport.http;

import com.acme.identity.capl.compiler.CaplCompiler;
import com.acme.identity.capl.compiler.CompilerConfig;

import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class CompileServerMain {
    private static final Logger LOG = Logger.getLogger(CompileServerMain.class.getName());

    private CompileServerMain() {
    }

    public static void main(String[] args) throws Exception {
        CompilerConfig config = CompilerConfig.fromEnv();
        int port = args.length > 0 ? Integer.parseInt(args[0]) : config.httpPort();

        NettyCompileHttpServer server = new NettyCompileHttpServer(
            port, config.maxSourceBytes(), new CaplCompiler(config), config.namePrefix());
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            try {
                server.stop();
            } finally {
                shutdownLatch.countDown();
            }
        }, "capl-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        server.start();
        LOG.info(() -> "Compile server ready; name prefix " + config.namePrefix());
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            server.stop();
        }
    }
}
