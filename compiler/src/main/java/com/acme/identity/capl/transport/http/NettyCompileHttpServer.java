package com.acme.identity.capl.transport.http;

import com.acme.identity.capl.compiler.CompileResult;
import com.acme.identity.capl.compiler.PolicyCompiler;
import com.acme.identity.capl.util.CompileEndpoints;
import com.acme.identity.capl.util.CompilerDefaults;
import com.acme.identity.capl.util.JsonCodec;
import com.acme.identity.capl.util.StatusCodes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front end for the compiler.
 *
 * <ul>
 *   <li>{@code POST /v1/compile}: body is CAPL source ({@code text/plain}) or
 *       {@code {"source": "...", "namePrefix": "..."}} ({@code application/json}). Answers
 *       {@code {"policies": [...], "diagnostics": [...]}} with 200 when clean, 422 otherwise.</li>
 *   <li>{@code GET /healthz}: {@code ok}.</li>
 * </ul>
 */
public final class NettyCompileHttpServer implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(NettyCompileHttpServer.class.getName());

    private final int port;
    private final int maxSourceBytes;
    private final PolicyCompiler compiler;
    private final String defaultNamePrefix;

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public NettyCompileHttpServer(int port, int maxSourceBytes, PolicyCompiler compiler, String defaultNamePrefix) {
        this.port = port;
        this.maxSourceBytes = maxSourceBytes;
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.defaultNamePrefix = Objects.requireNonNull(defaultNamePrefix, "defaultNamePrefix");
    }

    public synchronized void start() throws Exception {
        if (serverChannel != null) {
            return;
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, CompilerDefaults.SO_BACKLOG)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(maxSourceBytes));
                        ch.pipeline().addLast(new CompileHandler());
                    }
                });

            serverChannel = bootstrap.bind(port).sync().channel();
            LOG.info(() -> "CAPL compile endpoint listening on port " + listenPort());
        } catch (Exception e) {
            stop();
            throw e;
        }
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int listenPort() {
        Channel ch = serverChannel;
        if (ch != null && ch.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return port;
    }

    public synchronized void stop() {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }

        EventLoopGroup workers = workerGroup;
        workerGroup = null;
        if (workers != null) {
            workers.shutdownGracefully().syncUninterruptibly();
        }

        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully().syncUninterruptibly();
        }

        LOG.info("CAPL compile endpoint stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private final class CompileHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
            if (!req.decoderResult().isSuccess()) {
                writeText(ctx, req, HttpResponseStatus.BAD_REQUEST, "bad request");
                return;
            }
            String path = CompileEndpoints.stripQuery(req.uri());
            if (path.equals(CompileEndpoints.HEALTH_PATH)) {
                if (req.method() != HttpMethod.GET) {
                    writeText(ctx, req, HttpResponseStatus.METHOD_NOT_ALLOWED, "method not allowed");
                    return;
                }
                writeText(ctx, req, HttpResponseStatus.OK, "ok");
                return;
            }
            if (!path.equals(CompileEndpoints.COMPILE_PATH)) {
                writeText(ctx, req, HttpResponseStatus.NOT_FOUND, "unknown path");
                return;
            }
            if (req.method() != HttpMethod.POST) {
                writeText(ctx, req, HttpResponseStatus.METHOD_NOT_ALLOWED, "method not allowed");
                return;
            }

            String contentType = req.headers().get(HttpHeaderNames.CONTENT_TYPE);
            String body = req.content().toString(StandardCharsets.UTF_8);
            CompileRequest request;
            if (CompileEndpoints.isPlainText(contentType)) {
                request = new CompileRequest(body, defaultNamePrefix);
            } else if (CompileEndpoints.isJson(contentType)) {
                try {
                    request = parseJsonRequest(body);
                } catch (JsonProcessingException | IllegalArgumentException e) {
                    writeText(ctx, req, HttpResponseStatus.BAD_REQUEST, "invalid compile request: " + e.getMessage());
                    return;
                }
            } else {
                writeText(ctx, req, HttpResponseStatus.UNSUPPORTED_MEDIA_TYPE,
                    "supported content-types: text/plain, application/json");
                return;
            }

            try {
                CompileResult result = compiler.compile(request.source(), request.namePrefix());
                int status = result.isClean() ? StatusCodes.OK : StatusCodes.UNPROCESSABLE_ENTITY;
                LOG.fine(() -> "compile request: " + result.policies().size() + " policies, "
                    + result.diagnostics().size() + " diagnostics");
                write(ctx, req, HttpResponseStatus.valueOf(status), JsonCodec.writeString(result), CompileEndpoints.JSON);
            } catch (Exception e) {
                LOG.log(Level.WARNING, "compile request failed", e);
                writeText(ctx, req, HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOG.log(Level.SEVERE, "HTTP pipeline failure", cause);
            ctx.close();
        }
    }

    private CompileRequest parseJsonRequest(String body) throws JsonProcessingException {
        JsonNode root = JsonCodec.readTree(body);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("expected a JSON object");
        }
        JsonNode source = root.get("source");
        if (source == null || !source.isTextual()) {
            throw new IllegalArgumentException("missing required text field: source");
        }
        JsonNode prefix = root.get("namePrefix");
        String namePrefix = prefix == null || !prefix.isTextual() || prefix.asText().isBlank()
            ? defaultNamePrefix
            : prefix.asText().trim();
        return new CompileRequest(source.asText(), namePrefix);
    }

    private record CompileRequest(String source, String namePrefix) {}

    private static void writeText(ChannelHandlerContext ctx, FullHttpRequest req, HttpResponseStatus status, String message) {
        write(ctx, req, status, message, CompileEndpoints.TEXT_PLAIN);
    }

    private static void write(ChannelHandlerContext ctx,
                              FullHttpRequest req,
                              HttpResponseStatus status,
                              String message,
                              String contentType) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        ByteBuf buf = ctx.alloc().buffer(bytes.length);
        buf.writeBytes(bytes);
        FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, buf);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType + "; charset=utf-8");
        response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);

        boolean keepAlive = HttpUtil.isKeepAlive(req);
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }
}
