package com.acme.identity.capl.compiler;

import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.diag.ErrorCode;
import com.acme.identity.capl.emit.GeneratedPolicy;
import com.acme.identity.capl.emit.PolicyNamer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles independent units on a fixed pool of daemon workers. Results come back in input order.
 *
 * <p>With more than one unit, each unit's display names are prefixed with the unit name as well.
 * Unit names that sanitize to the same prefix get the unit's 1-based position appended. Any display
 * name still produced twice is kept for the first unit only; later copies are dropped with a
 * {@link ErrorCode#DUPLICATE_POLICY_NAME} diagnostic on the unit that lost.</p>
 */
public final class BatchCompiler implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(BatchCompiler.class.getName());

    private final PolicyCompiler compiler;
    private final String namePrefix;
    private final ExecutorService workers;

    public BatchCompiler(CompilerConfig config) {
        this(new CaplCompiler(config), config.namePrefix(), config.workers());
    }

    public BatchCompiler(PolicyCompiler compiler, String namePrefix, int workerCount) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.namePrefix = Objects.requireNonNull(namePrefix, "namePrefix");
        AtomicInteger ids = new AtomicInteger(1);
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerCount), r -> {
            Thread t = new Thread(r, "capl-compiler-" + ids.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    public List<UnitResult> compileAll(List<SourceUnit> units) throws InterruptedException {
        List<String> prefixes = unitPrefixes(namePrefix, units);
        List<Future<CompileResult>> futures = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            SourceUnit unit = units.get(i);
            String prefix = prefixes.get(i);
            futures.add(workers.submit(() -> compiler.compile(unit.source(), prefix)));
        }

        List<UnitResult> out = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            SourceUnit unit = units.get(i);
            try {
                CompileResult result = futures.get(i).get();
                out.add(new UnitResult(unit, result));
                LOG.fine(() -> "Compiled " + unit.name() + ": " + result.policies().size() + " policies, "
                    + result.diagnostics().size() + " diagnostics");
            } catch (ExecutionException e) {
                LOG.log(Level.SEVERE, "Compiler failure on " + unit.name(), e.getCause());
                throw new IllegalStateException("compiler failed on " + unit.name(), e.getCause());
            }
        }
        return dropDuplicateNames(out);
    }

    static List<String> unitPrefixes(String namePrefix, List<SourceUnit> units) {
        List<String> prefixes = new ArrayList<>(units.size());
        if (units.size() <= 1) {
            units.forEach(u -> prefixes.add(namePrefix));
            return prefixes;
        }
        Set<String> used = new HashSet<>();
        for (int i = 0; i < units.size(); i++) {
            String base = PolicyNamer.sanitizePrefix(namePrefix + "-" + units.get(i).name());
            String candidate = base;
            while (!used.add(candidate)) {
                candidate = candidate + "-" + (i + 1);
            }
            prefixes.add(candidate);
        }
        return prefixes;
    }

    static List<UnitResult> dropDuplicateNames(List<UnitResult> results) {
        Map<String, String> owners = new HashMap<>();
        List<UnitResult> out = new ArrayList<>(results.size());
        for (UnitResult r : results) {
            List<GeneratedPolicy> kept = new ArrayList<>(r.result().policies().size());
            List<Diagnostic> dropped = new ArrayList<>();
            for (GeneratedPolicy p : r.result().policies()) {
                String owner = owners.putIfAbsent(p.displayName(), r.unit().name());
                if (owner == null) {
                    kept.add(p);
                } else {
                    LOG.warning(() -> "Duplicate display name " + p.displayName() + " in " + r.unit().name());
                    dropped.add(Diagnostic.of(ErrorCode.DUPLICATE_POLICY_NAME,
                        "display name '" + p.displayName() + "' already generated from " + owner, 0, ""));
                }
            }
            if (dropped.isEmpty()) {
                out.add(r);
            } else {
                List<Diagnostic> diags = new ArrayList<>(r.result().diagnostics());
                diags.addAll(dropped);
                out.add(new UnitResult(r.unit(), new CompileResult(kept, diags)));
            }
        }
        return out;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
