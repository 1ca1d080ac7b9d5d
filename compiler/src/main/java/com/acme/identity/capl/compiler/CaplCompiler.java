package com.acme.identity.capl.compiler;

import com.acme.identity.capl.ast.IfStatement;
import com.acme.identity.capl.ast.Program;
import com.acme.identity.capl.diag.CompileException;
import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.emit.GeneratedPolicy;
import com.acme.identity.capl.emit.PolicyEmitter;
import com.acme.identity.capl.emit.PolicyNamer;
import com.acme.identity.capl.lexer.LexResult;
import com.acme.identity.capl.lexer.Lexer;
import com.acme.identity.capl.normalize.ActionNormalizer;
import com.acme.identity.capl.normalize.ActionSet;
import com.acme.identity.capl.normalize.ConditionNormalizer;
import com.acme.identity.capl.normalize.NormalizedConditions;
import com.acme.identity.capl.parser.ParseResult;
import com.acme.identity.capl.parser.Parser;
import com.acme.identity.capl.paths.PathEnumerator;
import com.acme.identity.capl.paths.PolicyPath;
import com.acme.identity.capl.symbols.SymbolTable;
import com.acme.identity.capl.symbols.TreeResolution;
import com.acme.identity.capl.symbols.VariableResolver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lexer, parser, resolver, path enumerator, normalizers and emitter chained into one pure function.
 *
 * <p>A tree with any resolution, action, contradiction or negation error contributes no policies; all of its
 * diagnostics are still reported. Leaf indexes are assigned before that filtering, so a failing tree
 * does not renumber the policies of the trees after it.</p>
 */
public final class CaplCompiler implements PolicyCompiler {
    private final int nameMaxLength;

    public CaplCompiler(int nameMaxLength) {
        this.nameMaxLength = nameMaxLength;
    }

    public CaplCompiler(CompilerConfig config) {
        this(config.nameMaxLength());
    }

    @Override
    public CompileResult compile(String source, String namePrefix) {
        LexResult lex = Lexer.tokenize(source);
        List<Diagnostic> diagnostics = new ArrayList<>(lex.diagnostics());

        ParseResult parsed = Parser.parse(lex);
        diagnostics.addAll(parsed.diagnostics());
        Program program = parsed.program();

        SymbolTable symbols = SymbolTable.build(program.variables(), lex::sourceLine);
        diagnostics.addAll(symbols.diagnostics());

        VariableResolver resolver = new VariableResolver(symbols, lex::sourceLine);
        PathEnumerator enumerator = new PathEnumerator();
        ConditionNormalizer conditionNormalizer = new ConditionNormalizer(lex::sourceLine);
        ActionNormalizer actionNormalizer = new ActionNormalizer(lex::sourceLine);
        PolicyEmitter emitter = new PolicyEmitter(new PolicyNamer(namePrefix, nameMaxLength));

        List<GeneratedPolicy> policies = new ArrayList<>();
        List<IfStatement> trees = program.trees();
        for (int i = 0; i < trees.size(); i++) {
            TreeResolution resolution = resolver.resolve(i, trees.get(i));
            List<PolicyPath> paths = enumerator.enumerate(i, resolution.tree());
            Set<Diagnostic> treeDiagnostics = new LinkedHashSet<>(resolution.diagnostics());
            List<GeneratedPolicy> treePolicies = new ArrayList<>(paths.size());
            if (resolution.isClean()) {
                for (PolicyPath path : paths) {
                    GeneratedPolicy policy = compilePath(path, conditionNormalizer, actionNormalizer, emitter, treeDiagnostics);
                    if (policy != null) {
                        treePolicies.add(policy);
                    }
                }
            }
            if (treeDiagnostics.isEmpty()) {
                policies.addAll(treePolicies);
            } else {
                diagnostics.addAll(treeDiagnostics);
            }
        }

        diagnostics.sort(Comparator.comparingInt(Diagnostic::line));
        return new CompileResult(policies, diagnostics);
    }

    private static GeneratedPolicy compilePath(PolicyPath path,
                                               ConditionNormalizer conditionNormalizer,
                                               ActionNormalizer actionNormalizer,
                                               PolicyEmitter emitter,
                                               Set<Diagnostic> treeDiagnostics) {
        NormalizedConditions conditions = null;
        ActionSet actions = null;
        try {
            conditions = conditionNormalizer.normalize(path.conditions());
        } catch (CompileException e) {
            treeDiagnostics.add(e.diagnostic());
        }
        try {
            actions = actionNormalizer.normalize(path.actions());
        } catch (CompileException e) {
            treeDiagnostics.add(e.diagnostic());
        }
        if (conditions == null || actions == null) {
            return null;
        }
        return emitter.emit(path, conditions, actions);
    }
}
