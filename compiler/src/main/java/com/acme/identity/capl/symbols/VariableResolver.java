package com.acme.identity.capl.symbols;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.ast.Branch;
import com.acme.identity.capl.ast.BranchBody;
import com.acme.identity.capl.ast.Category;
import com.acme.identity.capl.ast.Condition;
import com.acme.identity.capl.ast.GrantControl;
import com.acme.identity.capl.ast.IfStatement;
import com.acme.identity.capl.ast.MatchOperator;
import com.acme.identity.capl.ast.Operand;
import com.acme.identity.capl.ast.VarDecl;
import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.diag.ErrorCode;
import com.acme.identity.capl.diag.SemanticException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Replaces every {@link Operand.Reference} with the literal or declared entity it names.
 *
 * <p>With {@code is}, a category literal takes precedence over a variable of the same name. With
 * {@code in}, and in categories without named entities, only one interpretation applies. Every failing
 * reference in a tree is reported, not only the first.</p>
 */
public final class VariableResolver {
    private final SymbolTable symbols;
    private final IntFunction<String> sourceLine;

    public VariableResolver(SymbolTable symbols, IntFunction<String> sourceLine) {
        this.symbols = symbols;
        this.sourceLine = sourceLine;
    }

    public TreeResolution resolve(int treeIndex, IfStatement tree) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        IfStatement resolved = resolveStatement(tree, diagnostics);
        return new TreeResolution(treeIndex, resolved, diagnostics);
    }

    private IfStatement resolveStatement(IfStatement stmt, List<Diagnostic> diagnostics) {
        Branch ifBranch = resolveBranch(stmt.ifBranch(), diagnostics);
        List<Branch> elseIfs = new ArrayList<>(stmt.elseIfBranches().size());
        for (Branch b : stmt.elseIfBranches()) {
            elseIfs.add(resolveBranch(b, diagnostics));
        }
        Branch elseBranch = stmt.hasElse() ? resolveBranch(stmt.elseBranch(), diagnostics) : null;
        return new IfStatement(ifBranch, elseIfs, elseBranch, stmt.line());
    }

    private Branch resolveBranch(Branch branch, List<Diagnostic> diagnostics) {
        List<Condition> conditions = new ArrayList<>(branch.conditions().size());
        for (Condition c : branch.conditions()) {
            conditions.add(resolveCondition(c, diagnostics));
        }
        BranchBody body;
        if (branch.body() instanceof BranchBody.NestedIf nested) {
            body = new BranchBody.NestedIf(resolveStatement(nested.statement(), diagnostics));
        } else {
            List<Action> actions = new ArrayList<>();
            for (Action a : ((BranchBody.ActionList) branch.body()).actions()) {
                actions.add(resolveAction(a, diagnostics));
            }
            body = new BranchBody.ActionList(actions);
        }
        return branch.withConditionsAndBody(conditions, body);
    }

    private Condition resolveCondition(Condition condition, List<Diagnostic> diagnostics) {
        List<Operand> values = new ArrayList<>(condition.values().size());
        for (Operand value : condition.values()) {
            try {
                values.add(resolveValue(condition, value));
            } catch (SemanticException e) {
                diagnostics.add(e.diagnostic());
                values.add(value);
            }
        }
        return condition.withValues(values);
    }

    Operand resolveValue(Condition condition, Operand value) throws SemanticException {
        Category category = condition.category();
        int line = condition.line();
        if (value instanceof Operand.Entity entity) {
            requireIdentifier(entity, line);
            return entity;
        }
        if (!(value instanceof Operand.Reference ref)) {
            return value;
        }
        String name = ref.name();
        if (condition.operator() == MatchOperator.IS && category.isLiteral(name)) {
            return new Operand.Literal(name);
        }
        if (!category.supportsMembership()) {
            throw new SemanticException(ErrorCode.UNKNOWN_LITERAL,
                "'" + name + "' is not a valid " + category.keyword() + " value", line, sourceLine.apply(line));
        }
        return entityFor(name, line);
    }

    private Action resolveAction(Action action, List<Diagnostic> diagnostics) {
        if (!(action instanceof Action.Grant grant)) {
            return action;
        }
        Operand control = grant.control();
        Operand alternate = grant.alternate();
        try {
            control = resolveControl(control, grant.line());
        } catch (SemanticException e) {
            diagnostics.add(e.diagnostic());
        }
        if (alternate != null) {
            try {
                alternate = resolveControl(alternate, grant.line());
            } catch (SemanticException e) {
                diagnostics.add(e.diagnostic());
            }
        }
        return new Action.Grant(control, alternate, grant.line());
    }

    private Operand resolveControl(Operand control, int line) throws SemanticException {
        if (control instanceof Operand.Entity entity) {
            requireIdentifier(entity, line);
            return entity;
        }
        if (control instanceof Operand.Reference ref) {
            if (GrantControl.fromKeyword(ref.name()).isPresent()) {
                return new Operand.Literal(ref.name());
            }
            return entityFor(ref.name(), line);
        }
        return control;
    }

    private Operand.Entity entityFor(String name, int line) throws SemanticException {
        VarDecl decl = symbols.lookup(name).orElse(null);
        if (decl == null) {
            String message = symbols.rejected(name)
                .map(bad -> "variable '" + name + "' refers to the invalid declaration on line " + bad.line())
                .orElse("undeclared variable '" + name + "'");
            throw new SemanticException(ErrorCode.UNDECLARED_VARIABLE, message, line, sourceLine.apply(line));
        }
        if (decl.line() > line) {
            throw new SemanticException(ErrorCode.VARIABLE_USED_BEFORE_DECLARATION,
                "variable '" + name + "' is used before its declaration on line " + decl.line(),
                line, sourceLine.apply(line));
        }
        return new Operand.Entity(decl.label(), decl.identifier());
    }

    private void requireIdentifier(Operand.Entity entity, int line) throws SemanticException {
        if (entity.identifier().isBlank()) {
            throw new SemanticException(ErrorCode.EMPTY_IDENTIFIER,
                "\"" + entity.label() + "\" has an empty identifier", line, sourceLine.apply(line));
        }
    }
}
