package com.acme.identity.capl.symbols;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.ast.BranchBody;
import com.acme.identity.capl.ast.Condition;
import com.acme.identity.capl.ast.Operand;
import com.acme.identity.capl.ast.VarDecl;
import com.acme.identity.capl.diag.DiagnosticKind;
import com.acme.identity.capl.diag.ErrorCode;
import com.acme.identity.capl.lexer.LexResult;
import com.acme.identity.capl.lexer.Lexer;
import com.acme.identity.capl.parser.ParseResult;
import com.acme.identity.capl.parser.Parser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VariableResolverTest {

    @Test
    void shouldKeepFirstDeclarationAndRejectDuplicatesAndEmptyIds() {
        SymbolTable table = SymbolTable.build(List.of(
            new VarDecl("A", "First", "id-1", 1),
            new VarDecl("A", "Second", "id-2", 2),
            new VarDecl("B", "Blank", "  ", 3)
        ), line -> "line " + line);

        assertEquals(1, table.size());
        assertEquals("id-1", table.lookup("A").orElseThrow().identifier());
        assertTrue(table.lookup("B").isEmpty());
        assertEquals(2, table.diagnostics().size());
        assertEquals(ErrorCode.DUPLICATE_VARIABLE, table.diagnostics().get(0).code());
        assertEquals("line 2", table.diagnostics().get(0).sourceText());
        assertEquals(ErrorCode.EMPTY_IDENTIFIER, table.diagnostics().get(1).code());
    }

    @Test
    void shouldResolveLiteralsVariablesAndGrantControls() {
        TreeResolution r = resolveFirst("""
            VAR Corp = "Corporate Network" [loc-1]
            VAR Terms = "Terms of Use" [tou-1]
            IF location in Corp
                location NOT is Trusted
                STATE enabled
                REQUIRE MFA OR Terms
            END
            """);

        assertTrue(r.isClean(), () -> r.diagnostics().toString());
        List<Condition> conditions = r.tree().ifBranch().conditions();
        assertEquals(List.of(new Operand.Entity("Corporate Network", "loc-1")), conditions.get(0).values());
        assertEquals(List.of(new Operand.Literal("Trusted")), conditions.get(1).values());
        Action.Grant grant = (Action.Grant) ((BranchBody.ActionList) r.tree().ifBranch().body()).actions().get(0);
        assertEquals(new Operand.Literal("MFA"), grant.control());
        assertEquals(new Operand.Entity("Terms of Use", "tou-1"), grant.alternate());
    }

    @Test
    void shouldPreferLiteralOverSameNamedVariableWithIs() {
        TreeResolution r = resolveFirst("""
            VAR All = "Shadow" [x-1]
            IF user is All
                user in group All
                STATE enabled
                BLOCK
            END
            """);

        assertTrue(r.isClean());
        assertEquals(new Operand.Literal("All"), r.tree().ifBranch().conditions().get(0).values().get(0));
        assertEquals(new Operand.Entity("Shadow", "x-1"), r.tree().ifBranch().conditions().get(1).values().get(0));
    }

    @Test
    void shouldReportEveryUndeclaredReferenceInTree() {
        TreeResolution r = resolveFirst("""
            IF user in group Finance
                STATE enabled
                IF app in Payroll
                    STATE enabled
                    REQUIRE Consent
                END
            END
            """);

        assertFalse(r.isClean());
        assertEquals(3, r.diagnostics().size());
        assertEquals(ErrorCode.UNDECLARED_VARIABLE, r.diagnostics().get(0).code());
        assertEquals(DiagnosticKind.SEMANTIC_ERROR, r.diagnostics().get(0).kind());
        assertTrue(r.diagnostics().get(0).message().contains("Finance"));
        assertTrue(r.diagnostics().get(1).message().contains("Payroll"));
        assertTrue(r.diagnostics().get(2).message().contains("Consent"));
    }

    @Test
    void shouldRejectUseBeforeDeclarationAndUnknownLiteral() {
        TreeResolution r = resolveFirst("""
            IF user in group Finance
                platform is BeOS
                STATE enabled
                BLOCK
            END
            VAR Finance = "Finance" [g-1]
            """);

        assertEquals(2, r.diagnostics().size());
        assertEquals(ErrorCode.VARIABLE_USED_BEFORE_DECLARATION, r.diagnostics().get(0).code());
        assertEquals(ErrorCode.UNKNOWN_LITERAL, r.diagnostics().get(1).code());
        assertEquals(2, r.diagnostics().get(1).line());
    }

    private static TreeResolution resolveFirst(String source) {
        LexResult lex = Lexer.tokenize(source);
        ParseResult parsed = Parser.parse(lex);
        assertTrue(parsed.diagnostics().isEmpty(), () -> parsed.diagnostics().toString());
        SymbolTable table = SymbolTable.build(parsed.program().variables(), lex::sourceLine);
        return new VariableResolver(table, lex::sourceLine).resolve(0, parsed.program().trees().get(0));
    }
}
