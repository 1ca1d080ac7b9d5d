package com.acme.identity.capl.parser;

import com.acme.identity.capl.ast.Action;
import com.acme.identity.capl.ast.Branch;
import com.acme.identity.capl.ast.BranchBody;
import com.acme.identity.capl.ast.BranchKind;
import com.acme.identity.capl.ast.BranchState;
import com.acme.identity.capl.ast.Category;
import com.acme.identity.capl.ast.Condition;
import com.acme.identity.capl.ast.IfStatement;
import com.acme.identity.capl.ast.MatchOperator;
import com.acme.identity.capl.ast.MemberKind;
import com.acme.identity.capl.ast.Operand;
import com.acme.identity.capl.ast.Program;
import com.acme.identity.capl.ast.SessionKind;
import com.acme.identity.capl.ast.VarDecl;
import com.acme.identity.capl.diag.CompileException;
import com.acme.identity.capl.diag.Diagnostic;
import com.acme.identity.capl.diag.ErrorCode;
import com.acme.identity.capl.diag.SemanticException;
import com.acme.identity.capl.diag.SyntaxException;
import com.acme.identity.capl.lexer.LexResult;
import com.acme.identity.capl.lexer.Token;
import com.acme.identity.capl.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser over the lexer's token stream. One method per production.
 *
 * <p>Statements are line oriented: every condition, STATE and action occupies its own line. A failing
 * top-level statement (VAR or IF ... END) is reported once and skipped; parsing resumes at the next
 * top-level statement.</p>
 */
public final class Parser {
    /** Deepest accepted IF nesting, top-level IF included. */
    public static final int MAX_NESTING_DEPTH = 128;

    private final LexResult lex;
    private final List<Token> tokens;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int pos;
    private int depth;

    private Parser(LexResult lex) {
        this.lex = lex;
        List<Token> filtered = new ArrayList<>(lex.tokens().size());
        for (Token t : lex.tokens()) {
            if (!t.is(TokenKind.COMMENT)) {
                filtered.add(t);
            }
        }
        if (filtered.isEmpty() || !filtered.get(filtered.size() - 1).is(TokenKind.EOF)) {
            filtered.add(new Token(TokenKind.EOF, "", lex.sourceLines().size(), 1));
        }
        this.tokens = filtered;
    }

    public static ParseResult parse(LexResult lex) {
        Parser parser = new Parser(lex);
        return parser.parseProgram();
    }

    private ParseResult parseProgram() {
        List<VarDecl> variables = new ArrayList<>();
        List<IfStatement> trees = new ArrayList<>();
        skipNewlines();
        while (!raw(pos).is(TokenKind.EOF)) {
            int start = pos;
            try {
                Token head = peek();
                if (head.isKeyword("VAR")) {
                    variables.add(parseVarDecl());
                } else if (head.isKeyword("IF")) {
                    trees.add(parseIfStatement());
                } else {
                    throw syntax(ErrorCode.UNEXPECTED_TOKEN,
                        "expected VAR or IF at top level but found " + head.describe(), head);
                }
            } catch (CompileException e) {
                diagnostics.add(e.diagnostic());
                resynchronize(start);
            } catch (AbortStatement e) {
                resynchronize(start);
            }
            skipNewlinesRaw();
        }
        return new ParseResult(new Program(variables, trees), diagnostics);
    }

    // VarDecl = "VAR" Ident "=" String "[" Token "]"
    private VarDecl parseVarDecl() throws CompileException {
        Token varTok = advance();
        Token name = peek();
        if (!name.is(TokenKind.IDENTIFIER)) {
            throw syntax(ErrorCode.MALFORMED_VAR, "expected variable name after VAR but found " + name.describe(), name);
        }
        advance();
        Token eq = peek();
        if (!eq.is(TokenKind.EQUALS)) {
            throw syntax(ErrorCode.MALFORMED_VAR, "expected '=' after " + name.lexeme() + " but found " + eq.describe(), eq);
        }
        advance();
        Token label = peek();
        if (!label.is(TokenKind.STRING)) {
            throw syntax(ErrorCode.MALFORMED_VAR, "expected quoted display name but found " + label.describe(), label);
        }
        advance();
        Token id = peek();
        if (!id.is(TokenKind.BRACKET_IDENTIFIER)) {
            throw syntax(ErrorCode.MALFORMED_VAR, "expected [identifier] after \"" + label.lexeme() + "\" but found "
                + id.describe(), id);
        }
        advance();
        expectEndOfLine();
        return new VarDecl(name.lexeme(), label.lexeme(), id.lexeme(), varTok.line());
    }

    private IfStatement parseIfStatement() throws CompileException {
        Token ifTok = advance();
        if (depth >= MAX_NESTING_DEPTH) {
            throw syntax(ErrorCode.NESTING_TOO_DEEP, "IF nested deeper than " + MAX_NESTING_DEPTH + " levels", ifTok);
        }
        depth++;
        try {
            return parseIfBody(ifTok);
        } finally {
            depth--;
        }
    }

    private IfStatement parseIfBody(Token ifTok) throws CompileException {
        Branch ifBranch = parseBranch(BranchKind.IF, ifTok);
        List<Branch> elseIfs = new ArrayList<>();
        Branch elseBranch = null;
        while (true) {
            skipNewlines();
            Token t = peek();
            if (t.isKeyword("END")) {
                advance();
                expectEndOfLine();
                return new IfStatement(ifBranch, elseIfs, elseBranch, ifTok.line());
            }
            if (t.isKeyword("ELSE")) {
                advance();
                if (peek().isKeyword("IF")) {
                    if (elseBranch != null) {
                        throw syntax(ErrorCode.DUPLICATE_ELSE, "ELSE IF after the terminal ELSE of line "
                            + elseBranch.line(), t);
                    }
                    advance();
                    elseIfs.add(parseBranch(BranchKind.ELSE_IF, t));
                } else {
                    if (elseBranch != null) {
                        throw syntax(ErrorCode.DUPLICATE_ELSE, "second ELSE for IF on line " + ifTok.line(), t);
                    }
                    expectEndOfLine();
                    elseBranch = parseBranch(BranchKind.ELSE, t);
                }
                continue;
            }
            if (t.is(TokenKind.EOF) || t.isKeyword("VAR") || t.isKeyword("IF")) {
                throw syntax(ErrorCode.MISSING_END, "expected END to close IF on line " + ifTok.line()
                    + " but found " + t.describe(), t);
            }
            throw syntax(ErrorCode.UNEXPECTED_TOKEN, "expected ELSE or END but found " + t.describe(), t);
        }
    }

    private Branch parseBranch(BranchKind kind, Token opener) throws CompileException {
        List<Condition> conditions = new ArrayList<>();
        if (kind != BranchKind.ELSE && !atEndOfLine()) {
            conditions.add(parseCondition());
            expectEndOfLine();
        } else if (kind != BranchKind.ELSE) {
            expectEndOfLine();
        }

        while (true) {
            skipNewlines();
            Token t = peek();
            if (t.isKeyword("STATE")) {
                break;
            }
            if (isActionStart(t)) {
                throw syntax(ErrorCode.ACTION_BEFORE_STATE, "expected STATE before action " + t.describe(), t);
            }
            if (kind == BranchKind.ELSE || isBlockKeyword(t) || t.is(TokenKind.EOF)) {
                throw syntax(ErrorCode.MISSING_STATE, "expected STATE in " + describe(kind) + " on line "
                    + opener.line() + " but found " + t.describe(), t);
            }
            conditions.add(parseCondition());
            expectEndOfLine();
        }
        if (kind != BranchKind.ELSE && conditions.isEmpty()) {
            throw new SemanticException(ErrorCode.EMPTY_CONDITION_LIST,
                describe(kind) + " has no conditions", opener.line(), sourceLine(opener.line()));
        }

        Token stateTok = advance();
        BranchState state = parseState();
        BranchBody body = parsePayload(stateTok);
        return new Branch(kind, conditions, state, body, opener.line());
    }

    private BranchState parseState() throws CompileException {
        Token value = peek();
        if (!value.is(TokenKind.IDENTIFIER)) {
            throw syntax(ErrorCode.INVALID_STATE, "expected enabled, disabled or report-only after STATE but found "
                + value.describe(), value);
        }
        BranchState state = BranchState.fromKeyword(value.lexeme()).orElseThrow(() -> syntax(ErrorCode.INVALID_STATE,
            "unknown state '" + value.lexeme() + "'; expected enabled, disabled or report-only", value));
        advance();
        expectEndOfLine();
        return state;
    }

    // ActionList | IfStmt
    private BranchBody parsePayload(Token stateTok) throws CompileException {
        List<Action> actions = new ArrayList<>();
        IfStatement nested = null;
        while (true) {
            skipNewlines();
            Token t = peek();
            if (t.isKeyword("ELSE") || t.isKeyword("END") || t.isKeyword("VAR") || t.is(TokenKind.EOF)) {
                break;
            }
            if (t.isKeyword("IF")) {
                if (nested != null || !actions.isEmpty()) {
                    throw misplacedIf(t, stateTok);
                }
                nested = parseIfStatement();
                continue;
            }
            if (isActionStart(t)) {
                if (nested != null) {
                    throw syntax(ErrorCode.MIXED_PAYLOAD,
                        "action after nested IF; a branch holds either actions or one nested IF, not both", t);
                }
                actions.add(parseAction());
                continue;
            }
            if (t.isKeyword("STATE")) {
                throw syntax(ErrorCode.UNEXPECTED_TOKEN, "second STATE in branch of line " + stateTok.line(), t);
            }
            if (t.is(TokenKind.IDENTIFIER) && Category.fromKeyword(t.lexeme()).isPresent()) {
                throw syntax(ErrorCode.CONDITION_AFTER_STATE,
                    "condition after STATE; conditions must precede STATE", t);
            }
            throw syntax(ErrorCode.UNEXPECTED_TOKEN, "expected an action or nested IF but found " + t.describe(), t);
        }
        if (nested != null) {
            return new BranchBody.NestedIf(nested);
        }
        if (actions.isEmpty()) {
            throw syntax(ErrorCode.MISSING_ACTION, "STATE on line " + stateTok.line() + " is not followed by any action",
                stateTok);
        }
        return new BranchBody.ActionList(actions);
    }

    // Condition = Category Polarity Operator Value ("OR" Category Polarity Operator Value)*
    private Condition parseCondition() throws CompileException {
        Token head = peek();
        Category category = parseCategory();
        boolean negated = parseNegation();
        OperatorSpec operator = parseOperator(category);
        List<Operand> values = new ArrayList<>();
        values.add(parseValue(category));
        while (peek().isKeyword("OR")) {
            advance();
            Token partTok = peek();
            Category partCategory = parseCategory();
            if (partCategory != category) {
                throw syntax(ErrorCode.CROSS_CATEGORY_OR, "OR joins '" + category.keyword() + "' with '"
                    + partCategory.keyword() + "'; OR may only join values of one category", partTok);
            }
            boolean partNegated = parseNegation();
            OperatorSpec partOperator = parseOperator(partCategory);
            if (partNegated != negated || !partOperator.equals(operator)) {
                throw syntax(ErrorCode.OR_OPERATOR_MISMATCH, "every part of an OR group must repeat '"
                    + operator.describe(negated) + "'", partTok);
            }
            values.add(parseValue(category));
        }
        return new Condition(category, negated, operator.operator(), operator.member(), values, head.line());
    }

    private Category parseCategory() throws CompileException {
        Token t = peek();
        if (!t.is(TokenKind.IDENTIFIER)) {
            throw syntax(ErrorCode.UNKNOWN_CATEGORY, "expected a condition category but found " + t.describe(), t);
        }
        Category category = Category.fromKeyword(t.lexeme()).orElseThrow(() -> syntax(ErrorCode.UNKNOWN_CATEGORY,
            "unknown condition category '" + t.lexeme() + "'", t));
        advance();
        return category;
    }

    private boolean parseNegation() {
        if (peek().isKeyword("NOT")) {
            advance();
            return true;
        }
        return false;
    }

    private OperatorSpec parseOperator(Category category) throws CompileException {
        Token t = peek();
        if (t.isKeyword("is")) {
            advance();
            return new OperatorSpec(MatchOperator.IS, MemberKind.NONE);
        }
        if (t.isKeyword("in")) {
            if (!category.supportsMembership()) {
                throw syntax(ErrorCode.UNSUPPORTED_OPERATOR, "'" + category.keyword() + "' supports only 'is'", t);
            }
            advance();
            if (category != Category.USER) {
                return new OperatorSpec(MatchOperator.IN, MemberKind.NONE);
            }
            Token member = peek();
            if (member.isIdentifier("group")) {
                advance();
                return new OperatorSpec(MatchOperator.IN, MemberKind.GROUP);
            }
            if (member.isIdentifier("role")) {
                advance();
                return new OperatorSpec(MatchOperator.IN, MemberKind.ROLE);
            }
            throw syntax(ErrorCode.UNSUPPORTED_OPERATOR, "expected 'group' or 'role' after 'user in' but found "
                + member.describe(), member);
        }
        if (isEndOfLine(t)) {
            throw syntax(ErrorCode.UNEXPECTED_TOKEN, "expected 'is' or 'in' after '" + category.keyword()
                + "' but found " + t.describe(), t);
        }
        throw syntax(ErrorCode.UNSUPPORTED_OPERATOR, "unsupported operator " + t.describe() + " for '"
            + category.keyword() + "'", t);
    }

    private Operand parseValue(Category category) throws CompileException {
        Token t = peek();
        if (t.is(TokenKind.IDENTIFIER) || t.is(TokenKind.NUMBER)) {
            advance();
            return new Operand.Reference(t.lexeme());
        }
        if (t.is(TokenKind.STRING)) {
            if (!category.supportsMembership()) {
                throw syntax(ErrorCode.MALFORMED_VALUE, "'" + category.keyword()
                    + "' accepts only literal values, not named entities", t);
            }
            return parseEntity();
        }
        if (t.is(TokenKind.BRACKET_IDENTIFIER)) {
            throw syntax(ErrorCode.MALFORMED_VALUE, "identifier " + t.describe()
                + " must be preceded by a quoted display name", t);
        }
        throw syntax(ErrorCode.MALFORMED_VALUE, "expected a value but found " + t.describe(), t);
    }

    private Operand parseEntity() throws CompileException {
        Token label = advance();
        Token id = peek();
        if (!id.is(TokenKind.BRACKET_IDENTIFIER)) {
            throw syntax(ErrorCode.MALFORMED_VALUE, "expected [identifier] after \"" + label.lexeme()
                + "\" but found " + id.describe(), id);
        }
        advance();
        return new Operand.Entity(label.lexeme(), id.lexeme());
    }

    private Action parseAction() throws CompileException {
        Token t = advance();
        Action action = switch (t.lexeme()) {
            case "REQUIRE" -> parseGrant(t);
            case "BLOCK" -> new Action.Block(t.line());
            case "ALLOW" -> new Action.Allow(t.line());
            default -> parseSession(t);
        };
        expectEndOfLine();
        return action;
    }

    // Grant = "REQUIRE" Control ("OR" Control)?
    private Action parseGrant(Token requireTok) throws CompileException {
        Operand control = parseControl();
        Operand alternate = null;
        if (peek().isKeyword("OR")) {
            advance();
            alternate = parseControl();
            if (peek().isKeyword("OR")) {
                throw syntax(ErrorCode.GRANT_OR_CHAIN_TOO_LONG,
                    "REQUIRE accepts at most two controls joined by OR", peek());
            }
        }
        return new Action.Grant(control, alternate, requireTok.line());
    }

    private Operand parseControl() throws CompileException {
        Token t = peek();
        if (t.is(TokenKind.IDENTIFIER)) {
            advance();
            return new Operand.Reference(t.lexeme());
        }
        if (t.is(TokenKind.STRING)) {
            return parseEntity();
        }
        throw syntax(ErrorCode.MALFORMED_VALUE, "expected a grant control after REQUIRE but found " + t.describe(), t);
    }

    // Session = "SESSION" SessionKind Params
    private Action parseSession(Token sessionTok) throws CompileException {
        Token kindTok = peek();
        SessionKind kind = kindTok.is(TokenKind.IDENTIFIER)
            ? SessionKind.fromKeyword(kindTok.lexeme()).orElse(null)
            : null;
        if (kind == null) {
            throw syntax(ErrorCode.MALFORMED_SESSION, "unknown session control " + kindTok.describe(), kindTok);
        }
        advance();
        List<String> params = switch (kind) {
            case SIGN_IN_FREQUENCY -> parseFrequency();
            case PERSISTENT_BROWSER -> {
                Token mode = expectSessionWord(kind, "always", "never");
                yield List.of(mode.lexeme());
            }
            case CLOUD_APP_SECURITY -> {
                expectSessionWord(kind, "with");
                expectSessionWord(kind, "CloudAppSecurity");
                yield List.of("monitorOnly");
            }
            case APP_ENFORCED_RESTRICTIONS -> List.of();
        };
        Token trailing = peek();
        if (!isEndOfLine(trailing)) {
            throw syntax(ErrorCode.MALFORMED_SESSION, "unexpected " + trailing.describe() + " after SESSION "
                + kind.keyword(), trailing);
        }
        return new Action.Session(kind, params, sessionTok.line());
    }

    private List<String> parseFrequency() throws CompileException {
        Token amount = peek();
        if (!amount.is(TokenKind.NUMBER) || amount.lexeme().length() > 6 || Integer.parseInt(amount.lexeme()) <= 0) {
            throw syntax(ErrorCode.MALFORMED_SESSION, "signin-frequency expects a positive number but found "
                + amount.describe(), amount);
        }
        advance();
        Token unit = expectSessionWord(SessionKind.SIGN_IN_FREQUENCY, "hours", "hour", "days", "day");
        String type = unit.lexeme().startsWith("hour") ? "hours" : "days";
        return List.of(String.valueOf(Integer.parseInt(amount.lexeme())), type);
    }

    private Token expectSessionWord(SessionKind kind, String... accepted) throws CompileException {
        Token t = peek();
        if (t.is(TokenKind.IDENTIFIER)) {
            for (String word : accepted) {
                if (t.lexeme().equals(word)) {
                    return advance();
                }
            }
        }
        throw syntax(ErrorCode.MALFORMED_SESSION, "SESSION " + kind.keyword() + " expects "
            + String.join("|", accepted) + " but found " + t.describe(), t);
    }

    /**
     * Skips the rest of a failed top-level statement. IF and END at line starts are balanced so the whole
     * block is skipped; a VAR line or an unindented IF inside an indented block ends the skip early, which
     * keeps a missing END from swallowing the statements after it.
     */
    private void resynchronize(int start) {
        pos = start;
        int depth = 0;
        boolean indented = false;
        boolean first = true;
        while (!raw(pos).is(TokenKind.EOF)) {
            Token head = raw(pos);
            if (!first) {
                boolean topLevelStart = head.isKeyword("VAR") || head.isKeyword("IF");
                if (head.isKeyword("VAR") || (topLevelStart && (depth <= 0 || (indented && head.column() == 1)))) {
                    return;
                }
                indented |= head.column() > 1;
            }
            first = false;
            if (head.isKeyword("IF")) {
                depth++;
            } else if (head.isKeyword("END")) {
                depth--;
                if (depth <= 0) {
                    skipLine();
                    return;
                }
            }
            skipLine();
        }
    }

    private void skipLine() {
        while (!raw(pos).is(TokenKind.EOF) && !raw(pos).is(TokenKind.NEWLINE)) {
            pos++;
        }
        skipNewlinesRaw();
    }

    /**
     * Classifies an IF that follows a complete payload. An unindented IF under an indented STATE is reported
     * as a missing END, anything else as a mixed payload.
     */
    private SyntaxException misplacedIf(Token ifTok, Token stateTok) {
        if (ifTok.column() == 1 && stateTok.column() > 1) {
            return syntax(ErrorCode.MISSING_END, "expected END before IF on line " + ifTok.line()
                + "; the branch on line " + stateTok.line() + " already has its payload", ifTok);
        }
        return syntax(ErrorCode.MIXED_PAYLOAD, "a branch holds either actions or one nested IF, not both", ifTok);
    }

    private static boolean isActionStart(Token t) {
        return t.isKeyword("REQUIRE") || t.isKeyword("BLOCK") || t.isKeyword("ALLOW") || t.isKeyword("SESSION");
    }

    private static boolean isBlockKeyword(Token t) {
        return t.isKeyword("ELSE") || t.isKeyword("END") || t.isKeyword("IF") || t.isKeyword("VAR");
    }

    private static boolean isEndOfLine(Token t) {
        return t.is(TokenKind.NEWLINE) || t.is(TokenKind.EOF);
    }

    private static String describe(BranchKind kind) {
        return kind.name().replace('_', ' ');
    }

    private boolean atEndOfLine() {
        return isEndOfLine(peek());
    }

    private void expectEndOfLine() throws CompileException {
        Token t = peek();
        if (t.is(TokenKind.NEWLINE)) {
            advance();
            return;
        }
        if (!t.is(TokenKind.EOF)) {
            throw syntax(ErrorCode.UNEXPECTED_TOKEN, "expected end of line but found " + t.describe(), t);
        }
    }

    private void skipNewlines() {
        while (peek().is(TokenKind.NEWLINE)) {
            pos++;
        }
    }

    private void skipNewlinesRaw() {
        while (raw(pos).is(TokenKind.NEWLINE)) {
            pos++;
        }
    }

    private Token peek() {
        Token t = raw(pos);
        if (t.is(TokenKind.ERROR)) {
            throw new AbortStatement();
        }
        return t;
    }

    private Token advance() {
        Token t = peek();
        if (!t.is(TokenKind.EOF)) {
            pos++;
        }
        return t;
    }

    private Token raw(int index) {
        return index < tokens.size() ? tokens.get(index) : tokens.get(tokens.size() - 1);
    }

    private String sourceLine(int line) {
        return lex.sourceLine(line);
    }

    private SyntaxException syntax(ErrorCode code, String message, Token at) {
        return new SyntaxException(code, message, at.line(), sourceLine(at.line()));
    }

    private record OperatorSpec(MatchOperator operator, MemberKind member) {
        String describe(boolean negated) {
            StringBuilder sb = new StringBuilder();
            if (negated) {
                sb.append("NOT ");
            }
            sb.append(operator.keyword());
            if (member != MemberKind.NONE) {
                sb.append(' ').append(member.name().toLowerCase(Locale.ROOT));
            }
            return sb.toString();
        }
    }

    /** Statement touched input the lexer already reported; drop it without a second diagnostic. */
    private static final class AbortStatement extends RuntimeException {
        AbortStatement() {
            super(null, null, false, false);
        }
    }
}
