package org.perles.bql.dsl;

import org.perles.bql.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recursive descent parser for BQL.
 *
 * Parses queries like:
 * type = bug and (priority <= P1 or label ~ urgent) expand down depth 2 order by updated desc
 *
 * Grammar:
 * query      := [expression] [expand] [orderBy]
 * expression := term ( OR term )*
 * term       := factor ( AND factor )*
 * factor     := NOT factor | '(' expression ')' | comparison
 * comparison := IDENT ( op value | [NOT] IN '(' value (',' value)* ')' )
 * expand     := EXPAND IDENT [ DEPTH (NUMBER | '*') ]
 * orderBy    := ORDER BY IDENT [ASC|DESC] (',' IDENT [ASC|DESC])*
 *
 * A parser instance holds the current and peek tokens and is used for a single query.
 */
public final class BqlParser {

    private static final Pattern ISO_DATE = Pattern.compile(
            "\\d{4}-\\d{2}-\\d{2}([T ]\\d{2}:\\d{2}(:\\d{2}(\\.\\d+)?)?(Z|[+-]\\d{2}:?\\d{2})?)?");

    /** Maximum combined depth of nested parentheses and NOT operators. */
    public static final int MAX_NESTING = 100;

    private final BqlLexer lexer;
    private Token current;
    private Token peek;
    private int nesting;

    public BqlParser(String input) {
        this.lexer = new BqlLexer(input);
        // Prime current and peek
        this.current = lexer.nextToken();
        this.peek = lexer.nextToken();
    }

    /**
     * Parses a BQL query string.
     *
     * @param input The query text
     * @return The parsed query
     * @throws BqlParseException if the query is malformed
     */
    public static Query parse(String input) {
        return new BqlParser(input).parseQuery();
    }

    /**
     * Parses the whole input. The input must be fully consumed.
     */
    public Query parseQuery() {
        Expr filter = null;
        if (!check(TokenType.EXPAND) && !check(TokenType.ORDER) && !check(TokenType.EOF)) {
            filter = parseOrExpression();
        }

        ExpandClause expand = null;
        if (check(TokenType.EXPAND)) {
            expand = parseExpand();
        }

        List<OrderTerm> orderBy = List.of();
        if (check(TokenType.ORDER)) {
            orderBy = parseOrderBy();
        }

        if (!check(TokenType.EOF)) {
            throw error("unexpected token " + current.describe() + " at position " + current.position());
        }

        return new Query(filter, expand, orderBy);
    }

    // ==================== Filter Expressions ====================

    /**
     * Parses OR-separated terms: term or term
     */
    private Expr parseOrExpression() {
        Expr left = parseAndExpression();

        while (check(TokenType.OR)) {
            advance();
            Expr right = parseAndExpression();
            left = BinaryExpr.or(left, right);
        }

        return left;
    }

    /**
     * Parses AND-separated factors: factor and factor
     */
    private Expr parseAndExpression() {
        Expr left = parseFactor();

        while (check(TokenType.AND)) {
            advance();
            Expr right = parseFactor();
            left = BinaryExpr.and(left, right);
        }

        return left;
    }

    /**
     * Parses NOT, parenthesized expressions, or comparisons.
     */
    private Expr parseFactor() {
        if (check(TokenType.NOT)) {
            enterNested();
            advance();
            Expr inner = parseFactor();
            nesting--;
            return new NotExpr(inner);
        }

        if (check(TokenType.LPAREN)) {
            enterNested();
            advance();
            Expr expr = parseOrExpression();
            consume(TokenType.RPAREN, "expected ')'");
            nesting--;
            return expr;
        }

        return parseComparison();
    }

    private void enterNested() {
        if (++nesting > MAX_NESTING) {
            throw new BqlParseException(
                    "expression nested too deeply at position " + current.position(), current);
        }
    }

    /**
     * Parses field comparisons: field op value, field in (...), field not in (...)
     */
    private Expr parseComparison() {
        String field = consume(TokenType.IDENT, "expected field name").literal();

        if (check(TokenType.NOT) && peek.type() == TokenType.IN) {
            advance(); // NOT
            advance(); // IN
            return parseInList(field, true);
        }

        if (check(TokenType.IN)) {
            advance();
            return parseInList(field, false);
        }

        if (!current.type().isComparisonOperator()) {
            throw expected("expected operator");
        }
        CompareExpr.Operator operator = CompareExpr.Operator.fromTokenType(advance().type());

        return new CompareExpr(field, operator, parseValue());
    }

    private Expr parseInList(String field, boolean negated) {
        consume(TokenType.LPAREN, "expected '('");

        List<Value> values = new ArrayList<>();
        values.add(parseValue());
        while (check(TokenType.COMMA)) {
            advance();
            values.add(parseValue());
        }

        consume(TokenType.RPAREN, "expected ')'");
        return new InExpr(field, values, negated);
    }

    // ==================== Values ====================

    private Value parseValue() {
        Value value = switch (current.type()) {
            case STRING -> stringValue(current.literal());
            case NUMBER -> numberValue(current);
            case TRUE -> Value.bool(current.literal(), true);
            case FALSE -> Value.bool(current.literal(), false);
            case IDENT -> identifierValue(current.literal());
            default -> throw expected("expected value");
        };
        advance();
        return value;
    }

    /**
     * Quoted strings are plain strings unless they hold an ISO date.
     */
    private static Value stringValue(String literal) {
        if (ISO_DATE.matcher(literal).matches()) {
            return Value.date(literal, literal);
        }
        return Value.string(literal);
    }

    /**
     * Numbers with a d/h/m unit are relative date offsets; everything else is an integer.
     */
    private Value numberValue(Token token) {
        String literal = token.literal();
        char last = literal.charAt(literal.length() - 1);
        if (Character.isLetter(last)) {
            String digits = literal.substring(0, literal.length() - 1);
            String sign = "+";
            if (digits.startsWith("-") || digits.startsWith("+")) {
                sign = digits.substring(0, 1);
                digits = digits.substring(1);
            }
            return Value.date(literal, sign + digits + Character.toLowerCase(last));
        }

        try {
            return Value.integer(literal, Long.parseLong(literal));
        } catch (NumberFormatException e) {
            throw new BqlParseException(
                    "invalid number '" + literal + "' at position " + token.position(), token);
        }
    }

    /**
     * Bare identifiers: P0-P4 are priorities, today/yesterday are dates, anything else a string.
     */
    private static Value identifierValue(String literal) {
        if (literal.length() == 2 && (literal.charAt(0) == 'P' || literal.charAt(0) == 'p')) {
            char level = literal.charAt(1);
            if (level >= '0' && level <= '4') {
                return Value.priority(literal, level - '0');
            }
        }

        String lower = literal.toLowerCase(Locale.ROOT);
        if (lower.equals("today") || lower.equals("yesterday")) {
            return Value.date(literal, lower);
        }

        return Value.string(literal);
    }

    // ==================== EXPAND ====================

    private ExpandClause parseExpand() {
        consume(TokenType.EXPAND, "expected 'expand'");

        if (!check(TokenType.IDENT)) {
            throw expected("expected expansion type", " (valid: " + ExpandType.VALID_KEYWORDS + ")");
        }
        Token typeToken = advance();
        ExpandType direction = ExpandType.fromKeyword(typeToken.literal())
                .orElseThrow(() -> new BqlParseException(
                        "unknown expansion type '" + typeToken.literal() + "' at position " + typeToken.position()
                                + " (valid: " + ExpandType.VALID_KEYWORDS + ")",
                        typeToken));

        int depth = ExpandClause.DEFAULT_DEPTH;
        if (check(TokenType.DEPTH)) {
            advance();
            depth = parseDepthValue();
        }

        return new ExpandClause(direction, depth);
    }

    /**
     * Parses the depth value: an integer between 1 and 10, or '*' for unlimited.
     */
    private int parseDepthValue() {
        if (check(TokenType.STAR)) {
            advance();
            return ExpandClause.UNLIMITED;
        }

        if (!check(TokenType.NUMBER)) {
            throw expected("expected depth value (number or *)");
        }

        Token token = current;
        long depth;
        try {
            depth = Long.parseLong(token.literal());
        } catch (NumberFormatException e) {
            throw new BqlParseException(
                    "invalid depth value '" + token.literal() + "' at position " + token.position(), token);
        }
        if (depth < 1) {
            throw new BqlParseException(
                    "depth must be at least 1, got " + depth + " at position " + token.position(), token);
        }
        if (depth > ExpandClause.MAX_DEPTH) {
            throw new BqlParseException(
                    "depth cannot exceed " + ExpandClause.MAX_DEPTH + ", got " + depth
                            + " at position " + token.position(),
                    token);
        }
        advance();
        return (int) depth;
    }

    // ==================== ORDER BY ====================

    private List<OrderTerm> parseOrderBy() {
        consume(TokenType.ORDER, "expected 'order'");
        consume(TokenType.BY, "expected 'by'");

        List<OrderTerm> terms = new ArrayList<>();
        do {
            if (!terms.isEmpty()) {
                advance(); // comma
            }
            String field = consume(TokenType.IDENT, "expected field name").literal();
            boolean descending = false;
            if (check(TokenType.ASC)) {
                advance();
            } else if (check(TokenType.DESC)) {
                advance();
                descending = true;
            }
            terms.add(new OrderTerm(field, descending));
        } while (check(TokenType.COMMA));

        return terms;
    }

    // ==================== Helper Methods ====================

    private boolean check(TokenType type) {
        return current.type() == type;
    }

    private Token advance() {
        Token consumed = current;
        current = peek;
        peek = lexer.nextToken();
        return consumed;
    }

    private Token consume(TokenType type, String expectation) {
        if (check(type)) {
            return advance();
        }
        throw expected(expectation);
    }

    private BqlParseException expected(String expectation) {
        return expected(expectation, "");
    }

    private BqlParseException expected(String expectation, String hint) {
        return error(expectation + " at position " + current.position() + ", got " + current.describe() + hint);
    }

    /**
     * Builds an error at the current token; illegal characters are reported as such.
     */
    private BqlParseException error(String message) {
        if (check(TokenType.ILLEGAL)) {
            return new BqlParseException(
                    "illegal character '" + current.literal() + "' at position " + current.position(), current);
        }
        return new BqlParseException(message, current);
    }
}
