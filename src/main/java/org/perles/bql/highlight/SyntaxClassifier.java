package org.perles.bql.highlight;

import org.perles.bql.dsl.BqlLexer;
import org.perles.bql.dsl.Token;
import org.perles.bql.dsl.Token.TokenType;
import org.perles.bql.highlight.SyntaxSpan.Category;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a single line of BQL into classified spans for an editor to color.
 *
 * Identifiers are fields unless they follow a comparison operator or sit inside an
 * {@code in (...)} list, in which case they are values. Illegal characters get no span.
 * Classification never fails, whatever the input.
 */
public final class SyntaxClassifier {

    public List<SyntaxSpan> classify(String line) {
        List<SyntaxSpan> spans = new ArrayList<>();
        if (line == null || line.isEmpty()) {
            return spans;
        }

        BqlLexer lexer = new BqlLexer(line);
        boolean inValueList = false;
        boolean afterOperator = false;
        TokenType previous = TokenType.EOF;

        for (Token token = lexer.nextToken(); token.type() != TokenType.EOF; token = lexer.nextToken()) {
            TokenType type = token.type();

            if (type == TokenType.LPAREN && previous == TokenType.IN) {
                inValueList = true;
            } else if (type == TokenType.RPAREN && inValueList) {
                inValueList = false;
            }

            if (type.isComparisonOperator()) {
                afterOperator = true;
            } else if (type == TokenType.AND || type == TokenType.OR
                    || type == TokenType.NOT || type == TokenType.ORDER) {
                afterOperator = false;
            }

            // The direction after EXPAND reads as part of the clause
            Category category = type == TokenType.IDENT && previous == TokenType.EXPAND
                    ? Category.KEYWORD
                    : categoryOf(type, inValueList || afterOperator);
            if (category != null) {
                spans.add(new SyntaxSpan(token.position(), token.end(), category));
            }

            switch (type) {
                case IDENT, NUMBER, STRING, TRUE, FALSE -> {
                    if (!inValueList) {
                        afterOperator = false;
                    }
                }
                default -> {
                }
            }
            previous = type;
        }
        return spans;
    }

    private static Category categoryOf(TokenType type, boolean valueContext) {
        return switch (type) {
            case AND, OR, NOT, IN, ORDER, BY, ASC, DESC, EXPAND, DEPTH -> Category.KEYWORD;
            case EQ, NEQ, LT, GT, LTE, GTE, CONTAINS, NOT_CONTAINS, STAR -> Category.OPERATOR;
            case LPAREN, RPAREN -> Category.PAREN;
            case COMMA -> Category.COMMA;
            case STRING -> Category.STRING;
            case NUMBER, TRUE, FALSE -> Category.LITERAL;
            case IDENT -> valueContext ? Category.VALUE : Category.FIELD;
            default -> null;
        };
    }
}
