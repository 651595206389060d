package org.perles.bql.dsl;

import org.perles.bql.dsl.Token.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Lexer for BQL.
 * Converts a query string into tokens one at a time; unrecognized characters
 * become ILLEGAL tokens so the lexer itself never fails.
 */
public final class BqlLexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("not", TokenType.NOT),
            Map.entry("in", TokenType.IN),
            Map.entry("order", TokenType.ORDER),
            Map.entry("by", TokenType.BY),
            Map.entry("asc", TokenType.ASC),
            Map.entry("desc", TokenType.DESC),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("expand", TokenType.EXPAND),
            Map.entry("depth", TokenType.DEPTH));

    private final String input;
    private int position;

    public BqlLexer(String input) {
        this.input = input == null ? "" : input;
        this.position = 0;
    }

    /**
     * Tokenizes the entire input string.
     *
     * @return List of tokens, always terminated by an EOF token
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * Returns the next token. Once the input is exhausted every call returns EOF.
     */
    public Token nextToken() {
        skipWhitespace();
        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", input.length(), input.length());
        }

        char c = input.charAt(position);
        int start = position;

        // Two-character operators
        if (position + 1 < input.length()) {
            String twoChar = input.substring(position, position + 2);
            TokenType twoCharType = switch (twoChar) {
                case "!=" -> TokenType.NEQ;
                case "!~" -> TokenType.NOT_CONTAINS;
                case "<=" -> TokenType.LTE;
                case ">=" -> TokenType.GTE;
                default -> null;
            };
            if (twoCharType != null) {
                position += 2;
                return new Token(twoCharType, twoChar, start, position);
            }
        }

        // Single-character operators and delimiters
        TokenType singleCharType = switch (c) {
            case '=' -> TokenType.EQ;
            case '<' -> TokenType.LT;
            case '>' -> TokenType.GT;
            case '~' -> TokenType.CONTAINS;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case ',' -> TokenType.COMMA;
            case '*' -> TokenType.STAR;
            default -> null;
        };
        if (singleCharType != null) {
            position++;
            return new Token(singleCharType, String.valueOf(c), start, position);
        }

        if (c == '"' || c == '\'') {
            return readString(c);
        }

        if (Character.isDigit(c) || (isSign(c) && position + 1 < input.length()
                && Character.isDigit(input.charAt(position + 1)))) {
            return readNumber();
        }

        if (Character.isLetter(c) || c == '_') {
            return readIdentifierOrKeyword();
        }

        position++;
        return new Token(TokenType.ILLEGAL, String.valueOf(c), start, position);
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            position++;
        }
    }

    private static boolean isSign(char c) {
        return c == '-' || c == '+';
    }

    /**
     * Reads a quoted string. An unterminated string runs to the end of input.
     */
    private Token readString(char quote) {
        int start = position;
        position++; // skip opening quote

        StringBuilder sb = new StringBuilder();
        while (position < input.length() && input.charAt(position) != quote) {
            char c = input.charAt(position);
            if (c == '\\' && position + 1 < input.length()) {
                position++;
                c = input.charAt(position);
            }
            sb.append(c);
            position++;
        }

        if (position < input.length()) {
            position++; // skip closing quote
        }
        return new Token(TokenType.STRING, sb.toString(), start, position);
    }

    /**
     * Reads an optionally signed integer with an optional d/h/m unit suffix.
     */
    private Token readNumber() {
        int start = position;
        if (isSign(input.charAt(position))) {
            position++;
        }
        while (position < input.length() && Character.isDigit(input.charAt(position))) {
            position++;
        }
        if (position < input.length()) {
            char unit = Character.toLowerCase(input.charAt(position));
            if (unit == 'd' || unit == 'h' || unit == 'm') {
                position++;
            }
        }
        return new Token(TokenType.NUMBER, input.substring(start, position), start, position);
    }

    private Token readIdentifierOrKeyword() {
        int start = position;
        while (position < input.length()) {
            char c = input.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-') {
                position++;
            } else {
                break;
            }
        }

        String value = input.substring(start, position);
        TokenType keyword = KEYWORDS.get(value.toLowerCase(Locale.ROOT));
        return new Token(keyword != null ? keyword : TokenType.IDENT, value, start, position);
    }
}
