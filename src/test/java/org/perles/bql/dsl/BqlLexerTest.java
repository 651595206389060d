package org.perles.bql.dsl;

import org.perles.bql.dsl.Token.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BqlLexer.
 */
class BqlLexerTest {

    private static List<TokenType> types(String input) {
        return new BqlLexer(input).tokenize().stream().map(Token::type).toList();
    }

    @Nested
    @DisplayName("Operators and delimiters")
    class Operators {

        @Test
        @DisplayName("Recognizes every comparison operator")
        void testComparisonOperators() {
            assertEquals(List.of(TokenType.EQ, TokenType.NEQ, TokenType.LT, TokenType.GT,
                    TokenType.LTE, TokenType.GTE, TokenType.CONTAINS, TokenType.NOT_CONTAINS, TokenType.EOF),
                    types("= != < > <= >= ~ !~"));
        }

        @Test
        @DisplayName("Two-character operators need no surrounding whitespace")
        void testOperatorsWithoutWhitespace() {
            assertEquals(List.of(TokenType.IDENT, TokenType.LTE, TokenType.IDENT, TokenType.EOF),
                    types("priority<=P1"));
        }

        @Test
        @DisplayName("Parentheses, comma and star")
        void testDelimiters() {
            assertEquals(List.of(TokenType.LPAREN, TokenType.IDENT, TokenType.COMMA, TokenType.IDENT,
                    TokenType.RPAREN, TokenType.STAR, TokenType.EOF), types("(a, b) *"));
        }

        @Test
        @DisplayName("A lone '!' is illegal")
        void testLoneBang() {
            Token token = new BqlLexer("a ! b").tokenize().get(1);
            assertEquals(TokenType.ILLEGAL, token.type());
            assertEquals("!", token.literal());
            assertEquals(2, token.position());
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("Single and double quoted strings drop their quotes")
        void testQuotedStrings() {
            List<Token> tokens = new BqlLexer("'one' \"two words\"").tokenize();
            assertEquals("one", tokens.get(0).literal());
            assertEquals("two words", tokens.get(1).literal());
            assertEquals(TokenType.STRING, tokens.get(1).type());
            // The span includes both quotes
            assertEquals(6, tokens.get(1).position());
            assertEquals(17, tokens.get(1).end());
        }

        @Test
        @DisplayName("Backslash escapes the next character")
        void testEscapes() {
            Token token = new BqlLexer("\"say \\\"hi\\\"\"").nextToken();
            assertEquals("say \"hi\"", token.literal());
        }

        @Test
        @DisplayName("Unterminated string runs to end of input")
        void testUnterminatedString() {
            List<Token> tokens = new BqlLexer("title = \"open ended").tokenize();
            assertEquals(TokenType.STRING, tokens.get(2).type());
            assertEquals("open ended", tokens.get(2).literal());
            assertEquals(TokenType.EOF, tokens.get(3).type());
        }

        @Test
        @DisplayName("Numbers keep their sign and unit suffix")
        void testNumbers() {
            List<Token> tokens = new BqlLexer("42 -7d +24h -3M").tokenize();
            assertEquals(List.of("42", "-7d", "+24h", "-3M"),
                    tokens.subList(0, 4).stream().map(Token::literal).toList());
            assertTrue(tokens.subList(0, 4).stream().allMatch(t -> t.type() == TokenType.NUMBER));
        }

        @Test
        @DisplayName("Identifiers may contain dashes and digits")
        void testDashedIdentifier() {
            Token token = new BqlLexer("perles-123").nextToken();
            assertEquals(TokenType.IDENT, token.type());
            assertEquals("perles-123", token.literal());
        }
    }

    @Nested
    @DisplayName("Keywords")
    class Keywords {

        @Test
        @DisplayName("Keywords are case-insensitive and keep their literal")
        void testCaseInsensitiveKeywords() {
            List<Token> tokens = new BqlLexer("AND Or not IN Order BY asc DESC True false EXPAND depth").tokenize();
            assertEquals(List.of(TokenType.AND, TokenType.OR, TokenType.NOT, TokenType.IN, TokenType.ORDER,
                    TokenType.BY, TokenType.ASC, TokenType.DESC, TokenType.TRUE, TokenType.FALSE,
                    TokenType.EXPAND, TokenType.DEPTH, TokenType.EOF),
                    tokens.stream().map(Token::type).toList());
            assertEquals("Or", tokens.get(1).literal());
        }

        @Test
        @DisplayName("Words that merely start with a keyword stay identifiers")
        void testKeywordPrefix() {
            assertEquals(List.of(TokenType.IDENT, TokenType.IDENT, TokenType.EOF), types("order_id android"));
        }
    }

    @Test
    @DisplayName("Positions are 0-based offsets and EOF repeats")
    void testPositionsAndRepeatedEof() {
        BqlLexer lexer = new BqlLexer("  type = bug");
        assertEquals(2, lexer.nextToken().position());
        assertEquals(7, lexer.nextToken().position());
        assertEquals(9, lexer.nextToken().position());
        Token eof = lexer.nextToken();
        assertEquals(TokenType.EOF, eof.type());
        assertEquals(12, eof.position());
        assertEquals(TokenType.EOF, lexer.nextToken().type());
    }

    @Test
    @DisplayName("Unknown characters become ILLEGAL tokens without throwing")
    void testIllegalCharacters() {
        assertEquals(List.of(TokenType.IDENT, TokenType.ILLEGAL, TokenType.ILLEGAL, TokenType.EOF),
                types("a@#"));
    }
}
