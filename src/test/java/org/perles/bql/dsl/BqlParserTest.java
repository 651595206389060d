package org.perles.bql.dsl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BqlParser.
 */
class BqlParserTest {

    private static CompareExpr compare(Expr expr) {
        return assertInstanceOf(CompareExpr.class, expr);
    }

    @Nested
    @DisplayName("Comparisons and values")
    class Comparisons {

        @Test
        @DisplayName("Simple equality")
        void testSimpleEquality() {
            // WHEN
            Query query = BqlParser.parse("type = bug");

            // THEN
            CompareExpr expr = compare(query.filter());
            assertEquals("type", expr.field());
            assertEquals(CompareExpr.Operator.EQUALS, expr.operator());
            assertEquals(Value.string("bug"), expr.value());
            assertFalse(query.hasExpand());
            assertTrue(query.orderBy().isEmpty());
        }

        @Test
        @DisplayName("Value kinds are classified from their token")
        void testValueClassification() {
            assertEquals(Value.Kind.PRIORITY, compare(BqlParser.parse("priority <= p1").filter()).value().kind());
            assertEquals(1, compare(BqlParser.parse("priority <= P1").filter()).value().priorityLevel());
            assertEquals(Value.Kind.BOOL, compare(BqlParser.parse("blocked = TRUE").filter()).value().kind());
            assertEquals(Value.Kind.INT, compare(BqlParser.parse("title = 42").filter()).value().kind());
            assertEquals(Value.Kind.STRING, compare(BqlParser.parse("title = P5").filter()).value().kind());
            assertEquals(Value.Kind.STRING, compare(BqlParser.parse("title ~ \"auth bug\"").filter()).value().kind());
        }

        @Test
        @DisplayName("Relative dates are normalized with an explicit sign")
        void testRelativeDates() {
            Value minus = compare(BqlParser.parse("created > -7d").filter()).value();
            assertEquals(Value.Kind.DATE, minus.kind());
            assertEquals("-7d", minus.text());
            assertTrue(minus.isRelativeOffset());

            Value unsigned = compare(BqlParser.parse("updated < 24H").filter()).value();
            assertEquals("+24h", unsigned.text());
            assertEquals("24H", unsigned.raw());

            Value today = compare(BqlParser.parse("created >= Today").filter()).value();
            assertEquals(Value.Kind.DATE, today.kind());
            assertEquals("today", today.text());
        }

        @Test
        @DisplayName("Quoted ISO dates become absolute dates")
        void testAbsoluteDates() {
            Value date = compare(BqlParser.parse("created >= \"2024-01-15\"").filter()).value();
            assertEquals(Value.Kind.DATE, date.kind());
            assertEquals("2024-01-15", date.text());
            assertFalse(date.isRelativeOffset());

            Value dateTime = compare(BqlParser.parse("updated < '2024-01-15T10:30:00Z'").filter()).value();
            assertEquals(Value.Kind.DATE, dateTime.kind());
        }

        @Test
        @DisplayName("IN and NOT IN lists")
        void testInLists() {
            InExpr in = assertInstanceOf(InExpr.class, BqlParser.parse("status in (open, in_progress)").filter());
            assertFalse(in.negated());
            assertEquals(List.of(Value.string("open"), Value.string("in_progress")), in.values());

            InExpr notIn = assertInstanceOf(InExpr.class, BqlParser.parse("label not in ('a', \"b\")").filter());
            assertTrue(notIn.negated());
            assertEquals(2, notIn.values().size());
        }
    }

    @Nested
    @DisplayName("Boolean structure")
    class Structure {

        @Test
        @DisplayName("AND binds tighter than OR")
        void testPrecedence() {
            // GIVEN: a or b and c
            Expr expr = BqlParser.parse("type = bug or type = task and priority = P0").filter();

            // THEN: a or (b and c)
            BinaryExpr or = assertInstanceOf(BinaryExpr.class, expr);
            assertEquals(BinaryExpr.LogicalOperator.OR, or.operator());
            BinaryExpr and = assertInstanceOf(BinaryExpr.class, or.right());
            assertEquals(BinaryExpr.LogicalOperator.AND, and.operator());
        }

        @Test
        @DisplayName("Parentheses override precedence")
        void testParentheses() {
            BinaryExpr and = assertInstanceOf(BinaryExpr.class,
                    BqlParser.parse("(type = bug or type = task) and priority = P0").filter());
            assertEquals(BinaryExpr.LogicalOperator.AND, and.operator());
            assertInstanceOf(BinaryExpr.class, and.left());
        }

        @Test
        @DisplayName("AND chains are left-associative")
        void testLeftAssociative() {
            BinaryExpr outer = assertInstanceOf(BinaryExpr.class,
                    BqlParser.parse("a = 1 and b = 2 and c = 3").filter());
            assertInstanceOf(BinaryExpr.class, outer.left());
            assertInstanceOf(CompareExpr.class, outer.right());
        }

        @Test
        @DisplayName("NOT applies to the following factor")
        void testNot() {
            NotExpr not = assertInstanceOf(NotExpr.class, BqlParser.parse("not not blocked = true").filter());
            assertInstanceOf(NotExpr.class, not.inner());
        }
    }

    @Nested
    @DisplayName("EXPAND and ORDER BY")
    class Clauses {

        @Test
        @DisplayName("Expand keywords map to directions")
        void testExpandKeywords() {
            assertEquals(ExpandType.DOWN, BqlParser.parse("expand children").expand().direction());
            assertEquals(ExpandType.DOWN, BqlParser.parse("expand Downstream").expand().direction());
            assertEquals(ExpandType.UP, BqlParser.parse("expand blockers").expand().direction());
            assertEquals(ExpandType.UP, BqlParser.parse("expand parents").expand().direction());
            assertEquals(ExpandType.ALL, BqlParser.parse("expand deps").expand().direction());
        }

        @Test
        @DisplayName("Depth defaults to 1, accepts 1..10 and *")
        void testDepth() {
            assertEquals(1, BqlParser.parse("type = epic expand down").expand().depth());
            assertEquals(10, BqlParser.parse("type = epic expand down depth 10").expand().depth());
            assertTrue(BqlParser.parse("type = epic expand all depth *").expand().isUnlimited());
        }

        @Test
        @DisplayName("Full query with filter, expand and order")
        void testFullQuery() {
            Query query = BqlParser.parse("type = epic expand down depth 2 order by priority, updated desc");

            assertTrue(query.hasFilter());
            assertEquals(new ExpandClause(ExpandType.DOWN, 2), query.expand());
            assertEquals(List.of(OrderTerm.asc("priority"), OrderTerm.desc("updated")), query.orderBy());
        }

        @Test
        @DisplayName("Query may consist of ORDER BY alone")
        void testOrderOnly() {
            Query query = BqlParser.parse("order by created asc");
            assertFalse(query.hasFilter());
            assertEquals(List.of(OrderTerm.asc("created")), query.orderBy());
        }

        @Test
        @DisplayName("Empty input parses to an empty query")
        void testEmptyInput() {
            Query query = BqlParser.parse("   ");
            assertFalse(query.hasFilter());
            assertFalse(query.hasExpand());
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Missing value names the offending token and position")
        void testMissingValue() {
            BqlParseException e = assertThrows(BqlParseException.class, () -> BqlParser.parse("type = = bug"));
            assertEquals("expected value at position 7, got '='", e.getMessage());
            assertEquals(7, e.getPosition());
            assertEquals("=", e.getFound());
        }

        @Test
        @DisplayName("Depth 11 is rejected")
        void testDepthTooLarge() {
            BqlParseException e = assertThrows(BqlParseException.class,
                    () -> BqlParser.parse("expand down depth 11"));
            assertTrue(e.getMessage().contains("depth cannot exceed 10, got 11"), e.getMessage());
        }

        @Test
        @DisplayName("Depth 0 and unit-suffixed depth are rejected")
        void testInvalidDepth() {
            assertThrows(BqlParseException.class, () -> BqlParser.parse("expand down depth 0"));
            assertThrows(BqlParseException.class, () -> BqlParser.parse("expand down depth 2d"));
            assertThrows(BqlParseException.class, () -> BqlParser.parse("expand down depth deep"));
        }

        @Test
        @DisplayName("Deeply nested parentheses are rejected")
        void testParenthesesTooDeep() {
            BqlParseException e = assertThrows(BqlParseException.class,
                    () -> BqlParser.parse("(".repeat(200_000) + "id = a"));
            assertEquals("expression nested too deeply at position " + BqlParser.MAX_NESTING, e.getMessage());
        }

        @Test
        @DisplayName("Deeply nested NOT is rejected")
        void testNotTooDeep() {
            BqlParseException e = assertThrows(BqlParseException.class,
                    () -> BqlParser.parse("not ".repeat(200_000) + "id = a"));
            assertTrue(e.getMessage().startsWith("expression nested too deeply"), e.getMessage());
        }

        @Test
        @DisplayName("Nesting up to the limit parses")
        void testNestingAtLimit() {
            int half = BqlParser.MAX_NESTING / 2;
            String text = "(".repeat(half) + "not ".repeat(half) + "id = a" + ")".repeat(half);

            Query query = BqlParser.parse(text);

            Expr expr = query.filter();
            for (int i = 0; i < half; i++) {
                expr = assertInstanceOf(NotExpr.class, expr).inner();
            }
            assertInstanceOf(CompareExpr.class, expr);
        }

        @Test
        @DisplayName("Unknown expansion type lists the valid keywords")
        void testUnknownExpansion() {
            BqlParseException e = assertThrows(BqlParseException.class,
                    () -> BqlParser.parse("expand sideways"));
            assertTrue(e.getMessage().startsWith("unknown expansion type 'sideways' at position 7"));
            assertTrue(e.getMessage().contains("children"));
        }

        @Test
        @DisplayName("Illegal characters are reported as such")
        void testIllegalCharacter() {
            BqlParseException e = assertThrows(BqlParseException.class, () -> BqlParser.parse("type @ bug"));
            assertEquals("illegal character '@' at position 5", e.getMessage());
        }

        @Test
        @DisplayName("Trailing tokens are rejected")
        void testTrailingTokens() {
            BqlParseException e = assertThrows(BqlParseException.class, () -> BqlParser.parse("type = bug )"));
            assertEquals("unexpected token ')' at position 11", e.getMessage());
        }

        @Test
        @DisplayName("Missing closing paren reports end of input")
        void testUnclosedParen() {
            BqlParseException e = assertThrows(BqlParseException.class, () -> BqlParser.parse("(type = bug"));
            assertEquals("expected ')' at position 11, got end of input", e.getMessage());
        }

        @Test
        @DisplayName("Integer overflow is a parse error")
        void testOverflow() {
            assertThrows(BqlParseException.class, () -> BqlParser.parse("title = 99999999999999999999"));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "", "(", ")", "=", "type", "type =", "type in", "type in (", "type in ()", "type in (a,",
                "not", "and", "expand", "expand down depth", "order", "order by", "order by ,",
                "!", "!!~", "\"", "'", "-", "+5", "-7x", "type = bug or", "((((", "p0 = p0 = p0",
                "depth * expand", "type ~~ x", "\u0000", "é = ü", "type = bug order by title desc asc"
        })
        @DisplayName("Arbitrary input yields a query or a BqlParseException, nothing else")
        void testNeverThrowsOtherExceptions(String input) {
            try {
                assertNotNull(BqlParser.parse(input));
            } catch (BqlParseException e) {
                assertNotNull(e.getMessage());
            }
        }
    }
}
