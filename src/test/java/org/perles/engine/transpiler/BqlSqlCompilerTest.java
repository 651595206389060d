package org.perles.engine.transpiler;

import org.perles.bql.dsl.BqlParser;
import org.perles.bql.dsl.Query;
import org.perles.bql.validation.BqlValidator;
import org.perles.bql.validation.FieldRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BqlSqlCompiler.
 */
class BqlSqlCompilerTest {

    private BqlSqlCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new BqlSqlCompiler(SQLiteDialect.INSTANCE, FieldRegistry.DEFAULT);
    }

    private CompiledQuery compile(String bql) {
        Query query = BqlParser.parse(bql);
        BqlValidator.check(query);
        return compiler.compile(query);
    }

    private static long placeholders(String sql) {
        return sql.chars().filter(c -> c == '?').count();
    }

    @Nested
    @DisplayName("Plain columns")
    class Columns {

        @Test
        @DisplayName("Equality binds the value as a parameter")
        void testEquality() {
            CompiledQuery compiled = compile("type = bug");

            assertEquals("i.issue_type = ?", compiled.where());
            assertEquals(List.of("bug"), compiled.params());
        }

        @Test
        @DisplayName("Boolean structure is parenthesized")
        void testBooleanStructure() {
            CompiledQuery compiled = compile("type = bug and not (status = closed or priority = P0)");

            assertEquals("(i.issue_type = ? AND NOT ((i.status = ? OR i.priority = ?)))", compiled.where());
            assertEquals(List.of("bug", "closed", 0), compiled.params());
        }

        @Test
        @DisplayName("Priority compares integer levels")
        void testPriority() {
            CompiledQuery compiled = compile("priority <= P1");
            assertEquals("i.priority <= ?", compiled.where());
            assertEquals(List.of(1), compiled.params());
        }

        @Test
        @DisplayName("Nullable text columns are coalesced")
        void testNullableText() {
            assertEquals("COALESCE(i.assignee, '') = ?", compile("assignee = \"\"").where());
            assertEquals("COALESCE(i.description, '') LIKE ? ESCAPE '\\'", compile("description ~ x").where());
        }

        @Test
        @DisplayName("Boolean columns are coalesced to 0 and bound as 1/0")
        void testBooleanColumns() {
            CompiledQuery compiled = compile("pinned = true and is_template != true");
            assertEquals("(COALESCE(i.pinned, 0) = ? AND COALESCE(i.is_template, 0) != ?)", compiled.where());
            assertEquals(List.of(1, 1), compiled.params());
        }

        @Test
        @DisplayName("Contains escapes LIKE wildcards")
        void testContainsEscapes() {
            CompiledQuery compiled = compile("title !~ \"100%_done\\\\\"");
            assertEquals("i.title NOT LIKE ? ESCAPE '\\'", compiled.where());
            assertEquals(List.of("%100\\%\\_done\\\\%"), compiled.params());
        }

        @Test
        @DisplayName("IN lists bind one parameter per value")
        void testInList() {
            CompiledQuery compiled = compile("status not in (open, blocked) and priority in (P0, P2)");
            assertEquals("(i.status NOT IN (?, ?) AND i.priority IN (?, ?))", compiled.where());
            assertEquals(List.of("open", "blocked", 0, 2), compiled.params());
        }

        @Test
        @DisplayName("Values never appear in the SQL text")
        void testNoInlinedValues() {
            CompiledQuery compiled = compile("title = \"'; DROP TABLE issues; --\"");
            assertFalse(compiled.where().contains("DROP"));
            assertEquals(1, compiled.params().size());
        }
    }

    @Nested
    @DisplayName("Dates")
    class Dates {

        private void assertDate(String bql, String expectedSql, String expectedParam) {
            CompiledQuery compiled = compile(bql);
            assertEquals(expectedSql, compiled.where(), bql);
            assertEquals(List.of(expectedParam), compiled.params(), bql);
        }

        @Test
        @DisplayName("Relative offsets bind the SQLite modifier")
        void testOffsets() {
            assertDate("created > -7d", "datetime(i.created_at) > date('now', ?)", "-7 days");
            assertDate("updated >= +2h", "datetime(i.updated_at) >= datetime('now', ?)", "+2 hours");
            assertDate("closed < -3m", "datetime(i.closed_at) < date('now', ?)", "-3 months");
            assertDate("updated > 5d", "datetime(i.updated_at) > date('now', ?)", "+5 days");
        }

        @Test
        @DisplayName("today and yesterday")
        void testNamedDays() {
            assertDate("created >= today", "datetime(i.created_at) >= date('now', ?)", "start of day");
            assertDate("created < yesterday", "datetime(i.created_at) < date('now', ?)", "-1 day");
        }

        @Test
        @DisplayName("Absolute dates are normalized by SQLite")
        void testAbsoluteDate() {
            assertDate("created >= '2024-01-15'", "datetime(i.created_at) >= datetime(?)", "2024-01-15");
        }
    }

    @Nested
    @DisplayName("Pseudo-fields")
    class PseudoFields {

        @Test
        @DisplayName("blocked and ready compile to membership without parameters")
        void testMembership() {
            assertEquals("i.id IN (SELECT issue_id FROM blocked_issues_cache)", compile("blocked = true").where());
            assertEquals("i.id NOT IN (SELECT issue_id FROM blocked_issues_cache)",
                    compile("blocked = false").where());
            assertEquals("i.id NOT IN (SELECT id FROM ready_issues)", compile("ready != true").where());
            assertEquals("i.id IN (SELECT id FROM ready_issues)", compile("ready != false").where());
            assertTrue(compile("blocked = true and ready = true").params().isEmpty());
        }

        @Test
        @DisplayName("label compiles to label-table membership")
        void testLabel() {
            assertEquals("i.id IN (SELECT issue_id FROM labels WHERE label = ?)", compile("label = ui").where());
            assertEquals("i.id NOT IN (SELECT issue_id FROM labels WHERE label LIKE ? ESCAPE '\\')",
                    compile("label !~ ui").where());
            CompiledQuery in = compile("label not in (a, b)");
            assertEquals("i.id NOT IN (SELECT issue_id FROM labels WHERE label IN (?, ?))", in.where());
            assertEquals(List.of("a", "b"), in.params());
        }

        @Test
        @DisplayName("labels ~ matches against the aggregated label list")
        void testLabelsContains() {
            CompiledQuery compiled = compile("labels ~ \"ui,back\"");
            assertEquals("COALESCE((SELECT group_concat(l.label, ',') FROM labels l WHERE l.issue_id = i.id), '')"
                    + " LIKE ? ESCAPE '\\'", compiled.where());
            assertEquals(List.of("%ui,back%"), compiled.params());
        }
    }

    @Nested
    @DisplayName("ORDER BY")
    class OrderBy {

        @Test
        @DisplayName("Defaults to most recently updated first")
        void testDefaultOrder() {
            CompiledQuery compiled = compile("type = bug");
            assertEquals("i.updated_at DESC, i.id ASC", compiled.orderBy());
        }

        @Test
        @DisplayName("Maps fields to columns and pseudo-fields to expressions")
        void testExplicitOrder() {
            assertEquals("i.priority ASC, i.created_at DESC", compile("order by priority, created desc").orderBy());
            assertEquals("(i.id IN (SELECT issue_id FROM blocked_issues_cache)) DESC",
                    compile("order by blocked desc").orderBy());
            assertEquals("(SELECT group_concat(l.label, ',') FROM labels l WHERE l.issue_id = i.id) ASC",
                    compile("order by labels").orderBy());
        }

        @Test
        @DisplayName("A query without filter has an empty WHERE")
        void testNoFilter() {
            CompiledQuery compiled = compile("order by title");
            assertFalse(compiled.hasWhere());
            assertTrue(compiled.params().isEmpty());
        }
    }

    @Test
    @DisplayName("Parameter count matches placeholders and value-producing leaves")
    void testParameterCount() {
        String[] queries = {
                "type = bug and blocked = true",
                "status in (open, closed, blocked) or ready = false",
                "created > -7d and updated < today and closed >= '2024-01-01' and label ~ x",
                "labels ~ a or label in (a, b, c) or pinned = false or priority > P3",
                "not (title ~ x and assignee != y) and description = z"
        };
        int[] expected = {1, 3, 4, 6, 3};
        for (int i = 0; i < queries.length; i++) {
            CompiledQuery compiled = compile(queries[i]);
            assertEquals(expected[i], compiled.params().size(), queries[i]);
            assertEquals(compiled.params().size(), placeholders(compiled.where()), queries[i]);
        }
    }

    @Test
    @DisplayName("Compiling twice yields equal, independent results")
    void testStateless() {
        Query query = BqlParser.parse("type = bug or priority = P1");
        assertEquals(compiler.compile(query), compiler.compile(query));
    }
}
