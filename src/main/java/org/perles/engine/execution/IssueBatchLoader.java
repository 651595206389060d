package org.perles.engine.execution;

import org.perles.engine.execution.BqlExecutionException.Stage;
import org.perles.engine.graph.DependencyEdge;
import org.perles.engine.model.Issue;
import org.perles.engine.model.IssueRelations;
import org.perles.engine.store.JdbcQueryRunner;
import org.perles.engine.store.RowMapper;
import org.perles.engine.store.Timestamps;
import org.perles.engine.transpiler.CompiledQuery;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fetches issues and hydrates them with a fixed number of store round-trips:
 * the base query, then one batch each for dependencies, labels and comment counts,
 * however many issues matched.
 */
public class IssueBatchLoader {

    static final String BASE_SELECT = """
            SELECT i.id, i.title, i.description, i.status, i.priority, i.issue_type, i.assignee,
                   i.pinned, i.is_template, i.created_at, i.updated_at, i.closed_at
            FROM issues i
            WHERE i.status NOT IN ('deleted', 'tombstone')
              AND i.deleted_at IS NULL""";

    private static final String DEPENDENCIES_SQL = """
            SELECT d.issue_id, d.depends_on_id, d.type
            FROM dependencies d
            JOIN issues i ON d.depends_on_id = i.id
            WHERE d.issue_id IN (%1$s)
              AND i.status NOT IN ('deleted', 'tombstone')
              AND i.deleted_at IS NULL
            UNION ALL
            SELECT d.issue_id, d.depends_on_id, d.type
            FROM dependencies d
            JOIN issues i ON d.issue_id = i.id
            WHERE d.depends_on_id IN (%1$s)
              AND d.issue_id NOT IN (%1$s)
              AND i.status NOT IN ('deleted', 'tombstone')
              AND i.deleted_at IS NULL
            """;

    private static final String LABELS_SQL =
            "SELECT issue_id, label FROM labels WHERE issue_id IN (%s) ORDER BY issue_id, label";

    private static final String COMMENT_COUNTS_SQL =
            "SELECT issue_id, COUNT(*) FROM comments WHERE issue_id IN (%s) GROUP BY issue_id";

    private final JdbcQueryRunner runner;

    public IssueBatchLoader(JdbcQueryRunner runner) {
        this.runner = Objects.requireNonNull(runner, "Query runner cannot be null");
    }

    /**
     * Runs a compiled query and hydrates the matches.
     */
    public List<Issue> load(CompiledQuery compiled) {
        StringBuilder sql = new StringBuilder(BASE_SELECT);
        if (compiled.hasWhere()) {
            sql.append("\n  AND ").append(compiled.where());
        }
        sql.append("\nORDER BY ").append(compiled.orderBy());
        List<Issue> issues = run(Stage.BASE_QUERY, sql.toString(), compiled.params(), IssueBatchLoader::mapIssue);
        return hydrate(issues);
    }

    /**
     * Fetches live issues by id and hydrates them, in the order of {@code ids}.
     * Ids that do not exist or are deleted are skipped.
     */
    public List<Issue> loadByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        List<String> idList = List.copyOf(ids);
        String sql = BASE_SELECT + "\n  AND i.id IN (" + placeholders(idList.size()) + ")";
        List<Issue> found = run(Stage.BASE_QUERY, sql, idList, IssueBatchLoader::mapIssue);

        Map<String, Issue> byId = new HashMap<>();
        found.forEach(issue -> byId.put(issue.id(), issue));
        List<Issue> ordered = new ArrayList<>(found.size());
        for (String id : idList) {
            Issue issue = byId.get(id);
            if (issue != null) {
                ordered.add(issue);
            }
        }
        return hydrate(ordered);
    }

    private List<Issue> hydrate(List<Issue> issues) {
        if (issues.isEmpty()) {
            return issues;
        }
        List<String> ids = issues.stream().map(Issue::id).toList();
        Map<String, IssueRelations> relations = loadRelations(ids);
        Map<String, List<String>> labels = loadLabels(ids);
        Map<String, Integer> commentCounts = loadCommentCounts(ids);

        List<Issue> hydrated = new ArrayList<>(issues.size());
        for (Issue issue : issues) {
            hydrated.add(issue.withDetails(
                    labels.getOrDefault(issue.id(), List.of()),
                    commentCounts.getOrDefault(issue.id(), 0),
                    relations.getOrDefault(issue.id(), IssueRelations.NONE)));
        }
        return hydrated;
    }

    private Map<String, IssueRelations> loadRelations(List<String> ids) {
        String in = placeholders(ids.size());
        // Edges with both ends in the batch come only from the first half
        List<Object> params = new ArrayList<>(ids.size() * 3);
        params.addAll(ids);
        params.addAll(ids);
        params.addAll(ids);
        List<DependencyRow> rows = run(Stage.LOAD_DEPENDENCIES, String.format(DEPENDENCIES_SQL, in), params,
                rs -> new DependencyRow(rs.getString(1), rs.getString(2), rs.getString(3)));

        Set<String> targets = new HashSet<>(ids);
        Map<String, IssueRelations.Builder> builders = new HashMap<>();
        for (DependencyRow row : rows) {
            String issueId = row.issueId();
            String dependsOnId = row.dependsOnId();
            boolean fromTarget = targets.contains(issueId);
            boolean toTarget = targets.contains(dependsOnId);
            switch (row.type()) {
                case DependencyEdge.PARENT_CHILD -> {
                    if (fromTarget) {
                        builder(builders, issueId).parentId(dependsOnId);
                    }
                    if (toTarget) {
                        builder(builders, dependsOnId).addChild(issueId);
                    }
                }
                case DependencyEdge.BLOCKS -> {
                    if (fromTarget) {
                        builder(builders, issueId).addBlockedBy(dependsOnId);
                    }
                    if (toTarget) {
                        builder(builders, dependsOnId).addBlocks(issueId);
                    }
                }
                case DependencyEdge.DISCOVERED_FROM -> {
                    if (fromTarget) {
                        builder(builders, issueId).addDiscoveredFrom(dependsOnId);
                    }
                    if (toTarget) {
                        builder(builders, dependsOnId).addDiscovered(issueId);
                    }
                }
                default -> {
                    // Other dependency types are not surfaced as relations
                }
            }
        }

        Map<String, IssueRelations> result = new HashMap<>();
        builders.forEach((id, builder) -> result.put(id, builder.build()));
        return result;
    }

    private Map<String, List<String>> loadLabels(List<String> ids) {
        List<LabelRow> rows = run(Stage.LOAD_LABELS, String.format(LABELS_SQL, placeholders(ids.size())), ids,
                rs -> new LabelRow(rs.getString(1), rs.getString(2)));
        Map<String, List<String>> result = new HashMap<>();
        for (LabelRow row : rows) {
            result.computeIfAbsent(row.issueId(), k -> new ArrayList<>()).add(row.label());
        }
        return result;
    }

    private Map<String, Integer> loadCommentCounts(List<String> ids) {
        List<CountRow> rows = run(Stage.LOAD_COMMENT_COUNTS,
                String.format(COMMENT_COUNTS_SQL, placeholders(ids.size())), ids,
                rs -> new CountRow(rs.getString(1), rs.getInt(2)));
        Map<String, Integer> result = new HashMap<>();
        rows.forEach(row -> result.put(row.issueId(), row.count()));
        return result;
    }

    private <T> List<T> run(Stage stage, String sql, List<?> params, RowMapper<T> mapper) {
        try {
            return runner.query(sql, params, mapper);
        } catch (SQLException e) {
            throw new BqlExecutionException(stage, e);
        }
    }

    private static IssueRelations.Builder builder(Map<String, IssueRelations.Builder> builders, String id) {
        return builders.computeIfAbsent(id, k -> IssueRelations.builder());
    }

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    private static Issue mapIssue(ResultSet rs) throws SQLException {
        return new Issue(
                rs.getString("id"),
                rs.getString("title"),
                Objects.toString(rs.getString("description"), ""),
                rs.getString("status"),
                rs.getInt("priority"),
                rs.getString("issue_type"),
                Objects.toString(rs.getString("assignee"), ""),
                nullableBoolean(rs, "pinned"),
                nullableBoolean(rs, "is_template"),
                Timestamps.parse(rs.getString("created_at")),
                Timestamps.parse(rs.getString("updated_at")),
                Timestamps.parse(rs.getString("closed_at")),
                List.of(),
                0,
                IssueRelations.NONE);
    }

    private static Boolean nullableBoolean(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value != 0;
    }

    private record DependencyRow(String issueId, String dependsOnId, String type) {
    }

    private record LabelRow(String issueId, String label) {
    }

    private record CountRow(String issueId, int count) {
    }
}
