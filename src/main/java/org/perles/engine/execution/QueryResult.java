package org.perles.engine.execution;

import org.perles.engine.model.Issue;

import java.util.List;

/**
 * Issues returned by a query: base matches first, then issues reached by expansion.
 *
 * @param issues             The issues, each id at most once
 * @param expansionTruncated true when an unlimited expansion hit the iteration ceiling
 */
public record QueryResult(List<Issue> issues, boolean expansionTruncated) {

    public QueryResult {
        issues = List.copyOf(issues);
    }

    public int size() {
        return issues.size();
    }
}
