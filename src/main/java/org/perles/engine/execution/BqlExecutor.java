package org.perles.engine.execution;

import org.perles.engine.model.Issue;

import java.util.List;

/**
 * Runs BQL query text against an issue store.
 */
public interface BqlExecutor {

    /**
     * @param query BQL text
     * @return Matching issues, base matches first
     * @throws BqlExecutionException naming the failed stage
     */
    List<Issue> execute(String query);

    /**
     * Like {@link #execute(String)}, also reporting whether an expansion was truncated.
     */
    QueryResult executeForResult(String query);
}
