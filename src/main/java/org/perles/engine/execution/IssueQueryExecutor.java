package org.perles.engine.execution;

import com.github.benmanes.caffeine.cache.Ticker;
import org.perles.bql.dsl.BqlParseException;
import org.perles.bql.dsl.BqlParser;
import org.perles.bql.dsl.ExpandClause;
import org.perles.bql.dsl.Query;
import org.perles.bql.validation.BqlValidationException;
import org.perles.bql.validation.BqlValidator;
import org.perles.engine.cache.ReadThroughCache;
import org.perles.engine.execution.BqlExecutionException.Stage;
import org.perles.engine.graph.DependencyGraph;
import org.perles.engine.graph.DependencyGraphLoader;
import org.perles.engine.graph.Expansion;
import org.perles.engine.graph.GraphExpander;
import org.perles.engine.graph.GraphExpansionException;
import org.perles.engine.model.Issue;
import org.perles.engine.store.JdbcQueryRunner;
import org.perles.engine.transpiler.BqlSqlCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Executes BQL against the issue store.
 *
 * The executor:
 * 1. Parses and validates the query text
 * 2. Compiles it to SQL and runs the base query plus three batch loads
 * 3. Expands over the cached dependency graph when the query has an EXPAND clause
 * 4. Fetches the issues the expansion reached and appends them after the base matches
 *
 * Results are cached per query text. {@link #onStoreMutated()} drops every cached
 * result and the dependency graph.
 */
public class IssueQueryExecutor implements BqlExecutor, StoreMutationListener {

    private static final Logger LOG = LoggerFactory.getLogger(IssueQueryExecutor.class);

    static final String DEPENDENCY_GRAPH_KEY = "__dependency_graph__";

    private final BqlValidator validator = new BqlValidator();
    private final BqlSqlCompiler compiler = new BqlSqlCompiler();
    private final IssueBatchLoader batchLoader;
    private final DependencyGraphLoader graphLoader;
    private final GraphExpander expander;
    private final ReadThroughCache<String, QueryResult> queryCache;
    private final ReadThroughCache<String, DependencyGraph> graphCache;

    public IssueQueryExecutor(DataSource dataSource) {
        this(dataSource, BqlConfig.load());
    }

    public IssueQueryExecutor(DataSource dataSource, BqlConfig config) {
        this(new JdbcQueryRunner(dataSource, config.queryTimeoutSeconds()), config, Ticker.systemTicker());
    }

    public IssueQueryExecutor(JdbcQueryRunner runner, BqlConfig config, Ticker ticker) {
        this.batchLoader = new IssueBatchLoader(runner);
        this.graphLoader = new DependencyGraphLoader(runner);
        this.expander = new GraphExpander(config.expandMaxIterations(), config.expandTimeBudget(), ticker);
        this.queryCache = ReadThroughCache.builder("bql-queries")
                .enabled(config.cacheEnabled())
                .defaultTtl(config.cacheTtl())
                .maximumSize(config.cacheMaxQueries())
                .ticker(ticker)
                .build();
        this.graphCache = ReadThroughCache.builder("bql-dependency-graph")
                .enabled(config.cacheEnabled())
                .defaultTtl(config.cacheTtl())
                .maximumSize(1)
                .ticker(ticker)
                .build();
    }

    @Override
    public List<Issue> execute(String query) {
        return executeForResult(query).issues();
    }

    @Override
    public QueryResult executeForResult(String text) {
        String input = text == null ? "" : text;
        long start = System.nanoTime();

        Query query;
        try {
            query = BqlParser.parse(input);
        } catch (BqlParseException e) {
            throw new BqlExecutionException(Stage.PARSE, e);
        }
        try {
            validator.validate(query);
        } catch (BqlValidationException e) {
            throw new BqlExecutionException(Stage.VALIDATE, e);
        }

        QueryResult result = queryCache.getWithRefresh(input, key -> run(query));
        LOG.debug("Query complete in {}ms with {} issues: {}",
                (System.nanoTime() - start) / 1_000_000, result.size(), input);
        return result;
    }

    /**
     * Drops the cached result of one query text.
     */
    public void invalidateQuery(String text) {
        queryCache.invalidate(text == null ? "" : text);
    }

    /**
     * Drops the cached dependency graph; the next expansion reloads it.
     */
    public void invalidateDependencyGraph() {
        graphCache.invalidate(DEPENDENCY_GRAPH_KEY);
    }

    @Override
    public void onStoreMutated() {
        queryCache.invalidateAll();
        graphCache.invalidateAll();
    }

    private QueryResult run(Query query) {
        List<Issue> base = batchLoader.load(compiler.compile(query));
        if (!query.hasExpand() || base.isEmpty()) {
            return new QueryResult(base, false);
        }

        ExpandClause expand = query.expand();
        DependencyGraph graph = graphCache.getWithRefresh(DEPENDENCY_GRAPH_KEY, key -> loadGraph());

        List<String> baseIds = base.stream().map(Issue::id).toList();
        Expansion expansion;
        try {
            expansion = expander.expand(graph, baseIds, expand.direction(), expand.depth());
        } catch (GraphExpansionException e) {
            throw new BqlExecutionException(Stage.EXPAND, e);
        }

        Set<String> known = new HashSet<>(baseIds);
        List<String> delta = new ArrayList<>();
        for (String id : expansion.ids()) {
            if (!known.contains(id)) {
                delta.add(id);
            }
        }
        if (delta.isEmpty()) {
            return new QueryResult(base, expansion.truncated());
        }

        List<Issue> expanded = batchLoader.loadByIds(delta);
        List<Issue> all = new ArrayList<>(base.size() + expanded.size());
        all.addAll(base);
        all.addAll(expanded);
        LOG.debug("Expanded {} depth {} over {}: {} base, {} added",
                expand.direction(), expand.isUnlimited() ? "*" : expand.depth(), graph, base.size(), expanded.size());
        return new QueryResult(all, expansion.truncated());
    }

    private DependencyGraph loadGraph() {
        try {
            return graphLoader.load();
        } catch (SQLException e) {
            throw new BqlExecutionException(Stage.LOAD_GRAPH, e);
        }
    }
}
