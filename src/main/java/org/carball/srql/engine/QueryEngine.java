package org.carball.srql.engine;

import lombok.extern.slf4j.Slf4j;
import org.carball.srql.compiler.CompiledQuery;
import org.carball.srql.compiler.QueryTranslator;
import org.carball.srql.error.InvalidCursorException;
import org.carball.srql.error.QueryExecutionException;
import org.carball.srql.error.SrqlException;
import org.carball.srql.error.SrqlResult;
import org.carball.srql.error.UnsupportedExpressionException;
import org.carball.srql.model.query.PageDirection;
import org.carball.srql.pagination.Page;
import org.carball.srql.pagination.PageAssembler;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Translate, execute and wrap the rows in a pagination envelope. A stale or foreign cursor
 * falls back to the first page with a warning instead of failing the request, and so does a
 * {@code prev} cursor with no rows left before it.
 */
@Slf4j
public class QueryEngine {

    private final QueryTranslator translator;
    private final QueryExecutor executor;
    private final PageAssembler pageAssembler;

    public QueryEngine(QueryTranslator translator, QueryExecutor executor) {
        this.translator = translator;
        this.executor = executor;
        this.pageAssembler = new PageAssembler(translator.getCursorCodec());
    }

    public SrqlResult<QueryResponse> execute(QueryRequest request) {
        try {
            String warning = null;
            CompiledQuery compiled;
            try {
                compiled = translator.compile(request.getQuery(), request.getCursor(),
                        request.getDirection(), request.getLimit());
            } catch (InvalidCursorException e) {
                log.warn("Ignoring invalid cursor, returning first page: {}", e.getMessage());
                warning = "cursor is no longer valid, showing the first page";
                compiled = translator.compileFirstPage(request.getQuery(), request.getLimit());
            }

            List<Map<String, Object>> rows = runQuery(compiled);
            if (rows.isEmpty() && compiled.getPlan().getCursor() != null
                    && compiled.getPlan().getDirection() == PageDirection.PREV) {
                log.debug("No rows before the cursor for '{}', returning first page",
                        compiled.getPlan().getSchema().getName());
                warning = "no earlier rows, showing the first page";
                compiled = translator.compileFirstPage(request.getQuery(), request.getLimit());
                rows = runQuery(compiled);
            }
            Page page = pageAssembler.assemble(compiled.getPlan(), rows);
            return SrqlResult.ok(new QueryResponse(page.getRows(), page.getPagination(), warning));
        } catch (SrqlException e) {
            log.debug("Query failed: {}", e.getMessage());
            return SrqlResult.failure(e);
        }
    }

    /**
     * Seeds a live feed from the compiled query. The executor owns the subscription; the caller
     * cancels it by closing the returned handle.
     */
    public SrqlResult<StreamSubscription> stream(QueryRequest request, Consumer<Map<String, Object>> onRow) {
        try {
            if (!(executor instanceof LiveQueryExecutor live)) {
                throw new UnsupportedExpressionException("the configured executor does not support streaming");
            }
            CompiledQuery compiled = translator.compileFirstPage(request.getQuery(), request.getLimit());
            if (!compiled.getPlan().isStream()) {
                log.debug("Streaming query for '{}' without stream:true", compiled.getPlan().getSchema().getName());
            }
            StreamSubscription subscription = live.subscribe(compiled, onRow);
            log.info("Started live feed for '{}'", compiled.getPlan().getSchema().getName());
            return SrqlResult.ok(subscription);
        } catch (SrqlException e) {
            log.debug("Stream failed: {}", e.getMessage());
            return SrqlResult.failure(e);
        }
    }

    private List<Map<String, Object>> runQuery(CompiledQuery compiled) throws QueryExecutionException {
        try {
            return executor.execute(compiled);
        } catch (QueryExecutionException e) {
            log.error("Executor failed for '{}': {}", compiled.getPlan().getSchema().getName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Executor failed for '{}'", compiled.getPlan().getSchema().getName(), e);
            throw new QueryExecutionException("executor failed: " + e.getMessage(), e);
        }
    }
}
