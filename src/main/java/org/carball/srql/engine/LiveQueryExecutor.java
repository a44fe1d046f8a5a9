package org.carball.srql.engine;

import org.carball.srql.compiler.CompiledQuery;
import org.carball.srql.error.QueryExecutionException;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Executor that can also push matching rows as they arrive, for {@code stream:true} queries.
 */
public interface LiveQueryExecutor extends QueryExecutor {

    /**
     * Starts a live feed seeded from the compiled predicate and sort. The feed runs until the
     * returned subscription is closed.
     */
    StreamSubscription subscribe(CompiledQuery query, Consumer<Map<String, Object>> onRow)
            throws QueryExecutionException;
}
