package org.carball.srql.engine;

import org.carball.srql.compiler.CompiledQuery;
import org.carball.srql.error.QueryExecutionException;

import java.util.List;
import java.util.Map;

/**
 * Backing store that runs compiled SQL. Authorization and row-level security are its concern.
 */
public interface QueryExecutor {

    /**
     * Runs the query and returns its rows in fetch order, keyed by column label.
     */
    List<Map<String, Object>> execute(CompiledQuery query) throws QueryExecutionException;
}
