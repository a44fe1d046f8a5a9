package org.carball.srql.compiler;

import lombok.Builder;
import lombok.Value;
import org.carball.srql.model.query.PageDirection;
import org.carball.srql.model.query.Query;
import org.carball.srql.model.query.SortSpec;
import org.carball.srql.model.schema.EntitySchema;
import org.carball.srql.pagination.CursorToken;

/**
 * Normalized view of a compiled query, kept alongside the SQL so executors and the pagination
 * layer do not have to parse again.
 */
@Value
@Builder
public class QueryPlan {
    Query query;
    EntitySchema schema;
    SortSpec sort;
    PageDirection direction;

    /** Cursor applied as a keyset predicate; null on a first page and for aggregate queries. */
    CursorToken cursor;

    /** Rows the caller asked for, after clamping. */
    int limit;

    /** Rows the SQL fetches: {@code limit + 1} when a probe row detects a further page. */
    int fetchLimit;

    boolean paginated;
    boolean stream;
    String fingerprint;

    public boolean hasProbeRow() {
        return fetchLimit > limit;
    }
}
