package org.carball.srql.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;
import org.carball.srql.pagination.PaginationMeta;

import java.util.List;
import java.util.Map;

/**
 * Result envelope: rows in the requested order, cursors, and a warning when the request was
 * served differently than asked (for example a stale cursor that fell back to the first page).
 */
@Value
public class QueryResponse {
    List<Map<String, Object>> results;
    PaginationMeta pagination;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    String warning;
}
