package org.carball.srql.pagination;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Rows of one page in the requested sort order, with the cursors around it.
 */
@Value
public class Page {
    List<Map<String, Object>> rows;
    PaginationMeta pagination;
}
