package org.carball.srql.pagination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.ALWAYS)
public class PaginationMeta {
    @JsonProperty("prev_cursor")
    String prevCursor;

    @JsonProperty("next_cursor")
    String nextCursor;

    int limit;

    public static PaginationMeta none(int limit) {
        return new PaginationMeta(null, null, limit);
    }
}
