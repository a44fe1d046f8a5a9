package org.carball.srql.engine;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryRequest {
    String query;
    String cursor;
    String direction;
    Integer limit;

    public static QueryRequest of(String query) {
        return QueryRequest.builder().query(query).build();
    }
}
