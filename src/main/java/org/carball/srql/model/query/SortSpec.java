package org.carball.srql.model.query;

public record SortSpec(String field, SortDirection direction) {

    public String toSrql() {
        return field + ":" + direction.keyword();
    }
}
