package org.carball.srql.builder;

import org.carball.srql.model.query.FilterClause;
import org.carball.srql.model.query.FilterOperator;
import org.carball.srql.model.query.RelativeWindow;
import org.carball.srql.model.query.SortSpec;

import java.util.List;

/**
 * Events delivered by the hosting view, applied one at a time by {@link BuilderReducer}.
 */
public interface BuilderEvent {

    /** Show or hide the structured editor. */
    record Toggle() implements BuilderEvent {
    }

    record SetEntity(String entity) implements BuilderEvent {
    }

    record AddFilter(String field, FilterOperator operator, List<String> values) implements BuilderEvent {

        /**
         * One value is an equality filter, several a set membership filter.
         */
        public static AddFilter of(String field, List<String> values) {
            return new AddFilter(field, values.size() == 1 ? FilterOperator.EQ : FilterOperator.IN, values);
        }
    }

    record RemoveFilter(int index) implements BuilderEvent {
    }

    record RemoveField(String field) implements BuilderEvent {
    }

    record ChangeFilter(int index, FilterClause filter) implements BuilderEvent {
    }

    /** A null window removes the time filter. */
    record SetTime(RelativeWindow window) implements BuilderEvent {
    }

    record SetSort(SortSpec sort) implements BuilderEvent {
    }

    record SetLimit(int limit) implements BuilderEvent {
    }

    /** Free-form text typed into the query box. */
    record EditQuery(String text) implements BuilderEvent {
    }

    record Apply() implements BuilderEvent {
    }

    /** Apply, then ask the host to execute the query. */
    record Run() implements BuilderEvent {
    }
}
