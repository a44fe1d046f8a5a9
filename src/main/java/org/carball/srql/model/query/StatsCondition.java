package org.carball.srql.model.query;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Condition of a conditional count in disjunctive normal form: the outer list is ORed, each
 * inner list is ANDed. {@code AND} binds tighter than {@code OR}.
 */
public record StatsCondition(List<List<ConditionTerm>> disjuncts) {

    public StatsCondition {
        disjuncts = disjuncts.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    public List<ConditionTerm> terms() {
        return disjuncts.stream().flatMap(List::stream).collect(Collectors.toList());
    }

    public String toSrql() {
        return disjuncts.stream()
                .map(group -> group.stream().map(ConditionTerm::toSrql).collect(Collectors.joining(" AND ")))
                .collect(Collectors.joining(" OR "));
    }
}
