package org.carball.srql.compiler;

import lombok.Value;

import java.util.List;

/**
 * Parameterized SQL plus its ordered parameter list. Every caller-supplied literal is in
 * {@code params}; {@code sql} holds only allow-listed identifiers, keywords and placeholders.
 */
@Value
public class CompiledQuery {
    String sql;
    List<Object> params;
    QueryPlan plan;
}
