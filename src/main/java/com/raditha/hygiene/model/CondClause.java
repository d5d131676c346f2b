package com.raditha.hygiene.model;

import java.util.Objects;

/**
 * One {@code condition -> body} arm of a {@code cond}.
 */
public record CondClause(Node condition, Node body) {
    public CondClause {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(body, "body");
    }
}
