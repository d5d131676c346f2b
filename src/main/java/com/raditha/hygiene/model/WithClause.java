package com.raditha.hygiene.model;

import java.util.Objects;

/**
 * A {@code pattern <- value} step of a {@code with}.
 */
public record WithClause(Pattern pattern, Node guard, Node value) {
    public WithClause {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(value, "value");
    }

    public WithClause(Pattern pattern, Node value) {
        this(pattern, null, value);
    }
}
