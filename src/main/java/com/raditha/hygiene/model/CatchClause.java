package com.raditha.hygiene.model;

import java.util.Objects;

/**
 * {@code catch kind, value -> body}; {@code kind} is {@code null} for the one-argument form.
 */
public record CatchClause(Pattern kind, Pattern value, Node guard, Node body) {
    public CatchClause {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(body, "body");
    }
}
