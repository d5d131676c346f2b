package com.raditha.hygiene.model;

import java.util.List;
import java.util.Objects;

/**
 * One clause of an anonymous function literal.
 *
 * @param params parameter patterns
 * @param guard  optional guard, {@code null} when absent
 * @param body   clause body
 */
public record FnClause(List<Pattern> params, Node guard, Node body) {
    public FnClause {
        params = List.copyOf(params);
        Objects.requireNonNull(body, "body");
    }

    public FnClause(List<Pattern> params, Node body) {
        this(params, null, body);
    }

    public int arity() {
        return params.size();
    }
}
