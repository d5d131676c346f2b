package com.raditha.hygiene.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code rescue binder in [Exceptions] -> body}. Both the binder and the exception list are optional.
 */
public record RescueClause(Pattern binder, List<String> exceptions, Node body) {
    public RescueClause {
        exceptions = exceptions == null ? List.of() : List.copyOf(exceptions);
        Objects.requireNonNull(body, "body");
    }
}
