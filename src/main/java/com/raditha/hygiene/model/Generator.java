package com.raditha.hygiene.model;

import java.util.Objects;

/**
 * A {@code pattern <- source} generator of a comprehension.
 */
public record Generator(Pattern pattern, Node source) {
    public Generator {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(source, "source");
    }
}
