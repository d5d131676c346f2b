package com.raditha.hygiene.model;

import java.util.Objects;

/**
 * A key/value pair of a map literal, map update or struct literal.
 */
public record MapEntry(Node key, Node value) {
    public MapEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }
}
