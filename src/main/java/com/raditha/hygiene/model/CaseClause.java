package com.raditha.hygiene.model;

import java.util.Objects;

/**
 * One clause of a {@code case}, {@code receive} or {@code else} block.
 *
 * @param pattern the clause head
 * @param guard   optional {@code when} expression, {@code null} when absent
 * @param body    clause body
 */
public record CaseClause(Pattern pattern, Node guard, Node body) {
    public CaseClause {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(body, "body");
    }

    public CaseClause(Pattern pattern, Node body) {
        this(pattern, null, body);
    }

    public CaseClause withPattern(Pattern p) {
        return p == pattern ? this : new CaseClause(p, guard, body);
    }

    public CaseClause withBody(Node b) {
        return b == body ? this : new CaseClause(pattern, guard, b);
    }
}
