package com.raditha.hygiene.model;

/**
 * Exhaustive visitor over {@link Pattern} variants.
 *
 * @param <R> result type
 */
public interface PatternVisitor<R> {

    R visit(Pattern.PBind p);

    R visit(Pattern.PTuple p);

    R visit(Pattern.PList p);

    R visit(Pattern.PCons p);

    R visit(Pattern.PMap p);

    R visit(Pattern.PStruct p);

    R visit(Pattern.PPin p);

    R visit(Pattern.PAlias p);

    R visit(Pattern.PLiteral p);
}
