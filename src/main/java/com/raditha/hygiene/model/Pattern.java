package com.raditha.hygiene.model;

import java.util.List;
import java.util.Objects;

/**
 * Binding-position tree: case heads, function parameters, left-hand sides of matches.
 * <p>
 * Patterns are not visited by {@link com.raditha.hygiene.util.TreeTransformer}. A pass that
 * renames binders has to walk the pattern explicitly, usually through
 * {@link com.raditha.hygiene.util.PatternUtility}.
 */
public sealed interface Pattern {

    Meta meta();

    <R> R accept(PatternVisitor<R> visitor);

    default boolean has(MetaFlag flag) {
        return meta().has(flag);
    }

    /** Binds a name. {@code _} and names starting with {@code _} are the "unused" forms. */
    record PBind(String name, Meta meta) implements Pattern {
        public PBind {
            Objects.requireNonNull(name, "name");
        }

        public PBind(String name) {
            this(name, Meta.NONE);
        }

        public boolean isWildcard() {
            return "_".equals(name);
        }

        public PBind rename(String newName) {
            return new PBind(newName, meta);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    record PTuple(List<Pattern> elements, Meta meta) implements Pattern {
        public PTuple {
            elements = List.copyOf(elements);
        }

        public PTuple(List<Pattern> elements) {
            this(elements, Meta.NONE);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    record PList(List<Pattern> elements, Meta meta) implements Pattern {
        public PList {
            elements = List.copyOf(elements);
        }

        public PList(List<Pattern> elements) {
            this(elements, Meta.NONE);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    record PCons(List<Pattern> heads, Pattern tail, Meta meta) implements Pattern {
        public PCons {
            heads = List.copyOf(heads);
            Objects.requireNonNull(tail, "tail");
        }

        public PCons(List<Pattern> heads, Pattern tail) {
            this(heads, tail, Meta.NONE);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    record PMap(List<PMapEntry> entries, Meta meta) implements Pattern {
        public PMap {
            entries = List.copyOf(entries);
        }

        public PMap(List<PMapEntry> entries) {
            this(entries, Meta.NONE);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    record PStruct(String module, List<PMapEntry> fields, Meta meta) implements Pattern {
        public PStruct {
            Objects.requireNonNull(module, "module");
            fields = List.copyOf(fields);
        }

        public PStruct(String module, List<PMapEntry> fields) {
            this(module, fields, Meta.NONE);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code ^name}: matches the value already bound to {@code name}; reads, never binds. */
    record PPin(String name, Meta meta) implements Pattern {
        public PPin {
            Objects.requireNonNull(name, "name");
        }

        public PPin(String name) {
            this(name, Meta.NONE);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** {@code inner = name}: binds the whole matched value to {@code name} as well. */
    record PAlias(String name, Pattern inner, Meta meta) implements Pattern {
        public PAlias {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(inner, "inner");
        }

        public PAlias(String name, Pattern inner) {
            this(name, inner, Meta.NONE);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** Matches a literal node (atom, number, string, boolean or nil). */
    record PLiteral(Node literal, Meta meta) implements Pattern {
        public PLiteral {
            Objects.requireNonNull(literal, "literal");
        }

        public PLiteral(Node literal) {
            this(literal, Meta.NONE);
        }

        public <R> R accept(PatternVisitor<R> v) {
            return v.visit(this);
        }
    }

    /** Key/value pair of a map or struct pattern. Keys are literal nodes. */
    record PMapEntry(Node key, Pattern value) {
        public PMapEntry {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }
}
