package com.raditha.hygiene.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Metadata attached to every node and pattern: a small set of flags plus a source position.
 * <p>
 * Flags can only be added. There is no operation that removes one, so a pass can never clear a
 * flag that an earlier pass set.
 */
public final class Meta {

    public static final Meta NONE = new Meta(EnumSet.noneOf(MetaFlag.class), SourcePos.UNKNOWN);

    private final Set<MetaFlag> flags;
    private final SourcePos pos;

    private Meta(EnumSet<MetaFlag> flags, SourcePos pos) {
        this.flags = Collections.unmodifiableSet(flags);
        this.pos = pos;
    }

    public static Meta at(SourcePos pos) {
        return new Meta(EnumSet.noneOf(MetaFlag.class), pos == null ? SourcePos.UNKNOWN : pos);
    }

    public static Meta of(MetaFlag first, MetaFlag... rest) {
        return new Meta(EnumSet.of(first, rest), SourcePos.UNKNOWN);
    }

    public Meta with(MetaFlag flag) {
        if (flags.contains(flag)) {
            return this;
        }
        EnumSet<MetaFlag> copy = flags.isEmpty() ? EnumSet.noneOf(MetaFlag.class) : EnumSet.copyOf(flags);
        copy.add(flag);
        return new Meta(copy, pos);
    }

    /**
     * Union of both flag sets, keeping this position (or the other one when this is unknown).
     */
    public Meta merge(Meta other) {
        if (other == null || other == this) {
            return this;
        }
        EnumSet<MetaFlag> copy = EnumSet.noneOf(MetaFlag.class);
        copy.addAll(flags);
        copy.addAll(other.flags);
        SourcePos p = pos.isKnown() ? pos : other.pos;
        return new Meta(copy, p);
    }

    public boolean has(MetaFlag flag) {
        return flags.contains(flag);
    }

    public Set<MetaFlag> flags() {
        return flags;
    }

    public SourcePos pos() {
        return pos;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Meta)) {
            return false;
        }
        Meta other = (Meta) o;
        return flags.equals(other.flags) && pos.equals(other.pos);
    }

    @Override
    public int hashCode() {
        return 31 * flags.hashCode() + pos.hashCode();
    }

    @Override
    public String toString() {
        return flags.isEmpty() ? pos.toString() : flags + "@" + pos;
    }
}
