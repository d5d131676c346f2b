package com.raditha.hygiene.util;

import com.raditha.hygiene.analysis.InterpolationScanner;
import com.raditha.hygiene.analysis.OpaqueFragmentScanner;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Raw;
import com.raditha.hygiene.model.Node.StringLit;
import com.raditha.hygiene.model.Node.Var;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.*;
import com.raditha.hygiene.model.PatternVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Binder helpers shared by the hygiene passes.
 * <p>
 * Patterns are never entered by {@link TreeTransformer}, so every pass that renames a binder goes
 * through here to keep the pattern and the body it governs in step.
 */
public final class PatternUtility {

    private static final Logger logger = LoggerFactory.getLogger(PatternUtility.class);

    private PatternUtility() {
        /* this is only a utility class */
    }

    /**
     * The result of a consistent rename: the new pattern and the new body.
     */
    public record Renamed(Pattern pattern, Node body) {
    }

    /**
     * Every name bound by the pattern, in left-to-right order. {@code _} is not a binding.
     *
     * @param pattern the pattern to walk
     * @return the bound names
     */
    public static Set<String> collectBound(Pattern pattern) {
        Set<String> names = new LinkedHashSet<>();
        collect(pattern, names, false);
        return names;
    }

    public static Set<String> collectBound(List<Pattern> patterns) {
        Set<String> names = new LinkedHashSet<>();
        for (Pattern p : patterns) {
            collect(p, names, false);
        }
        return names;
    }

    /**
     * Names the pattern reads through {@code ^pin}.
     */
    public static Set<String> collectPinned(Pattern pattern) {
        Set<String> names = new LinkedHashSet<>();
        collect(pattern, names, true);
        return names;
    }

    private static void collect(Pattern pattern, Set<String> into, boolean pins) {
        pattern.accept(new PatternVisitor<Void>() {
            public Void visit(PBind p) {
                if (!pins && !p.isWildcard()) {
                    into.add(p.name());
                }
                return null;
            }

            public Void visit(PTuple p) {
                p.elements().forEach(e -> e.accept(this));
                return null;
            }

            public Void visit(PList p) {
                p.elements().forEach(e -> e.accept(this));
                return null;
            }

            public Void visit(PCons p) {
                p.heads().forEach(e -> e.accept(this));
                p.tail().accept(this);
                return null;
            }

            public Void visit(PMap p) {
                p.entries().forEach(e -> e.value().accept(this));
                return null;
            }

            public Void visit(PStruct p) {
                p.fields().forEach(e -> e.value().accept(this));
                return null;
            }

            public Void visit(PPin p) {
                if (pins) {
                    into.add(p.name());
                }
                return null;
            }

            public Void visit(PAlias p) {
                if (!pins && !"_".equals(p.name())) {
                    into.add(p.name());
                }
                p.inner().accept(this);
                return null;
            }

            public Void visit(PLiteral p) {
                return null;
            }
        });
    }

    /**
     * Every {@link PBind} in the pattern, in order, including wildcards.
     */
    public static List<PBind> binders(Pattern pattern) {
        List<PBind> result = new ArrayList<>();
        rewriteBinders(pattern, b -> {
            result.add(b);
            return b;
        });
        return result;
    }

    /**
     * Rebuilds the pattern with every {@link PBind} passed through {@code fn}. Alias names are
     * rewritten too, through a synthetic {@link PBind} carrying the alias' metadata. Returns the
     * same instance when nothing changed.
     */
    public static Pattern rewriteBinders(Pattern pattern, UnaryOperator<PBind> fn) {
        return pattern.accept(new PatternVisitor<Pattern>() {
            private List<Pattern> all(List<Pattern> in) {
                List<Pattern> out = new ArrayList<>(in.size());
                boolean changed = false;
                for (Pattern p : in) {
                    Pattern r = p.accept(this);
                    changed |= r != p;
                    out.add(r);
                }
                return changed ? out : in;
            }

            private List<PMapEntry> entries(List<PMapEntry> in) {
                List<PMapEntry> out = new ArrayList<>(in.size());
                boolean changed = false;
                for (PMapEntry e : in) {
                    Pattern r = e.value().accept(this);
                    changed |= r != e.value();
                    out.add(r == e.value() ? e : new PMapEntry(e.key(), r));
                }
                return changed ? out : in;
            }

            public Pattern visit(PBind p) {
                return fn.apply(p);
            }

            public Pattern visit(PTuple p) {
                List<Pattern> e = all(p.elements());
                return e == p.elements() ? p : new PTuple(e, p.meta());
            }

            public Pattern visit(PList p) {
                List<Pattern> e = all(p.elements());
                return e == p.elements() ? p : new PList(e, p.meta());
            }

            public Pattern visit(PCons p) {
                List<Pattern> h = all(p.heads());
                Pattern t = p.tail().accept(this);
                return h == p.heads() && t == p.tail() ? p : new PCons(h, t, p.meta());
            }

            public Pattern visit(PMap p) {
                List<PMapEntry> e = entries(p.entries());
                return e == p.entries() ? p : new PMap(e, p.meta());
            }

            public Pattern visit(PStruct p) {
                List<PMapEntry> e = entries(p.fields());
                return e == p.fields() ? p : new PStruct(p.module(), e, p.meta());
            }

            public Pattern visit(PPin p) {
                return p;
            }

            public Pattern visit(PAlias p) {
                PBind asBind = new PBind(p.name(), p.meta());
                PBind renamed = fn.apply(asBind);
                Pattern inner = p.inner().accept(this);
                if (renamed.name().equals(p.name()) && renamed.meta().equals(p.meta()) && inner == p.inner()) {
                    return p;
                }
                return new PAlias(renamed.name(), inner, renamed.meta());
            }

            public Pattern visit(PLiteral p) {
                return p;
            }
        });
    }

    /**
     * Renames the binder {@code from} to {@code to} inside the pattern only.
     */
    public static Pattern renameBinder(Pattern pattern, String from, String to) {
        return rewriteBinders(pattern, b -> b.name().equals(from) ? b.rename(to) : b);
    }

    /**
     * Rewrites pins of {@code from} into pins of {@code to}.
     */
    public static Pattern renamePins(Pattern pattern, String from, String to) {
        return pattern.accept(new Rebuilder() {
            @Override
            public Pattern visit(PPin p) {
                return p.name().equals(from) ? new PPin(to, p.meta()) : p;
            }
        });
    }

    /**
     * Module names of every struct pattern ({@code %Mod{...}}) inside the pattern.
     */
    public static Set<String> structModules(Pattern pattern) {
        Set<String> result = new LinkedHashSet<>();
        pattern.accept(new Rebuilder() {
            @Override
            public Pattern visit(PStruct p) {
                result.add(p.module());
                return super.visit(p);
            }
        });
        return result;
    }

    /**
     * Rebuilds the pattern with the module of every struct pattern passed through {@code fn}.
     */
    public static Pattern rewriteStructModules(Pattern pattern, UnaryOperator<String> fn) {
        return pattern.accept(new Rebuilder() {
            @Override
            public Pattern visit(PStruct p) {
                PStruct rebuilt = (PStruct) super.visit(p);
                String module = fn.apply(rebuilt.module());
                return module.equals(rebuilt.module()) ? rebuilt : new PStruct(module, rebuilt.fields(), rebuilt.meta());
            }
        });
    }

    /**
     * Identity-preserving rebuild of a pattern; subclasses override the variants they change.
     */
    private static class Rebuilder implements PatternVisitor<Pattern> {
        List<Pattern> all(List<Pattern> in) {
            List<Pattern> out = new ArrayList<>(in.size());
            boolean changed = false;
            for (Pattern p : in) {
                Pattern r = p.accept(this);
                changed |= r != p;
                out.add(r);
            }
            return changed ? out : in;
        }

        List<PMapEntry> entries(List<PMapEntry> in) {
            List<PMapEntry> out = new ArrayList<>(in.size());
            boolean changed = false;
            for (PMapEntry e : in) {
                Pattern r = e.value().accept(this);
                changed |= r != e.value();
                out.add(r == e.value() ? e : new PMapEntry(e.key(), r));
            }
            return changed ? out : in;
        }

        public Pattern visit(PBind p) {
            return p;
        }

        public Pattern visit(PTuple p) {
            List<Pattern> e = all(p.elements());
            return e == p.elements() ? p : new PTuple(e, p.meta());
        }

        public Pattern visit(PList p) {
            List<Pattern> e = all(p.elements());
            return e == p.elements() ? p : new PList(e, p.meta());
        }

        public Pattern visit(PCons p) {
            List<Pattern> h = all(p.heads());
            Pattern t = p.tail().accept(this);
            return h == p.heads() && t == p.tail() ? p : new PCons(h, t, p.meta());
        }

        public Pattern visit(PMap p) {
            List<PMapEntry> e = entries(p.entries());
            return e == p.entries() ? p : new PMap(e, p.meta());
        }

        public Pattern visit(PStruct p) {
            List<PMapEntry> e = entries(p.fields());
            return e == p.fields() ? p : new PStruct(p.module(), e, p.meta());
        }

        public Pattern visit(PPin p) {
            return p;
        }

        public Pattern visit(PAlias p) {
            Pattern inner = p.inner().accept(this);
            return inner == p.inner() ? p : new PAlias(p.name(), inner, p.meta());
        }

        public Pattern visit(PLiteral p) {
            return p;
        }
    }

    /**
     * Renames a binder in a pattern together with every read of it in the governed body.
     * <p>
     * Refuses (returns empty) when:
     * <ol>
     *     <li>{@code from} is not bound by the pattern</li>
     *     <li>{@code to} is already bound by the pattern</li>
     *     <li>the body binds {@code from} or {@code to} itself, so reads could refer to another binding</li>
     *     <li>the body pins {@code from} in a nested pattern</li>
     *     <li>an opaque fragment or an unparseable interpolation in the body mentions {@code from}</li>
     * </ol>
     *
     * @param pattern the clause head or parameter
     * @param body    the body the binder governs; may be {@code null} for a bodiless binder
     * @param from    current name
     * @param to      new name
     * @return the renamed pair, or empty when the rename is not provably safe
     */
    public static Optional<Renamed> renameConsistently(Pattern pattern, Node body, String from, String to) {
        if (from.equals(to)) {
            return Optional.of(new Renamed(pattern, body));
        }
        Set<String> bound = collectBound(pattern);
        if (!bound.contains(from)) {
            return Optional.empty();
        }
        if (bound.contains(to)) {
            logger.debug("Refusing rename {} -> {}: target already bound in pattern", from, to);
            return Optional.empty();
        }
        Pattern newPattern = renameBinder(pattern, from, to);
        if (body == null) {
            return Optional.of(new Renamed(newPattern, null));
        }
        Set<String> inner = NodeQueries.boundAnywhere(body);
        if (inner.contains(from) || inner.contains(to) || NodeQueries.pinnedAnywhere(body).contains(from)) {
            logger.debug("Refusing rename {} -> {}: body rebinds one of the names", from, to);
            return Optional.empty();
        }
        return renameReads(body, from, to).map(b -> new Renamed(newPattern, b));
    }

    /**
     * Renames plain reads of {@code from} in a node, interpolations included. Does not look at
     * binders. Empty when an opaque fragment or malformed interpolation mentions {@code from}.
     */
    public static Optional<Node> renameReads(Node body, String from, String to) {
        boolean[] blocked = {false};
        Node result = TreeTransformer.transform(body, n -> {
            if (n instanceof Var v && v.name().equals(from)) {
                return new Var(to, v.meta());
            }
            if (n instanceof StringLit s && s.isInterpolated()) {
                Optional<String> renamed = InterpolationScanner.rename(s.value(), from, to);
                if (renamed.isEmpty()) {
                    blocked[0] = true;
                    return n;
                }
                return renamed.get().equals(s.value()) ? n : new StringLit(renamed.get(), s.meta());
            }
            if (n instanceof Raw r && OpaqueFragmentScanner.mentions(r.code(), from)) {
                blocked[0] = true;
            }
            return n;
        });
        return blocked[0] ? Optional.empty() : Optional.of(result);
    }
}
