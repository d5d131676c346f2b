package com.raditha.hygiene.util;

import com.raditha.hygiene.analysis.InterpolationScanner;
import com.raditha.hygiene.model.CaseClause;
import com.raditha.hygiene.model.CatchClause;
import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Generator;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.model.RescueClause;
import com.raditha.hygiene.model.WithClause;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Renames variables by map across a whole subtree: binders, pins, reads and interpolation
 * tokens alike. Callers are responsible for proving the mapping is collision free.
 */
public final class VariableRenamer {

    private VariableRenamer() {
        /* this is only a utility class */
    }

    /**
     * Rename every binder and read named by a key of {@code mapping}.
     * Binders and reads flagged {@code PRESERVE_NAME} are renamed too: callers filter those
     * names out of the mapping beforehand.
     */
    public static Node renameAll(Node root, Map<String, String> mapping) {
        if (mapping.isEmpty()) {
            return root;
        }
        UnaryOperator<Pattern> patternFn = p -> renamePattern(p, mapping);
        return TreeTransformer.transform(root, n -> {
            if (n instanceof Var v && mapping.containsKey(v.name())) {
                return new Var(mapping.get(v.name()), v.meta());
            }
            if (n instanceof StringLit s && s.isInterpolated()) {
                String value = s.value();
                for (Map.Entry<String, String> e : mapping.entrySet()) {
                    Optional<String> renamed = InterpolationScanner.rename(value, e.getKey(), e.getValue());
                    if (renamed.isPresent()) {
                        value = renamed.get();
                    }
                }
                return value.equals(s.value()) ? n : new StringLit(value, s.meta());
            }
            return mapOwnPatterns(n, patternFn);
        });
    }

    public static Pattern renamePattern(Pattern p, Map<String, String> mapping) {
        Pattern result = PatternUtility.rewriteBinders(p,
                b -> mapping.containsKey(b.name()) ? b.rename(mapping.get(b.name())) : b);
        for (Map.Entry<String, String> e : mapping.entrySet()) {
            result = PatternUtility.renamePins(result, e.getKey(), e.getValue());
        }
        return result;
    }

    /**
     * Rebuild {@code n} with each pattern it holds directly passed through {@code fn}.
     * Children are not visited; combine with {@link TreeTransformer} for a deep rewrite.
     */
    public static Node mapOwnPatterns(Node n, UnaryOperator<Pattern> fn) {
        if (n instanceof Match m) {
            Pattern p = fn.apply(m.pattern());
            return p == m.pattern() ? n : new Match(p, m.value(), m.meta());
        }
        if (n instanceof Case c) {
            List<CaseClause> cl = caseClauses(c.clauses(), fn);
            return cl == c.clauses() ? n : new Case(c.subject(), cl, c.meta());
        }
        if (n instanceof Receive r) {
            List<CaseClause> cl = caseClauses(r.clauses(), fn);
            return cl == r.clauses() ? n : new Receive(cl, r.timeout(), r.afterBody(), r.meta());
        }
        if (n instanceof Fn f) {
            List<FnClause> out = new ArrayList<>();
            boolean changed = false;
            for (FnClause c : f.clauses()) {
                List<Pattern> params = patterns(c.params(), fn);
                changed |= params != c.params();
                out.add(params == c.params() ? c : new FnClause(params, c.guard(), c.body()));
            }
            return changed ? new Fn(out, f.meta()) : n;
        }
        if (n instanceof For f) {
            List<Generator> out = new ArrayList<>();
            boolean changed = false;
            for (Generator g : f.generators()) {
                Pattern p = fn.apply(g.pattern());
                changed |= p != g.pattern();
                out.add(p == g.pattern() ? g : new Generator(p, g.source()));
            }
            return changed ? new For(out, f.filters(), f.into(), f.body(), f.meta()) : n;
        }
        if (n instanceof With w) {
            List<WithClause> out = new ArrayList<>();
            boolean changed = false;
            for (WithClause c : w.clauses()) {
                Pattern p = fn.apply(c.pattern());
                changed |= p != c.pattern();
                out.add(p == c.pattern() ? c : new WithClause(p, c.guard(), c.value()));
            }
            List<CaseClause> elses = caseClauses(w.elseClauses(), fn);
            changed |= elses != w.elseClauses();
            return changed ? new With(out, w.body(), elses, w.meta()) : n;
        }
        if (n instanceof Try t) {
            boolean changed = false;
            List<RescueClause> rescues = new ArrayList<>();
            for (RescueClause r : t.rescues()) {
                Pattern b = r.binder() == null ? null : fn.apply(r.binder());
                changed |= b != r.binder();
                rescues.add(b == r.binder() ? r : new RescueClause(b, r.exceptions(), r.body()));
            }
            List<CatchClause> catches = new ArrayList<>();
            for (CatchClause c : t.catches()) {
                Pattern k = c.kind() == null ? null : fn.apply(c.kind());
                Pattern v = fn.apply(c.value());
                changed |= k != c.kind() || v != c.value();
                catches.add(k == c.kind() && v == c.value() ? c : new CatchClause(k, v, c.guard(), c.body()));
            }
            List<CaseClause> elses = caseClauses(t.elseClauses(), fn);
            changed |= elses != t.elseClauses();
            return changed ? new Try(t.body(), rescues, catches, elses, t.after(), t.meta()) : n;
        }
        if (n instanceof FunctionDef d) {
            List<Pattern> params = patterns(d.params(), fn);
            return params == d.params() ? n
                    : new FunctionDef(d.name(), d.kind(), params, d.guard(), d.body(), d.meta());
        }
        return n;
    }

    private static List<CaseClause> caseClauses(List<CaseClause> clauses, UnaryOperator<Pattern> fn) {
        List<CaseClause> out = new ArrayList<>(clauses.size());
        boolean changed = false;
        for (CaseClause c : clauses) {
            CaseClause r = c.withPattern(fn.apply(c.pattern()));
            changed |= r != c;
            out.add(r);
        }
        return changed ? out : clauses;
    }

    private static List<Pattern> patterns(List<Pattern> in, UnaryOperator<Pattern> fn) {
        List<Pattern> out = new ArrayList<>(in.size());
        boolean changed = false;
        for (Pattern p : in) {
            Pattern r = fn.apply(p);
            changed |= r != p;
            out.add(r);
        }
        return changed ? out : in;
    }

    /**
     * True when any binder, pin or read of {@code name} in the subtree carries {@code PRESERVE_NAME}.
     */
    public static boolean isPreserved(Node root, String name) {
        boolean[] found = {false};
        NodeQueries.walk(root, n -> {
            if (n instanceof Var v && v.name().equals(name) && v.has(MetaFlag.PRESERVE_NAME)) {
                found[0] = true;
            }
            for (Pattern p : NodeQueries.patternsOf(n)) {
                for (PBind b : PatternUtility.binders(p)) {
                    if (b.name().equals(name) && b.has(MetaFlag.PRESERVE_NAME)) {
                        found[0] = true;
                    }
                }
            }
            return !found[0];
        });
        return found[0];
    }
}
