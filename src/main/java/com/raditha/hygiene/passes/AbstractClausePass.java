package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.CaseClause;
import com.raditha.hygiene.model.CatchClause;
import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.RescueClause;
import com.raditha.hygiene.util.PatternUtility;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base for passes that rewrite one clause at a time: a list of head patterns, an optional guard
 * and a body, all of which may change together.
 * <p>
 * {@link #rewriteClauses} finds the clauses held directly by a node (function definitions,
 * anonymous functions, {@code case}, {@code receive}, {@code try} and the {@code else} of a
 * {@code with}) and rebuilds the node from the rewritten clauses.
 */
public abstract class AbstractClausePass implements NormalizationPass {

    /**
     * A clause after rewriting.
     */
    protected record Clause(List<Pattern> heads, Node guard, Node body) {
    }

    @FunctionalInterface
    protected interface ClauseRewriter {
        /**
         * @return the rewritten clause, or {@code null} when it stays as it is
         */
        Clause rewrite(BinderScope scope, List<Pattern> heads, Node guard, Node body);
    }

    /**
     * Rename binder {@code from} of head {@code h} to {@code to}, together with its reads in the
     * guard and the body.
     *
     * @return the renamed clause, or empty when {@link PatternUtility#renameConsistently} refuses
     */
    protected static Optional<Clause> renameInClause(List<Pattern> heads, int h, Node guard, Node body,
                                                     String from, String to) {
        Node scope = guard == null ? body : new Block(List.of(guard, body));
        return PatternUtility.renameConsistently(heads.get(h), scope, from, to).map(r -> {
            List<Pattern> out = new ArrayList<>(heads);
            out.set(h, r.pattern());
            if (guard == null) {
                return new Clause(out, null, r.body());
            }
            List<Node> parts = ((Block) r.body()).statements();
            return new Clause(out, parts.get(0), parts.get(1));
        });
    }

    protected static Node rewriteClauses(Node n, ClauseRewriter rewriter) {
        if (n instanceof FunctionDef d) {
            Clause c = rewriter.rewrite(BinderScope.FUNCTION_PARAM, d.params(), d.guard(), d.body());
            return c == null ? n : new FunctionDef(d.name(), d.kind(), c.heads(), c.guard(), c.body(), d.meta());
        }
        if (n instanceof Fn f) {
            List<FnClause> out = new ArrayList<>();
            boolean changed = false;
            for (FnClause fc : f.clauses()) {
                Clause c = rewriter.rewrite(BinderScope.FN_PARAM, fc.params(), fc.guard(), fc.body());
                changed |= c != null;
                out.add(c == null ? fc : new FnClause(c.heads(), c.guard(), c.body()));
            }
            return changed ? new Fn(out, f.meta()) : n;
        }
        if (n instanceof Case cs) {
            List<CaseClause> out = caseClauses(BinderScope.CASE_CLAUSE, cs.clauses(), rewriter);
            return out == cs.clauses() ? n : new Case(cs.subject(), out, cs.meta());
        }
        if (n instanceof Receive r) {
            List<CaseClause> out = caseClauses(BinderScope.RECEIVE_CLAUSE, r.clauses(), rewriter);
            return out == r.clauses() ? n : new Receive(out, r.timeout(), r.afterBody(), r.meta());
        }
        if (n instanceof Try t) {
            return tryClauses(t, rewriter);
        }
        if (n instanceof With w) {
            List<CaseClause> elses = caseClauses(BinderScope.CASE_CLAUSE, w.elseClauses(), rewriter);
            return elses == w.elseClauses() ? n : new With(w.clauses(), w.body(), elses, w.meta());
        }
        return n;
    }

    private static List<CaseClause> caseClauses(BinderScope scope, List<CaseClause> clauses, ClauseRewriter rewriter) {
        List<CaseClause> out = new ArrayList<>();
        boolean changed = false;
        for (CaseClause cc : clauses) {
            Clause c = rewriter.rewrite(scope, List.of(cc.pattern()), cc.guard(), cc.body());
            changed |= c != null;
            out.add(c == null ? cc : new CaseClause(c.heads().get(0), c.guard(), c.body()));
        }
        return changed ? out : clauses;
    }

    private static Node tryClauses(Try t, ClauseRewriter rewriter) {
        boolean changed = false;
        List<RescueClause> rescues = new ArrayList<>();
        for (RescueClause r : t.rescues()) {
            Clause c = r.binder() == null ? null
                    : rewriter.rewrite(BinderScope.RESCUE, List.of(r.binder()), null, r.body());
            changed |= c != null;
            rescues.add(c == null ? r : new RescueClause(c.heads().get(0), r.exceptions(), c.body()));
        }
        List<CatchClause> catches = new ArrayList<>();
        for (CatchClause cc : t.catches()) {
            List<Pattern> heads = cc.kind() == null ? List.of(cc.value()) : List.of(cc.kind(), cc.value());
            Clause c = rewriter.rewrite(BinderScope.CATCH, heads, cc.guard(), cc.body());
            changed |= c != null;
            if (c == null) {
                catches.add(cc);
            } else if (cc.kind() == null) {
                catches.add(new CatchClause(null, c.heads().get(0), c.guard(), c.body()));
            } else {
                catches.add(new CatchClause(c.heads().get(0), c.heads().get(1), c.guard(), c.body()));
            }
        }
        List<CaseClause> elses = caseClauses(BinderScope.CASE_CLAUSE, t.elseClauses(), rewriter);
        changed |= elses != t.elseClauses();
        return changed ? new Try(t.body(), rescues, catches, elses, t.after(), t.meta()) : t;
    }
}
