package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.FreeVariableCollector;
import com.raditha.hygiene.model.Generator;
import com.raditha.hygiene.model.MetaFlag;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.model.WithClause;
import com.raditha.hygiene.util.Names;
import com.raditha.hygiene.util.PatternUtility;
import com.raditha.hygiene.util.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the "unused" marker of clause binders in step with their use.
 * <p>
 * For every plain binder of a clause head: when neither the guard nor the body reads it, it gains a
 * leading underscore. When a binder already carries the underscore but the body reads it under that
 * name, the marker is dropped and the reads are renamed with it. The decision depends only on the
 * clause itself, so running the pass twice changes nothing the second time.
 * <p>
 * Comprehension generators and {@code with} clauses are scoped over the steps that follow them;
 * only the "mark unused" direction is applied there.
 */
public class BinderHygienePass extends AbstractClausePass {

    private static final Logger logger = LoggerFactory.getLogger(BinderHygienePass.class);

    private final Set<BinderScope> scopes;

    public BinderHygienePass() {
        this(EnumSet.allOf(BinderScope.class));
    }

    public BinderHygienePass(Set<BinderScope> scopes) {
        this.scopes = scopes.isEmpty() ? EnumSet.noneOf(BinderScope.class) : EnumSet.copyOf(scopes);
    }

    @Override
    public String name() {
        return "binder-hygiene";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, this::rewrite);
    }

    private Node rewrite(Node n) {
        if (n instanceof For f) {
            return scopes.contains(BinderScope.GENERATOR) ? generators(f) : n;
        }
        Node result = n;
        if (n instanceof With w && scopes.contains(BinderScope.WITH_CLAUSE)) {
            result = withClauses(w);
        }
        return rewriteClauses(result, (scope, heads, guard, body) ->
                scopes.contains(scope) ? adjust(heads, guard, body) : null);
    }

    private Node generators(For f) {
        List<Generator> out = new ArrayList<>();
        boolean changed = false;
        List<Generator> gens = f.generators();
        for (int k = 0; k < gens.size(); k++) {
            List<Node> scope = new ArrayList<>();
            for (int j = k + 1; j < gens.size(); j++) {
                scope.add(gens.get(j).source());
            }
            scope.addAll(f.filters());
            if (f.body() != null) {
                scope.add(f.body());
            }
            Pattern p = markUnused(gens.get(k).pattern(), readsOf(scope));
            changed |= p != gens.get(k).pattern();
            out.add(p == gens.get(k).pattern() ? gens.get(k) : new Generator(p, gens.get(k).source()));
        }
        return changed ? new For(out, f.filters(), f.into(), f.body(), f.meta()) : f;
    }

    private Node withClauses(With w) {
        List<WithClause> out = new ArrayList<>();
        boolean changed = false;
        List<WithClause> clauses = w.clauses();
        for (int k = 0; k < clauses.size(); k++) {
            List<Node> scope = new ArrayList<>();
            if (clauses.get(k).guard() != null) {
                scope.add(clauses.get(k).guard());
            }
            for (int j = k + 1; j < clauses.size(); j++) {
                scope.add(clauses.get(j).value());
                if (clauses.get(j).guard() != null) {
                    scope.add(clauses.get(j).guard());
                }
            }
            scope.add(w.body());
            WithClause wc = clauses.get(k);
            Pattern p = markUnused(wc.pattern(), readsOf(scope));
            changed |= p != wc.pattern();
            out.add(p == wc.pattern() ? wc : new WithClause(p, wc.guard(), wc.value()));
        }
        return changed ? new With(out, w.body(), w.elseClauses(), w.meta()) : w;
    }

    /**
     * Conservative union of the reads of several sibling nodes.
     */
    private static FreeVariableCollector.Reads readsOf(List<Node> nodes) {
        Map<String, Integer> counts = new HashMap<>();
        boolean wildcard = false;
        for (Node n : nodes) {
            FreeVariableCollector.Reads r = FreeVariableCollector.collect(n);
            r.counts().forEach((k, v) -> counts.merge(k, v, Integer::sum));
            wildcard |= r.wildcard();
        }
        return new FreeVariableCollector.Reads(counts, wildcard);
    }

    /**
     * Apply both directions to one clause.
     *
     * @return the adjusted clause, or null when nothing changed
     */
    Clause adjust(List<Pattern> heads, Node guard, Node body) {
        FreeVariableCollector.Reads reads = readsOf(guard == null ? List.of(body) : List.of(guard, body));
        Map<String, Integer> binderCounts = binderCounts(heads);

        List<Pattern> newHeads = new ArrayList<>(heads);
        Node newGuard = guard;
        Node newBody = body;
        boolean changed = false;

        for (int h = 0; h < newHeads.size(); h++) {
            for (PBind b : PatternUtility.binders(newHeads.get(h))) {
                String name = b.name();
                if (b.isWildcard() || b.has(MetaFlag.PRESERVE_NAME) || binderCounts.getOrDefault(name, 0) != 1) {
                    continue;
                }
                if (!Names.isUnderscored(name) && !reads.reads(name)) {
                    String target = Names.underscore(name);
                    if (binderCounts.containsKey(target) || reads.reads(target)) {
                        continue;
                    }
                    logger.debug("Marking unused binder {}", name);
                    newHeads.set(h, PatternUtility.renameBinder(newHeads.get(h), name, target));
                    changed = true;
                } else if (Names.isUnderscored(name) && reads.count(name) > 0) {
                    String target = name.substring(1);
                    if (!Names.isVariableName(target) || binderCounts.containsKey(target) || reads.reads(target)) {
                        continue;
                    }
                    Optional<Clause> renamed = renameInClause(newHeads, h, newGuard, newBody, name, target);
                    if (renamed.isEmpty()) {
                        continue;
                    }
                    logger.debug("Unmarking used binder {}", name);
                    newHeads = renamed.get().heads();
                    newGuard = renamed.get().guard();
                    newBody = renamed.get().body();
                    changed = true;
                }
            }
        }
        return changed ? new Clause(newHeads, newGuard, newBody) : null;
    }

    private static Pattern markUnused(Pattern pattern, FreeVariableCollector.Reads reads) {
        Map<String, Integer> counts = binderCounts(List.of(pattern));
        return PatternUtility.rewriteBinders(pattern, b -> {
            String name = b.name();
            if (b.isWildcard() || Names.isUnderscored(name) || b.has(MetaFlag.PRESERVE_NAME)
                    || counts.getOrDefault(name, 0) != 1 || reads.reads(name)
                    || counts.containsKey(Names.underscore(name)) || reads.reads(Names.underscore(name))) {
                return b;
            }
            return b.rename(Names.underscore(name));
        });
    }

    private static Map<String, Integer> binderCounts(List<Pattern> heads) {
        Map<String, Integer> counts = new HashMap<>();
        for (Pattern p : heads) {
            for (PBind b : PatternUtility.binders(p)) {
                counts.merge(b.name(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
