package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.FnClause;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern;
import com.raditha.hygiene.model.Pattern.PBind;
import com.raditha.hygiene.util.TreeTransformer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code fn a, b -> f(a, b) end} becomes {@code &f/2}, and likewise for remote calls on a
 * module name. Every parameter must be a distinct plain binder passed exactly once, in order.
 */
public class CaptureSimplificationPass implements NormalizationPass {

    @Override
    public String name() {
        return "capture-simplification";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, n -> {
            if (!(n instanceof Fn fn) || fn.clauses().size() != 1) {
                return n;
            }
            FnClause clause = fn.clauses().get(0);
            if (clause.guard() != null || !distinctBinders(clause.params())) {
                return n;
            }
            if (clause.body() instanceof LocalCall call && forwards(clause.params(), call.args())) {
                return new Capture(null, call.name(), call.arity(), fn.meta());
            }
            if (clause.body() instanceof RemoteCall call && call.module() instanceof AliasRef
                    && forwards(clause.params(), call.args())) {
                return new Capture(call.module(), call.name(), call.args().size(), fn.meta());
            }
            return n;
        });
    }

    private static boolean distinctBinders(List<Pattern> params) {
        Set<String> seen = new HashSet<>();
        for (Pattern p : params) {
            if (!(p instanceof PBind b) || b.isWildcard() || !seen.add(b.name())) {
                return false;
            }
        }
        return true;
    }

    private static boolean forwards(List<Pattern> params, List<Node> args) {
        if (params.size() != args.size()) {
            return false;
        }
        for (int i = 0; i < args.size(); i++) {
            if (!(args.get(i) instanceof Var v) || !v.name().equals(((PBind) params.get(i)).name())) {
                return false;
            }
        }
        return true;
    }
}
