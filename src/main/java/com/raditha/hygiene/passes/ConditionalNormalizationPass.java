package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.CaseClause;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.model.Pattern.PLiteral;
import com.raditha.hygiene.util.TreeTransformer;

/**
 * Canonical conditional forms:
 * <ul>
 *     <li>{@code if not c} without else becomes {@code unless c}</li>
 *     <li>{@code unless c ... else ...} becomes {@code if c} with the branches swapped</li>
 *     <li>a two clause {@code case} over {@code true} and {@code false} becomes {@code if}</li>
 *     <li>an explicit {@code else nil} is dropped</li>
 * </ul>
 */
public class ConditionalNormalizationPass implements NormalizationPass {

    @Override
    public String name() {
        return "conditional-normalization";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, this::normalize);
    }

    private Node normalize(Node n) {
        if (n instanceof If i) {
            Node orElse = i.orElse() instanceof NilLit ? null : i.orElse();
            if (orElse == null && i.condition() instanceof Unary u && isNegation(u.op())) {
                return new Unless(u.operand(), i.then(), null, i.meta());
            }
            return orElse == i.orElse() ? n : new If(i.condition(), i.then(), null, i.meta());
        }
        if (n instanceof Unless u) {
            if (u.orElse() instanceof NilLit) {
                return new Unless(u.condition(), u.then(), null, u.meta());
            }
            if (u.orElse() != null) {
                return new If(u.condition(), u.orElse(), u.then(), u.meta());
            }
            return n;
        }
        if (n instanceof Case c && c.clauses().size() == 2) {
            Node whenTrue = booleanArm(c, true);
            Node whenFalse = booleanArm(c, false);
            if (whenTrue != null && whenFalse != null) {
                return new If(c.subject(), whenTrue, whenFalse instanceof NilLit ? null : whenFalse, c.meta());
            }
        }
        return n;
    }

    private static boolean isNegation(String op) {
        return "not".equals(op) || "!".equals(op);
    }

    private static Node booleanArm(Case c, boolean value) {
        for (CaseClause clause : c.clauses()) {
            if (clause.guard() == null && clause.pattern() instanceof PLiteral l
                    && l.literal() instanceof BoolLit b && b.value() == value) {
                return clause.body();
            }
        }
        return null;
    }
}
