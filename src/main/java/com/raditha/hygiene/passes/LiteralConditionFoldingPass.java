package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds {@code if} and {@code unless} whose condition is a boolean or nil literal.
 * <p>
 * The taken branch is only lifted out when it binds nothing at its top level: a branch's
 * bindings are local to it, and lifting would let them leak into the enclosing block.
 */
public class LiteralConditionFoldingPass implements NormalizationPass {

    private static final Logger logger = LoggerFactory.getLogger(LiteralConditionFoldingPass.class);

    @Override
    public String name() {
        return "literal-condition-folding";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, this::fold);
    }

    private Node fold(Node n) {
        if (n instanceof If i) {
            return choose(i.condition(), i.then(), i.orElse(), false, n);
        }
        if (n instanceof Unless u) {
            return choose(u.condition(), u.then(), u.orElse(), true, n);
        }
        return n;
    }

    private Node choose(Node condition, Node then, Node orElse, boolean negated, Node original) {
        Boolean truthy = literalTruth(condition);
        if (truthy == null) {
            return original;
        }
        Node taken = truthy != negated ? then : orElse;
        if (taken == null) {
            return new NilLit(original.meta());
        }
        for (Node statement : NodeQueries.statementsOf(taken)) {
            if (!NodeQueries.statementBinds(statement).isEmpty()) {
                logger.debug("Not folding literal condition: taken branch binds variables");
                return original;
            }
        }
        logger.debug("Folded literal {} condition", truthy);
        return taken;
    }

    private static Boolean literalTruth(Node condition) {
        if (condition instanceof BoolLit b) {
            return b.value();
        }
        if (condition instanceof NilLit) {
            return Boolean.FALSE;
        }
        return null;
    }
}
