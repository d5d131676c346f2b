package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.TreeTransformer;

import java.util.List;

/**
 * {@code x == nil} becomes {@code is_nil(x)} and {@code x != nil} becomes {@code not is_nil(x)},
 * in either operand order and for the strict operators too.
 */
public class NilCheckNormalizationPass implements NormalizationPass {

    @Override
    public String name() {
        return "nil-check-normalization";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, n -> {
            if (!(n instanceof Binary b)) {
                return n;
            }
            boolean equal = "==".equals(b.op()) || "===".equals(b.op());
            boolean notEqual = "!=".equals(b.op()) || "!==".equals(b.op());
            if (!equal && !notEqual) {
                return n;
            }
            Node subject;
            if (b.right() instanceof NilLit) {
                subject = b.left();
            } else if (b.left() instanceof NilLit) {
                subject = b.right();
            } else {
                return n;
            }
            Node check = new LocalCall("is_nil", List.of(subject), b.meta());
            return equal ? check : new Unary("not", check, b.meta());
        });
    }
}
