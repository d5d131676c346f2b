package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.TreeTransformer;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code [] ++ x} and {@code x ++ []} become {@code x}; {@code [a] ++ [b]} becomes {@code [a, b]}.
 */
public class ListAppendSimplificationPass implements NormalizationPass {

    @Override
    public String name() {
        return "list-append-simplification";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, n -> {
            if (!(n instanceof Binary b) || !"++".equals(b.op())) {
                return n;
            }
            if (isEmptyList(b.left())) {
                return b.right();
            }
            if (isEmptyList(b.right())) {
                return b.left();
            }
            if (b.left() instanceof ListLit l && b.right() instanceof ListLit r) {
                List<Node> elements = new ArrayList<>(l.elements());
                elements.addAll(r.elements());
                return new ListLit(elements, b.meta());
            }
            return n;
        });
    }

    private static boolean isEmptyList(Node n) {
        return n instanceof ListLit l && l.elements().isEmpty();
    }
}
