package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.*;
import com.raditha.hygiene.util.TreeTransformer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splices blocks nested in blocks into their parent, unwraps single statement blocks and turns
 * empty blocks into {@code nil}. Module bodies keep their block.
 */
public class BlockFlatteningPass implements NormalizationPass {

    @Override
    public String name() {
        return "block-flattening";
    }

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, n -> n instanceof Block b ? flatten(b) : n);
    }

    private static Node flatten(Block block) {
        Block spliced = splice(block);
        List<Node> statements = spliced.statements();
        if (statements.isEmpty()) {
            return new NilLit(block.meta());
        }
        if (statements.size() == 1 && !isModuleLevel(statements.get(0))) {
            return statements.get(0);
        }
        return spliced;
    }

    /**
     * Inline every block that appears directly as a statement of another block. The nested block
     * shares the scope of its parent, so this never changes meaning.
     */
    public static Node spliceNestedBlocks(Node root) {
        return TreeTransformer.transform(root, n -> n instanceof Block b ? splice(b) : n);
    }

    private static Block splice(Block block) {
        boolean nested = false;
        for (Node s : block.statements()) {
            if (s instanceof Block) {
                nested = true;
                break;
            }
        }
        if (!nested) {
            return block;
        }
        List<Node> out = new ArrayList<>();
        for (Node s : block.statements()) {
            if (s instanceof Block inner) {
                out.addAll(inner.statements());
            } else {
                out.add(s);
            }
        }
        return block.withStatements(out);
    }

    static boolean isModuleLevel(Node n) {
        return n instanceof FunctionDef || n instanceof ModuleDef || n instanceof Alias || n instanceof Import
                || n instanceof Require || n instanceof Use || n instanceof Attribute;
    }
}
