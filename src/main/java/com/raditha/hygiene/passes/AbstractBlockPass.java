package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Block;
import com.raditha.hygiene.util.TreeTransformer;

/**
 * Base for passes that rewrite statement sequences.
 * <p>
 * Blocks nested directly inside blocks share their parent's scope, so they are spliced into the
 * parent before any block is rewritten; otherwise a rewrite of the inner block could not see
 * the reads that follow it in the outer one.
 */
public abstract class AbstractBlockPass implements NormalizationPass {

    @Override
    public Node apply(Node root) {
        Node flat = BlockFlatteningPass.spliceNestedBlocks(root);
        return TreeTransformer.transform(flat, n -> n instanceof Block b ? rewriteBlock(b) : n);
    }

    /**
     * Rewrite one block whose nested blocks have already been rewritten.
     *
     * @return the new node (not necessarily a block), or {@code block} itself
     */
    protected abstract Node rewriteBlock(Block block);
}
