package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;

/**
 * One rewrite of the normalization catalog.
 * <p>
 * A pass is a pure function of the tree. When its shape does not match, or matches but cannot be
 * proven safe, it returns the very instance it was given. Applying a pass to its own output
 * changes nothing.
 */
public interface NormalizationPass {

    /**
     * Stable kebab-case name, used in configuration, logs and failure reports.
     */
    String name();

    /**
     * Rewrite the tree.
     *
     * @param root the tree to rewrite, usually a module definition
     * @return the rewritten tree, or {@code root} itself when nothing applied
     */
    Node apply(Node root);
}
