package com.raditha.hygiene.passes;

import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.ModuleDef;
import com.raditha.hygiene.util.NodeQueries;
import com.raditha.hygiene.util.TreeTransformer;

import java.util.function.Predicate;

/**
 * Base for passes that work on the top-level statements of a module definition.
 * Nested modules are rewritten before the module that contains them.
 */
public abstract class AbstractModulePass implements NormalizationPass {

    @Override
    public Node apply(Node root) {
        return TreeTransformer.transform(root, n -> n instanceof ModuleDef m ? rewriteModule(m) : n);
    }

    /**
     * @return the rewritten module, or {@code module} itself
     */
    protected abstract Node rewriteModule(ModuleDef module);

    /**
     * Walk the module's own code, without entering nested module definitions.
     */
    protected static void walkOwn(ModuleDef module, Predicate<Node> visitor) {
        NodeQueries.walk(module.body(), n -> !(n instanceof ModuleDef) && visitor.test(n));
    }
}
