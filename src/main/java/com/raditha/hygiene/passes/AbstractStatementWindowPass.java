package com.raditha.hygiene.passes;

import com.raditha.hygiene.analysis.UsageAnalyzer;
import com.raditha.hygiene.analysis.UsageIndex;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.Node.Block;
import com.raditha.hygiene.model.Nodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Base for passes that match a short window of consecutive statements.
 * <p>
 * The block is swept left to right. At each position {@link #matchAt} may claim a window and
 * return its replacement; unclaimed statements are copied through. Sweeps repeat until one makes
 * no change, so the result is stable under a second application of the pass.
 */
public abstract class AbstractStatementWindowPass extends AbstractBlockPass {

    /**
     * Replacement for a matched window.
     *
     * @param consumed    number of statements starting at the match position that are replaced
     * @param replacement statements to put in their place, possibly none
     */
    protected record Rewrite(int consumed, List<Node> replacement) {
        public Rewrite {
            if (consumed < 1) {
                throw new IllegalArgumentException("A rewrite must consume at least one statement");
            }
            replacement = List.copyOf(replacement);
        }

        public static Rewrite of(int consumed, Node... replacement) {
            return new Rewrite(consumed, List.of(replacement));
        }

        public static Rewrite drop(int consumed) {
            return new Rewrite(consumed, List.of());
        }
    }

    /**
     * Try to match a window starting at {@code i}.
     *
     * @param statements the statements of the block being swept
     * @param i          window start
     * @param usage      usage index over {@code statements}
     * @return the rewrite, or empty to leave statement {@code i} alone
     */
    protected abstract Optional<Rewrite> matchAt(List<Node> statements, int i, UsageIndex usage);

    @Override
    protected Node rewriteBlock(Block block) {
        List<Node> current = block.statements();
        boolean changedAny = false;
        // each accepted rewrite either shrinks the block or replaces a statement by a normal form
        for (int sweep = 0; sweep <= block.statements().size(); sweep++) {
            List<Node> next = sweep(current);
            if (next == current) {
                break;
            }
            current = next;
            changedAny = true;
        }
        if (!changedAny) {
            return block;
        }
        return current.isEmpty() ? Nodes.nil() : block.withStatements(current);
    }

    private List<Node> sweep(List<Node> statements) {
        UsageIndex usage = UsageAnalyzer.build(statements);
        List<Node> out = new ArrayList<>(statements.size());
        boolean changed = false;
        int i = 0;
        while (i < statements.size()) {
            Optional<Rewrite> rewrite = matchAt(statements, i, usage);
            if (rewrite.isPresent()) {
                out.addAll(rewrite.get().replacement());
                i += Math.min(rewrite.get().consumed(), statements.size() - i);
                changed = true;
            } else {
                out.add(statements.get(i));
                i++;
            }
        }
        return changed ? out : statements;
    }

    protected static boolean isLast(List<Node> statements, int i) {
        return i == statements.size() - 1;
    }
}
