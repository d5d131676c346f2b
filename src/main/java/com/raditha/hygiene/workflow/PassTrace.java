package com.raditha.hygiene.workflow;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.model.NodeDumper;

import java.util.Arrays;
import java.util.List;

/**
 * What one pass did to the tree, as a unified diff of the {@link NodeDumper} outline.
 *
 * @param passName  the pass that made the change
 * @param iteration the sweep it happened in, starting at 1
 * @param diff      unified diff text
 */
public record PassTrace(String passName, int iteration, String diff) {

    private static final int CONTEXT_LINES = 3;

    /**
     * Generate the trace for a pass that turned {@code before} into {@code after}.
     */
    public static PassTrace between(String passName, int iteration, Node before, Node after) {
        List<String> original = Arrays.asList(NodeDumper.dump(before).split("\n"));
        List<String> revised = Arrays.asList(NodeDumper.dump(after).split("\n"));

        Patch<String> patch = DiffUtils.diff(original, revised);

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + passName,
                "b/" + passName,
                original,
                patch,
                CONTEXT_LINES);

        return new PassTrace(passName, iteration, String.join("\n", unifiedDiff));
    }

    public boolean isEmpty() {
        return diff.isBlank();
    }
}
