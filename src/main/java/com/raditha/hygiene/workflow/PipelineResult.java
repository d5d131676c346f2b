package com.raditha.hygiene.workflow;

import com.raditha.hygiene.model.Node;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a pipeline run.
 *
 * @param tree       the normalized tree
 * @param iterations number of sweeps over the pass list
 * @param runs       one entry per pass invocation, in order
 * @param traces     diffs of the passes that changed the tree; empty unless tracing is on
 */
public record PipelineResult(Node tree, int iterations, List<PassRun> runs, List<PassTrace> traces) {

    /**
     * One invocation of one pass.
     *
     * @param name      pass name
     * @param iteration sweep number, starting at 1
     * @param changed   whether the pass returned a different tree
     * @param nanos     wall time spent in the pass
     */
    public record PassRun(String name, int iteration, boolean changed, long nanos) {
    }

    public PipelineResult {
        runs = List.copyOf(runs);
        traces = List.copyOf(traces);
    }

    /**
     * Number of invocations that changed the tree, per pass, in pipeline order.
     */
    public Map<String, Integer> changeCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (PassRun run : runs) {
            counts.merge(run.name(), run.changed() ? 1 : 0, Integer::sum);
        }
        return counts;
    }

    public boolean changed(String passName) {
        return runs.stream().anyMatch(r -> r.name().equals(passName) && r.changed());
    }

    public long totalNanos() {
        return runs.stream().mapToLong(PassRun::nanos).sum();
    }
}
