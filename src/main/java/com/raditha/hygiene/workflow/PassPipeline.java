package com.raditha.hygiene.workflow;

import com.raditha.hygiene.PassFailureException;
import com.raditha.hygiene.PipelineException;
import com.raditha.hygiene.TransformDefectException;
import com.raditha.hygiene.config.PipelineConfig;
import com.raditha.hygiene.model.Node;
import com.raditha.hygiene.passes.NormalizationPass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the passes over a tree in their declared order.
 * <p>
 * In fixpoint mode the whole sequence is repeated until a sweep leaves the tree unchanged or
 * the configured number of sweeps is used up. Anything a pass throws is wrapped in a
 * {@link PassFailureException} naming the pass.
 */
public class PassPipeline {

    private static final Logger logger = LoggerFactory.getLogger(PassPipeline.class);

    private final List<NormalizationPass> passes;
    private final PipelineConfig config;

    /**
     * Creates a pipeline over the default catalog.
     *
     * @param config the run configuration
     */
    public PassPipeline(PipelineConfig config) {
        this(PassRegistry.defaultOrder(config), config);
    }

    /**
     * Creates a pipeline over an explicit pass list.
     *
     * @param passes the passes, in the order they must run
     * @param config the run configuration
     */
    public PassPipeline(List<NormalizationPass> passes, PipelineConfig config) {
        this.passes = List.copyOf(passes);
        this.config = config;
    }

    public List<NormalizationPass> passes() {
        return passes;
    }

    /**
     * Normalize a tree.
     *
     * @param root the lowered tree, usually a module definition
     * @return the normalized tree with per-pass statistics
     * @throws PassFailureException when a pass throws
     */
    public PipelineResult run(Node root) {
        List<PipelineResult.PassRun> runs = new ArrayList<>();
        List<PassTrace> traces = new ArrayList<>();
        Node current = root;
        int iteration = 0;
        boolean stable = false;
        int limit = config.fixpoint() ? config.maxIterations() : 1;

        while (iteration < limit && !stable) {
            iteration++;
            Node before = current;
            for (NormalizationPass pass : passes) {
                if (!config.isEnabled(pass.name())) {
                    logger.debug("Skipping disabled pass {}", pass.name());
                    continue;
                }
                current = invoke(pass, current, iteration, runs, traces);
            }
            stable = sameTree(before, current);
        }

        if (config.fixpoint() && !stable) {
            logger.warn("Normalization did not reach a fixpoint within {} iterations", limit);
        }
        logger.info("Normalization finished after {} iteration(s), {} pass invocation(s) changed the tree",
                iteration, runs.stream().filter(PipelineResult.PassRun::changed).count());
        return new PipelineResult(current, iteration, runs, traces);
    }

    private Node invoke(NormalizationPass pass, Node input, int iteration,
                        List<PipelineResult.PassRun> runs, List<PassTrace> traces) {
        long start = System.nanoTime();
        Node output;
        try {
            output = pass.apply(input);
        } catch (PassFailureException e) {
            throw e;
        } catch (RuntimeException | StackOverflowError e) {
            throw new PassFailureException(pass.name(), iteration, e);
        }
        long nanos = System.nanoTime() - start;
        if (output == null) {
            throw new PassFailureException(pass.name(), iteration,
                    new TransformDefectException("Pass returned no tree", input.getClass().getSimpleName()));
        }
        boolean changed = !sameTree(input, output);
        runs.add(new PipelineResult.PassRun(pass.name(), iteration, changed, nanos));
        if (changed) {
            logger.debug("Pass {} changed the tree in iteration {}", pass.name(), iteration);
            if (config.traceDiffs()) {
                PassTrace trace = PassTrace.between(pass.name(), iteration, input, output);
                logger.debug("{}", trace.diff());
                traces.add(trace);
            }
        }
        return changed ? output : input;
    }

    private static boolean sameTree(Node a, Node b) {
        return a == b || a.equals(b);
    }

    /**
     * Convenience for callers that only want the tree.
     */
    public static Node normalize(Node root, PipelineConfig config) {
        try {
            return new PassPipeline(config).run(root).tree();
        } catch (PipelineException e) {
            logger.error("Normalization failed: {}", e.getMessage());
            throw e;
        }
    }
}
