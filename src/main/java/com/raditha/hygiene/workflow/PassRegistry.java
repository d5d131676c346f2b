package com.raditha.hygiene.workflow;

import com.raditha.hygiene.config.PipelineConfig;
import com.raditha.hygiene.passes.*;

import java.util.List;

/**
 * The pass catalog. This is the only place where the order of the passes is declared.
 * <p>
 * Identifier and structural cleanup runs first because every later pass matches on clean
 * names and flat blocks. Binder hygiene runs after the statement rewrites, which can remove
 * reads. Module-level passes run last.
 */
public final class PassRegistry {

    private PassRegistry() {
        /* this is only a utility class */
    }

    public static List<NormalizationPass> defaultOrder(PipelineConfig config) {
        return List.of(
                // identifier and structural cleanup
                new IdentifierNormalizationPass(),
                new BlockFlatteningPass(),
                new LiteralConditionFoldingPass(),
                new ConditionalNormalizationPass(),
                new NilCheckNormalizationPass(),
                new ListAppendSimplificationPass(),
                new MapPutChainCollapsePass(),
                new StringConcatInterpolationPass(),
                new CaptureSimplificationPass(),
                // statement level
                new BareUpdateAssignmentPass(),
                new SelfAssignmentEliminationPass(),
                new DeadStatementEliminationPass(),
                new BranchAssignmentLiftPass(),
                new AliasChainCollapsePass(),
                new RedundantTemporaryInliningPass(),
                // loops and accumulators
                new LoopRebindToReducePass(),
                new AccumulatorThreadingPass(),
                new AppendLoopComprehensionPass(),
                // binder hygiene
                new BinderHygienePass(),
                new UnderscoreBinderPromotionPass(),
                new AssignmentHygienePass(),
                // module level
                new ModuleQualificationPass(config),
                new RequireHoistingPass(config),
                new DirectiveDeduplicationPass(),
                new UnusedAliasRemovalPass(),
                new UnusedAttributeRemovalPass(),
                new AritySynthesisPass(),
                new ClauseGroupingPass(),
                new UnusedPrivateFunctionRemovalPass());
    }

    public static List<String> names(PipelineConfig config) {
        return defaultOrder(config).stream().map(NormalizationPass::name).toList();
    }
}
