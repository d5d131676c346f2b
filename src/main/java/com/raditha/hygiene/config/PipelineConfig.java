package com.raditha.hygiene.config;

import java.util.Set;

/**
 * Configuration of one normalization run.
 *
 * @param rootModule     application root module used to qualify {@code appModules}; null disables qualification
 * @param appModules     unqualified module names that belong under {@code rootModule}
 * @param macroModules   modules whose macros are only available after {@code require}
 * @param fixpoint       repeat the whole pass sequence until it stops changing the tree
 * @param maxIterations  upper bound on sweeps in fixpoint mode
 * @param disabledPasses names of passes to skip
 * @param traceDiffs     record a unified diff of the tree dump for every pass that changed it
 */
public record PipelineConfig(
        String rootModule,
        Set<String> appModules,
        Set<String> macroModules,
        boolean fixpoint,
        int maxIterations,
        Set<String> disabledPasses,
        boolean traceDiffs) {

    /**
     * Validate configuration.
     */
    public PipelineConfig {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1");
        }
        if (rootModule != null && (rootModule.isBlank() || !Character.isUpperCase(rootModule.charAt(0)))) {
            throw new IllegalArgumentException("rootModule must be a module name such as MyApp");
        }
        appModules = appModules == null ? Set.of() : Set.copyOf(appModules);
        macroModules = macroModules == null ? Set.of() : Set.copyOf(macroModules);
        disabledPasses = disabledPasses == null ? Set.of() : Set.copyOf(disabledPasses);
        if (!appModules.isEmpty() && rootModule == null) {
            throw new IllegalArgumentException("appModules require a rootModule");
        }
    }

    /**
     * Default preset: fixpoint over at most four sweeps, {@code Logger} as the only macro module.
     */
    public static PipelineConfig defaults() {
        return new PipelineConfig(
                null,
                Set.of(),
                Set.of("Logger"),
                true,
                4,
                Set.of(),
                false);
    }

    /**
     * Strict preset: fixpoint over up to eight sweeps, with per-pass diffs recorded.
     */
    public static PipelineConfig strict() {
        return new PipelineConfig(
                null,
                Set.of(),
                Set.of("Logger"),
                true,
                8,
                Set.of(),
                true);
    }

    /**
     * Fast preset: a single sweep over the passes.
     */
    public static PipelineConfig fast() {
        return new PipelineConfig(
                null,
                Set.of(),
                Set.of("Logger"),
                false,
                1,
                Set.of(),
                false);
    }

    public PipelineConfig withRootModule(String root, Set<String> apps) {
        return new PipelineConfig(root, apps, macroModules, fixpoint, maxIterations, disabledPasses, traceDiffs);
    }

    public PipelineConfig withDisabledPasses(Set<String> names) {
        return new PipelineConfig(rootModule, appModules, macroModules, fixpoint, maxIterations, names, traceDiffs);
    }

    public PipelineConfig withTraceDiffs(boolean trace) {
        return new PipelineConfig(rootModule, appModules, macroModules, fixpoint, maxIterations, disabledPasses, trace);
    }

    public boolean isEnabled(String passName) {
        return !disabledPasses.contains(passName);
    }
}
