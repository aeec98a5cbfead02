package io.github.eutro.vprep.passes;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.passes.meta.ExpressionCostEstimator;
import io.github.eutro.vprep.util.Namespace;

/**
 * Everything preparing one module for emission needs to share: the module itself, the options,
 * the names already taken, and counts of what was done.
 * <p>
 * A context belongs to exactly one run over exactly one module.
 */
public class LegalizationContext {
    public final HWModule module;
    public final LoweringOptions options;
    public final Namespace namespace;
    private final ExpressionCostEstimator costs;
    public final Stats stats = new Stats();

    public LegalizationContext(HWModule module, LoweringOptions options) {
        this.module = module;
        this.options = options;
        namespace = Namespace.of(module);
        costs = new ExpressionCostEstimator(options);
    }

    public ExpressionCostEstimator getCosts() {
        return costs;
    }

    /**
     * Counts of the rewrites performed on a module.
     */
    public static class Stats {
        public int materialized;
        public int hoisted;
        public int pinned;
        public int rebalanced;
        public int reused;
        public int alwaysInlineLowered;
        public int forwardReferencesRepaired;
        public int pruned;
        public int spilledForReadability;

        @Override
        public String toString() {
            return "materialized=" + materialized +
                    ", hoisted=" + hoisted +
                    ", pinned=" + pinned +
                    ", rebalanced=" + rebalanced +
                    ", reused=" + reused +
                    ", alwaysInlineLowered=" + alwaysInlineLowered +
                    ", forwardReferencesRepaired=" + forwardReferencesRepaired +
                    ", pruned=" + pruned +
                    ", spilledForReadability=" + spilledForReadability;
        }
    }
}
