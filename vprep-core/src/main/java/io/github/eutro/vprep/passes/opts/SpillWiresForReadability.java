package io.github.eutro.vprep.passes.opts;

import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Region;
import io.github.eutro.vprep.passes.InPlaceIRPass;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.passes.form.WireMaterializer;
import io.github.eutro.vprep.passes.meta.ExpressionCostEstimator;
import io.github.eutro.vprep.util.Classification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;

/**
 * Spills expressions to wires once legalization is done, when they are too large to emit on one
 * line, or the configured name hint heuristic asks for it.
 * <p>
 * Only non-procedural blocks are visited, outermost first.
 */
public final class SpillWiresForReadability implements InPlaceIRPass<LegalizationContext> {
    public static final SpillWiresForReadability INSTANCE = new SpillWiresForReadability();

    private static final Logger logger = LogManager.getLogger();

    @Override
    public void runInPlace(LegalizationContext ctx) {
        prettify(ctx.module.getBodyBlock(), ctx);
    }

    private void prettify(Block block, LegalizationContext ctx) {
        Region parent = block.getParent();
        if (parent != null && parent.isSequential()) return;

        ExpressionCostEstimator costs = ctx.getCosts();
        for (Operation op : new ArrayList<>(block.getOperations())) {
            if (op.isErased() || op.getBlock() != block || !Classification.isExpression(op)) continue;
            if (costs.shouldSpillWireBasedOnState(op)) {
                logger.debug("spilling {} with {} terms", op.kind, costs.cost(op.getResult()));
                WireMaterializer.materialize(op, false, ctx);
                ctx.stats.spilledForReadability++;
            }
        }

        for (Operation op : new ArrayList<>(block.getOperations())) {
            for (Region region : op.getRegions()) {
                if (!region.getBlocks().isEmpty()) {
                    prettify(region.getEntryBlock(), ctx);
                }
            }
        }
    }
}
