package io.github.eutro.vprep.passes.opts;

import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Region;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.InPlaceIRPass;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.util.Classification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes logic that carries no bits, which Verilog has no way of writing down.
 */
public final class PruneZeroValuedLogic implements InPlaceIRPass<LegalizationContext> {
    public static final PruneZeroValuedLogic INSTANCE = new PruneZeroValuedLogic();

    private static final Logger logger = LogManager.getLogger();

    @Override
    public void runInPlace(LegalizationContext ctx) {
        int total = 0;
        int pruned;
        do {
            pruned = pruneBlock(ctx.module.getBodyBlock());
            total += pruned;
        } while (pruned != 0);
        ctx.stats.pruned += total;
        if (total != 0) {
            logger.debug("pruned {} zero-valued operations from {}", total, ctx.module.name);
        }
    }

    private static boolean isZeroWidth(Value value) {
        return value.getType().isZeroBitType();
    }

    private int pruneBlock(Block block) {
        int pruned = 0;
        for (Operation op : new ArrayList<>(block.getOperations())) {
            if (op.isErased()) continue;
            for (Region region : op.getRegions()) {
                for (Block nested : region.getBlocks()) {
                    pruned += pruneBlock(nested);
                }
            }

            if (op.kind.has(OpKind.Fact.ASSIGNMENT)) {
                if (isZeroWidth(op.getOperand(1))) {
                    op.erase();
                    pruned++;
                }
                continue;
            }

            if (op.kind == OpKind.CONCAT && pruneConcat(op)) {
                pruned++;
                continue;
            }

            if (isPrunable(op)) {
                op.erase();
                pruned++;
            }
        }
        return pruned;
    }

    private static boolean pruneConcat(Operation op) {
        List<Value> kept = new ArrayList<>();
        for (Value operand : op.getOperands()) {
            if (!isZeroWidth(operand)) kept.add(operand);
        }
        if (kept.size() == op.getNumOperands() || kept.isEmpty()) return false;
        if (kept.size() == 1) {
            op.getResult().replaceAllUsesWith(kept.get(0));
            op.erase();
        } else {
            op.setOperands(kept);
        }
        return true;
    }

    private static boolean isPrunable(Operation op) {
        if (op.getNumResults() == 0
                || op.getNumRegions() != 0
                || Classification.hasSideEffects(op)
                || !op.useEmpty()) {
            return false;
        }
        if (!Classification.isExpression(op) && !Classification.isDeclaration(op)) return false;
        for (Value result : op.getResults()) {
            if (!isZeroWidth(result)) return false;
        }
        return true;
    }
}
