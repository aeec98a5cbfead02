package io.github.eutro.vprep.passes.form;

import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.util.Classification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Removes forward references from a non-procedural block, where operations may be written in any
 * order, but Verilog still requires names to be declared before they are used.
 */
public final class ResolveUseBeforeDef {
    private static final Logger logger = LogManager.getLogger();

    private ResolveUseBeforeDef() {
    }

    /**
     * Find the operation in {@code block} which is, or contains, {@code op}.
     *
     * @param op    The operation.
     * @param block The block.
     * @return The ancestor, or null if {@code op} is not within the block.
     */
    static @Nullable Operation ancestorInBlock(Operation op, Block block) {
        Operation current = op;
        while (current != null && current.getBlock() != block) {
            current = current.getParentOp();
        }
        return current;
    }

    /**
     * Resolve every forward reference in the block.
     * <p>
     * Declarations and constants used too early are moved to the start of the block, reads of
     * declarations are moved there along with their declaration, and anything else is
     * materialized into a wire declared at the start of the block.
     *
     * @param block The non-procedural block.
     * @param ctx   The legalization context.
     */
    public static void resolve(Block block, LegalizationContext ctx) {
        Set<Operation> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Operation op : new ArrayList<>(block.getOperations())) {
            if (op.isErased() || op.getBlock() != block || seen.contains(op)) continue;

            boolean outOfOrder = false;
            for (Operation user : op.getUsers()) {
                Operation ancestor = ancestorInBlock(user, block);
                if (ancestor != null && seen.contains(ancestor)) {
                    outOfOrder = true;
                    break;
                }
            }
            seen.add(op);
            if (!outOfOrder) continue;

            ctx.stats.forwardReferencesRepaired++;
            if (Classification.isMovableDeclaration(op) || Classification.isConstantExpression(op)) {
                logger.debug("moving {} to the start of its block", op.kind);
                op.moveToBlockStart(block);
                continue;
            }

            if (op.kind == OpKind.READ_INOUT) {
                Operation def = op.getOperand(0).getDefiningOp();
                if (Classification.isMovableDeclaration(def)) {
                    logger.debug("moving read of {} to the start of its block", def.kind);
                    op.moveToBlockStart(block);
                    if (def.getBlock() == block) {
                        def.moveToBlockStart(block);
                        seen.add(def);
                    }
                    continue;
                }
            }

            logger.debug("materializing forward referenced {}", op.kind);
            WireMaterializer.materialize(op, true, ctx);
        }
    }
}
