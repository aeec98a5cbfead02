package io.github.eutro.vprep.passes.form;

import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Use;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.util.Classification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Gives every use of an always-inline operation its own copy, placed right before the user.
 * <p>
 * Always-inline operands of the operation are handled the same way, so a chain of always-inline
 * operations fans out together.
 */
public final class AlwaysInlinePropagator {
    private static final Logger logger = LogManager.getLogger();

    private AlwaysInlinePropagator() {
    }

    /**
     * Duplicate {@code op} until each copy has one use, and move each copy before its user.
     * An operation with no uses is erased instead.
     *
     * @param op The always-inline operation.
     * @throws IllegalArgumentException If the operation does not have exactly one result.
     */
    public static void propagate(Operation op) {
        if (op.getNumResults() != 1) {
            throw new IllegalArgumentException("only always-inline operations with one result are supported: " + op);
        }
        Value result = op.getResult();
        if (result.useEmpty()) {
            logger.debug("erasing unused always-inline {}", op.kind);
            op.erase();
            return;
        }

        while (!result.hasOneUse()) {
            Use use = result.getUses().get(0);
            Operation user = use.getOwner();
            Operation clone = op.cloneWithoutRegions();
            user.getBlock().insertBefore(user, clone);
            use.set(clone.getResult());
            propagateOperands(clone);
        }

        Operation user = result.getUses().get(0).getOwner();
        op.moveBefore(user);
        propagateOperands(op);
    }

    /**
     * {@link #propagate(Operation) Propagate} every always-inline operand of {@code op},
     * for when it has become their new user.
     *
     * @param op The user.
     */
    public static void propagateOperands(Operation op) {
        for (Value operand : op.getOperands()) {
            Operation operandOp = operand.getDefiningOp();
            if (operandOp != null && Classification.isAlwaysInline(operandOp)) {
                propagate(operandOp);
            }
        }
    }
}
