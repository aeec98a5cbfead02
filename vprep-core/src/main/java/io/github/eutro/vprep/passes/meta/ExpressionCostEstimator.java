package io.github.eutro.vprep.passes.meta;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.util.NameHints;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Estimates how many terms an expression will occupy when emitted, and so whether it should be
 * spilled to a wire of its own.
 * <p>
 * Ports and nullary operations cost one term; anything else costs the sum of its operands.
 * Costs are memoized per value, so an estimator must not outlive the module it was made for.
 */
public class ExpressionCostEstimator {
    private final LoweringOptions options;
    private final Map<Value, Integer> costs = new HashMap<>();

    public ExpressionCostEstimator(LoweringOptions options) {
        this.options = options;
    }

    /**
     * Get the estimated number of terms in the expression computing {@code value}.
     *
     * @param value The value.
     * @return The cost, at least 1.
     */
    public int cost(Value value) {
        Integer cached = costs.get(value);
        if (cached != null) return cached;
        Operation def = value.getDefiningOp();
        if (def == null) return 1;
        int cost;
        if (def.getNumOperands() == 0) {
            cost = 1;
        } else {
            cost = 0;
            for (Value operand : def.getOperands()) {
                cost += cost(operand);
            }
        }
        costs.put(value, cost);
        return cost;
    }

    /**
     * Whether the configured name hint heuristic asks for the expression to be spilled.
     *
     * @param op The expression.
     * @return True if the expression should be spilled.
     */
    public boolean dispatchHeuristic(Operation op) {
        if (options.getWireSpillingHeuristic() != LoweringOptions.WireSpillingHeuristic.SPILL_LARGE_TERMS_WITH_NAMEHINTS) {
            return false;
        }
        String hint = op.getNameHint();
        if (hint == null) return false;
        if (!NameHints.isPrivate(hint)) return true;
        return cost(op.getResult(0)) >= options.getWireSpillingNamehintTermLimit();
    }

    private static boolean isSink(Operation user, boolean allowInstance) {
        switch (user.kind) {
            case OUTPUT:
            case ASSIGN:
            case BPASSIGN:
                return true;
            case INSTANCE:
                return allowInstance;
            default:
                return false;
        }
    }

    /**
     * Whether spilling the expression to a wire would make the emitted Verilog easier to read,
     * now that the final structure of every expression is known.
     *
     * @param op The expression.
     * @return True if the expression should be spilled.
     */
    public boolean shouldSpillWireBasedOnState(Operation op) {
        if (op.getNumResults() == 0
                || op.getResult(0).getType().isInOut()
                || op.kind == OpKind.READ_INOUT
                || op.kind == OpKind.CONSTANT) {
            return false;
        }

        if (op.hasOneUse()) {
            Operation user = op.getUsers().get(0);
            if (isSink(user, true)) return false;
            if (user.kind == OpKind.BITCAST && user.hasOneUse()) {
                List<Operation> next = user.getUsers();
                if (isSink(next.get(0), false)) return false;
            }
        }

        if (cost(op.getResult(0)) > options.getMaximumNumberOfTermsPerExpression()) return true;
        return dispatchHeuristic(op);
    }
}
