package io.github.eutro.vprep.passes.form;

import io.github.eutro.vprep.LegalizationException;
import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ir.*;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.InPlaceIRPass;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.types.IntType;
import io.github.eutro.vprep.types.StructType;
import io.github.eutro.vprep.util.Classification;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.*;

/**
 * Rewrites every block of a module, innermost first, into a form each operation of which the
 * emitter can write out as it comes.
 * <p>
 * Each block is swept once with a worklist of its operations. Rewrites which create operations
 * that need looking at again push them onto the front of the worklist.
 */
public final class LegalizeRegions implements InPlaceIRPass<LegalizationContext> {
    public static final LegalizeRegions INSTANCE = new LegalizeRegions();

    private static final Logger logger = LogManager.getLogger();

    @Override
    public void runInPlace(LegalizationContext ctx) {
        legalizeBlock(ctx.module.getBodyBlock(), ctx);
    }

    private static boolean isProceduralBlock(Block block) {
        Region region = block.getParent();
        return region != null && region.isSequential();
    }

    private void legalizeBlock(Block block, LegalizationContext ctx) {
        for (Operation op : new ArrayList<>(block.getOperations())) {
            for (Region region : op.getRegions()) {
                if (!region.getBlocks().isEmpty()) {
                    legalizeBlock(region.getEntryBlock(), ctx);
                }
            }
        }

        LoweringOptions options = ctx.options;
        boolean procedural = isProceduralBlock(block);
        Set<Operation> visitedAlwaysInline = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Operation> worklist = new ArrayDeque<>(block.getOperations());

        while (!worklist.isEmpty()) {
            Operation op = worklist.pollFirst();
            if (op.isErased() || op.getBlock() != block) continue;

            if (!op.kind.isSupported()) {
                String name = op.getExtOrDefault(CommonExts.FOREIGN_NAME, op.kind.mnemonic);
                logger.error("cannot emit {} in module {}, it must be lowered first", name, ctx.module.name);
                throw new LegalizationException("this is an instance of unknown dialect detected (" + name
                        + "); it cannot be emitted, so it needs to be lowered before emission", op);
            }

            if (op.kind == OpKind.INSTANCE) {
                WireMaterializer.anchorInstanceResults(op, ctx);
                if (options.isDisallowExpressionInliningInPorts()) {
                    WireMaterializer.anchorInstanceInputs(op, ctx);
                }
            }

            if (procedural && op.kind == OpKind.LOGIC) {
                if (options.isDisallowLocalVariables()) {
                    op.moveBefore(WireMaterializer.findParentInNonProceduralRegion(op));
                    ctx.stats.hoisted++;
                    logger.debug("hoisted local {} out of procedural region", op.kind);
                }
                continue;
            }

            if (!options.isAllowExpressionInEventControl()) {
                if (op.kind == OpKind.ALWAYS) {
                    for (Value clock : op.getOperands()) {
                        WireMaterializer.enforceWire(op, clock, ctx);
                    }
                    continue;
                }
                if (op.kind == OpKind.ALWAYS_FF) {
                    WireMaterializer.enforceWire(op, op.getOperand(0), ctx);
                    if (op.getNumOperands() > 1) {
                        WireMaterializer.enforceWire(op, op.getOperand(1), ctx);
                    }
                    continue;
                }
            }

            if (options.isDisallowLocalVariables() && procedural && Classification.isExpression(op)) {
                if (Classification.hasSideEffects(op)) {
                    if (WireMaterializer.pinSideEffectingExpr(op, ctx)) continue;
                } else if (hoistNonSideEffectExpr(op, ctx)) {
                    continue;
                }
            }

            if (Classification.isAlwaysInline(op)) {
                if (op.useEmpty()) {
                    op.erase();
                } else if (visitedAlwaysInline.add(op)) {
                    AlwaysInlinePropagator.propagate(op);
                    ctx.stats.alwaysInlineLowered++;
                }
                continue;
            }

            if (Classification.isExpression(op) && !Classification.isExpressionEmittedInline(op, options)) {
                if (procedural || !reuseExistingInOut(op, ctx)) {
                    if (options.isDisallowLocalVariables()) {
                        if (!procedural || hoistNonSideEffectExpr(op, ctx)) {
                            Region region = op.getParentRegion();
                            if (region != null && !region.isSequential()) {
                                WireMaterializer.materialize(op, false, ctx);
                            }
                            if (procedural) continue;
                        }
                    } else {
                        WireMaterializer.materialize(op, false, ctx);
                    }
                }
            }

            if (Classification.isRebalanceable(op)) {
                pushAll(worklist, rebalance(op));
                ctx.stats.rebalanced++;
                continue;
            }

            if (op.kind == OpKind.ADD && op.getNumOperands() == 2) {
                Operation cst = op.getOperand(1).getDefiningOp();
                if (cst != null
                        && cst.kind == OpKind.CONSTANT
                        && Classification.getSignedValue(cst).signum() < 0) {
                    pushAll(worklist, rewriteAddWithNegativeConstant(op, cst));
                    continue;
                }
            }

            if (op.kind == OpKind.STRUCT_EXPLODE) {
                pushAll(worklist, explodeStruct(op));
                continue;
            }

            if (!procedural && Classification.isExpression(op)) {
                reuseExistingInOut(op, ctx);
            }
        }

        if (procedural) {
            frontLoadLogic(block);
        } else {
            ResolveUseBeforeDef.resolve(block, ctx);
        }
    }

    private static void pushAll(Deque<Operation> worklist, List<Operation> ops) {
        for (int i = ops.size() - 1; i >= 0; i--) {
            worklist.addFirst(ops.get(i));
        }
    }

    /**
     * Hoist a pure expression out of procedural regions, so it does not need a local variable.
     * <p>
     * The expression moves to just before the outermost enclosing procedural operation, or
     * only out of its own parent if an operand is defined in an intermediate procedural region.
     *
     * @param op  The expression, in a procedural region.
     * @param ctx The legalization context.
     * @return True if the expression was moved.
     */
    static boolean hoistNonSideEffectExpr(Operation op, LegalizationContext ctx) {
        if (Classification.hasSideEffects(op)) return false;
        if (Classification.isAlwaysInline(op)
                && !(op.kind == OpKind.READ_INOUT || op.getResult().getType().isInOut())) {
            return false;
        }

        Operation target = WireMaterializer.findParentInNonProceduralRegion(op);
        boolean operandInProcedural = false;
        for (Value operand : op.getOperands()) {
            Operation def = operand.getDefiningOp();
            if (def == null) continue;
            Operation defParent = def.getParentOp();
            if (defParent != null && Classification.isProcedural(defParent)) {
                // a dependency local to this very block pins the expression here
                if (def.getBlock() == op.getBlock()) return false;
                operandInProcedural = true;
            }
        }
        if (operandInProcedural) {
            target = op.getParentOp();
        }

        op.moveBefore(target);
        ctx.stats.hoisted++;
        logger.debug("hoisted {} out of procedural region", op.kind);
        return true;
    }

    /**
     * Replace uses of an expression with reads of the storage it is already assigned to,
     * if it is assigned exactly once, unconditionally, at the top level of the module.
     *
     * @param op  The expression, in a non-procedural region.
     * @param ctx The legalization context.
     * @return True if any uses were replaced.
     */
    static boolean reuseExistingInOut(Operation op, LegalizationContext ctx) {
        Value result = op.getResult();
        if (result.getType().isInOut()) return false;

        Operation assign = null;
        List<Use> others = new ArrayList<>();
        for (Use use : result.getUses()) {
            Operation user = use.getOwner();
            if (user.kind == OpKind.ASSIGN && use.getOperandNumber() == 1) {
                if (assign != null) return false;
                // conditionally executed if nested in anything
                if (user.getParentOp() != null) return false;
                assign = user;
                continue;
            }
            others.add(use);
        }
        if (assign == null || others.isEmpty()) return false;

        // constants are never worth routing through a wire
        Operation src = assign.getOperand(1).getDefiningOp();
        if (src != null && src.kind == OpKind.CONSTANT) return false;

        Value dest = assign.getOperand(0);
        for (Use use : others) {
            use.set(IRBuilder.before(use.getOwner()).read(dest));
        }
        Operation destOp = dest.getDefiningOp();
        if (destOp != null && Classification.isAlwaysInline(destOp)) {
            AlwaysInlinePropagator.propagate(destOp);
        }
        ctx.stats.reused++;
        logger.debug("reused existing storage for {} other uses of {}", others.size(), op.kind);
        return true;
    }

    /**
     * Rebuild a variadic associative operation as a balanced tree of binary ones.
     *
     * @param op The operation.
     * @return The new operations, in block order.
     */
    static List<Operation> rebalance(Operation op) {
        List<Operation> newOps = new ArrayList<>();
        Value result = buildBalanced(op, op.getOperands(), newOps, true);
        logger.debug("rebalanced {} with {} operands into {} binary operations", op.kind, op.getNumOperands(), newOps.size());
        op.getResult().replaceAllUsesWith(result);
        op.erase();
        for (Operation node : newOps) {
            AlwaysInlinePropagator.propagateOperands(node);
        }
        return newOps;
    }

    private static Value buildBalanced(Operation op, List<Value> operands, List<Operation> newOps, boolean top) {
        Value lhs, rhs;
        switch (operands.size()) {
            case 0:
                throw new IllegalArgumentException("cannot rebalance an empty operand list");
            case 1:
                return operands.get(0);
            case 2:
                lhs = operands.get(0);
                rhs = operands.get(1);
                break;
            default: {
                int firstHalf = operands.size() / 2;
                lhs = buildBalanced(op, operands.subList(0, firstHalf), newOps, false);
                rhs = buildBalanced(op, operands.subList(firstHalf, operands.size()), newOps, false);
                break;
            }
        }

        Operation node = IRBuilder.before(op).create(op.kind,
                Arrays.asList(lhs, rhs),
                Collections.singletonList(op.getResult().getType()));
        newOps.add(node);
        if (top) {
            String hint = op.getNameHint();
            if (hint != null) node.setNameHint(hint);
            Boolean twoState = op.getNullable(CommonExts.TWO_STATE);
            if (twoState != null) node.attachExt(CommonExts.TWO_STATE, twoState);
        }
        return node.getResult();
    }

    /**
     * Rewrite {@code a + -c} as {@code a - c}.
     *
     * @param add The addition.
     * @param cst The negative constant it adds.
     * @return The new constant and subtraction.
     */
    static List<Operation> rewriteAddWithNegativeConstant(Operation add, Operation cst) {
        IRBuilder ib = IRBuilder.before(add);
        IntType type = (IntType) cst.getResult().getType();
        BigInteger negated = Classification.toSigned(Classification.getSignedValue(cst).negate(), type.width);
        Value positive = ib.constant(type, negated);
        Value sub = ib.sub(add.getOperand(0), positive);
        Operation subOp = sub.getDefiningOp();
        Boolean twoState = add.getNullable(CommonExts.TWO_STATE);
        if (twoState != null) subOp.attachExt(CommonExts.TWO_STATE, twoState);
        String hint = add.getNameHint();
        if (hint != null) subOp.setNameHint(hint);

        add.getResult().replaceAllUsesWith(sub);
        add.erase();
        if (cst.useEmpty()) cst.erase();
        AlwaysInlinePropagator.propagateOperands(subOp);
        logger.debug("rewrote addition of {} as subtraction", Classification.getSignedValue(positive.getDefiningOp()).negate());
        return Arrays.asList(positive.getDefiningOp(), subOp);
    }

    /**
     * Replace a {@code hw.struct_explode} with one {@code hw.struct_extract} per field.
     *
     * @param op The explode.
     * @return The extracts, in field order.
     */
    static List<Operation> explodeStruct(Operation op) {
        Value input = op.getOperand(0);
        StructType type = (StructType) input.getType();
        IRBuilder ib = IRBuilder.before(op);
        List<Operation> extracts = new ArrayList<>(type.fields.size());
        for (int i = 0; i < type.fields.size(); i++) {
            Value extract = ib.structExtract(input, type.fields.get(i).name);
            op.getResult(i).replaceAllUsesWith(extract);
            extracts.add(extract.getDefiningOp());
        }
        op.erase();
        Operation inputOp = input.getDefiningOp();
        if (inputOp != null && Classification.isAlwaysInline(inputOp)) {
            AlwaysInlinePropagator.propagate(inputOp);
        }
        logger.debug("exploded struct into {} extracts", extracts.size());
        return extracts;
    }

    /**
     * Move every {@code sv.logic} of a procedural block to the start of the nearest block not
     * wrapped in an {@code sv.ifdef.procedural}, keeping their order.
     *
     * @param block The procedural block.
     */
    static void frontLoadLogic(Block block) {
        if (block.isEmpty()) return;

        Block target = block;
        Operation parent = block.getParentOp();
        while (parent != null && parent.kind == OpKind.IFDEF_PROCEDURAL && parent.getBlock() != null) {
            target = parent.getBlock();
            parent = target.getParentOp();
        }
        Operation anchor = target.front();

        for (Operation op : new ArrayList<>(block.getOperations())) {
            if (op.kind != OpKind.LOGIC) continue;
            if (op == anchor) {
                anchor = op.getNextNode();
                continue;
            }
            if (anchor == null) {
                op.moveToBlockEnd(target);
            } else {
                op.moveBefore(anchor);
            }
        }
    }
}
