package io.github.eutro.vprep.util;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.types.ArrayType;
import io.github.eutro.vprep.types.HWType;
import io.github.eutro.vprep.types.IntType;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;

/**
 * Predicates classifying operations and values, answering what the emitter can and cannot
 * write where.
 * <p>
 * All of these are pure, and only look at the operation, its operands and its users.
 */
public final class Classification {
    /**
     * Verbatim expressions longer than this are never inlined or duplicated.
     */
    public static final int MAX_INLINE_VERBATIM_LENGTH = 32;

    private Classification() {
    }

    /**
     * Whether the operation is a Verilog expression: a single value that may be written inline.
     *
     * @param op The operation.
     * @return True if the operation is an expression.
     */
    public static boolean isExpression(Operation op) {
        return op.kind.has(OpKind.Fact.EXPRESSION) && op.getNumResults() == 1;
    }

    /**
     * Whether the operation is an expression that may never be bound to a name,
     * and must be written out at every use.
     *
     * @param op The operation.
     * @return True if the operation must always be inlined.
     */
    public static boolean isAlwaysInline(Operation op) {
        return op.kind.has(OpKind.Fact.ALWAYS_INLINE);
    }

    /**
     * Whether the operation is a declaration which may be moved anywhere in its block:
     * no operands, and a single storage handle result.
     *
     * @param op The operation.
     * @return True if the operation is a movable declaration.
     */
    public static boolean isMovableDeclaration(@Nullable Operation op) {
        return op != null
                && op.getNumResults() == 1
                && op.getResult(0).getType().isInOut()
                && op.getNumOperands() == 0;
    }

    public static boolean isConstantExpression(Operation op) {
        return op.kind.has(OpKind.Fact.CONSTANT);
    }

    public static boolean isDeclaration(@Nullable Operation op) {
        return op != null && op.kind.has(OpKind.Fact.DECLARATION);
    }

    public static boolean isProcedural(Operation op) {
        return op.kind.has(OpKind.Fact.PROCEDURAL_BODY);
    }

    public static boolean hasSideEffects(Operation op) {
        return op.kind.has(OpKind.Fact.SIDE_EFFECTS);
    }

    /**
     * Whether the value is a port, or a read of a wire, reg or logic.
     *
     * @param v The value.
     * @return True if the value is a simple read or port.
     */
    public static boolean isSimpleReadOrPort(Value v) {
        if (v.isBlockArgument()) return true;
        Operation op = v.getDefiningOp();
        if (op == null || op.kind != OpKind.READ_INOUT) return false;
        return isDeclaration(op.getOperand(0).getDefiningOp());
    }

    /**
     * Whether the value may be the selected operand of a bit or element select,
     * which Verilog only allows of names and other selects.
     *
     * @param v The value.
     * @return True if it is fine to select from the value.
     */
    public static boolean isOkToBitSelectFrom(Value v) {
        if (v.isBlockArgument()) return true;
        Operation op = v.getDefiningOp();
        if (op == null) return false;
        switch (op.kind) {
            case READ_INOUT:
            case STRUCT_EXTRACT:
            case ARRAY_GET:
                return true;
            default:
                return false;
        }
    }

    private static boolean isShortVerbatim(Operation op) {
        String format = op.getNullable(CommonExts.FORMAT);
        return format == null || format.length() <= MAX_INLINE_VERBATIM_LENGTH;
    }

    /**
     * Whether the expression is cheap enough to write out at each of several uses.
     *
     * @param op The expression.
     * @return True if the expression may be duplicated.
     */
    public static boolean isDuplicatableExpression(Operation op) {
        if (op.getNumOperands() == 0) {
            if (isConstantExpression(op)) return true;
            return op.kind == OpKind.VERBATIM_EXPR && isShortVerbatim(op);
        }
        switch (op.kind) {
            case EXTRACT:
            case STRUCT_EXTRACT:
                return true;
            case ARRAY_GET: {
                Operation indexOp = op.getOperand(1).getDefiningOp();
                if (indexOp == null || indexOp.kind == OpKind.CONSTANT) return true;
                if (indexOp.kind == OpKind.READ_INOUT) {
                    Operation src = indexOp.getOperand(0).getDefiningOp();
                    return src == null || src.kind == OpKind.WIRE || src.kind == OpKind.LOGIC;
                }
                return false;
            }
            default:
                return false;
        }
    }

    private static boolean haveMatchingDims(HWType a, HWType b) {
        if (a instanceof IntType && b instanceof IntType) {
            return a.getBitWidth() == b.getBitWidth();
        }
        if (a instanceof ArrayType && b instanceof ArrayType) {
            ArrayType aa = (ArrayType) a;
            ArrayType ab = (ArrayType) b;
            return aa.size == ab.size && haveMatchingDims(aa.element, ab.element);
        }
        return a.equals(b);
    }

    /**
     * Whether the expression can, structurally, never be written inline where it is used.
     *
     * @param op      The expression.
     * @param options The lowering options.
     * @return True if the expression must be emitted out of line.
     */
    public static boolean isExpressionUnableToInline(Operation op, LoweringOptions options) {
        switch (op.kind) {
            case BITCAST:
                if (!haveMatchingDims(op.getOperand(0).getType(), op.getResult().getType())) return true;
                break;
            case STRUCT_CREATE:
            case ARRAY_CREATE:
                return true;
            case VERBATIM_EXPR:
            case VERBATIM_EXPR_SE:
                if (!isShortVerbatim(op)) return true;
                break;
            default:
                break;
        }
        Value result = op.getResult();
        for (Operation user : op.getUsers()) {
            if (user.kind.has(OpKind.Fact.BIT_SELECT)
                    && user.getOperand(0) == result
                    && !isOkToBitSelectFrom(result)) {
                return true;
            }
            if (!options.isAllowExpressionInEventControl()
                    && (user.kind == OpKind.ALWAYS || user.kind == OpKind.ALWAYS_FF)) {
                if (op.kind == OpKind.READ_INOUT) {
                    Operation src = op.getOperand(0).getDefiningOp();
                    if (src != null && (src.kind == OpKind.WIRE || src.kind == OpKind.REG)) continue;
                }
                return true;
            }
            if (options.isDisallowExpressionInliningInPorts()
                    && user.kind == OpKind.INSTANCE
                    && !isSimpleReadOrPort(result)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the emitter will write the expression inline at its use, rather than in a
     * temporary of its own.
     *
     * @param op      The expression.
     * @param options The lowering options.
     * @return True if the expression will be inlined.
     */
    public static boolean isExpressionEmittedInline(Operation op, LoweringOptions options) {
        Value result = op.getResult();
        if (result.useEmpty()) return true;
        if (result.hasOneUse()) {
            switch (result.getUses().get(0).getOwner().kind) {
                case OUTPUT:
                case ASSIGN:
                case BPASSIGN:
                case PASSIGN:
                    return true;
                default:
                    break;
            }
        }
        if (options.isDisallowMuxInlining() && op.kind == OpKind.MUX) return false;
        if (!result.hasOneUse() && !isDuplicatableExpression(op)) return false;
        return !isExpressionUnableToInline(op, options);
    }

    /**
     * Whether the expression is a fully associative operation with more than two operands,
     * which may be rebuilt as a balanced tree of binary operations.
     *
     * @param op The operation.
     * @return True if the operation may be rebalanced.
     */
    public static boolean isRebalanceable(Operation op) {
        if (op.getNumOperands() <= 2
                || op.getNumResults() != 1
                || !op.kind.has(OpKind.Fact.ASSOCIATIVE)
                || hasSideEffects(op)
                || op.getNumRegions() != 0) {
            return false;
        }
        return op.getExtKeys().stream()
                .allMatch(ext -> ext.isDiscardable() || ext == CommonExts.TWO_STATE);
    }

    /**
     * Get the value of a {@code hw.constant}, interpreted as a signed integer of its width.
     *
     * @param op The constant.
     * @return The signed value.
     */
    public static BigInteger getSignedValue(Operation op) {
        int width = op.getResult().getType().getBitWidth();
        BigInteger value = op.getExtOrThrow(CommonExts.VALUE);
        return toSigned(value, width);
    }

    /**
     * Truncate a value to {@code width} bits, and interpret it as signed.
     *
     * @param value The value.
     * @param width The width.
     * @return The signed value.
     */
    public static BigInteger toSigned(BigInteger value, int width) {
        if (width == 0) return BigInteger.ZERO;
        BigInteger modulus = BigInteger.ONE.shiftLeft(width);
        BigInteger unsigned = value.mod(modulus);
        return unsigned.testBit(width - 1) ? unsigned.subtract(modulus) : unsigned;
    }
}
