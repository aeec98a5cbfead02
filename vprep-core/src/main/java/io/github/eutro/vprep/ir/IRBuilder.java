package io.github.eutro.vprep.ir;

import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ops.EventEdge;
import io.github.eutro.vprep.ops.ICmpPredicate;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.types.*;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.*;

/**
 * An IR, or operation, builder, which encapsulates a position in a block
 * where operations are being inserted.
 * <p>
 * Operations are inserted immediately before an anchor operation, or at the end of
 * the block if there is no anchor, so consecutive insertions keep their order.
 */
public class IRBuilder {
    private Block block;
    @Nullable
    private Operation anchor;

    /**
     * Construct an operation builder inserting before {@code anchor} in {@code block}.
     *
     * @param block  The block.
     * @param anchor The operation to insert before, or null to insert at the end.
     */
    public IRBuilder(Block block, @Nullable Operation anchor) {
        this.block = block;
        this.anchor = anchor;
    }

    public static IRBuilder atBlockEnd(Block block) {
        return new IRBuilder(block, null);
    }

    public static IRBuilder atBlockBegin(Block block) {
        return new IRBuilder(block, block.front());
    }

    public static IRBuilder before(Operation op) {
        return new IRBuilder(requireBlock(op), op);
    }

    public static IRBuilder after(Operation op) {
        return new IRBuilder(requireBlock(op), op.getNextNode());
    }

    private static Block requireBlock(Operation op) {
        Block block = op.getBlock();
        if (block == null) throw new IllegalStateException("operation is not in a block: " + op);
        return block;
    }

    /**
     * Get the block this builder is inserting into.
     *
     * @return The block.
     */
    public Block getBlock() {
        return block;
    }

    public void setInsertionPointBefore(Operation op) {
        block = requireBlock(op);
        anchor = op;
    }

    public void setInsertionPointAfter(Operation op) {
        block = requireBlock(op);
        anchor = op.getNextNode();
    }

    public void setInsertionPointToEnd(Block block) {
        this.block = block;
        anchor = null;
    }

    /**
     * Insert a detached operation at the insertion point.
     *
     * @param op The operation.
     * @return The same operation.
     */
    public Operation insert(Operation op) {
        if (anchor == null) {
            block.append(op);
        } else {
            block.insertBefore(anchor, op);
        }
        return op;
    }

    /**
     * Create and insert an operation.
     *
     * @param kind        The kind of operation.
     * @param operands    The operands.
     * @param resultTypes The result types.
     * @return The operation.
     */
    public Operation create(OpKind kind, List<Value> operands, List<HWType> resultTypes) {
        return insert(new Operation(kind, operands, resultTypes));
    }

    private Value expr(OpKind kind, HWType type, Value... operands) {
        return create(kind, Arrays.asList(operands), Collections.singletonList(type)).getResult();
    }

    private Operation stmt(OpKind kind, int numRegions, Value... operands) {
        return insert(new Operation(kind, Arrays.asList(operands), Collections.emptyList(), numRegions));
    }

    // constants

    public Value constant(IntType type, BigInteger value) {
        Value v = expr(OpKind.CONSTANT, type);
        v.getDefiningOp().attachExt(CommonExts.VALUE, value);
        return v;
    }

    public Value constant(IntType type, long value) {
        return constant(type, BigInteger.valueOf(value));
    }

    public Value constantX(HWType type) {
        return expr(OpKind.CONSTANT_X, type);
    }

    public Value constantZ(HWType type) {
        return expr(OpKind.CONSTANT_Z, type);
    }

    // comb

    /**
     * Create a variadic or binary comb operation, typed like its first operand.
     *
     * @param kind     The kind of operation.
     * @param operands The operands, at least one.
     * @return The result.
     */
    public Value comb(OpKind kind, Value... operands) {
        if (operands.length == 0) throw new IllegalArgumentException("no operands for " + kind);
        return expr(kind, operands[0].getType(), operands);
    }

    public Value add(Value... operands) {
        return comb(OpKind.ADD, operands);
    }

    public Value sub(Value lhs, Value rhs) {
        return comb(OpKind.SUB, lhs, rhs);
    }

    public Value and(Value... operands) {
        return comb(OpKind.AND, operands);
    }

    public Value or(Value... operands) {
        return comb(OpKind.OR, operands);
    }

    public Value xor(Value... operands) {
        return comb(OpKind.XOR, operands);
    }

    public Value icmp(ICmpPredicate predicate, Value lhs, Value rhs) {
        Value v = expr(OpKind.ICMP, IntType.of(1), lhs, rhs);
        v.getDefiningOp().attachExt(CommonExts.PREDICATE, predicate);
        return v;
    }

    public Value mux(Value cond, Value trueValue, Value falseValue) {
        return expr(OpKind.MUX, trueValue.getType(), cond, trueValue, falseValue);
    }

    public Value concat(Value... operands) {
        int width = 0;
        for (Value operand : operands) {
            width += operand.getType().getBitWidth();
        }
        return expr(OpKind.CONCAT, IntType.of(width), operands);
    }

    public Value extract(Value input, int lowBit, int width) {
        Value v = expr(OpKind.EXTRACT, IntType.of(width), input);
        v.getDefiningOp().attachExt(CommonExts.LOW_BIT, lowBit);
        return v;
    }

    public Value replicate(Value input, int times) {
        return expr(OpKind.REPLICATE, IntType.of(input.getType().getBitWidth() * times), input);
    }

    public Value parity(Value input) {
        return expr(OpKind.PARITY, IntType.of(1), input);
    }

    // hw

    public Value bitcast(Value input, HWType type) {
        return expr(OpKind.BITCAST, type, input);
    }

    public Value structCreate(StructType type, Value... fields) {
        return expr(OpKind.STRUCT_CREATE, type, fields);
    }

    public Value structExtract(Value input, String field) {
        StructType type = (StructType) input.getType();
        Value v = expr(OpKind.STRUCT_EXTRACT, type.getField(field).type, input);
        v.getDefiningOp().attachExt(CommonExts.FIELD, field);
        return v;
    }

    public Operation structExplode(Value input) {
        StructType type = (StructType) input.getType();
        List<HWType> types = new ArrayList<>(type.fields.size());
        for (StructType.Field field : type.fields) {
            types.add(field.type);
        }
        return create(OpKind.STRUCT_EXPLODE, Collections.singletonList(input), types);
    }

    public Value arrayCreate(Value... elements) {
        if (elements.length == 0) throw new IllegalArgumentException("empty array");
        return expr(OpKind.ARRAY_CREATE, new ArrayType(elements[0].getType(), elements.length), elements);
    }

    public Value arrayGet(Value array, Value index) {
        return expr(OpKind.ARRAY_GET, ((ArrayType) array.getType()).element, array, index);
    }

    /**
     * Create a {@code hw.instance} of another module.
     *
     * @param instanceName The name of the instance.
     * @param moduleName   The name of the instantiated module.
     * @param inputNames   The names of the input ports, matching {@code inputs}.
     * @param inputs       The values driving the input ports.
     * @param outputNames  The names of the output ports.
     * @param outputTypes  The types of the output ports.
     * @return The instance.
     */
    public Operation instance(String instanceName, String moduleName,
                              List<String> inputNames, List<Value> inputs,
                              List<String> outputNames, List<HWType> outputTypes) {
        Operation op = create(OpKind.INSTANCE, inputs, outputTypes);
        op.attachExt(CommonExts.INSTANCE_NAME, instanceName);
        op.attachExt(CommonExts.MODULE_NAME, moduleName);
        op.attachExt(CommonExts.INPUT_NAMES, Collections.unmodifiableList(new ArrayList<>(inputNames)));
        op.attachExt(CommonExts.OUTPUT_NAMES, Collections.unmodifiableList(new ArrayList<>(outputNames)));
        return op;
    }

    public Operation output(Value... values) {
        return stmt(OpKind.OUTPUT, 0, values);
    }

    // sv

    private Value decl(OpKind kind, HWType type, @Nullable String name) {
        Value v = expr(kind, new InOutType(type));
        if (name != null) v.getDefiningOp().attachExt(CommonExts.DECL_NAME, name);
        return v;
    }

    public Value wire(HWType type, @Nullable String name) {
        return decl(OpKind.WIRE, type, name);
    }

    public Value reg(HWType type, @Nullable String name) {
        return decl(OpKind.REG, type, name);
    }

    public Value logic(HWType type, @Nullable String name) {
        return decl(OpKind.LOGIC, type, name);
    }

    public Value read(Value inout) {
        return expr(OpKind.READ_INOUT, ((InOutType) inout.getType()).element, inout);
    }

    public Value arrayIndexInOut(Value inout, Value index) {
        ArrayType array = (ArrayType) ((InOutType) inout.getType()).element;
        return expr(OpKind.ARRAY_INDEX_INOUT, new InOutType(array.element), inout, index);
    }

    public Value structFieldInOut(Value inout, String field) {
        StructType struct = (StructType) ((InOutType) inout.getType()).element;
        Value v = expr(OpKind.STRUCT_FIELD_INOUT, new InOutType(struct.getField(field).type), inout);
        v.getDefiningOp().attachExt(CommonExts.FIELD, field);
        return v;
    }

    public Value verbatim(HWType type, String format, Value... operands) {
        Value v = expr(OpKind.VERBATIM_EXPR, type, operands);
        v.getDefiningOp().attachExt(CommonExts.FORMAT, format);
        return v;
    }

    public Value verbatimSE(HWType type, String format, Value... operands) {
        Value v = expr(OpKind.VERBATIM_EXPR_SE, type, operands);
        v.getDefiningOp().attachExt(CommonExts.FORMAT, format);
        return v;
    }

    public Operation assign(Value dest, Value src) {
        return stmt(OpKind.ASSIGN, 0, dest, src);
    }

    public Operation bpassign(Value dest, Value src) {
        return stmt(OpKind.BPASSIGN, 0, dest, src);
    }

    public Operation passign(Value dest, Value src) {
        return stmt(OpKind.PASSIGN, 0, dest, src);
    }

    /**
     * Create an {@code sv.always} sensitive to the given edges of the given values.
     *
     * @param edges  The edges, one per condition.
     * @param conditions The conditions.
     * @return The operation, with one region.
     */
    public Operation always(List<EventEdge> edges, List<Value> conditions) {
        if (edges.size() != conditions.size()) {
            throw new IllegalArgumentException("edges and conditions differ in length");
        }
        Operation op = insert(new Operation(OpKind.ALWAYS, conditions, Collections.emptyList(), 1));
        op.attachExt(CommonExts.EVENTS, Collections.unmodifiableList(new ArrayList<>(edges)));
        return op;
    }

    public Operation alwaysFF(EventEdge clockEdge, Value clock) {
        Operation op = stmt(OpKind.ALWAYS_FF, 1, clock);
        op.attachExt(CommonExts.CLOCK_EDGE, clockEdge);
        return op;
    }

    public Operation alwaysFF(EventEdge clockEdge, Value clock, EventEdge resetEdge, Value reset) {
        Operation op = stmt(OpKind.ALWAYS_FF, 1, clock, reset);
        op.attachExt(CommonExts.CLOCK_EDGE, clockEdge);
        op.attachExt(CommonExts.RESET_EDGE, resetEdge);
        return op;
    }

    public Operation alwaysComb() {
        return stmt(OpKind.ALWAYS_COMB, 1);
    }

    public Operation initial() {
        return stmt(OpKind.INITIAL, 1);
    }

    /**
     * Create an {@code sv.if}, with a then region and an else region.
     *
     * @param cond The condition.
     * @return The operation.
     */
    public Operation ifOp(Value cond) {
        return stmt(OpKind.IF, 2, cond);
    }

    public Operation ifdef(String macro) {
        Operation op = stmt(OpKind.IFDEF, 2);
        op.attachExt(CommonExts.MACRO, macro);
        return op;
    }

    public Operation ifdefProcedural(String macro) {
        Operation op = stmt(OpKind.IFDEF_PROCEDURAL, 2);
        op.attachExt(CommonExts.MACRO, macro);
        return op;
    }

    public Operation fwrite(String format, Value... operands) {
        Operation op = stmt(OpKind.FWRITE, 0, operands);
        op.attachExt(CommonExts.FORMAT, format);
        return op;
    }

    /**
     * Create a stand-in for an operation that was never lowered to the emitter's vocabulary.
     *
     * @param foreignName The name of the operation.
     * @param operands    The operands.
     * @param resultTypes The result types.
     * @return The operation.
     */
    public Operation unlowered(String foreignName, List<Value> operands, List<HWType> resultTypes) {
        Operation op = create(OpKind.UNLOWERED, operands, resultTypes);
        op.attachExt(CommonExts.FOREIGN_NAME, foreignName);
        return op;
    }

    /**
     * Set the name hint of the operation defining {@code value}.
     *
     * @param value The value.
     * @param hint  The name hint.
     * @return The same value.
     */
    public static Value named(Value value, String hint) {
        Operation op = value.getDefiningOp();
        if (op == null) throw new IllegalArgumentException("block arguments have no name hint");
        op.setNameHint(hint);
        return value;
    }
}
