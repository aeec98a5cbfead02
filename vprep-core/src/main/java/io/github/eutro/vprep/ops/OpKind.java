package io.github.eutro.vprep.ops;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static io.github.eutro.vprep.ops.OpKind.Dialect.*;
import static io.github.eutro.vprep.ops.OpKind.Fact.*;

/**
 * The closed vocabulary of operations the emitter understands.
 * <p>
 * Each kind carries a fixed table of {@link Fact facts}, which is all the
 * {@link io.github.eutro.vprep.util.Classification classification} needs to know about it.
 * Anything an earlier stage failed to lower is represented as {@link #UNLOWERED}.
 */
public enum OpKind {
    // comb
    ADD("comb.add", COMB, EXPRESSION, ASSOCIATIVE),
    SUB("comb.sub", COMB, EXPRESSION),
    MUL("comb.mul", COMB, EXPRESSION, ASSOCIATIVE),
    DIVU("comb.divu", COMB, EXPRESSION),
    DIVS("comb.divs", COMB, EXPRESSION),
    MODU("comb.modu", COMB, EXPRESSION),
    MODS("comb.mods", COMB, EXPRESSION),
    SHL("comb.shl", COMB, EXPRESSION),
    SHRU("comb.shru", COMB, EXPRESSION),
    SHRS("comb.shrs", COMB, EXPRESSION),
    AND("comb.and", COMB, EXPRESSION, ASSOCIATIVE),
    OR("comb.or", COMB, EXPRESSION, ASSOCIATIVE),
    XOR("comb.xor", COMB, EXPRESSION, ASSOCIATIVE),
    ICMP("comb.icmp", COMB, EXPRESSION),
    MUX("comb.mux", COMB, EXPRESSION),
    CONCAT("comb.concat", COMB, EXPRESSION),
    EXTRACT("comb.extract", COMB, EXPRESSION, BIT_SELECT),
    REPLICATE("comb.replicate", COMB, EXPRESSION),
    PARITY("comb.parity", COMB, EXPRESSION),

    // hw
    CONSTANT("hw.constant", HW, EXPRESSION, Fact.CONSTANT),
    BITCAST("hw.bitcast", HW, EXPRESSION),
    STRUCT_CREATE("hw.struct_create", HW, EXPRESSION),
    STRUCT_EXTRACT("hw.struct_extract", HW, EXPRESSION, BIT_SELECT),
    STRUCT_EXPLODE("hw.struct_explode", HW),
    ARRAY_CREATE("hw.array_create", HW, EXPRESSION),
    ARRAY_GET("hw.array_get", HW, EXPRESSION, BIT_SELECT),
    INSTANCE("hw.instance", HW),
    OUTPUT("hw.output", HW, TERMINATOR),

    // sv
    WIRE("sv.wire", SV, DECLARATION),
    REG("sv.reg", SV, DECLARATION),
    LOGIC("sv.logic", SV, DECLARATION),
    READ_INOUT("sv.read_inout", SV, EXPRESSION, ALWAYS_INLINE),
    ARRAY_INDEX_INOUT("sv.array_index_inout", SV, EXPRESSION, ALWAYS_INLINE),
    STRUCT_FIELD_INOUT("sv.struct_field_inout", SV, EXPRESSION, ALWAYS_INLINE),
    CONSTANT_X("sv.constantX", SV, EXPRESSION, Fact.CONSTANT),
    CONSTANT_Z("sv.constantZ", SV, EXPRESSION, Fact.CONSTANT),
    VERBATIM_EXPR("sv.verbatim.expr", SV, EXPRESSION),
    VERBATIM_EXPR_SE("sv.verbatim.expr.se", SV, EXPRESSION, SIDE_EFFECTS),
    ASSIGN("sv.assign", SV, ASSIGNMENT, SIDE_EFFECTS),
    BPASSIGN("sv.bpassign", SV, ASSIGNMENT, SIDE_EFFECTS),
    PASSIGN("sv.passign", SV, ASSIGNMENT, SIDE_EFFECTS),
    ALWAYS("sv.always", SV, PROCEDURAL_BODY, EVENT_CONTROL, SIDE_EFFECTS),
    ALWAYS_FF("sv.alwaysff", SV, PROCEDURAL_BODY, EVENT_CONTROL, SIDE_EFFECTS),
    ALWAYS_COMB("sv.alwayscomb", SV, PROCEDURAL_BODY, SIDE_EFFECTS),
    INITIAL("sv.initial", SV, PROCEDURAL_BODY, SIDE_EFFECTS),
    IF("sv.if", SV, PROCEDURAL_BODY, SIDE_EFFECTS),
    IFDEF("sv.ifdef", SV, CONDITIONAL_COMPILATION, SIDE_EFFECTS),
    IFDEF_PROCEDURAL("sv.ifdef.procedural", SV, PROCEDURAL_BODY, CONDITIONAL_COMPILATION, SIDE_EFFECTS),
    FWRITE("sv.fwrite", SV, SIDE_EFFECTS),

    /**
     * An operation outside the vocabulary. Its original name is kept in
     * {@link io.github.eutro.vprep.ext.CommonExts#FOREIGN_NAME}.
     */
    UNLOWERED("unlowered", OTHER, SIDE_EFFECTS),
    ;

    /**
     * The dialect a kind belongs to.
     */
    public enum Dialect {
        COMB,
        HW,
        SV,
        OTHER,
    }

    /**
     * Facts about a kind of operation.
     */
    public enum Fact {
        /**
         * Produces a single value which may be written inline in a Verilog expression.
         */
        EXPRESSION,
        /**
         * An expression which Verilog never allows to be bound to a name,
         * and which must therefore be written out at each use.
         */
        ALWAYS_INLINE,
        /**
         * A constant, foldable by the emitter with no dependencies.
         */
        CONSTANT,
        /**
         * Variadic, and fully associative in its operands.
         */
        ASSOCIATIVE,
        /**
         * Reading or writing state, or talking to the outside world.
         */
        SIDE_EFFECTS,
        /**
         * All of its regions are sequential (procedural).
         */
        PROCEDURAL_BODY,
        /**
         * Its regions are only selected by the preprocessor.
         */
        CONDITIONAL_COMPILATION,
        /**
         * Declares a named storage element.
         */
        DECLARATION,
        /**
         * Drives a storage element: operand 0 is the destination, operand 1 the source.
         */
        ASSIGNMENT,
        /**
         * Selects part of its first operand.
         */
        BIT_SELECT,
        /**
         * Its operands are event controls (clocks, resets).
         */
        EVENT_CONTROL,
        /**
         * Ends the module body.
         */
        TERMINATOR,
    }

    public final String mnemonic;
    public final Dialect dialect;
    private final Set<Fact> facts;

    OpKind(String mnemonic, Dialect dialect, Fact... facts) {
        this.mnemonic = mnemonic;
        this.dialect = dialect;
        EnumSet<Fact> set = EnumSet.noneOf(Fact.class);
        Collections.addAll(set, facts);
        this.facts = Collections.unmodifiableSet(set);
    }

    public boolean has(Fact fact) {
        return facts.contains(fact);
    }

    public Set<Fact> getFacts() {
        return facts;
    }

    /**
     * Whether the emitter knows how to print this kind of operation at all.
     *
     * @return False only for {@link #UNLOWERED}.
     */
    public boolean isSupported() {
        return dialect != OTHER;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
