package io.github.eutro.vprep.ext;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ops.EventEdge;
import io.github.eutro.vprep.ops.ICmpPredicate;

import java.math.BigInteger;
import java.util.List;

/**
 * The exts used as operation attributes, and on the other parts of the IR.
 */
public class CommonExts {
    /**
     * A suggestion for the name of the value an operation produces. Only a hint;
     * the emitter may ignore it. Names starting with {@code _} are considered private.
     */
    public static final Ext<String> NAME_HINT = Ext.createDiscardable(String.class, "sv.namehint");
    /**
     * Marks arithmetic which may ignore X and Z values.
     */
    public static final Ext<Boolean> TWO_STATE = Ext.create(Boolean.class, "twoState");

    /**
     * The value of a {@code hw.constant}.
     */
    public static final Ext<BigInteger> VALUE = Ext.create(BigInteger.class, "value");
    /**
     * The low bit of a {@code comb.extract}.
     */
    public static final Ext<Integer> LOW_BIT = Ext.create(Integer.class, "lowBit");
    /**
     * The field selected by a {@code hw.struct_extract} or {@code sv.struct_field_inout}.
     */
    public static final Ext<String> FIELD = Ext.create(String.class, "field");
    public static final Ext<ICmpPredicate> PREDICATE = Ext.create(ICmpPredicate.class, "predicate");
    /**
     * The name of a declaration ({@code sv.wire}, {@code sv.reg}, {@code sv.logic}).
     */
    public static final Ext<String> DECL_NAME = Ext.create(String.class, "name");
    /**
     * The text of a verbatim expression, or the format string of an {@code sv.fwrite}.
     */
    public static final Ext<String> FORMAT = Ext.create(String.class, "format");
    public static final Ext<String> MACRO = Ext.create(String.class, "cond");

    public static final Ext<String> INSTANCE_NAME = Ext.create(String.class, "instanceName");
    public static final Ext<String> MODULE_NAME = Ext.create(String.class, "moduleName");
    public static final Ext<List<String>> INPUT_NAMES = Ext.create(List.class, "argNames");
    public static final Ext<List<String>> OUTPUT_NAMES = Ext.create(List.class, "resultNames");

    /**
     * One edge per operand of an {@code sv.always}.
     */
    public static final Ext<List<EventEdge>> EVENTS = Ext.create(List.class, "events");
    public static final Ext<EventEdge> CLOCK_EDGE = Ext.create(EventEdge.class, "clockEdge");
    /**
     * Present iff an {@code sv.alwaysff} has a reset operand.
     */
    public static final Ext<EventEdge> RESET_EDGE = Ext.create(EventEdge.class, "resetEdge");

    /**
     * The name of the operation an {@link io.github.eutro.vprep.ops.OpKind#UNLOWERED} operation stands for.
     */
    public static final Ext<String> FOREIGN_NAME = Ext.create(String.class, "foreignName");

    /**
     * Options for emitting the modules of a {@link io.github.eutro.vprep.ir.Circuit}.
     */
    public static final Ext<LoweringOptions> LOWERING_OPTIONS = Ext.create(LoweringOptions.class, "circt.loweringOptions");
}
