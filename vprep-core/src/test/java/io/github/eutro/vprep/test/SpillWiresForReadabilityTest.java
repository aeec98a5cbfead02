package io.github.eutro.vprep.test;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.IRBuilder;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.PrepareForEmission;
import io.github.eutro.vprep.passes.meta.VerifyPrepared;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.vprep.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class SpillWiresForReadabilityTest {
    private static final LoweringOptions SPILL_NAMED = LoweringOptions.parse("wireSpillingHeuristic=spillLargeTermsWithNamehints");

    private static Value wideSum(HWModule m, IRBuilder ib) {
        Value[] terms = new Value[10];
        for (int i = 0; i < terms.length; i++) {
            terms[i] = m.addInput("p" + i, I8);
        }
        return ib.add(terms);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "maximumNumberOfTermsPerExpression=8",
            "maximumNumberOfTermsPerExpression=8,wireSpillingHeuristic=spillLargeTermsWithNamehints",
    })
    void testLargeExpressionSpilled(String options) {
        HWModule m = new HWModule("m");
        m.addOutput("y", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value sum = wideSum(m, ib);
        Value t = ib.xor(sum, m.getBodyBlock().getArgument(0));
        ib.output(t);

        new PrepareForEmission(LoweringOptions.parse(options)).run(m);

        assertEquals(9, count(m, OpKind.ADD));
        List<Operation> wires = collect(m, OpKind.WIRE);
        assertEquals(1, wires.size());
        Operation read = def(def(t).getOperand(0));
        assertEquals(OpKind.READ_INOUT, read.kind);
        assertSame(wires.get(0).getResult(), read.getOperand(0));
        VerifyPrepared.INSTANCE.run(m);
    }

    @Test
    void testSmallExpressionKept() {
        HWModule m = new HWModule("m");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value sum = wideSum(m, ib);
        ib.output(ib.xor(sum, m.getBodyBlock().getArgument(0)));

        new PrepareForEmission(LoweringOptions.parse("maximumNumberOfTermsPerExpression=16")).run(m);

        assertEquals(0, count(m, OpKind.WIRE));
    }

    private static HWModule namedModule(String hint) {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value x = IRBuilder.named(ib.add(in.get(0), in.get(1)), hint);
        ib.output(ib.xor(x, in.get(0)));
        return m;
    }

    @Test
    void testPublicNameHintSpilled() {
        HWModule m = namedModule("foo");
        new PrepareForEmission(SPILL_NAMED).run(m);

        List<Operation> wires = collect(m, OpKind.WIRE);
        assertEquals(1, wires.size());
        assertEquals("foo", wires.get(0).getNullable(CommonExts.DECL_NAME));
        for (Operation add : collect(m, OpKind.ADD)) {
            assertNull(add.getNameHint());
        }
    }

    @Test
    void testPrivateNameHintKept() {
        HWModule m = namedModule("_foo");
        new PrepareForEmission(SPILL_NAMED).run(m);
        assertEquals(0, count(m, OpKind.WIRE));
    }

    @Test
    void testHeuristicOff() {
        HWModule m = namedModule("foo");
        new PrepareForEmission(LoweringOptions.DEFAULT).run(m);
        assertEquals(0, count(m, OpKind.WIRE));
    }

    @Test
    void testProceduralRegionsSkipped() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Operation initial = ib.initial();
        IRBuilder inner = IRBuilder.atBlockEnd(initial.getRegion(0).getEntryBlock());
        Value x = IRBuilder.named(inner.add(in.get(0), in.get(1)), "foo");
        inner.fwrite("%d", inner.xor(x, in.get(1)));

        new PrepareForEmission(SPILL_NAMED).run(m);

        assertEquals(0, count(m, OpKind.WIRE));
        assertEquals(0, count(m, OpKind.LOGIC));
        assertEquals("foo", def(x).getNameHint());
    }

    @Test
    void testNestedGraphRegionsVisited() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value w = ib.wire(I8, "w");
        Operation ifdef = ib.ifdef("FOO");
        Block then = ifdef.getRegion(0).getEntryBlock();
        IRBuilder inner = IRBuilder.atBlockEnd(then);
        Value x = IRBuilder.named(inner.add(in.get(0), in.get(1)), "foo");
        inner.assign(w, inner.xor(x, in.get(0)));

        new PrepareForEmission(SPILL_NAMED).run(m);

        List<Operation> spilled = collect(then, OpKind.WIRE);
        assertEquals(1, spilled.size());
        assertEquals("foo", spilled.get(0).getNullable(CommonExts.DECL_NAME));
        VerifyPrepared.INSTANCE.run(m);
    }
}
