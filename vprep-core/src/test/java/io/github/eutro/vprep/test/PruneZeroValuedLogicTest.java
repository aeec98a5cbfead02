package io.github.eutro.vprep.test;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.IRBuilder;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.passes.opts.PruneZeroValuedLogic;
import io.github.eutro.vprep.types.IntType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.vprep.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class PruneZeroValuedLogicTest {
    private static final IntType I0 = IntType.of(0);

    private static LegalizationContext prune(HWModule m) {
        return PruneZeroValuedLogic.INSTANCE.run(new LegalizationContext(m, LoweringOptions.DEFAULT));
    }

    @Test
    void testPruneToFixpoint() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value zero = ib.constant(I0, 0);
        Value w = ib.wire(I0, "w");
        ib.assign(w, zero);
        Value cat = ib.concat(a, zero);
        Operation out = ib.output(cat);

        LegalizationContext ctx = prune(m);

        assertEquals(Collections.singletonList(out), m.getBodyBlock().getOperations());
        assertSame(a, out.getOperand(0));
        assertEquals(4, ctx.stats.pruned);
    }

    @Test
    void testConcatOperandsDropped() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        Value nothing = m.addInput("nothing", I0);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value cat = ib.concat(in.get(0), nothing, in.get(1));
        ib.output(cat);

        prune(m);

        assertFalse(def(cat).isErased());
        assertEquals(Arrays.asList(in.get(0), in.get(1)), def(cat).getOperands());
    }

    @Test
    void testNestedAssignmentsPruned() {
        HWModule m = new HWModule("m");
        Value nothing = m.addInput("nothing", I0);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value r = ib.reg(I0, "r");
        Operation initial = ib.initial();
        IRBuilder.atBlockEnd(initial.getRegion(0).getEntryBlock()).bpassign(r, nothing);

        prune(m);

        assertTrue(initial.getRegion(0).getEntryBlock().isEmpty());
        assertTrue(def(r).isErased());
        assertFalse(initial.isErased());
    }

    @Test
    void testUsedAndSideEffectingKept() {
        HWModule m = new HWModule("m");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value v = ib.verbatimSE(I0, "$nothing()");
        Value used = ib.constant(I0, 0);
        Value cat = ib.concat(used, used);
        ib.output(cat);

        prune(m);

        assertFalse(def(v).isErased());
        assertFalse(def(used).isErased());
        assertEquals(2, def(cat).getNumOperands());
    }
}
