package io.github.eutro.vprep.test;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.IRBuilder;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.passes.meta.ExpressionCostEstimator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.vprep.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionCostEstimatorTest {
    private static final LoweringOptions SPILL_NAMED = LoweringOptions.builder()
            .setWireSpillingHeuristic(LoweringOptions.WireSpillingHeuristic.SPILL_LARGE_TERMS_WITH_NAMEHINTS)
            .build();

    @Test
    void testLeafCosts() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        ExpressionCostEstimator costs = new ExpressionCostEstimator(LoweringOptions.DEFAULT);
        assertEquals(1, costs.cost(a));
        assertEquals(1, costs.cost(ib.constant(I8, 4)));
        assertEquals(1, costs.cost(ib.wire(I8, "w")));
    }

    @Test
    void testCostsAddUp() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b", "c");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        ExpressionCostEstimator costs = new ExpressionCostEstimator(LoweringOptions.DEFAULT);

        Value ab = ib.add(in.get(0), in.get(1));
        Value abc = ib.xor(ab, in.get(2));
        Value shared = ib.and(abc, abc);
        assertEquals(2, costs.cost(ab));
        assertEquals(3, costs.cost(abc));
        // repeated operands count every time
        assertEquals(6, costs.cost(shared));
        assertTrue(costs.cost(shared) >= costs.cost(abc));
    }

    private static Value wideAdd(HWModule m, IRBuilder ib, int terms) {
        Value[] operands = new Value[terms];
        for (int i = 0; i < terms; i++) {
            operands[i] = m.addInput("p" + i, I8);
        }
        return ib.add(operands);
    }

    @Test
    void testTermLimit() {
        LoweringOptions options = LoweringOptions.builder().setMaximumNumberOfTermsPerExpression(8).build();
        HWModule m = new HWModule("m");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value big = wideAdd(m, ib, 10);
        Value small = ib.add(m.getBodyBlock().getArguments().get(0), m.getBodyBlock().getArguments().get(1));
        ib.xor(big, small);

        ExpressionCostEstimator costs = new ExpressionCostEstimator(options);
        assertEquals(10, costs.cost(big));
        assertTrue(costs.shouldSpillWireBasedOnState(def(big)));
        assertFalse(costs.shouldSpillWireBasedOnState(def(small)));
    }

    @Test
    void testSinksNeverSpill() {
        LoweringOptions options = LoweringOptions.builder().setMaximumNumberOfTermsPerExpression(8).build();
        HWModule m = new HWModule("m");
        m.addOutput("y", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value big = wideAdd(m, ib, 10);
        ib.output(big);

        assertFalse(new ExpressionCostEstimator(options).shouldSpillWireBasedOnState(def(big)));
    }

    @Test
    void testNameHintHeuristic() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b", "c");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value pub = IRBuilder.named(ib.add(in.get(0), in.get(1)), "sum");
        Value priv = IRBuilder.named(ib.add(in.get(0), in.get(1)), "_sum");
        Value privBig = IRBuilder.named(ib.add(in.get(0), in.get(1), in.get(2)), "_sum3");
        Value unnamed = ib.add(in.get(0), in.get(2));
        ib.xor(pub, priv, privBig, unnamed);

        ExpressionCostEstimator spilling = new ExpressionCostEstimator(SPILL_NAMED);
        assertTrue(spilling.shouldSpillWireBasedOnState(def(pub)));
        assertFalse(spilling.shouldSpillWireBasedOnState(def(priv)));
        assertTrue(spilling.shouldSpillWireBasedOnState(def(privBig)));
        assertFalse(spilling.shouldSpillWireBasedOnState(def(unnamed)));

        ExpressionCostEstimator off = new ExpressionCostEstimator(LoweringOptions.DEFAULT);
        assertFalse(off.shouldSpillWireBasedOnState(def(pub)));
        assertFalse(off.shouldSpillWireBasedOnState(def(privBig)));
    }
}
