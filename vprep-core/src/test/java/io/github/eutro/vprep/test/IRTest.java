package io.github.eutro.vprep.test;

import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.IRBuilder;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ir.display.IRPrinter;
import io.github.eutro.vprep.passes.meta.VerifyPrepared;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.vprep.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class IRTest {
    @Test
    void testPrint() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        m.addOutput("y", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value sum = IRBuilder.named(ib.add(in.get(0), in.get(1)), "sum");
        Operation initial = ib.initial();
        IRBuilder.atBlockEnd(initial.getRegion(0).getEntryBlock()).fwrite("%d", sum);
        ib.output(sum);

        assertEquals("hw.module @m(in a: i8, in b: i8, out y: i8) {\n" +
                        "  %0 = comb.add %a, %b {sv.namehint = sum} : i8\n" +
                        "  sv.initial {\n" +
                        "    sv.fwrite %0 {format = %d}\n" +
                        "  }\n" +
                        "  hw.output %0\n" +
                        "}\n",
                IRPrinter.print(m));
    }

    @Test
    void testEraseWithUses() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value x = ib.xor(a, a);
        Operation user = ib.output(x);
        assertThrows(IllegalStateException.class, () -> def(x).erase());

        user.erase();
        def(x).erase();
        assertTrue(m.getBodyBlock().isEmpty());
        assertTrue(a.useEmpty());
    }

    @Test
    void testMoveIntoRegion() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value x = ib.xor(a, a);
        Operation initial = ib.initial();
        Block body = initial.getRegion(0).getEntryBlock();

        def(x).moveToBlockEnd(body);
        assertSame(body, def(x).getBlock());
        assertSame(initial, def(x).getParentOp());
        assertSame(m, def(x).getParentModule());
        assertTrue(body.isWithin(m.getBodyBlock()));
        assertFalse(m.getBodyBlock().isWithin(body));
        assertEquals(1, m.getBodyBlock().size());
    }

    @Test
    void testInsertTwiceRejected() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Operation op = def(ib.xor(a, a));
        assertThrows(IllegalStateException.class, () -> m.getBodyBlock().append(op));
    }

    @Test
    void testCloneWithoutRegions() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Operation op = def(IRBuilder.named(ib.xor(a, a), "x"));
        Operation clone = op.cloneWithoutRegions();
        assertNull(clone.getBlock());
        assertEquals("x", clone.getNameHint());
        assertEquals(op.getOperands(), clone.getOperands());
        assertEquals(4, a.getNumUses());

        Operation initial = ib.initial();
        assertThrows(IllegalArgumentException.class, initial::cloneWithoutRegions);
    }

    @Test
    void testVerifyReportsEveryProblem() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value w = ib.wire(I8, "w");
        Value r = ib.read(w);
        Value x = ib.xor(r, a);
        Value y = ib.and(r, x);
        ib.output(y);
        def(y).moveBefore(def(x));

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> VerifyPrepared.INSTANCE.run(m));
        assertTrue(e.getMessage().contains("use before definition"), e::getMessage);
        assertTrue(e.getMessage().contains("always-inline operation with 2 uses"), e::getMessage);
    }
}
