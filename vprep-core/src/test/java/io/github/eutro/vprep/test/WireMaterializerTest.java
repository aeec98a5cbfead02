package io.github.eutro.vprep.test;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.IRBuilder;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.passes.form.WireMaterializer;
import io.github.eutro.vprep.types.StructType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.github.eutro.vprep.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class WireMaterializerTest {
    @Test
    void testMaterializeInGraphRegion() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        Value a = in.get(0);
        Value b = in.get(1);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value x = ib.add(a, b);
        Value u1 = ib.xor(x, a);
        Value u2 = ib.and(x, b);
        Value u3 = ib.or(x, a);
        ib.output(u1, u2, u3);

        LegalizationContext ctx = new LegalizationContext(m, LoweringOptions.DEFAULT);
        List<Value> decls = WireMaterializer.materialize(def(x), false, ctx);

        assertEquals(1, decls.size());
        Value wire = decls.get(0);
        Operation wireOp = def(wire);
        assertEquals(OpKind.WIRE, wireOp.kind);
        assertEquals("_GEN", wireOp.getNullable(CommonExts.DECL_NAME));
        assertSame(wireOp, def(x).getNextNode());

        Operation assign = wireOp.getNextNode();
        assertNotNull(assign);
        assertEquals(OpKind.ASSIGN, assign.kind);
        assertSame(wire, assign.getOperand(0));
        assertSame(x, assign.getOperand(1));
        assertTrue(x.hasOneUse());

        for (Value user : Arrays.asList(u1, u2, u3)) {
            Operation read = def(def(user).getOperand(0));
            assertEquals(OpKind.READ_INOUT, read.kind);
            assertSame(wire, read.getOperand(0));
            assertSame(def(user), read.getNextNode());
        }
        assertEquals(3, count(m, OpKind.READ_INOUT));
        assertEquals(1, ctx.stats.materialized);
    }

    @Test
    void testNameFromHint() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "sum");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value x = IRBuilder.named(ib.add(in.get(0), in.get(1)), "sum");
        ib.output(ib.xor(x, x));

        LegalizationContext ctx = new LegalizationContext(m, LoweringOptions.DEFAULT);
        Value wire = WireMaterializer.materialize(def(x), false, ctx).get(0);
        // "sum" is taken by the port
        assertEquals("sum_0", def(wire).getNullable(CommonExts.DECL_NAME));
        assertNull(def(x).getNameHint());
    }

    @Test
    void testMaterializeInProceduralRegion() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Operation initial = ib.initial();
        Block body = initial.getRegion(0).getEntryBlock();
        IRBuilder inner = IRBuilder.atBlockEnd(body);
        Value x = inner.add(in.get(0), in.get(1));
        inner.fwrite("%d", x);
        inner.fwrite("%d %d", x, in.get(0));

        LegalizationContext ctx = new LegalizationContext(m, LoweringOptions.DEFAULT);
        Value logic = WireMaterializer.materialize(def(x), false, ctx).get(0);
        assertEquals(OpKind.LOGIC, def(logic).kind);
        assertSame(body, def(logic).getBlock());
        Operation assign = def(logic).getNextNode();
        assertNotNull(assign);
        assertEquals(OpKind.BPASSIGN, assign.kind);
        assertEquals(0, count(m, OpKind.WIRE));
        assertEquals(2, collect(body, OpKind.READ_INOUT).size());
    }

    @Test
    void testDeclarationAtBlockBegin() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        ib.output(ib.xor(in.get(0), in.get(1)));
        ib.setInsertionPointToEnd(m.getBodyBlock());
        Value x = ib.add(in.get(0), in.get(1));
        ib.xor(x, x);

        LegalizationContext ctx = new LegalizationContext(m, LoweringOptions.DEFAULT);
        Value wire = WireMaterializer.materialize(def(x), true, ctx).get(0);
        assertSame(def(wire), m.getBodyBlock().front());
        Operation assign = def(x).getNextNode();
        assertNotNull(assign);
        assertEquals(OpKind.ASSIGN, assign.kind);
        assertSame(wire, assign.getOperand(0));
    }

    @Test
    void testMultipleResults() {
        HWModule m = new HWModule("m");
        Value s = m.addInput("s", StructType.of("lo", I8, "hi", I8));
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Operation explode = ib.structExplode(s);
        ib.output(ib.xor(explode.getResult(0), explode.getResult(1)));

        LegalizationContext ctx = new LegalizationContext(m, LoweringOptions.DEFAULT);
        List<Value> decls = WireMaterializer.materialize(explode, false, ctx);
        assertEquals(2, decls.size());
        assertEquals("_GEN", def(decls.get(0)).getNullable(CommonExts.DECL_NAME));
        assertEquals("_GEN_0", def(decls.get(1)).getNullable(CommonExts.DECL_NAME));
        assertEquals(2, count(m, OpKind.ASSIGN));
        assertEquals(2, ctx.stats.materialized);
    }

    @Test
    void testNoResults() {
        HWModule m = new HWModule("m");
        Operation out = IRBuilder.atBlockEnd(m.getBodyBlock()).output();
        LegalizationContext ctx = new LegalizationContext(m, LoweringOptions.DEFAULT);
        assertThrows(IllegalArgumentException.class, () -> WireMaterializer.materialize(out, false, ctx));
    }
}
