package io.github.eutro.vprep.test;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.IRBuilder;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.passes.form.ResolveUseBeforeDef;
import io.github.eutro.vprep.passes.meta.VerifyPrepared;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.eutro.vprep.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ResolveUseBeforeDefTest {
    @Test
    void testExpressionMaterialized() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value x = ib.xor(in.get(0), in.get(1));
        Value y = ib.add(x, in.get(0));
        ib.output(y);
        def(y).moveBefore(def(x));

        assertThrows(IllegalStateException.class, () -> VerifyPrepared.INSTANCE.run(m));
        LegalizationContext ctx = legalize(m, LoweringOptions.DEFAULT);

        Block body = m.getBodyBlock();
        assertEquals(OpKind.WIRE, body.front().kind);
        Operation read = def(def(y).getOperand(0));
        assertEquals(OpKind.READ_INOUT, read.kind);
        assertSame(body.front().getResult(), read.getOperand(0));
        assertEquals(1, ctx.stats.forwardReferencesRepaired);
        VerifyPrepared.INSTANCE.run(m);
    }

    @Test
    void testConstantMoved() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value c = ib.constant(I8, 7);
        Value y = ib.add(a, c);
        ib.output(y);
        def(c).moveAfter(def(y));

        legalize(m, LoweringOptions.DEFAULT);

        assertSame(def(c), m.getBodyBlock().front());
        assertEquals(0, count(m, OpKind.WIRE));
        VerifyPrepared.INSTANCE.run(m);
    }

    @Test
    void testDeclarationMoved() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        m.addOutput("y", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value w = ib.wire(I8, "w");
        Value r = ib.read(w);
        ib.assign(w, a);
        Operation out = ib.output(r);
        def(w).moveAfter(out);

        legalize(m, LoweringOptions.DEFAULT);

        assertSame(def(w), m.getBodyBlock().front());
        assertEquals(1, count(m, OpKind.WIRE));
        VerifyPrepared.INSTANCE.run(m);
    }

    @Test
    void testReadMovedWithDeclaration() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value w = ib.wire(I8, "w");
        Value r = ib.read(w);
        Operation assign = ib.assign(w, a);
        Operation out = ib.output(r);
        def(r).moveAfter(out);
        def(w).moveAfter(def(r));

        LegalizationContext ctx = new LegalizationContext(m, LoweringOptions.DEFAULT);
        ResolveUseBeforeDef.resolve(m.getBodyBlock(), ctx);

        List<Operation> ops = m.getBodyBlock().getOperations();
        assertSame(def(w), ops.get(0));
        assertSame(def(r), ops.get(1));
        assertSame(assign, ops.get(2));
        assertSame(out, ops.get(3));
        assertEquals(1, ctx.stats.forwardReferencesRepaired);
    }

    @Test
    void testNestedUsersCount() {
        HWModule m = new HWModule("m");
        List<Value> in = inputs(m, "a", "b");
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value w = ib.wire(I8, "w");
        Value x = ib.xor(in.get(0), in.get(1));
        Operation ifdef = ib.ifdef("FOO");
        IRBuilder.atBlockEnd(ifdef.getRegion(0).getEntryBlock()).assign(w, x);
        def(x).moveAfter(ifdef);

        legalize(m, LoweringOptions.DEFAULT);

        assertEquals(2, count(m, OpKind.WIRE));
        VerifyPrepared.INSTANCE.run(m);
    }
}
