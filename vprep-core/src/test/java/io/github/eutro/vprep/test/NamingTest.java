package io.github.eutro.vprep.test;

import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.IRBuilder;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.types.StructType;
import io.github.eutro.vprep.util.NameHints;
import io.github.eutro.vprep.util.Namespace;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Collections;

import static io.github.eutro.vprep.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class NamingTest {
    @ParameterizedTest
    @CsvSource({
            "foo, foo",
            "foo.bar, foo_bar",
            "1st, _1st",
            "a$b, a$b",
            "'', _GEN",
    })
    void testLegalize(String name, String expected) {
        assertEquals(expected, NameHints.legalize(name));
    }

    @Test
    void testNamespaceSeeded() {
        HWModule m = new HWModule("m");
        m.addInput("a", I8);
        m.addOutput("y", I8);
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        ib.wire(I8, "w");
        Operation initial = ib.initial();
        IRBuilder.atBlockEnd(initial.getRegion(0).getEntryBlock()).logic(I8, "inner");
        ib.instance("u0", "child", Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList());

        Namespace ns = Namespace.of(m);
        for (String name : new String[]{"a", "y", "w", "inner", "u0"}) {
            assertTrue(ns.contains(name), name);
        }
        assertEquals("a_0", ns.newName("a"));
        assertEquals("a_1", ns.newName("a"));
        assertEquals("fresh", ns.newName("fresh"));
        assertEquals("fresh_0", ns.newName("fresh"));
    }

    @Test
    void testNamespaceSkipsTakenSuffixes() {
        Namespace ns = new Namespace();
        ns.add("x");
        ns.add("x_0");
        assertEquals("x_1", ns.newName("x"));
        assertEquals("_$x_y", ns.newName("$x.y"));
    }

    @Test
    void testInferStructuralName() {
        HWModule m = new HWModule("m");
        Value a = m.addInput("a", I8);
        Value s = m.addInput("s", StructType.of("valid", I1, "data", I8));
        IRBuilder ib = IRBuilder.atBlockEnd(m.getBodyBlock());
        Value w = ib.wire(I8, "w");

        assertEquals("_a", NameHints.inferStructuralName(a));
        assertEquals("_w", NameHints.inferStructuralName(ib.read(w)));
        assertEquals("_a_3", NameHints.inferStructuralName(ib.extract(a, 3, 1)));
        assertEquals("_a_5to2", NameHints.inferStructuralName(ib.extract(a, 2, 4)));
        assertEquals("_s_valid", NameHints.inferStructuralName(ib.structExtract(s, "valid")));
        assertEquals("_MACRO", NameHints.inferStructuralName(ib.verbatim(I8, "`MACRO")));
        assertEquals("hint", NameHints.inferStructuralName(IRBuilder.named(ib.add(a, a), "hint")));
        assertEquals("_priv", NameHints.inferStructuralName(IRBuilder.named(ib.add(a, a), "_priv")));
        assertNull(NameHints.inferStructuralName(ib.add(a, a)));
        assertNull(NameHints.inferStructuralName(ib.verbatim(I8, "$random")));
    }

    @Test
    void testPrivateHints() {
        assertTrue(NameHints.isPrivate("_x"));
        assertFalse(NameHints.isPrivate("x"));
    }
}
