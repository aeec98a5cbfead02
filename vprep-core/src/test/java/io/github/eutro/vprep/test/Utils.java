package io.github.eutro.vprep.test;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Region;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.passes.form.LegalizeRegions;
import io.github.eutro.vprep.types.IntType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

public class Utils {
    public static final IntType I1 = IntType.of(1);
    public static final IntType I8 = IntType.of(8);

    @NotNull
    public static List<Value> inputs(HWModule module, String... names) {
        List<Value> values = new ArrayList<>();
        for (String name : names) {
            values.add(module.addInput(name, I8));
        }
        return values;
    }

    @NotNull
    public static List<Operation> collect(Block block, OpKind kind) {
        List<Operation> found = new ArrayList<>();
        collect(block, kind, found);
        return found;
    }

    private static void collect(Block block, OpKind kind, List<Operation> found) {
        for (Operation op : block.getOperations()) {
            if (op.kind == kind) found.add(op);
            for (Region region : op.getRegions()) {
                for (Block nested : region.getBlocks()) {
                    collect(nested, kind, found);
                }
            }
        }
    }

    @NotNull
    public static List<Operation> collect(HWModule module, OpKind kind) {
        return collect(module.getBodyBlock(), kind);
    }

    public static int count(HWModule module, OpKind kind) {
        return collect(module, kind).size();
    }

    public static Operation def(Value value) {
        return value.getDefiningOp();
    }

    public static LegalizationContext legalize(HWModule module, LoweringOptions options) {
        return LegalizeRegions.INSTANCE.run(new LegalizationContext(module, options));
    }
}
