package io.github.eutro.vprep.ir.display;

import io.github.eutro.vprep.ext.Ext;
import io.github.eutro.vprep.ir.*;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prints modules in a deterministic, MLIR-like textual form, for debugging.
 * <p>
 * Values are numbered in the order they are printed, so two structurally equal modules
 * print identically. Values used before they are printed are numbered on first mention.
 */
public class IRPrinter {
    private final StringBuilder sb = new StringBuilder();
    private final Map<Value, String> names = new IdentityHashMap<>();
    private int counter = 0;

    public static String print(HWModule module) {
        IRPrinter printer = new IRPrinter();
        printer.printModule(module);
        return printer.sb.toString();
    }

    public static String print(Circuit circuit) {
        IRPrinter printer = new IRPrinter();
        for (HWModule module : circuit.modules) {
            printer.printModule(module);
        }
        return printer.sb.toString();
    }

    private String nameOf(Value value) {
        String name = names.get(value);
        if (name == null) {
            name = value.isBlockArgument() && value.name != null
                    ? "%" + value.name
                    : "%" + counter++;
            names.put(value, name);
        }
        return name;
    }

    private void indent(int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append("  ");
        }
    }

    private void printModule(HWModule module) {
        sb.append("hw.module @").append(module.name).append('(');
        boolean first = true;
        for (Port port : module.getPorts()) {
            if (!first) sb.append(", ");
            first = false;
            sb.append(port);
        }
        sb.append(") {\n");
        printBlock(module.getBodyBlock(), 1);
        sb.append("}\n");
    }

    private void printBlock(Block block, int depth) {
        for (Operation op : block.getOperations()) {
            printOp(op, depth);
        }
    }

    private void printOp(Operation op, int depth) {
        indent(depth);
        List<Value> results = op.getResults();
        for (int i = 0; i < results.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(nameOf(results.get(i)));
        }
        if (!results.isEmpty()) sb.append(" = ");
        sb.append(op.kind.mnemonic);
        for (int i = 0; i < op.getNumOperands(); i++) {
            sb.append(i == 0 ? " " : ", ").append(nameOf(op.getOperand(i)));
        }
        Set<Ext<?>> keys = op.getExtKeys();
        if (!keys.isEmpty()) {
            sb.append(" {");
            boolean first = true;
            for (Ext<?> key : keys) {
                if (!first) sb.append(", ");
                first = false;
                sb.append(key.getName()).append(" = ").append(op.getNullable(key));
            }
            sb.append('}');
        }
        if (!results.isEmpty()) {
            sb.append(" :");
            for (int i = 0; i < results.size(); i++) {
                sb.append(i == 0 ? " " : ", ").append(results.get(i).getType());
            }
        }
        if (op.getNumRegions() == 0) {
            sb.append('\n');
            return;
        }
        sb.append(" {\n");
        boolean firstRegion = true;
        for (Region region : op.getRegions()) {
            if (!firstRegion) {
                indent(depth);
                sb.append("} else {\n");
            }
            firstRegion = false;
            for (Block block : region.getBlocks()) {
                printBlock(block, depth + 1);
            }
        }
        indent(depth);
        sb.append("}\n");
    }
}
