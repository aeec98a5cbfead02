package io.github.eutro.vprep.passes.meta;

import io.github.eutro.vprep.ir.Block;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Region;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.InPlaceIRPass;
import io.github.eutro.vprep.util.Classification;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a module is ready to be emitted line by line, throwing an
 * {@link IllegalStateException} listing every problem if it isn't.
 */
public class VerifyPrepared implements InPlaceIRPass<HWModule> {
    public static final VerifyPrepared INSTANCE = new VerifyPrepared();

    @Override
    public void runInPlace(HWModule module) {
        List<String> problems = new ArrayList<>();
        verifyBlock(module.getBodyBlock(), problems);
        if (!problems.isEmpty()) {
            throw new IllegalStateException(String.format(
                    "module %s is not prepared for emission:\n%s",
                    module.name,
                    String.join("\n", problems)));
        }
    }

    private void verifyBlock(Block block, List<String> problems) {
        List<Operation> ops = block.getOperations();
        Map<Operation, Integer> indices = new IdentityHashMap<>();
        for (int i = 0; i < ops.size(); i++) {
            Operation op = ops.get(i);
            indices.put(op, i);
            if (op.getBlock() != block) {
                problems.add(String.format("operation not owned by block\n  op: %s", op));
            }
        }

        Region region = block.getParent();
        boolean procedural = region != null && region.isSequential();
        boolean seenStatement = false;

        for (int i = 0; i < ops.size(); i++) {
            Operation op = ops.get(i);

            if (procedural) {
                if (op.kind == OpKind.LOGIC) {
                    if (seenStatement) {
                        problems.add(String.format("local declaration after statements\n  op: %s", op));
                    }
                } else {
                    seenStatement = true;
                }
            } else {
                for (Operation user : op.getUsers()) {
                    Operation ancestor = user;
                    while (ancestor != null && ancestor.getBlock() != block) {
                        ancestor = ancestor.getParentOp();
                    }
                    if (ancestor != null && indices.get(ancestor) < i) {
                        problems.add(String.format("use before definition\n  def: %s\n  user: %s", op, user));
                    }
                }
            }

            if (Classification.isAlwaysInline(op)) {
                verifyAlwaysInline(op, problems);
            }

            for (Region nested : op.getRegions()) {
                for (Block nestedBlock : nested.getBlocks()) {
                    verifyBlock(nestedBlock, problems);
                }
            }
        }
    }

    private void verifyAlwaysInline(Operation op, List<String> problems) {
        int uses = op.getNumUses();
        if (uses > 1) {
            problems.add(String.format("always-inline operation with %d uses\n  op: %s", uses, op));
            return;
        }
        if (uses == 0) return;
        Operation user = op.getUsers().get(0);
        if (user.getBlock() != op.getBlock()) {
            problems.add(String.format("always-inline operation not in its user's block\n  op: %s\n  user: %s", op, user));
            return;
        }
        Operation next = op.getNextNode();
        while (next != null && next != user && Classification.isAlwaysInline(next)) {
            next = next.getNextNode();
        }
        if (next != user) {
            problems.add(String.format("always-inline operation not immediately before its user\n  op: %s\n  user: %s", op, user));
        }
    }
}
