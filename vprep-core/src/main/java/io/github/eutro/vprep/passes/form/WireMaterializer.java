package io.github.eutro.vprep.passes.form;

import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ir.*;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.passes.LegalizationContext;
import io.github.eutro.vprep.util.Classification;
import io.github.eutro.vprep.util.NameHints;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds values to named storage: a declaration, a single assignment driving it, and a read of it
 * at each place the value was used.
 * <p>
 * In procedural regions the storage is an {@code sv.logic} driven by an {@code sv.bpassign};
 * elsewhere it is an {@code sv.wire} driven by an {@code sv.assign}.
 */
public final class WireMaterializer {
    private static final Logger logger = LogManager.getLogger();

    private WireMaterializer() {
    }

    private static Block requireBlock(Operation op) {
        Block block = op.getBlock();
        if (block == null) throw new IllegalStateException("operation is not in a block: " + op);
        return block;
    }

    private static boolean isInProceduralRegion(Operation op) {
        Region region = op.getParentRegion();
        return region != null && region.isSequential();
    }

    /**
     * Redirect every use of {@code value} to a fresh read of {@code decl}, placed right before the user.
     *
     * @param value The value.
     * @param decl  The storage to read instead.
     */
    static void replaceUsesWithReads(Value value, Value decl) {
        while (!value.useEmpty()) {
            Use use = value.getUses().get(0);
            Value read = IRBuilder.before(use.getOwner()).read(decl);
            use.set(read);
        }
    }

    /**
     * Materialize every result of {@code op} into named storage.
     * <p>
     * Normally the declaration is placed right after {@code op}, followed by its assignment.
     * With {@code declAtBlockBegin} the declaration is placed at the start of the block instead,
     * so reads placed earlier in the block may refer to it.
     *
     * @param op               The operation.
     * @param declAtBlockBegin Whether to place the declarations at the start of the block.
     * @param ctx              The legalization context.
     * @return The new declarations, one per result.
     */
    public static List<Value> materialize(Operation op, boolean declAtBlockBegin, LegalizationContext ctx) {
        if (op.getNumResults() == 0) {
            throw new IllegalArgumentException("cannot materialize an operation without results: " + op);
        }
        boolean procedural = isInProceduralRegion(op);
        List<Value> decls = new ArrayList<>(op.getNumResults());
        if (op.getNumResults() == 1) {
            String name = NameHints.inferStructuralName(op.getResult());
            op.setNameHint(null);
            decls.add(materializeResult(op, op.getResult(), name, procedural, declAtBlockBegin, ctx));
        } else {
            for (Value result : op.getResults()) {
                decls.add(materializeResult(op, result, null, procedural, declAtBlockBegin, ctx));
            }
        }
        ctx.stats.materialized += decls.size();
        return decls;
    }

    private static Value materializeResult(Operation op, Value result, @Nullable String name,
                                           boolean procedural, boolean declAtBlockBegin,
                                           LegalizationContext ctx) {
        String declName = ctx.namespace.newName(name == null ? NameHints.GENERIC : name);
        IRBuilder ib = IRBuilder.atBlockBegin(requireBlock(op));
        Value decl = procedural
                ? ib.logic(result.getType(), declName)
                : ib.wire(result.getType(), declName);
        int uses = result.getNumUses();
        replaceUsesWithReads(result, decl);

        Operation declOp = decl.getDefiningOp();
        if (!declAtBlockBegin) declOp.moveAfter(op);
        ib.setInsertionPointAfter(declAtBlockBegin ? op : declOp);
        if (procedural) {
            ib.bpassign(decl, result);
        } else {
            ib.assign(decl, result);
        }
        logger.debug("materialized {} into {} {} with {} reads", op.kind, declOp.kind, declName, uses);
        return decl;
    }

    /**
     * Make sure each result of an instance is only used by an output, a directly following
     * assignment, or reads of a wire it drives.
     *
     * @param instance The instance.
     * @param ctx      The legalization context.
     */
    public static void anchorInstanceResults(Operation instance, LegalizationContext ctx) {
        List<String> names = instance.getNullable(CommonExts.OUTPUT_NAMES);
        for (int i = 0; i < instance.getNumResults(); i++) {
            Value result = instance.getResult(i);
            if (result.hasOneUse()) {
                Operation user = result.getUses().get(0).getOwner();
                if (user.kind == OpKind.OUTPUT) continue;
                if (user.kind == OpKind.ASSIGN && user.getBlock() == instance.getBlock()) {
                    user.moveAfter(instance);
                    continue;
                }
            }

            String declName = ctx.namespace.newName(portWireName(instance, names, i));
            Value wire = IRBuilder.atBlockBegin(ctx.module.getBodyBlock()).wire(result.getType(), declName);
            replaceUsesWithReads(result, wire);
            IRBuilder.after(instance).assign(wire, result);
            ctx.stats.materialized++;
            logger.debug("anchored output {} of instance {} to {}", i, instance.getNullable(CommonExts.INSTANCE_NAME), declName);
        }
    }

    /**
     * Make sure each input of an instance is driven by a port, or a read of storage.
     *
     * @param instance The instance.
     * @param ctx      The legalization context.
     */
    public static void anchorInstanceInputs(Operation instance, LegalizationContext ctx) {
        List<String> names = instance.getNullable(CommonExts.INPUT_NAMES);
        for (int i = 0; i < instance.getNumOperands(); i++) {
            Value src = instance.getOperand(i);
            if (Classification.isSimpleReadOrPort(src)) continue;

            String declName = ctx.namespace.newName(portWireName(instance, names, i));
            Value wire = IRBuilder.atBlockBegin(ctx.module.getBodyBlock()).wire(src.getType(), declName);
            IRBuilder ib = IRBuilder.before(instance);
            ib.assign(wire, src);
            Value read = ib.read(wire);
            instance.setOperand(i, read);
            ctx.stats.materialized++;
            logger.debug("anchored input {} of instance {} to {}", i, instance.getNullable(CommonExts.INSTANCE_NAME), declName);
        }
    }

    private static String portWireName(Operation instance, @Nullable List<String> names, int i) {
        String port = names != null && i < names.size() && !names.get(i).isEmpty()
                ? names.get(i)
                : Integer.toString(i);
        return "_" + instance.getExtOrDefault(CommonExts.INSTANCE_NAME, "") + "_" + port;
    }

    /**
     * Make sure an event control operand of {@code op} is a port, a read of storage, or an
     * instance result, by routing it through a wire declared at the start of the module.
     *
     * @param op   The always block.
     * @param expr The event control operand.
     * @param ctx  The legalization context.
     */
    public static void enforceWire(Operation op, Value expr, LegalizationContext ctx) {
        if (Classification.isSimpleReadOrPort(expr)) return;
        Operation def = expr.getDefiningOp();
        if (def != null && def.kind == OpKind.INSTANCE) return;

        String declName = ctx.namespace.newName(NameHints.GENERIC);
        Value wire = IRBuilder.atBlockBegin(ctx.module.getBodyBlock()).wire(expr.getType(), declName);
        IRBuilder ib = IRBuilder.before(op);
        Value read = ib.read(wire);
        expr.replaceAllUsesWith(read);
        ib.assign(wire, expr);
        AlwaysInlinePropagator.propagate(read.getDefiningOp());
        ctx.stats.materialized++;
        logger.debug("moved event control expression of {} into wire {}", op.kind, declName);
    }

    /**
     * Find the outermost procedural operation enclosing {@code op}, whose own block is in a
     * non-procedural region.
     *
     * @param op An operation in a procedural region.
     * @return The procedural operation.
     */
    public static Operation findParentInNonProceduralRegion(Operation op) {
        Operation parent = op.getParentOp();
        if (parent == null || !Classification.isProcedural(parent)) {
            throw new IllegalArgumentException("operation is not in a procedural region: " + op);
        }
        Operation next;
        while ((next = parent.getParentOp()) != null && Classification.isProcedural(next)) {
            parent = next;
        }
        return parent;
    }

    /**
     * Make sure a side-effecting expression in a procedural region is only used by a single
     * blocking assignment to a reg, which every other user reads instead.
     *
     * @param op  The side-effecting expression.
     * @param ctx The legalization context.
     * @return False if the expression was already in that form, true if it was rewritten.
     */
    public static boolean pinSideEffectingExpr(Operation op, LegalizationContext ctx) {
        Value result = op.getResult();
        if (result.hasOneUse()) {
            Operation user = result.getUses().get(0).getOwner();
            if (user.kind == OpKind.BPASSIGN) {
                Operation dest = user.getOperand(0).getDefiningOp();
                if (dest != null && (dest.kind == OpKind.REG || dest.kind == OpKind.LOGIC)) return false;
            }
        }

        Operation parent = findParentInNonProceduralRegion(op);
        String name = NameHints.inferStructuralName(result);
        String declName = ctx.namespace.newName(name == null ? NameHints.GENERIC : name);
        IRBuilder ib = IRBuilder.before(parent);
        Value reg = ib.reg(result.getType(), declName);
        Value read = ib.read(reg);
        result.replaceAllUsesWith(read);
        IRBuilder.after(op).bpassign(reg, result);
        ctx.stats.pinned++;
        logger.debug("pinned side-effecting {} to reg {}", op.kind, declName);
        return true;
    }
}
