package io.github.eutro.vprep.ir;

import io.github.eutro.vprep.ext.ExtHolder;
import io.github.eutro.vprep.ext.TrackedList;
import io.github.eutro.vprep.types.HWType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of operations, with some arguments.
 */
public final class Block extends ExtHolder {
    private final List<Value> arguments = new ArrayList<>();
    private final TrackedList<Operation> operations = new TrackedList<Operation>(new ArrayList<>()) {
        @Override
        protected void onAdded(Operation elt) {
            if (elt.getBlock() != null) {
                throw new IllegalStateException("operation is already in a block: " + elt);
            }
            elt.setBlock(Block.this);
        }

        @Override
        protected void onRemoved(Operation elt) {
            elt.setBlock(null);
        }
    };
    @Nullable
    Region parent;

    public @Nullable Region getParent() {
        return parent;
    }

    /**
     * Get the operation whose region this block is in.
     *
     * @return The operation, or null for a module body.
     */
    public @Nullable Operation getParentOp() {
        return parent == null ? null : parent.getParentOp();
    }

    public List<Value> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public Value getArgument(int i) {
        return arguments.get(i);
    }

    public Value addArgument(HWType type, @Nullable String name) {
        Value arg = new Value(type, this, arguments.size(), name);
        arguments.add(arg);
        return arg;
    }

    /**
     * Get the operations of this block.
     *
     * @return An unmodifiable view of the operations, which reflects later changes.
     */
    public List<Operation> getOperations() {
        return Collections.unmodifiableList(operations);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public @Nullable Operation front() {
        return operations.isEmpty() ? null : operations.get(0);
    }

    public @Nullable Operation back() {
        return operations.isEmpty() ? null : operations.get(operations.size() - 1);
    }

    public int indexOf(Operation op) {
        return operations.identityIndexOf(op);
    }

    void insert(int index, Operation op) {
        operations.add(index, op);
    }

    void remove(Operation op) {
        operations.removeIdentical(op);
    }

    public Operation append(Operation op) {
        operations.add(op);
        return op;
    }

    public Operation prepend(Operation op) {
        operations.add(0, op);
        return op;
    }

    /**
     * Insert a detached operation immediately before {@code anchor}, which must be in this block.
     *
     * @param anchor The operation to insert before.
     * @param op     The operation to insert.
     * @return {@code op}.
     */
    public Operation insertBefore(Operation anchor, Operation op) {
        int i = indexOf(anchor);
        if (i == -1) throw new IllegalArgumentException("anchor is not in this block: " + anchor);
        operations.add(i, op);
        return op;
    }

    public Operation insertAfter(Operation anchor, Operation op) {
        int i = indexOf(anchor);
        if (i == -1) throw new IllegalArgumentException("anchor is not in this block: " + anchor);
        operations.add(i + 1, op);
        return op;
    }

    /**
     * Whether this block is {@code other}, or is nested somewhere inside it.
     *
     * @param other The block which may contain this one.
     * @return True if this block is within {@code other}.
     */
    public boolean isWithin(Block other) {
        Block b = this;
        while (b != null) {
            if (b == other) return true;
            Operation op = b.getParentOp();
            b = op == null ? null : op.getBlock();
        }
        return false;
    }
}
