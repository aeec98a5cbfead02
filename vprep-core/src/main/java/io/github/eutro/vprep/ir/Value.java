package io.github.eutro.vprep.ir;

import io.github.eutro.vprep.ext.ExtHolder;
import io.github.eutro.vprep.types.HWType;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed value: either the result of an {@link Operation}, or an argument of a {@link Block}.
 * <p>
 * Values keep track of every {@link Use} reading them, so use counts are always current.
 */
public final class Value extends ExtHolder {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger();

    private final int id = ID_COUNTER.getAndIncrement();
    private final HWType type;
    @Nullable
    public String name;

    @Nullable
    private final Operation definingOp;
    @Nullable
    private final Block ownerBlock;
    private final int number;

    private final List<Use> uses = new ArrayList<>(1);

    Value(HWType type, Operation definingOp, int resultNumber) {
        this.type = type;
        this.definingOp = definingOp;
        this.ownerBlock = null;
        this.number = resultNumber;
    }

    Value(HWType type, Block ownerBlock, int argNumber, @Nullable String name) {
        this.type = type;
        this.definingOp = null;
        this.ownerBlock = ownerBlock;
        this.number = argNumber;
        this.name = name;
    }

    public HWType getType() {
        return type;
    }

    /**
     * Get the operation that produces this value.
     *
     * @return The operation, or null if this is a block argument.
     */
    public @Nullable Operation getDefiningOp() {
        return definingOp;
    }

    public boolean isBlockArgument() {
        return definingOp == null;
    }

    /**
     * Get the result or argument number of this value.
     *
     * @return The index of this value in its defining operation's results, or its block's arguments.
     */
    public int getNumber() {
        return number;
    }

    /**
     * Get the block this value is visible from first: the block of its defining operation,
     * or the block it is an argument of.
     *
     * @return The block, or null if the defining operation is not in a block.
     */
    public @Nullable Block getParentBlock() {
        return definingOp == null ? ownerBlock : definingOp.getBlock();
    }

    void addUse(Use use) {
        uses.add(use);
    }

    void removeUse(Use use) {
        for (int i = 0; i < uses.size(); i++) {
            if (uses.get(i) == use) {
                uses.remove(i);
                return;
            }
        }
    }

    /**
     * Get the uses of this value.
     *
     * @return An unmodifiable view of the uses.
     */
    public List<Use> getUses() {
        return Collections.unmodifiableList(uses);
    }

    /**
     * Get the operations using this value, one entry per use.
     *
     * @return A fresh list of the users.
     */
    public List<Operation> getUsers() {
        List<Operation> users = new ArrayList<>(uses.size());
        for (Use use : uses) {
            users.add(use.getOwner());
        }
        return users;
    }

    public int getNumUses() {
        return uses.size();
    }

    public boolean hasOneUse() {
        return uses.size() == 1;
    }

    public boolean useEmpty() {
        return uses.isEmpty();
    }

    /**
     * Make every use of this value read {@code replacement} instead.
     *
     * @param replacement The new value.
     */
    public void replaceAllUsesWith(Value replacement) {
        if (replacement == this) return;
        for (Use use : new ArrayList<>(uses)) {
            use.set(replacement);
        }
    }

    @Override
    public String toString() {
        return "%" + (name == null ? Integer.toString(id) : name);
    }
}
