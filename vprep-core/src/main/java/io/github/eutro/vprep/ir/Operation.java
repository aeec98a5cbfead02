package io.github.eutro.vprep.ir;

import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ext.Ext;
import io.github.eutro.vprep.ext.ExtHolder;
import io.github.eutro.vprep.ops.OpKind;
import io.github.eutro.vprep.types.HWType;
import org.jetbrains.annotations.Nullable;

import java.util.*;
import java.util.stream.Collectors;

/**
 * An operation: a kind, operands, results, nested regions, and a position in a {@link Block}.
 * <p>
 * Named attributes are stored as {@link Ext exts}, see {@link CommonExts}.
 */
public final class Operation extends ExtHolder {
    public final OpKind kind;
    private final List<Use> operands = new ArrayList<>();
    private final List<Value> results;
    private final List<Region> regions;

    @Nullable
    private Block block;
    private boolean erased;

    /**
     * Construct a detached operation.
     *
     * @param kind        The kind of the operation.
     * @param operands    The operands.
     * @param resultTypes The types of the results.
     * @param numRegions  The number of regions, each of which will be given one empty block.
     */
    public Operation(OpKind kind, List<Value> operands, List<HWType> resultTypes, int numRegions) {
        this.kind = kind;
        for (Value operand : operands) {
            this.operands.add(new Use(this, this.operands.size(), operand));
        }
        switch (resultTypes.size()) {
            case 0:
                results = Collections.emptyList();
                break;
            case 1:
                results = Collections.singletonList(new Value(resultTypes.get(0), this, 0));
                break;
            default: {
                List<Value> rs = new ArrayList<>(resultTypes.size());
                for (HWType type : resultTypes) {
                    rs.add(new Value(type, this, rs.size()));
                }
                results = Collections.unmodifiableList(rs);
                break;
            }
        }
        if (numRegions == 0) {
            regions = Collections.emptyList();
        } else {
            List<Region> rs = new ArrayList<>(numRegions);
            for (int i = 0; i < numRegions; i++) {
                Region region = new Region(this);
                region.addBlock(new Block());
                rs.add(region);
            }
            regions = Collections.unmodifiableList(rs);
        }
    }

    public Operation(OpKind kind, List<Value> operands, List<HWType> resultTypes) {
        this(kind, operands, resultTypes, 0);
    }

    // operands

    public int getNumOperands() {
        return operands.size();
    }

    public Value getOperand(int i) {
        return operands.get(i).get();
    }

    public void setOperand(int i, Value value) {
        operands.get(i).set(value);
    }

    /**
     * Get the operand slots of this operation.
     *
     * @return An unmodifiable view of the slots.
     */
    public List<Use> getOperandUses() {
        return Collections.unmodifiableList(operands);
    }

    /**
     * Get the values this operation reads.
     *
     * @return A fresh list of the operands.
     */
    public List<Value> getOperands() {
        List<Value> values = new ArrayList<>(operands.size());
        for (Use use : operands) {
            values.add(use.get());
        }
        return values;
    }

    /**
     * Replace the whole operand list.
     *
     * @param values The new operands.
     */
    public void setOperands(List<Value> values) {
        List<Value> copy = new ArrayList<>(values);
        for (Use use : operands) {
            use.drop();
        }
        operands.clear();
        for (Value value : copy) {
            operands.add(new Use(this, operands.size(), value));
        }
    }

    // results

    public List<Value> getResults() {
        return results;
    }

    public int getNumResults() {
        return results.size();
    }

    public Value getResult(int i) {
        return results.get(i);
    }

    /**
     * Get the only result of this operation.
     *
     * @return The result.
     * @throws IllegalStateException If this operation does not have exactly one result.
     */
    public Value getResult() {
        if (results.size() != 1) {
            throw new IllegalStateException(kind + " has " + results.size() + " results, expected 1");
        }
        return results.get(0);
    }

    /**
     * Get every operation using any result of this operation, once per use.
     *
     * @return A fresh list of the users.
     */
    public List<Operation> getUsers() {
        if (results.size() == 1) return results.get(0).getUsers();
        List<Operation> users = new ArrayList<>();
        for (Value result : results) {
            users.addAll(result.getUsers());
        }
        return users;
    }

    public int getNumUses() {
        int n = 0;
        for (Value result : results) {
            n += result.getNumUses();
        }
        return n;
    }

    public boolean hasOneUse() {
        return getNumUses() == 1;
    }

    public boolean useEmpty() {
        for (Value result : results) {
            if (!result.useEmpty()) return false;
        }
        return true;
    }

    // regions

    public List<Region> getRegions() {
        return regions;
    }

    public int getNumRegions() {
        return regions.size();
    }

    public Region getRegion(int i) {
        return regions.get(i);
    }

    // position

    public @Nullable Block getBlock() {
        return block;
    }

    void setBlock(@Nullable Block block) {
        this.block = block;
    }

    public @Nullable Region getParentRegion() {
        return block == null ? null : block.getParent();
    }

    /**
     * Get the operation whose region contains this operation.
     *
     * @return The parent operation, or null if this is at the top level of a module (or detached).
     */
    public @Nullable Operation getParentOp() {
        Region region = getParentRegion();
        return region == null ? null : region.getParentOp();
    }

    public @Nullable HWModule getParentModule() {
        Region region = getParentRegion();
        return region == null ? null : region.getParentModule();
    }

    public boolean isErased() {
        return erased;
    }

    private Block requireBlock() {
        if (block == null) {
            throw new IllegalStateException("operation is not in a block: " + this);
        }
        return block;
    }

    public @Nullable Operation getNextNode() {
        Block b = requireBlock();
        int i = b.indexOf(this);
        return i + 1 < b.size() ? b.getOperations().get(i + 1) : null;
    }

    public @Nullable Operation getPrevNode() {
        Block b = requireBlock();
        int i = b.indexOf(this);
        return i > 0 ? b.getOperations().get(i - 1) : null;
    }

    /**
     * Whether this operation comes strictly before {@code other}, which must be in the same block.
     *
     * @param other The other operation.
     * @return True if this operation is first.
     */
    public boolean isBeforeInBlock(Operation other) {
        Block b = requireBlock();
        if (other.block != b) {
            throw new IllegalArgumentException("operations are in different blocks");
        }
        return b.indexOf(this) < b.indexOf(other);
    }

    private void detach() {
        if (block != null) {
            block.remove(this);
        }
    }

    /**
     * Move this operation to immediately before {@code anchor}, possibly into another block.
     *
     * @param anchor The operation to move before.
     */
    public void moveBefore(Operation anchor) {
        if (anchor == this) return;
        Block target = anchor.requireBlock();
        detach();
        target.insert(target.indexOf(anchor), this);
    }

    /**
     * Move this operation to immediately after {@code anchor}, possibly into another block.
     *
     * @param anchor The operation to move after.
     */
    public void moveAfter(Operation anchor) {
        if (anchor == this) return;
        Block target = anchor.requireBlock();
        detach();
        target.insert(target.indexOf(anchor) + 1, this);
    }

    public void moveToBlockStart(Block target) {
        detach();
        target.insert(0, this);
    }

    public void moveToBlockEnd(Block target) {
        detach();
        target.insert(target.size(), this);
    }

    /**
     * Remove this operation from the IR entirely.
     *
     * @throws IllegalStateException If any of its results are still used.
     */
    public void erase() {
        if (!useEmpty()) {
            throw new IllegalStateException("erasing operation which still has uses: " + this);
        }
        dropAllReferences();
        detach();
        erased = true;
    }

    private void dropAllReferences() {
        for (Use use : operands) {
            use.drop();
        }
        operands.clear();
        for (Region region : regions) {
            for (Block nested : region.getBlocks()) {
                for (Operation op : nested.getOperations()) {
                    op.dropAllReferences();
                    op.erased = true;
                }
            }
        }
    }

    /**
     * Create a detached copy of this operation, with the same operands, result types and exts.
     *
     * @return The copy.
     * @throws IllegalArgumentException If this operation has regions.
     */
    public Operation cloneWithoutRegions() {
        if (!regions.isEmpty()) {
            throw new IllegalArgumentException("cannot clone operation with regions: " + kind);
        }
        List<HWType> types = new ArrayList<>(results.size());
        for (Value result : results) {
            types.add(result.getType());
        }
        Operation copy = new Operation(kind, getOperands(), types);
        copy.copyExtsFrom(this);
        for (int i = 0; i < results.size(); i++) {
            copy.results.get(i).name = results.get(i).name;
        }
        return copy;
    }

    // attributes

    public @Nullable String getNameHint() {
        return getNullable(CommonExts.NAME_HINT);
    }

    public void setNameHint(@Nullable String hint) {
        if (hint == null) {
            removeExt(CommonExts.NAME_HINT);
        } else {
            attachExt(CommonExts.NAME_HINT, hint);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (!results.isEmpty()) {
            sb.append(results.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(kind);
        if (!operands.isEmpty()) {
            sb.append(' ').append(getOperands().stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ")));
        }
        Set<Ext<?>> keys = getExtKeys();
        if (!keys.isEmpty()) {
            sb.append(keys.stream()
                    .map(ext -> ext.getName() + "=" + getNullable(ext))
                    .collect(Collectors.joining(", ", " {", "}")));
        }
        if (!results.isEmpty()) {
            sb.append(results.stream()
                    .map(v -> v.getType().toString())
                    .collect(Collectors.joining(", ", " : ", "")));
        }
        return sb.toString();
    }
}
