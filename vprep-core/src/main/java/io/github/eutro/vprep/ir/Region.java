package io.github.eutro.vprep.ir;

import io.github.eutro.vprep.ops.OpKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A list of blocks, owned by either an {@link Operation} or an {@link HWModule}.
 */
public final class Region {
    @Nullable
    private final Operation parentOp;
    @Nullable
    private final HWModule parentModule;
    private final List<Block> blocks = new ArrayList<>(1);

    Region(Operation parentOp) {
        this.parentOp = parentOp;
        this.parentModule = null;
    }

    Region(HWModule parentModule) {
        this.parentOp = null;
        this.parentModule = parentModule;
    }

    public @Nullable Operation getParentOp() {
        return parentOp;
    }

    /**
     * Get the module this region belongs to, looking through any enclosing operations.
     *
     * @return The module, or null if this region is not (yet) part of one.
     */
    public @Nullable HWModule getParentModule() {
        Region region = this;
        while (region.parentOp != null) {
            Region next = region.parentOp.getParentRegion();
            if (next == null) return null;
            region = next;
        }
        return region.parentModule;
    }

    public List<Block> getBlocks() {
        return Collections.unmodifiableList(blocks);
    }

    public Block getEntryBlock() {
        return blocks.get(0);
    }

    void addBlock(Block block) {
        block.parent = this;
        blocks.add(block);
    }

    /**
     * Whether operations in this region run in order, as statements, rather than as a
     * graph of concurrent declarations and continuous assignments.
     *
     * @return True if the owning operation has a procedural body.
     */
    public boolean isSequential() {
        return parentOp != null && parentOp.kind.has(OpKind.Fact.PROCEDURAL_BODY);
    }
}
