package io.github.eutro.vprep.ir;

import io.github.eutro.vprep.types.HWType;

/**
 * A port of an {@link HWModule}.
 */
public final class Port {
    public enum Direction {
        INPUT,
        OUTPUT,
    }

    public final String name;
    public final Direction direction;
    public final HWType type;

    public Port(String name, Direction direction, HWType type) {
        this.name = name;
        this.direction = direction;
        this.type = type;
    }

    @Override
    public String toString() {
        return (direction == Direction.INPUT ? "in " : "out ") + name + ": " + type;
    }
}
