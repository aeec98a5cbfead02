package io.github.eutro.vprep.ir;

/**
 * An operand slot of an {@link Operation}, registered with the {@link Value} it currently reads.
 */
public final class Use {
    private final Operation owner;
    int index;
    private Value value;

    Use(Operation owner, int index, Value value) {
        this.owner = owner;
        this.index = index;
        this.value = value;
        value.addUse(this);
    }

    public Operation getOwner() {
        return owner;
    }

    public int getOperandNumber() {
        return index;
    }

    public Value get() {
        return value;
    }

    /**
     * Make this slot read another value.
     *
     * @param newValue The value to read.
     */
    public void set(Value newValue) {
        if (newValue == value) return;
        value.removeUse(this);
        value = newValue;
        newValue.addUse(this);
    }

    void drop() {
        value.removeUse(this);
    }

    @Override
    public String toString() {
        return value + " in " + owner.kind + "#" + index;
    }
}
