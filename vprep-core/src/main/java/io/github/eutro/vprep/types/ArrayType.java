package io.github.eutro.vprep.types;

import java.util.Objects;

public final class ArrayType extends HWType {
    public final HWType element;
    public final int size;

    public ArrayType(HWType element, int size) {
        this.element = element;
        this.size = size;
    }

    @Override
    public int getBitWidth() {
        int elementWidth = element.getBitWidth();
        if (elementWidth < 0) return -1;
        return elementWidth * size;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ArrayType)) return false;
        ArrayType that = (ArrayType) o;
        return size == that.size && element.equals(that.element);
    }

    @Override
    public int hashCode() {
        return Objects.hash(element, size);
    }

    @Override
    public String toString() {
        return "!array<" + size + "x" + element + ">";
    }
}
