package io.github.eutro.vprep.types;

import java.util.Objects;

/**
 * A handle to mutable storage (a wire, reg or logic) holding values of the element type.
 */
public final class InOutType extends HWType {
    public final HWType element;

    public InOutType(HWType element) {
        this.element = element;
    }

    @Override
    public int getBitWidth() {
        return -1;
    }

    @Override
    public boolean isZeroBitType() {
        return element.isZeroBitType();
    }

    @Override
    public boolean isInOut() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InOutType && ((InOutType) o).element.equals(element);
    }

    @Override
    public int hashCode() {
        return Objects.hash(InOutType.class, element);
    }

    @Override
    public String toString() {
        return "!inout<" + element + ">";
    }
}
