package io.github.eutro.vprep.types;

/**
 * The type of a {@link io.github.eutro.vprep.ir.Value}.
 */
public abstract class HWType {
    /**
     * Get the number of bits a value of this type occupies, or -1 if the type has no bit width
     * (a storage handle, for instance).
     *
     * @return The bit width.
     */
    public abstract int getBitWidth();

    /**
     * Whether values of this type carry no information at all, and can thus be removed.
     *
     * @return True if this type is zero bits wide.
     */
    public boolean isZeroBitType() {
        return getBitWidth() == 0;
    }

    /**
     * Whether this is a storage handle type, i.e. an {@link InOutType}.
     *
     * @return True if this is an inout type.
     */
    public boolean isInOut() {
        return false;
    }
}
