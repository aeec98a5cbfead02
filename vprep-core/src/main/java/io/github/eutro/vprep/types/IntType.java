package io.github.eutro.vprep.types;

/**
 * A plain bit vector of a fixed width.
 */
public final class IntType extends HWType {
    private static final IntType[] SMALL = new IntType[65];

    static {
        for (int i = 0; i < SMALL.length; i++) {
            SMALL[i] = new IntType(i);
        }
    }

    public final int width;

    private IntType(int width) {
        this.width = width;
    }

    public static IntType of(int width) {
        if (width < 0) throw new IllegalArgumentException("negative width " + width);
        return width < SMALL.length ? SMALL[width] : new IntType(width);
    }

    @Override
    public int getBitWidth() {
        return width;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IntType && ((IntType) o).width == width;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(width);
    }

    @Override
    public String toString() {
        return "i" + width;
    }
}
