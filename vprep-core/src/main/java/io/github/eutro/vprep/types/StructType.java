package io.github.eutro.vprep.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A packed struct, with named fields in declaration order.
 */
public final class StructType extends HWType {
    public final List<Field> fields;

    public StructType(List<Field> fields) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public static StructType of(Object... namesAndTypes) {
        if (namesAndTypes.length % 2 != 0) throw new IllegalArgumentException("odd number of arguments");
        List<Field> fields = new ArrayList<>();
        for (int i = 0; i < namesAndTypes.length; i += 2) {
            fields.add(new Field((String) namesAndTypes[i], (HWType) namesAndTypes[i + 1]));
        }
        return new StructType(fields);
    }

    public Field getField(String name) {
        for (Field field : fields) {
            if (field.name.equals(name)) return field;
        }
        throw new IllegalArgumentException("no field " + name + " in " + this);
    }

    @Override
    public int getBitWidth() {
        int total = 0;
        for (Field field : fields) {
            int width = field.type.getBitWidth();
            if (width < 0) return -1;
            total += width;
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructType && ((StructType) o).fields.equals(fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.stream()
                .map(Objects::toString)
                .collect(Collectors.joining(", ", "!struct<", ">"));
    }

    public static final class Field {
        public final String name;
        public final HWType type;

        public Field(String name, HWType type) {
            this.name = name;
            this.type = type;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Field)) return false;
            Field that = (Field) o;
            return name.equals(that.name) && type.equals(that.type);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, type);
        }

        @Override
        public String toString() {
            return name + ": " + type;
        }
    }
}
