package io.github.eutro.vprep.util;

import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ir.Operation;
import io.github.eutro.vprep.ir.Value;
import io.github.eutro.vprep.ops.OpKind;
import org.jetbrains.annotations.Nullable;

/**
 * Names for temporaries, derived from the structure of the values they hold.
 */
public final class NameHints {
    /**
     * The name given to a temporary when no better one can be inferred.
     */
    public static final String GENERIC = "_GEN";

    private NameHints() {
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || c == '$' || (c >= '0' && c <= '9');
    }

    /**
     * Turn a string into a legal Verilog identifier, replacing illegal characters with {@code _}.
     *
     * @param name The string.
     * @return The identifier.
     */
    public static String legalize(String name) {
        if (name.isEmpty()) return GENERIC;
        StringBuilder sb = new StringBuilder(name.length() + 1);
        if (!isIdentifierStart(name.charAt(0))) sb.append('_');
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(isIdentifierPart(c) ? c : '_');
        }
        return sb.toString();
    }

    /**
     * Whether a name hint marks its value as private, i.e. it starts with {@code _}.
     *
     * @param hint The hint.
     * @return True if the hint is private.
     */
    public static boolean isPrivate(String hint) {
        return hint.startsWith("_");
    }

    /**
     * Infer a name for a temporary holding {@code expr}, from the names of what it is computed from.
     * <p>
     * Explicit name hints are used as they are. Other names are prefixed with {@code _}, to mark them
     * as synthesized.
     *
     * @param expr The value.
     * @return The name, or null if none could be inferred.
     */
    public static @Nullable String inferStructuralName(Value expr) {
        boolean addPrefix = true;
        String result = null;

        Operation def = expr.getDefiningOp();
        if (def != null && def.kind == OpKind.READ_INOUT) {
            expr = def.getOperand(0);
            def = expr.getDefiningOp();
        }

        if (def == null) {
            result = expr.name;
        } else if (Classification.isDeclaration(def)) {
            result = def.getNullable(CommonExts.DECL_NAME);
        } else if (def.getNameHint() != null) {
            result = def.getNameHint();
            addPrefix = false;
        } else {
            switch (def.kind) {
                case VERBATIM_EXPR:
                case VERBATIM_EXPR_SE:
                    result = verbatimName(def.getNullable(CommonExts.FORMAT));
                    break;
                case EXTRACT: {
                    String base = inferStructuralName(def.getOperand(0));
                    if (base != null) {
                        int lo = def.getExtOrThrow(CommonExts.LOW_BIT);
                        int width = expr.getType().getBitWidth();
                        result = width == 1
                                ? base + "_" + lo
                                : base + "_" + (lo + width - 1) + "to" + lo;
                    }
                    break;
                }
                case STRUCT_EXTRACT: {
                    String base = inferStructuralName(def.getOperand(0));
                    if (base != null) {
                        result = base + "_" + def.getExtOrThrow(CommonExts.FIELD);
                    }
                    break;
                }
                default:
                    break;
            }
        }

        if (result == null || result.isEmpty()) return null;
        if (addPrefix && !isPrivate(result)) result = "_" + result;
        return result;
    }

    // macro-like verbatims, such as `FOO, name themselves
    private static @Nullable String verbatimName(@Nullable String format) {
        if (format == null) return null;
        String name = format.startsWith("`") ? format.substring(1) : format;
        if (name.isEmpty() || !isIdentifierStart(name.charAt(0))) return null;
        for (int i = 1; i < name.length(); i++) {
            if (!isIdentifierPart(name.charAt(i))) return null;
        }
        return name;
    }
}
