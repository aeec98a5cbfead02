package io.github.eutro.vprep.conf;

import java.util.ArrayList;
import java.util.List;

/**
 * Options controlling the style of Verilog the module will be emitted as,
 * and so what preparing for emission has to legalize.
 * <p>
 * Instances are immutable; create them with {@link #builder()}, or {@link #parse(String)}
 * a comma separated option string such as
 * {@code "disallowLocalVariables,maximumNumberOfTermsPerExpression=8"}.
 */
public final class LoweringOptions {
    public static final int DEFAULT_TERM_LIMIT = 256;
    public static final int DEFAULT_NAMEHINT_TERM_LIMIT = 3;

    public static final LoweringOptions DEFAULT = builder().build();

    /**
     * How expressions with name hints are spilled to wires for readability.
     */
    public enum WireSpillingHeuristic {
        /**
         * Only spill expressions that are too large.
         */
        OFF,
        /**
         * Also spill expressions with a public name hint, or a private one and more than
         * {@link #getWireSpillingNamehintTermLimit()} terms.
         */
        SPILL_LARGE_TERMS_WITH_NAMEHINTS,
    }

    private final int maximumNumberOfTermsPerExpression;
    private final WireSpillingHeuristic wireSpillingHeuristic;
    private final int wireSpillingNamehintTermLimit;
    private final boolean disallowLocalVariables;
    private final boolean disallowExpressionInliningInPorts;
    private final boolean allowExpressionInEventControl;
    private final boolean disallowMuxInlining;

    private LoweringOptions(Builder builder) {
        maximumNumberOfTermsPerExpression = builder.maximumNumberOfTermsPerExpression;
        wireSpillingHeuristic = builder.wireSpillingHeuristic;
        wireSpillingNamehintTermLimit = builder.wireSpillingNamehintTermLimit;
        disallowLocalVariables = builder.disallowLocalVariables;
        disallowExpressionInliningInPorts = builder.disallowExpressionInliningInPorts;
        allowExpressionInEventControl = builder.allowExpressionInEventControl;
        disallowMuxInlining = builder.disallowMuxInlining;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse a comma separated option string.
     * <p>
     * Flags are given by name; valued options as {@code name=value}. Blank entries are ignored.
     *
     * @param options The option string.
     * @return The options.
     * @throws IllegalArgumentException If an option is unknown, or its value is malformed.
     */
    public static LoweringOptions parse(String options) {
        Builder builder = builder();
        for (String entry : options.split(",")) {
            String option = entry.trim();
            if (option.isEmpty()) continue;
            int eq = option.indexOf('=');
            String key = eq == -1 ? option : option.substring(0, eq).trim();
            String value = eq == -1 ? null : option.substring(eq + 1).trim();
            switch (key) {
                case "maximumNumberOfTermsPerExpression":
                    builder.setMaximumNumberOfTermsPerExpression(parseInt(key, value));
                    break;
                case "wireSpillingHeuristic":
                    if (!"spillLargeTermsWithNamehints".equals(value)) {
                        throw new IllegalArgumentException("unknown value for wireSpillingHeuristic: " + value);
                    }
                    builder.setWireSpillingHeuristic(WireSpillingHeuristic.SPILL_LARGE_TERMS_WITH_NAMEHINTS);
                    break;
                case "wireSpillingNamehintTermLimit":
                    builder.setWireSpillingNamehintTermLimit(parseInt(key, value));
                    break;
                case "disallowLocalVariables":
                    builder.setDisallowLocalVariables(parseFlag(key, value));
                    break;
                case "disallowExpressionInliningInPorts":
                    builder.setDisallowExpressionInliningInPorts(parseFlag(key, value));
                    break;
                case "exprInEventControl":
                    builder.setAllowExpressionInEventControl(parseFlag(key, value));
                    break;
                case "disallowMuxInlining":
                    builder.setDisallowMuxInlining(parseFlag(key, value));
                    break;
                default:
                    throw new IllegalArgumentException("unknown lowering option: " + key);
            }
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        if (value == null) throw new IllegalArgumentException("option " + key + " requires a value");
        int n;
        try {
            n = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("option " + key + " expects a number, got " + value, e);
        }
        if (n <= 0) throw new IllegalArgumentException("option " + key + " must be positive, got " + n);
        return n;
    }

    private static boolean parseFlag(String key, String value) {
        if (value != null) throw new IllegalArgumentException("option " + key + " takes no value");
        return true;
    }

    public int getMaximumNumberOfTermsPerExpression() {
        return maximumNumberOfTermsPerExpression;
    }

    public WireSpillingHeuristic getWireSpillingHeuristic() {
        return wireSpillingHeuristic;
    }

    public int getWireSpillingNamehintTermLimit() {
        return wireSpillingNamehintTermLimit;
    }

    public boolean isDisallowLocalVariables() {
        return disallowLocalVariables;
    }

    public boolean isDisallowExpressionInliningInPorts() {
        return disallowExpressionInliningInPorts;
    }

    public boolean isAllowExpressionInEventControl() {
        return allowExpressionInEventControl;
    }

    public boolean isDisallowMuxInlining() {
        return disallowMuxInlining;
    }

    public Builder toBuilder() {
        return builder()
                .setMaximumNumberOfTermsPerExpression(maximumNumberOfTermsPerExpression)
                .setWireSpillingHeuristic(wireSpillingHeuristic)
                .setWireSpillingNamehintTermLimit(wireSpillingNamehintTermLimit)
                .setDisallowLocalVariables(disallowLocalVariables)
                .setDisallowExpressionInliningInPorts(disallowExpressionInliningInPorts)
                .setAllowExpressionInEventControl(allowExpressionInEventControl)
                .setDisallowMuxInlining(disallowMuxInlining);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        if (maximumNumberOfTermsPerExpression != DEFAULT_TERM_LIMIT) {
            parts.add("maximumNumberOfTermsPerExpression=" + maximumNumberOfTermsPerExpression);
        }
        if (wireSpillingHeuristic == WireSpillingHeuristic.SPILL_LARGE_TERMS_WITH_NAMEHINTS) {
            parts.add("wireSpillingHeuristic=spillLargeTermsWithNamehints");
        }
        if (wireSpillingNamehintTermLimit != DEFAULT_NAMEHINT_TERM_LIMIT) {
            parts.add("wireSpillingNamehintTermLimit=" + wireSpillingNamehintTermLimit);
        }
        if (disallowLocalVariables) parts.add("disallowLocalVariables");
        if (disallowExpressionInliningInPorts) parts.add("disallowExpressionInliningInPorts");
        if (allowExpressionInEventControl) parts.add("exprInEventControl");
        if (disallowMuxInlining) parts.add("disallowMuxInlining");
        return String.join(",", parts);
    }

    public static class Builder {
        private int maximumNumberOfTermsPerExpression = DEFAULT_TERM_LIMIT;
        private WireSpillingHeuristic wireSpillingHeuristic = WireSpillingHeuristic.OFF;
        private int wireSpillingNamehintTermLimit = DEFAULT_NAMEHINT_TERM_LIMIT;
        private boolean disallowLocalVariables;
        private boolean disallowExpressionInliningInPorts;
        private boolean allowExpressionInEventControl;
        private boolean disallowMuxInlining;

        private Builder() {
        }

        public Builder setMaximumNumberOfTermsPerExpression(int maximumNumberOfTermsPerExpression) {
            this.maximumNumberOfTermsPerExpression = maximumNumberOfTermsPerExpression;
            return this;
        }

        public Builder setWireSpillingHeuristic(WireSpillingHeuristic wireSpillingHeuristic) {
            this.wireSpillingHeuristic = wireSpillingHeuristic;
            return this;
        }

        public Builder setWireSpillingNamehintTermLimit(int wireSpillingNamehintTermLimit) {
            this.wireSpillingNamehintTermLimit = wireSpillingNamehintTermLimit;
            return this;
        }

        public Builder setDisallowLocalVariables(boolean disallowLocalVariables) {
            this.disallowLocalVariables = disallowLocalVariables;
            return this;
        }

        public Builder setDisallowExpressionInliningInPorts(boolean disallowExpressionInliningInPorts) {
            this.disallowExpressionInliningInPorts = disallowExpressionInliningInPorts;
            return this;
        }

        public Builder setAllowExpressionInEventControl(boolean allowExpressionInEventControl) {
            this.allowExpressionInEventControl = allowExpressionInEventControl;
            return this;
        }

        public Builder setDisallowMuxInlining(boolean disallowMuxInlining) {
            this.disallowMuxInlining = disallowMuxInlining;
            return this;
        }

        public LoweringOptions build() {
            return new LoweringOptions(this);
        }
    }
}
