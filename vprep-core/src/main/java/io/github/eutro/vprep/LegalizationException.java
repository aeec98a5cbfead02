package io.github.eutro.vprep;

import io.github.eutro.vprep.ir.Operation;

/**
 * Thrown when a module cannot be prepared for emission, because it contains an
 * operation the emitter does not understand.
 * <p>
 * This aborts preparation of the whole module, which should then not be emitted.
 */
public class LegalizationException extends RuntimeException {
    private final transient Operation operation;

    public LegalizationException(String message, Operation operation) {
        super(message);
        this.operation = operation;
    }

    /**
     * Get the operation that could not be legalized.
     *
     * @return The operation.
     */
    public Operation getOperation() {
        return operation;
    }
}
