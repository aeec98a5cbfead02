package io.github.eutro.vprep.passes;

import io.github.eutro.vprep.passes.misc.ChainedPass;

/**
 * A pass over some part of the IR, producing a result.
 *
 * @param <A> The type of the IR this pass runs on.
 * @param <B> The type of the result.
 */
public interface IRPass<A, B> {
    B run(A a);

    default boolean isInPlace() {
        return false;
    }

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
