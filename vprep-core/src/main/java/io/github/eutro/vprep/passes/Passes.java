package io.github.eutro.vprep.passes;

import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.passes.meta.VerifyPrepared;

public class Passes {
    /**
     * Prepare a module for emission with its own options, then check the result.
     */
    public static final IRPass<HWModule, HWModule> PREPARE_AND_VERIFY =
            PrepareForEmission.INSTANCE
                    .then(VerifyPrepared.INSTANCE);
}
