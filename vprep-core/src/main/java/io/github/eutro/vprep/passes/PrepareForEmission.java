package io.github.eutro.vprep.passes;

import io.github.eutro.vprep.conf.LoweringOptions;
import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ir.Circuit;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.ir.display.IRPrinter;
import io.github.eutro.vprep.passes.form.LegalizeRegions;
import io.github.eutro.vprep.passes.misc.ForPass;
import io.github.eutro.vprep.passes.opts.PruneZeroValuedLogic;
import io.github.eutro.vprep.passes.opts.SpillWiresForReadability;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.ExecutorService;

/**
 * Prepares a module for line by line emission as Verilog: prunes zero-valued logic,
 * legalizes every region, then spills large or named expressions to wires.
 * <p>
 * The module is rewritten in place. If it contains anything the emitter cannot write,
 * a {@link io.github.eutro.vprep.LegalizationException} is thrown and the module
 * should not be emitted.
 */
public class PrepareForEmission implements InPlaceIRPass<HWModule> {
    /**
     * Prepares modules with the options attached to them, or the defaults.
     */
    public static final PrepareForEmission INSTANCE = new PrepareForEmission(null);

    private static final Logger logger = LogManager.getLogger();

    private static final IRPass<LegalizationContext, LegalizationContext> PIPELINE =
            PruneZeroValuedLogic.INSTANCE
                    .then(LegalizeRegions.INSTANCE)
                    .then(SpillWiresForReadability.INSTANCE);

    @Nullable
    private final LoweringOptions options;

    /**
     * Create a pass preparing modules with the given options.
     *
     * @param options The options, or null to use those attached to each module.
     */
    public PrepareForEmission(@Nullable LoweringOptions options) {
        this.options = options;
    }

    /**
     * Create a pass preparing every module of a circuit, with the options attached to the circuit.
     *
     * @param circuit The circuit to read the options of.
     * @return The circuit pass.
     */
    public static InPlaceIRPass<Circuit> forCircuit(Circuit circuit) {
        return ForPass.liftModules(new PrepareForEmission(optionsOf(circuit)));
    }

    /**
     * Like {@link #forCircuit(Circuit)}, but preparing the modules concurrently.
     *
     * @param circuit  The circuit to read the options of.
     * @param executor The executor to prepare modules on.
     * @return The circuit pass.
     */
    public static InPlaceIRPass<Circuit> forCircuitParallel(Circuit circuit, ExecutorService executor) {
        return ForPass.liftModulesParallel(new PrepareForEmission(optionsOf(circuit)), executor);
    }

    private static LoweringOptions optionsOf(Circuit circuit) {
        return circuit.getExtOrDefault(CommonExts.LOWERING_OPTIONS, LoweringOptions.DEFAULT);
    }

    @Override
    public void runInPlace(HWModule module) {
        LoweringOptions opts = options != null
                ? options
                : module.getExtOrDefault(CommonExts.LOWERING_OPTIONS, LoweringOptions.DEFAULT);
        LegalizationContext ctx = new LegalizationContext(module, opts);

        logger.info("preparing module {} for emission", module.name);
        logger.trace("before preparation:\n{}", () -> IRPrinter.print(module));
        PIPELINE.run(ctx);
        logger.trace("after preparation:\n{}", () -> IRPrinter.print(module));
        logger.info("prepared module {}: {}", module.name, ctx.stats);
    }
}
