package io.github.eutro.vprep.passes.misc;

import io.github.eutro.vprep.ir.Circuit;
import io.github.eutro.vprep.ir.HWModule;
import io.github.eutro.vprep.passes.IRPass;
import io.github.eutro.vprep.passes.InPlaceIRPass;

import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Lifts passes which operate on modules into ones that operate on whole circuits.
 */
public class ForPass {
    /**
     * Lift a module pass to operate on every module of a circuit, one after another.
     *
     * @param pass The module pass.
     * @return The circuit pass.
     */
    public static Modules liftModules(IRPass<HWModule, HWModule> pass) {
        return new Modules(pass);
    }

    /**
     * Lift a module pass to operate on every module of a circuit at once, on the given executor.
     * <p>
     * Modules share no state, so any module pass which only touches its own module may be lifted
     * this way. All modules are waited for; if any failed, the first failure is thrown, with the
     * others suppressed.
     *
     * @param pass     The module pass.
     * @param executor The executor to run each module's pass on.
     * @return The circuit pass.
     */
    public static ParallelModules liftModulesParallel(IRPass<HWModule, HWModule> pass, ExecutorService executor) {
        return new ParallelModules(pass, executor);
    }

    static RuntimeException inModule(HWModule module) {
        return new RuntimeException("in module " + module.name);
    }

    /**
     * A module pass lifted to operate on a full circuit.
     */
    public static class Modules implements InPlaceIRPass<Circuit> {
        private final IRPass<HWModule, HWModule> pass;

        private Modules(IRPass<HWModule, HWModule> pass) {
            this.pass = pass;
        }

        @Override
        public void runInPlace(Circuit circuit) {
            ListIterator<HWModule> iter = circuit.modules.listIterator();
            while (iter.hasNext()) {
                HWModule module = iter.next();
                try {
                    HWModule result = pass.run(module);
                    if (!pass.isInPlace()) iter.set(result);
                } catch (Throwable t) {
                    t.addSuppressed(inModule(module));
                    throw t;
                }
            }
        }
    }

    /**
     * A module pass lifted to operate on a full circuit, running modules concurrently.
     */
    public static class ParallelModules implements InPlaceIRPass<Circuit> {
        private final IRPass<HWModule, HWModule> pass;
        private final ExecutorService executor;

        private ParallelModules(IRPass<HWModule, HWModule> pass, ExecutorService executor) {
            this.pass = pass;
            this.executor = executor;
        }

        @Override
        public void runInPlace(Circuit circuit) {
            List<Future<HWModule>> futures = new ArrayList<>(circuit.modules.size());
            for (HWModule module : circuit.modules) {
                futures.add(executor.submit(() -> pass.run(module)));
            }

            RuntimeException failure = null;
            for (int i = 0; i < futures.size(); i++) {
                HWModule module = circuit.modules.get(i);
                try {
                    HWModule result = futures.get(i).get();
                    if (!pass.isInPlace()) circuit.modules.set(i, result);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    for (Future<HWModule> future : futures) {
                        future.cancel(true);
                    }
                    throw new IllegalStateException("interrupted while preparing modules", e);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    cause.addSuppressed(inModule(module));
                    if (cause instanceof Error) throw (Error) cause;
                    RuntimeException ex = cause instanceof RuntimeException
                            ? (RuntimeException) cause
                            : new RuntimeException(cause);
                    if (failure == null) {
                        failure = ex;
                    } else {
                        failure.addSuppressed(ex);
                    }
                }
            }
            if (failure != null) throw failure;
        }
    }
}
