package io.github.eutro.vprep.ir;

import io.github.eutro.vprep.ext.ExtHolder;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A collection of modules, processed together.
 */
public final class Circuit extends ExtHolder {
    public final List<HWModule> modules = new ArrayList<>();

    public HWModule addModule(HWModule module) {
        modules.add(module);
        return module;
    }

    public @Nullable HWModule getModule(String name) {
        for (HWModule module : modules) {
            if (module.name.equals(name)) return module;
        }
        return null;
    }
}
