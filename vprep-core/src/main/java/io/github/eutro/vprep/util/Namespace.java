package io.github.eutro.vprep.util;

import io.github.eutro.vprep.ext.CommonExts;
import io.github.eutro.vprep.ir.*;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * The names in use in a module, for creating new ones which collide with none of them.
 */
public class Namespace {
    private final Set<String> used = new HashSet<>();
    private final Map<String, Integer> nextIndex = new HashMap<>();

    /**
     * Create a namespace holding the port, declaration and instance names of a module.
     *
     * @param module The module.
     * @return The namespace.
     */
    public static Namespace of(HWModule module) {
        Namespace ns = new Namespace();
        for (Port port : module.getPorts()) {
            ns.add(port.name);
        }
        ns.addAll(module.getBodyBlock());
        return ns;
    }

    private void addAll(Block block) {
        for (Operation op : block.getOperations()) {
            String name = op.getNullable(CommonExts.DECL_NAME);
            if (name != null) add(name);
            String instance = op.getNullable(CommonExts.INSTANCE_NAME);
            if (instance != null) add(instance);
            for (Region region : op.getRegions()) {
                for (Block nested : region.getBlocks()) {
                    addAll(nested);
                }
            }
        }
    }

    public void add(String name) {
        used.add(name);
    }

    public boolean contains(String name) {
        return used.contains(name);
    }

    /**
     * Reserve a legal name based on {@code base}, which collides with no other name in this namespace.
     * <p>
     * The name is {@code base} itself if that is free, otherwise {@code base} with the first free
     * {@code _0}, {@code _1}, ... suffix.
     *
     * @param base The name to start from.
     * @return The new name.
     */
    public String newName(String base) {
        String legal = NameHints.legalize(base);
        if (used.add(legal)) return legal;
        int i = nextIndex.getOrDefault(legal, 0);
        String candidate;
        do {
            candidate = legal + "_" + i++;
        } while (!used.add(candidate));
        nextIndex.put(legal, i);
        return candidate;
    }
}
