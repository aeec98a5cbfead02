package io.github.eutro.vprep.ir;

import io.github.eutro.vprep.ext.ExtHolder;
import io.github.eutro.vprep.types.HWType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A hardware module: a name, some ports, and a graph region body.
 * <p>
 * Input ports are the arguments of the body block; output ports are driven by the
 * operands of its {@code hw.output} terminator.
 */
public final class HWModule extends ExtHolder {
    public final String name;
    private final List<Port> ports = new ArrayList<>();
    private final Region body;

    public HWModule(String name) {
        this.name = name;
        body = new Region(this);
        body.addBlock(new Block());
    }

    public Value addInput(String name, HWType type) {
        ports.add(new Port(name, Port.Direction.INPUT, type));
        return getBodyBlock().addArgument(type, name);
    }

    public void addOutput(String name, HWType type) {
        ports.add(new Port(name, Port.Direction.OUTPUT, type));
    }

    public List<Port> getPorts() {
        return Collections.unmodifiableList(ports);
    }

    public Region getBody() {
        return body;
    }

    public Block getBodyBlock() {
        return body.getEntryBlock();
    }

    @Override
    public String toString() {
        return "hw.module @" + name;
    }
}
