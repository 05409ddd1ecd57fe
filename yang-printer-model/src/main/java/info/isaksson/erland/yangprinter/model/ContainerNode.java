package info.isaksson.erland.yangprinter.model;

import java.util.ArrayList;
import java.util.List;

public final class ContainerNode extends InteriorNode {

    /** Typedefs scoped to this container, in declaration order. */
    public final List<Typedef> typedefs = new ArrayList<>();

    public ContainerNode(Module module, String name) {
        super(module, name);
    }

    @Override public NodeKind kind() {
        return NodeKind.CONTAINER;
    }
}
