package info.isaksson.erland.yangprinter.model;

import java.util.ArrayList;
import java.util.List;

public final class GroupingNode extends InteriorNode {

    public final List<Typedef> typedefs = new ArrayList<>();

    public GroupingNode(Module module, String name) {
        super(module, name);
    }

    @Override public NodeKind kind() {
        return NodeKind.GROUPING;
    }
}
