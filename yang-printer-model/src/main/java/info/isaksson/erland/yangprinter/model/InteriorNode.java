package info.isaksson.erland.yangprinter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Node kinds that own an ordered list of child nodes. */
public abstract sealed class InteriorNode extends SchemaNode
        permits ContainerNode, ChoiceNode, ListNode, GroupingNode {

    private final List<SchemaNode> children = new ArrayList<>();

    protected InteriorNode(Module module, String name) {
        super(module, name);
    }

    /** Children in declaration order. */
    public List<SchemaNode> children() {
        return Collections.unmodifiableList(children);
    }

    /** Append a child and make this node its parent. */
    public <T extends SchemaNode> T addChild(T child) {
        Objects.requireNonNull(child, "child must not be null");
        child.attachTo(this);
        children.add(child);
        return child;
    }
}
