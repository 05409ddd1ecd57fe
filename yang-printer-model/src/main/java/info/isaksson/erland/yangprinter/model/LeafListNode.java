package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

public final class LeafListNode extends SchemaNode {

    private final TypeRef type;

    public LeafListNode(Module module, String name, TypeRef type) {
        super(module, name);
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    @Override public NodeKind kind() {
        return NodeKind.LEAF_LIST;
    }

    public TypeRef type() {
        return type;
    }
}
