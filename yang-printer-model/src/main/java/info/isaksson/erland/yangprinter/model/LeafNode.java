package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

public final class LeafNode extends SchemaNode {

    private final TypeRef type;

    public LeafNode(Module module, String name, TypeRef type) {
        super(module, name);
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    @Override public NodeKind kind() {
        return NodeKind.LEAF;
    }

    public TypeRef type() {
        return type;
    }
}
