package info.isaksson.erland.yangprinter.model;

/**
 * Reference to a grouping. {@link #name()} is the referenced grouping's name, possibly
 * prefixed.
 */
public final class UsesNode extends SchemaNode {

    public UsesNode(Module module, String grouping) {
        super(module, grouping);
    }

    @Override public NodeKind kind() {
        return NodeKind.USES;
    }
}
