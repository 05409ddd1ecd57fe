package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

/**
 * A structural node of the schema tree.
 *
 * <p>The set of node kinds is closed: every concrete subclass maps to one {@link NodeKind}.
 * The parent is a back-reference only; the parent's child list owns the node. Root nodes of a
 * module have no parent.</p>
 */
public abstract sealed class SchemaNode extends Definition
        permits InteriorNode, LeafNode, LeafListNode, UsesNode {

    private final Module module;
    private InteriorNode parent;
    private Boolean config;

    protected SchemaNode(Module module, String name) {
        super(name);
        this.module = Objects.requireNonNull(module, "module must not be null");
    }

    public abstract NodeKind kind();

    public Module module() {
        return module;
    }

    /** Parent node, or null for a module root. */
    public InteriorNode parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Explicitly set config value, or null when inherited. */
    public Boolean config() {
        return config;
    }

    public void setConfig(Boolean config) {
        this.config = config;
    }

    /**
     * Config value in effect for this node: the explicit value if set, otherwise the parent's
     * effective value. Null when neither this node nor any ancestor sets one.
     */
    public Boolean effectiveConfig() {
        for (SchemaNode n = this; n != null; n = n.parent) {
            if (n.config != null) return n.config;
        }
        return null;
    }

    void attachTo(InteriorNode newParent) {
        if (parent != null) {
            throw new IllegalStateException(kind().keyword + " " + name() + " already has parent " + parent.name());
        }
        if (newParent == this) {
            throw new IllegalArgumentException("node cannot be its own parent: " + name());
        }
        parent = newParent;
    }
}
