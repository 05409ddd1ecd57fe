package info.isaksson.erland.yangprinter.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A YANG module: header fields, linkage statements, top-level definitions and the forest of
 * root data nodes.
 *
 * <p>All lists keep declaration order. Root nodes in {@link #data} have no parent.</p>
 */
public final class Module {
    public final String name;
    public final String namespace;
    public final String prefix;

    public final List<Import> imports = new ArrayList<>();
    public final List<Include> includes = new ArrayList<>();
    public final List<Revision> revisions = new ArrayList<>();
    public final List<Identity> identities = new ArrayList<>();
    public final List<Typedef> typedefs = new ArrayList<>();
    public final List<SchemaNode> data = new ArrayList<>();

    private YangVersion version;
    private String organization;
    private String contact;
    private String description;
    private String reference;

    public Module(String name, String namespace, String prefix) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.namespace = Objects.requireNonNull(namespace, "namespace must not be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
    }

    /** Explicit yang-version, or null when the statement is absent. */
    public YangVersion version() {
        return version;
    }

    public String organization() {
        return organization;
    }

    public String contact() {
        return contact;
    }

    public String description() {
        return description;
    }

    public String reference() {
        return reference;
    }

    public void setVersion(YangVersion version) {
        this.version = version;
    }

    public void setOrganization(String organization) {
        this.organization = organization;
    }

    public void setContact(String contact) {
        this.contact = contact;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    /** Add a root data node. The node must not already have a parent. */
    public <T extends SchemaNode> T addData(T node) {
        Objects.requireNonNull(node, "node must not be null");
        if (node.parent() != null) {
            throw new IllegalArgumentException("root node already has a parent: " + node.name());
        }
        data.add(node);
        return node;
    }

    @Override public String toString() {
        return "Module[" + name + "]";
    }
}
