package info.isaksson.erland.yangprinter.model;

/**
 * Structural node kinds. Each {@link SchemaNode} subclass reports exactly one kind.
 */
public enum NodeKind {
    CONTAINER("container"),
    CHOICE("choice"),
    LEAF("leaf"),
    LEAF_LIST("leaf-list"),
    LIST("list"),
    GROUPING("grouping"),
    USES("uses");

    /** Statement keyword used when printing. */
    public final String keyword;

    NodeKind(String keyword) {
        this.keyword = keyword;
    }

    public static NodeKind fromKeyword(String keyword) {
        if (keyword == null) throw new IllegalArgumentException("node kind is null");
        for (NodeKind k : values()) {
            if (k.keyword.equals(keyword.trim())) return k;
        }
        throw new IllegalArgumentException("Unknown node kind: " + keyword);
    }
}
