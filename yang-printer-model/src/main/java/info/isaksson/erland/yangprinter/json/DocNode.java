package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One schema node of any kind. Fields that do not apply to {@code kind} are ignored.
 */
public final class DocNode {
    /** YANG keyword of the node kind, e.g. "leaf-list". */
    public final String kind;
    public final String name;
    public final Boolean config;
    public final String status;
    public final String description;
    public final String reference;
    public final List<DocTypedef> typedefs;
    public final List<DocNode> children;
    /** List only: names of leaf children, in key order. */
    public final List<String> keys;
    /** Leaf and leaf-list only. */
    public final DocType type;

    @JsonCreator
    public DocNode(
            @JsonProperty("kind") String kind,
            @JsonProperty("name") String name,
            @JsonProperty("config") Boolean config,
            @JsonProperty("status") String status,
            @JsonProperty("description") String description,
            @JsonProperty("reference") String reference,
            @JsonProperty("typedefs") List<DocTypedef> typedefs,
            @JsonProperty("children") List<DocNode> children,
            @JsonProperty("keys") List<String> keys,
            @JsonProperty("type") DocType type
    ) {
        this.kind = kind;
        this.name = name;
        this.config = config;
        this.status = status;
        this.description = description;
        this.reference = reference;
        this.typedefs = typedefs == null ? List.of() : List.copyOf(typedefs);
        this.children = children == null ? List.of() : List.copyOf(children);
        this.keys = keys == null ? List.of() : List.copyOf(keys);
        this.type = type;
    }
}
