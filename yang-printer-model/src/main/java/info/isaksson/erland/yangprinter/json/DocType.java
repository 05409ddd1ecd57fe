package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Type use. {@code base} defaults to {@code name} when that is a built-in type name.
 */
public final class DocType {
    public final String name;
    public final String prefix;
    public final String base;
    public final List<DocEnum> enums;
    /** For identityref: {@code [prefix:]name} of the referenced identity. */
    public final String identity;

    @JsonCreator
    public DocType(
            @JsonProperty("name") String name,
            @JsonProperty("prefix") String prefix,
            @JsonProperty("base") String base,
            @JsonProperty("enums") List<DocEnum> enums,
            @JsonProperty("identity") String identity
    ) {
        this.name = name;
        this.prefix = prefix;
        this.base = base;
        this.enums = enums == null ? List.of() : List.copyOf(enums);
        this.identity = identity;
    }
}
