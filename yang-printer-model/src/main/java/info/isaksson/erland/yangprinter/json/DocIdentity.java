package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class DocIdentity {
    public final String name;
    /** Optional {@code [prefix:]name} of the base identity. */
    public final String base;
    public final String status;
    public final String description;
    public final String reference;

    @JsonCreator
    public DocIdentity(
            @JsonProperty("name") String name,
            @JsonProperty("base") String base,
            @JsonProperty("status") String status,
            @JsonProperty("description") String description,
            @JsonProperty("reference") String reference
    ) {
        this.name = name;
        this.base = base;
        this.status = status;
        this.description = description;
        this.reference = reference;
    }
}
