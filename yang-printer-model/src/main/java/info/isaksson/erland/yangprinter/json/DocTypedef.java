package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class DocTypedef {
    public final String name;
    public final DocType type;
    public final String status;
    public final String description;
    public final String reference;

    @JsonCreator
    public DocTypedef(
            @JsonProperty("name") String name,
            @JsonProperty("type") DocType type,
            @JsonProperty("status") String status,
            @JsonProperty("description") String description,
            @JsonProperty("reference") String reference
    ) {
        this.name = name;
        this.type = type;
        this.status = status;
        this.description = description;
        this.reference = reference;
    }
}
