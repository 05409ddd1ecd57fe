package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class DocEnum {
    public final String name;
    /** Required; checked when the model is assembled. */
    public final Integer value;
    public final String status;
    public final String description;
    public final String reference;

    @JsonCreator
    public DocEnum(
            @JsonProperty("name") String name,
            @JsonProperty("value") Integer value,
            @JsonProperty("status") String status,
            @JsonProperty("description") String description,
            @JsonProperty("reference") String reference
    ) {
        this.name = name;
        this.value = value;
        this.status = status;
        this.description = description;
        this.reference = reference;
    }
}
