package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class DocRevision {
    public final String date;
    public final String description;
    public final String reference;

    @JsonCreator
    public DocRevision(
            @JsonProperty("date") String date,
            @JsonProperty("description") String description,
            @JsonProperty("reference") String reference
    ) {
        this.date = date;
        this.description = description;
        this.reference = reference;
    }
}
