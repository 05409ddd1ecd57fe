package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class DocInclude {
    public final String submodule;
    public final String revisionDate;

    @JsonCreator
    public DocInclude(
            @JsonProperty("submodule") String submodule,
            @JsonProperty("revisionDate") String revisionDate
    ) {
        this.submodule = submodule;
        this.revisionDate = revisionDate;
    }
}
