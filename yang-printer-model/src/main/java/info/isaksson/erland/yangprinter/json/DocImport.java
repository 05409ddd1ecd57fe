package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class DocImport {
    public final String module;
    public final String prefix;
    public final String revisionDate;

    @JsonCreator
    public DocImport(
            @JsonProperty("module") String module,
            @JsonProperty("prefix") String prefix,
            @JsonProperty("revisionDate") String revisionDate
    ) {
        this.module = module;
        this.prefix = prefix;
        this.revisionDate = revisionDate;
    }
}
