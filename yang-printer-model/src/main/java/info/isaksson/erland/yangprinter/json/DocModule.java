package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public final class DocModule {
    public final String name;
    public final String namespace;
    public final String prefix;
    public final String yangVersion;
    public final String organization;
    public final String contact;
    public final String description;
    public final String reference;
    public final List<DocImport> imports;
    public final List<DocInclude> includes;
    public final List<DocRevision> revisions;
    public final List<DocIdentity> identities;
    public final List<DocTypedef> typedefs;
    public final List<DocNode> data;

    @JsonCreator
    public DocModule(
            @JsonProperty("name") String name,
            @JsonProperty("namespace") String namespace,
            @JsonProperty("prefix") String prefix,
            @JsonProperty("yangVersion") String yangVersion,
            @JsonProperty("organization") String organization,
            @JsonProperty("contact") String contact,
            @JsonProperty("description") String description,
            @JsonProperty("reference") String reference,
            @JsonProperty("imports") List<DocImport> imports,
            @JsonProperty("includes") List<DocInclude> includes,
            @JsonProperty("revisions") List<DocRevision> revisions,
            @JsonProperty("identities") List<DocIdentity> identities,
            @JsonProperty("typedefs") List<DocTypedef> typedefs,
            @JsonProperty("data") List<DocNode> data
    ) {
        this.name = name;
        this.namespace = namespace;
        this.prefix = prefix;
        this.yangVersion = yangVersion;
        this.organization = organization;
        this.contact = contact;
        this.description = description;
        this.reference = reference;
        this.imports = imports == null ? List.of() : List.copyOf(imports);
        this.includes = includes == null ? List.of() : List.copyOf(includes);
        this.revisions = revisions == null ? List.of() : List.copyOf(revisions);
        this.identities = identities == null ? List.of() : List.copyOf(identities);
        this.typedefs = typedefs == null ? List.of() : List.copyOf(typedefs);
        this.data = data == null ? List.of() : List.copyOf(data);
    }
}
