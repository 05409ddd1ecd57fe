package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root of the JSON model format: a list of modules that may import each other.
 */
public final class SchemaDocument {
    public final List<DocModule> modules;

    @JsonCreator
    public SchemaDocument(@JsonProperty("modules") List<DocModule> modules) {
        this.modules = modules == null ? List.of() : List.copyOf(modules);
    }
}
