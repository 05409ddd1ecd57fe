package info.isaksson.erland.yangprinter.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import info.isaksson.erland.yangprinter.model.Module;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads schema models from the JSON model format.
 *
 * <p>Parsing is strict: unknown properties and duplicate keys are rejected so typos in
 * hand-written documents do not silently drop fields.</p>
 */
public final class SchemaJson {

    private static final ObjectMapper MAPPER = createMapper();

    private SchemaJson() {}

    /** Parse and link every module in the document, in document order. */
    public static List<Module> read(Path path) throws IOException {
        return new SchemaModelAssembler().assemble(readDocument(path));
    }

    public static List<Module> readFromString(String json) throws IOException {
        return new SchemaModelAssembler().assemble(readDocumentFromString(json));
    }

    public static SchemaDocument readDocument(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, SchemaDocument.class);
        }
    }

    public static SchemaDocument readDocumentFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, SchemaDocument.class);
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        om.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        om.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        om.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
        return om;
    }
}
