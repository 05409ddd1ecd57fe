package info.isaksson.erland.yangprinter.json;

/** A JSON model document that parses but cannot be linked into a schema model. */
public class SchemaModelException extends RuntimeException {

    public SchemaModelException(String message) {
        super(message);
    }

    public SchemaModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
