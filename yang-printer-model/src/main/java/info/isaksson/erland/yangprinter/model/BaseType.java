package info.isaksson.erland.yangprinter.model;

/**
 * Built-in base types a {@link TypeRef} can resolve to.
 *
 * <p>{@link #UNKNOWN} marks a type whose base could not be determined; printers treat it like
 * any other kind they have no body for.</p>
 */
public enum BaseType {
    BINARY("binary"),
    BITS("bits"),
    BOOLEAN("boolean"),
    DECIMAL64("decimal64"),
    EMPTY("empty"),
    ENUMERATION("enumeration"),
    IDENTITYREF("identityref"),
    INSTANCE_IDENTIFIER("instance-identifier"),
    INT8("int8"),
    INT16("int16"),
    INT32("int32"),
    INT64("int64"),
    LEAFREF("leafref"),
    STRING("string"),
    UINT8("uint8"),
    UINT16("uint16"),
    UINT32("uint32"),
    UINT64("uint64"),
    UNION("union"),
    UNKNOWN("unknown");

    public final String keyword;

    BaseType(String keyword) {
        this.keyword = keyword;
    }

    /** Returns the built-in type with this keyword, or null if the name is not built in. */
    public static BaseType builtin(String name) {
        if (name == null) return null;
        for (BaseType t : values()) {
            if (t != UNKNOWN && t.keyword.equals(name)) return t;
        }
        return null;
    }

    public static BaseType fromKeyword(String keyword) {
        if (keyword == null) return UNKNOWN;
        String s = keyword.trim();
        if (s.equals(UNKNOWN.keyword)) return UNKNOWN;
        BaseType t = builtin(s);
        if (t == null) throw new IllegalArgumentException("Unknown base type: " + keyword);
        return t;
    }
}
