package info.isaksson.erland.yangprinter.model;

/** Lifecycle marker of a definition. Absence on a definition means the implicit default. */
public enum Status {
    CURRENT("current"),
    DEPRECATED("deprecated"),
    OBSOLETE("obsolete");

    public final String keyword;

    Status(String keyword) {
        this.keyword = keyword;
    }

    /** Parse a YANG keyword ("current", "deprecated", "obsolete"); returns null for null input. */
    public static Status fromKeyword(String keyword) {
        if (keyword == null) return null;
        for (Status s : values()) {
            if (s.keyword.equals(keyword.trim())) return s;
        }
        throw new IllegalArgumentException("Unknown status: " + keyword);
    }
}
