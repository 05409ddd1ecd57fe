package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

public final class Import {
    public final String moduleName;
    public final String prefix;
    /** Optional, may be null. */
    public final String revisionDate;

    public Import(String moduleName, String prefix, String revisionDate) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName must not be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
        this.revisionDate = revisionDate == null || revisionDate.isBlank() ? null : revisionDate;
    }
}
