package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

public final class Include {
    public final String submoduleName;
    /** Optional, may be null. */
    public final String revisionDate;

    public Include(String submoduleName, String revisionDate) {
        this.submoduleName = Objects.requireNonNull(submoduleName, "submoduleName must not be null");
        this.revisionDate = revisionDate == null || revisionDate.isBlank() ? null : revisionDate;
    }
}
