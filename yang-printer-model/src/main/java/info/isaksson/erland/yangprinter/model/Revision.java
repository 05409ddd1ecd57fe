package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

public final class Revision {
    public final String date;
    public final String description;
    public final String reference;

    public Revision(String date, String description, String reference) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.description = description;
        this.reference = reference;
    }

    public Revision(String date) {
        this(date, null, null);
    }
}
