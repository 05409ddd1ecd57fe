package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

/**
 * Named schema definition carrying the fields every definition shares: status, description
 * and reference.
 */
public abstract class Definition {

    private final String name;
    private Status status;
    private String description;
    private String reference;

    protected Definition(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String name() {
        return name;
    }

    /** Explicit status, or null when the implicit default applies. */
    public Status status() {
        return status;
    }

    public String description() {
        return description;
    }

    public String reference() {
        return reference;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public void setReference(String reference) {
        this.reference = reference;
    }

    @Override public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
