package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

/** An identity, optionally derived from a base identity that may live in another module. */
public final class Identity extends Definition {

    private final Module module;
    private Identity base;

    public Identity(Module module, String name) {
        super(name);
        this.module = Objects.requireNonNull(module, "module must not be null");
    }

    public Module module() {
        return module;
    }

    /** Base identity or null. */
    public Identity base() {
        return base;
    }

    public void setBase(Identity base) {
        this.base = base;
    }
}
