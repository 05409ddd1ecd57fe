package info.isaksson.erland.yangprinter.model;

import java.util.Objects;

/** Named type definition, declared at module level or inside a container, list or grouping. */
public final class Typedef extends Definition {

    private final Module module;
    private final TypeRef type;

    public Typedef(Module module, String name, TypeRef type) {
        super(name);
        this.module = Objects.requireNonNull(module, "module must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public Module module() {
        return module;
    }

    public TypeRef type() {
        return type;
    }
}
