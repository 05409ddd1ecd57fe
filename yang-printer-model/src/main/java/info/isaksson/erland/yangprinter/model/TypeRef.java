package info.isaksson.erland.yangprinter.model;

import java.util.List;
import java.util.Objects;

/**
 * Use of a type by a leaf, leaf-list or typedef.
 *
 * <p>{@link #name()} is the name of the type the use derives from (a built-in type or a
 * typedef). {@link #prefix()} is set when that name was written qualified. The payload
 * depends on {@link #base()}: enum values for {@link BaseType#ENUMERATION}, the referenced
 * identity for {@link BaseType#IDENTITYREF}.</p>
 */
public final class TypeRef {

    private final String name;
    private final String prefix;
    private final BaseType base;
    private final List<EnumValue> enums;
    private final Identity identity;

    public TypeRef(String name, String prefix, BaseType base, List<EnumValue> enums, Identity identity) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.prefix = prefix == null || prefix.isBlank() ? null : prefix;
        this.base = base == null ? BaseType.UNKNOWN : base;
        this.enums = enums == null ? List.of() : List.copyOf(enums);
        this.identity = identity;
    }

    /** Unqualified use of a built-in type, e.g. {@code type string}. */
    public static TypeRef builtin(BaseType base) {
        return new TypeRef(base.keyword, null, base, null, null);
    }

    /** Use of a typedef, optionally prefixed, resolving to the given base. */
    public static TypeRef derived(String prefix, String name, BaseType base) {
        return new TypeRef(name, prefix, base, null, null);
    }

    public static TypeRef enumeration(List<EnumValue> enums) {
        return new TypeRef(BaseType.ENUMERATION.keyword, null, BaseType.ENUMERATION, enums, null);
    }

    public static TypeRef identityref(Identity identity) {
        return new TypeRef(BaseType.IDENTITYREF.keyword, null, BaseType.IDENTITYREF, null, identity);
    }

    public String name() {
        return name;
    }

    public String prefix() {
        return prefix;
    }

    public BaseType base() {
        return base;
    }

    /** Enum members in declaration order; empty unless the base is an enumeration. */
    public List<EnumValue> enums() {
        return enums;
    }

    /** Referenced identity of an identityref, or null. */
    public Identity identity() {
        return identity;
    }

    /** {@code prefix:name} when a prefix is set, else {@code name}. */
    public String qualifiedName() {
        return prefix == null ? name : prefix + ":" + name;
    }

    @Override public String toString() {
        return qualifiedName();
    }
}
