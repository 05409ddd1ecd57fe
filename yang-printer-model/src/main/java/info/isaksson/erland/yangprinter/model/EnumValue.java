package info.isaksson.erland.yangprinter.model;

/** One member of an enumeration type. */
public final class EnumValue extends Definition {

    private final int value;

    public EnumValue(String name, int value) {
        super(name);
        this.value = value;
    }

    public int value() {
        return value;
    }
}
