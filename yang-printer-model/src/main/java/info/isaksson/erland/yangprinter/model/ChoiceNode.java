package info.isaksson.erland.yangprinter.model;

public final class ChoiceNode extends InteriorNode {

    public ChoiceNode(Module module, String name) {
        super(module, name);
    }

    @Override public NodeKind kind() {
        return NodeKind.CHOICE;
    }
}
