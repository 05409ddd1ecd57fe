package info.isaksson.erland.yangprinter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A list node. Keys refer to leaf children of this list; their order is the key order.
 */
public final class ListNode extends InteriorNode {

    public final List<Typedef> typedefs = new ArrayList<>();

    private final List<LeafNode> keys = new ArrayList<>();

    public ListNode(Module module, String name) {
        super(module, name);
    }

    @Override public NodeKind kind() {
        return NodeKind.LIST;
    }

    public List<LeafNode> keys() {
        return Collections.unmodifiableList(keys);
    }

    /** Append a key. The leaf must already be a child of this list. */
    public void addKey(LeafNode leaf) {
        Objects.requireNonNull(leaf, "leaf must not be null");
        if (leaf.parent() != this) {
            throw new IllegalArgumentException("key " + leaf.name() + " is not a child of list " + name());
        }
        keys.add(leaf);
    }
}
