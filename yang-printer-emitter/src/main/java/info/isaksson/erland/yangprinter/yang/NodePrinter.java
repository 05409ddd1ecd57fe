package info.isaksson.erland.yangprinter.yang;

import info.isaksson.erland.yangprinter.model.ChoiceNode;
import info.isaksson.erland.yangprinter.model.ContainerNode;
import info.isaksson.erland.yangprinter.model.GroupingNode;
import info.isaksson.erland.yangprinter.model.LeafListNode;
import info.isaksson.erland.yangprinter.model.LeafNode;
import info.isaksson.erland.yangprinter.model.ListNode;
import info.isaksson.erland.yangprinter.model.NodeKind;
import info.isaksson.erland.yangprinter.model.SchemaNode;
import info.isaksson.erland.yangprinter.model.Typedef;
import info.isaksson.erland.yangprinter.model.UsesNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Prints schema nodes. Each kind printer recurses into its children through
 * {@link #dispatch}, passing the set of kinds that may appear under it.
 */
final class NodePrinter {

    private static final Logger LOG = LoggerFactory.getLogger(NodePrinter.class);

    /** Kinds allowed under a module, container, list or grouping. */
    static final Set<NodeKind> DATA_DEF_KINDS = Collections.unmodifiableSet(EnumSet.of(
            NodeKind.CHOICE, NodeKind.CONTAINER, NodeKind.LEAF, NodeKind.LEAF_LIST,
            NodeKind.LIST, NodeKind.USES, NodeKind.GROUPING));

    /** Kinds allowed under a choice. */
    static final Set<NodeKind> CHOICE_KINDS = Collections.unmodifiableSet(EnumSet.of(
            NodeKind.CONTAINER, NodeKind.LEAF, NodeKind.LEAF_LIST, NodeKind.LIST));

    private NodePrinter() {}

    /** Print {@code node} if its kind is in {@code allowed}; otherwise print nothing. */
    static void dispatch(YangWriter w, SchemaNode node, Set<NodeKind> allowed) throws IOException {
        if (!allowed.contains(node.kind())) {
            LOG.debug("Skipping {} {}: not allowed here", node.kind().keyword, node.name());
            return;
        }
        switch (node.kind()) {
            case CONTAINER:
                printContainer(w, (ContainerNode) node);
                break;
            case CHOICE:
                printChoice(w, (ChoiceNode) node);
                break;
            case LEAF:
                printLeaf(w, (LeafNode) node);
                break;
            case LEAF_LIST:
                printLeafList(w, (LeafListNode) node);
                break;
            case LIST:
                printList(w, (ListNode) node);
                break;
            case GROUPING:
                printGrouping(w, (GroupingNode) node);
                break;
            case USES:
                printUses(w, (UsesNode) node);
                break;
        }
    }

    private static void printContainer(YangWriter w, ContainerNode node) throws IOException {
        YangWriter body = open(w, node);
        CommonPrinter.printCommonWithConfig(body, node);
        printTypedefs(body, node, node.typedefs);
        printChildren(body, node.children(), DATA_DEF_KINDS);
        w.emit("}");
    }

    private static void printChoice(YangWriter w, ChoiceNode node) throws IOException {
        YangWriter body = open(w, node);
        CommonPrinter.printCommonWithConfig(body, node);
        printChildren(body, node.children(), CHOICE_KINDS);
        w.emit("}");
    }

    private static void printLeaf(YangWriter w, LeafNode node) throws IOException {
        YangWriter body = open(w, node);
        CommonPrinter.printCommonWithConfig(body, node);
        TypePrinter.printType(body, node.module(), node.type());
        w.emit("}");
    }

    private static void printLeafList(YangWriter w, LeafListNode node) throws IOException {
        YangWriter body = open(w, node);
        CommonPrinter.printCommonWithConfig(body, node);
        TypePrinter.printType(body, node.module(), node.type());
        w.emit("}");
    }

    private static void printList(YangWriter w, ListNode node) throws IOException {
        YangWriter body = open(w, node);
        CommonPrinter.printCommonWithConfig(body, node);
        if (!node.keys().isEmpty()) {
            String keys = node.keys().stream().map(SchemaNode::name).collect(Collectors.joining(" "));
            body.emit("key " + YangWriter.quote(keys) + ";");
        }
        printTypedefs(body, node, node.typedefs);
        printChildren(body, node.children(), DATA_DEF_KINDS);
        w.emit("}");
    }

    private static void printGrouping(YangWriter w, GroupingNode node) throws IOException {
        YangWriter body = open(w, node);
        CommonPrinter.printCommon(body, node);
        printTypedefs(body, node, node.typedefs);
        printChildren(body, node.children(), DATA_DEF_KINDS);
        w.emit("}");
    }

    private static void printUses(YangWriter w, UsesNode node) throws IOException {
        YangWriter body = open(w, node);
        CommonPrinter.printCommon(body, node);
        w.emit("}");
    }

    /** Emit the block opening line and return the context for the block body. */
    private static YangWriter open(YangWriter w, SchemaNode node) throws IOException {
        w.emit(node.kind().keyword + " " + node.name() + " {");
        return w.nested();
    }

    private static void printTypedefs(YangWriter w, SchemaNode owner, List<Typedef> typedefs) throws IOException {
        for (Typedef tpdf : typedefs) {
            TypePrinter.printTypedef(w, owner.module(), tpdf);
        }
    }

    private static void printChildren(YangWriter w, List<SchemaNode> children, Set<NodeKind> allowed) throws IOException {
        for (SchemaNode child : children) {
            dispatch(w, child, allowed);
        }
    }
}
