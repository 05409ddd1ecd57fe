package info.isaksson.erland.yangprinter.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaNodeTest {

    private final Module module = new Module("m", "urn:m", "m");

    @Test
    void rootNodesHaveNoParentAndChildrenPointBack() {
        ContainerNode root = module.addData(new ContainerNode(module, "top"));
        LeafNode leaf = root.addChild(new LeafNode(module, "name", TypeRef.builtin(BaseType.STRING)));

        assertTrue(root.isRoot());
        assertNull(root.parent());
        assertFalse(leaf.isRoot());
        assertSame(root, leaf.parent());
        assertEquals(List.of(leaf), root.children());
    }

    @Test
    void effectiveConfigInheritsUntilOverridden() {
        ContainerNode root = module.addData(new ContainerNode(module, "top"));
        ContainerNode inner = root.addChild(new ContainerNode(module, "inner"));
        LeafNode leaf = inner.addChild(new LeafNode(module, "x", TypeRef.builtin(BaseType.INT32)));

        assertNull(leaf.effectiveConfig(), "nothing set anywhere");

        root.setConfig(true);
        assertNull(leaf.config());
        assertEquals(Boolean.TRUE, leaf.effectiveConfig());

        inner.setConfig(false);
        assertEquals(Boolean.TRUE, root.effectiveConfig());
        assertEquals(Boolean.FALSE, inner.effectiveConfig());
        assertEquals(Boolean.FALSE, leaf.effectiveConfig());
    }

    @Test
    void nodeCannotBeAttachedTwice() {
        ContainerNode a = new ContainerNode(module, "a");
        ContainerNode b = new ContainerNode(module, "b");
        LeafNode leaf = a.addChild(new LeafNode(module, "x", TypeRef.builtin(BaseType.STRING)));

        assertThrows(IllegalStateException.class, () -> b.addChild(leaf));
        assertThrows(IllegalArgumentException.class, () -> module.addData(leaf));
    }

    @Test
    void listKeysKeepDeclarationOrderAndMustBeChildren() {
        ListNode list = new ListNode(module, "user");
        LeafNode a = list.addChild(new LeafNode(module, "a", TypeRef.builtin(BaseType.STRING)));
        LeafNode b = list.addChild(new LeafNode(module, "b", TypeRef.builtin(BaseType.STRING)));
        list.addKey(b);
        list.addKey(a);

        assertEquals(List.of(b, a), list.keys());

        LeafNode stranger = new LeafNode(module, "c", TypeRef.builtin(BaseType.STRING));
        assertThrows(IllegalArgumentException.class, () -> list.addKey(stranger));
    }

    @Test
    void typeRefQualifiesOnlyWithPrefix() {
        assertEquals("string", TypeRef.builtin(BaseType.STRING).qualifiedName());
        assertEquals("inet:host", TypeRef.derived("inet", "host", BaseType.UNION).qualifiedName());
        assertEquals("host", TypeRef.derived("", "host", BaseType.UNKNOWN).qualifiedName());
    }

    @Test
    void keywordsParse() {
        assertEquals(NodeKind.LEAF_LIST, NodeKind.fromKeyword("leaf-list"));
        assertEquals(Status.OBSOLETE, Status.fromKeyword("obsolete"));
        assertNull(Status.fromKeyword(null));
        assertEquals(YangVersion.V1_0, YangVersion.fromKeyword("1"));
        assertEquals(BaseType.IDENTITYREF, BaseType.fromKeyword("identityref"));
        assertNull(BaseType.builtin("my-type"));
        assertThrows(IllegalArgumentException.class, () -> NodeKind.fromKeyword("anyxml"));
    }
}
