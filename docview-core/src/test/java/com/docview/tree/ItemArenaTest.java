package com.docview.tree;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ItemArenaTest {

    private static final class Node extends TreeItem<Node> {
        Node(ItemArena<Node> arena, int id, int parentId) {
            super(arena, id, parentId);
        }

        void add(Node child) {
            appendChild(child);
        }

        @Override
        public String key() {
            return "n" + id();
        }

        @Override
        public Object value() {
            return null;
        }

        @Override
        public String typeName() {
            return "node";
        }

        @Override
        public String path() {
            return parent() == null ? "" : parent().path() + "/" + key();
        }

        @Override
        public String serialize() {
            return key();
        }
    }

    @Test
    @DisplayName("Items get dense ids starting at the root")
    void testAllocate_AssignsDenseIds() {
        ItemArena<Node> arena = new ItemArena<>(10);
        Node root = arena.allocate(id -> new Node(arena, id, TreeItem.NO_PARENT));
        Node a = arena.allocate(id -> new Node(arena, id, root.id()));
        Node b = arena.allocate(id -> new Node(arena, id, root.id()));
        root.add(a);
        root.add(b);

        assertEquals(0, root.id());
        assertSame(root, arena.root());
        assertEquals(3, arena.size());
        assertEquals(2, root.childCount());
        assertSame(b, root.child(1));
        assertNull(root.child(2));
        assertNull(root.child(-1));
        assertSame(root, a.parent());
        assertEquals(0, a.row());
        assertEquals(1, b.row());
        assertFalse(a.isLastChild());
        assertTrue(b.isLastChild());
        assertTrue(root.isLastChild());
        assertTrue(root.isExpandable());
        assertFalse(a.isExpandable());
        assertEquals("/n2", b.path());
    }

    @Test
    @DisplayName("A full arena refuses further allocations")
    void testAllocate_WhenFull_Throws() {
        ItemArena<Node> arena = new ItemArena<>(2);
        arena.allocate(id -> new Node(arena, id, TreeItem.NO_PARENT));
        assertFalse(arena.isFull());
        arena.allocate(id -> new Node(arena, id, 0));
        assertTrue(arena.isFull());

        assertThrows(IllegalStateException.class, () -> arena.allocate(id -> new Node(arena, id, 0)));
        assertEquals(2, arena.size());
    }

    @Test
    @DisplayName("An item carrying the wrong id is rejected")
    void testAllocate_WrongId_Throws() {
        ItemArena<Node> arena = new ItemArena<>(5);
        assertThrows(IllegalStateException.class, () -> arena.allocate(id -> new Node(arena, id + 1, TreeItem.NO_PARENT)));
        assertEquals(0, arena.size());
    }

    @Test
    @DisplayName("Only direct children can be appended")
    void testAppendChild_ForeignItem_Throws() {
        ItemArena<Node> arena = new ItemArena<>(5);
        Node root = arena.allocate(id -> new Node(arena, id, TreeItem.NO_PARENT));
        Node a = arena.allocate(id -> new Node(arena, id, root.id()));
        Node grandchild = arena.allocate(id -> new Node(arena, id, a.id()));

        assertThrows(IllegalArgumentException.class, () -> root.add(grandchild));
        assertThrows(IllegalArgumentException.class, () -> new ItemArena<Node>(0));
    }
}
