package io.socarel.core.forest;

import io.socarel.core.ErrorKind;
import io.socarel.core.SocarelException;
import io.socarel.core.Tree;
import io.socarel.core.content.WeightedContent;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ForestTest {

    private static void fails(ErrorKind kind, Runnable op) {
        var e = assertThrows(SocarelException.class, op::run);
        assertEquals(kind, e.kind(), e.getMessage());
        assertTrue(e.kind().isForestError());
    }

    @Test
    void create_then_create_again_fails() {
        var forest = Forest.raw();
        var tree = forest.create("x");

        assertTrue(tree.isEmpty());
        assertSame(tree, forest.get("x"));
        fails(ErrorKind.TREE_ID_ALREADY_EXISTS, () -> forest.create("x"));
        assertEquals(1, forest.size());
    }

    @Test
    void remove_then_get_fails_with_not_found() {
        var forest = Forest.raw();
        forest.create("x");
        forest.get("x").setRoot("root");

        var removed = forest.remove("x");
        assertEquals("root", removed.content(0).orElseThrow().value());
        fails(ErrorKind.TREE_NOT_FOUND, () -> forest.get("x"));
        fails(ErrorKind.TREE_NOT_FOUND, () -> forest.remove("x"));
        assertTrue(forest.isEmpty());
    }

    @Test
    void add_registers_a_caller_built_tree() {
        var forest = Forest.raw();
        var tree = Tree.raw();
        int root = tree.setRoot("root_node");
        tree.link("child_1", root);

        forest.add("my_tree", tree);
        assertEquals(2, forest.get("my_tree").size());
        fails(ErrorKind.TREE_ID_ALREADY_EXISTS, () -> forest.add("my_tree", Tree.raw()));
        assertSame(tree, forest.get("my_tree"));
    }

    @Test
    void one_tree_instance_is_held_under_one_id_only() {
        var forest = Forest.raw();
        var tree = forest.create("first");

        assertThrows(IllegalArgumentException.class, () -> forest.add("second", tree));
        assertFalse(forest.contains("second"));
        assertEquals(1, forest.size());

        // once removed, the instance may be registered again
        forest.remove("first");
        forest.add("second", tree);
        assertSame(tree, forest.get("second"));
    }

    @Test
    void get_mut_returns_the_live_tree() {
        var forest = Forest.raw();
        forest.create("t");
        int root = forest.getMut("t").setRoot("r");
        forest.getMut("t").link("c", root);
        assertEquals(2, forest.get("t").size());
    }

    @Test
    void unparsable_names_fail_before_lookup() {
        var forest = Forest.raw();
        fails(ErrorKind.TREE_ID_PARSE_FAILED, () -> forest.create(" "));
        fails(ErrorKind.TREE_ID_PARSE_FAILED, () -> forest.get(""));
        fails(ErrorKind.TREE_ID_PARSE_FAILED, () -> forest.remove("   "));
        fails(ErrorKind.TREE_ID_PARSE_FAILED, () -> forest.add("", Tree.raw()));
        assertTrue(forest.isEmpty());
    }

    @Test
    void custom_identifier_parser_normalizes_keys() {
        TreeId.Parser<RawTreeId> lowerCase = name -> new RawTreeId(name.trim().toLowerCase());
        var forest = new Forest<>(lowerCase, WeightedContent.PARSER);

        forest.create("Routes");
        assertTrue(forest.contains(" routes "));
        fails(ErrorKind.TREE_ID_ALREADY_EXISTS, () -> forest.create("ROUTES"));

        forest.get("routes").setRoot("0:hub");
        assertEquals(0, forest.get("ROUTES").content(0).orElseThrow().weight());
    }

    @Test
    void iterate_enumerates_every_tree_read_only() {
        var forest = Forest.raw();
        forest.create("a");
        forest.create("b");
        forest.create("c");

        Set<String> seen = new HashSet<>();
        for (var e : forest.iterate()) {
            seen.add(e.getKey().id());
            assertNotNull(e.getValue());
        }
        assertEquals(Set.of("a", "b", "c"), seen);
        assertEquals(3, forest.ids().size());

        var entry = forest.iterate().iterator().next();
        assertThrows(UnsupportedOperationException.class, () -> entry.setValue(Tree.raw()));
        assertThrows(UnsupportedOperationException.class, () -> forest.iterate().clear());
    }

    @Test
    void raw_tree_ids_compare_by_id() {
        var a = new RawTreeId("same");
        var b = new RawTreeId("same");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new RawTreeId("other"));
        assertNotEquals(a, "same");
        assertThrows(IllegalArgumentException.class, () -> new RawTreeId(null));
    }
}
