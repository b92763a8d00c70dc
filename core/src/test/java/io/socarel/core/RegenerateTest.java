package io.socarel.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static io.socarel.core.TreeFixtures.names;
import static io.socarel.core.TreeFixtures.sample;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Compaction of pruned subtrees into a fresh arena.
 */
class RegenerateTest {

    @Test
    void regenerate_of_an_intact_tree_preserves_every_order() {
        var tree = sample();
        var regen = tree.regenerate();
        var fresh = regen.tree();

        assertEquals(8, fresh.size());
        assertEquals(0, regen.prunedCount());
        assertEquals(names(tree.iterators().bfs()), names(fresh.iterators().bfs()));
        assertEquals(names(tree.iterators().preDfs()), names(fresh.iterators().preDfs()));
        assertEquals(names(tree.iterators().postDfs()), names(fresh.iterators().postDfs()));
        assertEquals(names(tree.iterators().inDfs()), names(fresh.iterators().inDfs()));
    }

    @Test
    void regenerate_drops_pruned_nodes_and_renumbers_in_bfs_order() {
        var tree = sample();
        tree.unlink(1); // B, D, E, H

        var regen = tree.regenerate();
        var fresh = regen.tree();

        assertEquals(4, fresh.size());
        assertEquals(4, regen.prunedCount());
        assertEquals(List.of("A", "C", "F", "G"), names(fresh.iterators().sequential()));
        assertEquals(names(tree.iterators().preDfs()), names(fresh.iterators().preDfs()));

        assertEquals(OptionalInt.of(0), regen.newHandle(0));
        assertEquals(OptionalInt.of(1), regen.newHandle(2));
        assertEquals(OptionalInt.of(3), regen.newHandle(6));
        assertTrue(regen.newHandle(1).isEmpty());
        assertTrue(regen.newHandle(7).isEmpty());
        assertTrue(regen.newHandle(42).isEmpty());
    }

    @Test
    void regenerated_tree_has_no_tombstones_and_valid_links() {
        var tree = sample();
        tree.unlink(3);
        tree.unlink(5);
        var fresh = tree.regenerate().tree();

        for (int handle = 0; handle < fresh.size(); handle++) {
            var node = fresh.node(handle).orElseThrow();
            assertEquals(node.childCount(), node.childSlotCount(), "tombstones under " + handle);
            assertTrue(fresh.isLinked(handle));
        }
        assertEquals(OptionalInt.of(fresh.size() - 1), fresh.findPath(0, "B", "E", "H"));
        assertEquals(4, fresh.node(fresh.size() - 1).orElseThrow().level());
    }

    @Test
    void source_tree_is_left_untouched_and_fresh_tree_stays_mutable() {
        var tree = sample();
        tree.unlink(2);
        var fresh = tree.regenerate().tree();

        assertEquals(8, tree.size());
        assertTrue(tree.content(2).isPresent());

        int c = fresh.link("C", 0);
        assertEquals(OptionalInt.of(c), fresh.findPath(0, "C"));
        assertTrue(tree.findPath(0, "C").isEmpty());
    }

    @Test
    void regenerate_of_empty_tree_is_empty() {
        var regen = Tree.raw().regenerate();
        assertTrue(regen.tree().isEmpty());
        assertEquals(0, regen.prunedCount());
    }
}
