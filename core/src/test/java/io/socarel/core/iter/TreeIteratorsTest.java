package io.socarel.core.iter;

import io.socarel.core.Tree;
import io.socarel.core.Visit;
import io.socarel.core.content.RawContent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

import static io.socarel.core.TreeFixtures.handles;
import static io.socarel.core.TreeFixtures.names;
import static io.socarel.core.TreeFixtures.sample;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Visiting orders of every strategy over the sample tree
 * A -> (B -> (D, E -> H), C -> (F, G)).
 */
class TreeIteratorsTest {

    private static List<String> list(String csv) {
        return List.of(csv.split(","));
    }

    @Test
    void sequential_orders_follow_the_arena() {
        var it = sample().iterators();
        assertEquals(list("A,B,C,D,E,F,G,H"), names(it.sequential()));
        assertEquals(list("H,G,F,E,D,C,B,A"), names(it.inverseSequential()));
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7), handles(it.sequential()));
    }

    @Test
    void breadth_first_orders() {
        var it = sample().iterators();
        assertEquals(list("A,B,C,D,E,F,G,H"), names(it.bfs()));
        assertEquals(list("A,C,B,G,F,E,D,H"), names(it.inverseBfs()));
    }

    @Test
    void pre_order_depth_first_orders() {
        var it = sample().iterators();
        assertEquals(list("A,B,D,E,H,C,F,G"), names(it.preDfs()));
        assertEquals(list("A,C,G,F,B,E,H,D"), names(it.inversePreDfs()));
    }

    @Test
    void post_order_depth_first_orders() {
        var it = sample().iterators();
        assertEquals(list("D,H,E,B,F,G,C,A"), names(it.postDfs()));
        assertEquals(list("G,F,C,H,E,D,B,A"), names(it.inversePostDfs()));
    }

    @Test
    void in_order_visits_a_node_after_its_first_subtree() {
        var it = sample().iterators();
        assertEquals(list("D,B,H,E,A,F,C,G"), names(it.inDfs()));
        assertEquals(list("G,C,F,A,H,E,B,D"), names(it.inverseInDfs()));
    }

    @Test
    void children_lists_immediate_children_only() {
        var tree = sample();
        assertEquals(list("B,C"), names(tree.iterators().children()));
        assertEquals(list("D,E"), names(tree.iterators(1).children()));
        assertEquals(List.of(), names(tree.iterators(7).children()));
    }

    @Test
    void traversals_can_start_below_the_root() {
        var it = sample().iterators(1); // B
        assertEquals(list("B,D,E,H"), names(it.bfs()));
        assertEquals(list("B,E,D,H"), names(it.inverseBfs()));
        assertEquals(list("B,D,E,H"), names(it.preDfs()));
        assertEquals(list("D,H,E,B"), names(it.postDfs()));
        assertEquals(list("D,B,H,E"), names(it.inDfs()));
        assertEquals(list("B,C,D,E,F,G,H"), names(it.sequential()));
        assertEquals(list("B,A"), names(it.inverseSequential()));
    }

    @Test
    void single_node_and_empty_trees() {
        var single = Tree.raw();
        single.setRoot("only");
        var it = single.iterators();
        for (var order : List.of(it.sequential(), it.inverseSequential(), it.bfs(), it.inverseBfs(),
                it.preDfs(), it.inversePreDfs(), it.postDfs(), it.inversePostDfs(), it.inDfs(), it.inverseInDfs())) {
            assertEquals(List.of("only"), names(order));
        }
        assertEquals(List.of(), names(it.children()));

        var empty = Tree.raw().iterators();
        assertFalse(empty.bfs().iterator().hasNext());
        assertFalse(empty.inverseSequential().iterator().hasNext());
        assertFalse(empty.children().iterator().hasNext());
    }

    @Test
    void out_of_range_start_yields_nothing() {
        var tree = sample();
        for (int start : new int[] {8, -1, 1000, Integer.MIN_VALUE, Integer.MAX_VALUE}) {
            var it = tree.iterators(start);
            assertEquals(List.of(), names(it.sequential()));
            assertEquals(List.of(), names(it.inverseSequential()));
            assertEquals(List.of(), names(it.bfs()));
            assertEquals(List.of(), names(it.preDfs()));
            assertEquals(List.of(), names(it.postDfs()));
            assertEquals(List.of(), names(it.inDfs()));
            assertEquals(List.of(), names(it.children()));
            assertEquals(List.of(), names(it.inverseBfs()));
            assertEquals(List.of(), names(it.inversePreDfs()));
            assertEquals(List.of(), names(it.inversePostDfs()));
            assertEquals(List.of(), names(it.inverseInDfs()));
        }
    }

    @Test
    void pruned_subtrees_are_invisible_to_topological_orders_only() {
        var tree = sample();
        tree.unlink(4); // E, with H
        var it = tree.iterators();

        assertEquals(list("A,B,C,D,F,G"), names(it.bfs()));
        assertEquals(list("A,C,B,G,F,D"), names(it.inverseBfs()));
        assertEquals(list("A,B,D,C,F,G"), names(it.preDfs()));
        assertEquals(list("A,C,G,F,B,D"), names(it.inversePreDfs()));
        assertEquals(list("D,B,F,G,C,A"), names(it.postDfs()));
        assertEquals(list("G,F,C,D,B,A"), names(it.inversePostDfs()));
        assertEquals(list("D,B,A,F,C,G"), names(it.inDfs()));
        assertEquals(list("G,C,F,A,D,B"), names(it.inverseInDfs()));
        assertEquals(list("D"), names(tree.iterators(1).children()));

        // the raw arena still holds everything
        assertEquals(list("A,B,C,D,E,F,G,H"), names(it.sequential()));
        // and the pruned subtree can still be walked from its own root
        assertEquals(list("E,H"), names(tree.iterators(4).preDfs()));
    }

    @Test
    void each_iterable_hands_out_fresh_cursors() {
        var bfs = sample().iterators().bfs();
        assertEquals(names(bfs), names(bfs));
    }

    @Test
    void consuming_a_prefix_leaves_the_tree_usable() {
        var tree = sample();
        var cursor = tree.iterators().preDfs().iterator();
        assertEquals("A", cursor.next().content().value());
        assertEquals("B", cursor.next().content().value());

        tree.link("I", 7);
        assertEquals(9, tree.size());
        assertEquals(list("A,B,D,E,H,I,C,F,G"), names(tree.iterators().preDfs()));
    }

    @Test
    void exhausted_cursor_throws_no_such_element() {
        var tree = Tree.raw();
        tree.setRoot("r");
        var cursor = tree.iterators().postDfs().iterator();
        cursor.next();
        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
    }

    @Test
    void mutation_during_traversal_fails_fast() {
        var tree = sample();
        var cursor = tree.iterators().bfs().iterator();
        cursor.next();

        tree.link("I", 0);
        assertThrows(ConcurrentModificationException.class, cursor::hasNext);
        assertThrows(ConcurrentModificationException.class, cursor::next);
    }

    @Test
    void remove_is_not_supported() {
        var cursor = sample().iterators().bfs().iterator();
        cursor.next();
        assertThrows(UnsupportedOperationException.class, cursor::remove);
    }

    @Test
    void inverse_orders_equal_forward_orders_of_the_mirrored_tree() {
        var random = new Random(7);
        for (int round = 0; round < 20; round++) {
            var tree = randomTree(random, 60);
            var mirror = mirror(tree).iterators();
            var it = tree.iterators();
            assertEquals(names(mirror.inDfs()), names(it.inverseInDfs()), "in-order, round " + round);
            assertEquals(names(mirror.preDfs()), names(it.inversePreDfs()), "pre-order, round " + round);
            assertEquals(names(mirror.postDfs()), names(it.inversePostDfs()), "post-order, round " + round);
            assertEquals(names(mirror.bfs()), names(it.inverseBfs()), "bfs, round " + round);
        }
    }

    @Test
    void every_topological_order_visits_the_same_live_nodes() {
        var random = new Random(11);
        for (int round = 0; round < 20; round++) {
            var tree = randomTree(random, 80);
            // prune a few random subtrees
            for (int i = 0; i < 5; i++) {
                int handle = 1 + random.nextInt(tree.size() - 1);
                if (tree.isLinked(handle)) tree.unlink(handle);
            }
            var expected = new ArrayList<String>();
            for (var v : tree.iterators().sequential()) {
                if (tree.isLinked(v.handle())) expected.add(v.content().value());
            }
            Collections.sort(expected);

            var it = tree.iterators();
            for (var order : List.of(it.bfs(), it.inverseBfs(), it.preDfs(), it.inversePreDfs(),
                    it.postDfs(), it.inversePostDfs(), it.inDfs(), it.inverseInDfs())) {
                var seen = new ArrayList<>(names(order));
                Collections.sort(seen);
                assertEquals(expected, seen, "round " + round);
            }
        }
    }

    @Test
    void visit_exposes_node_and_handle() {
        var tree = sample();
        Visit<RawContent> last = null;
        for (var v : tree.iterators().postDfs()) {
            last = v;
        }
        assertNotNull(last);
        assertEquals(0, last.handle());
        assertSame(tree.node(0).orElseThrow(), last.node());
    }

    /** Same tree with every node's children linked right to left. */
    private static Tree<RawContent> mirror(Tree<RawContent> tree) {
        var out = Tree.raw();
        var mapping = new int[tree.size()];
        for (var v : tree.iterators().bfs()) {
            if (v.node().isRoot()) {
                mapping[v.handle()] = out.setRoot(v.content().value());
            }
            var children = v.node().children();
            for (int i = children.size() - 1; i >= 0; i--) {
                int child = children.get(i);
                mapping[child] = out.link(tree.content(child).orElseThrow().value(), mapping[v.handle()]);
            }
        }
        return out;
    }

    private static Tree<RawContent> randomTree(Random random, int size) {
        var tree = Tree.raw();
        tree.setRoot("n0");
        for (int i = 1; i < size; i++) {
            tree.link("n" + i, random.nextInt(i));
        }
        return tree;
    }
}
