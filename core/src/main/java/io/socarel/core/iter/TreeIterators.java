// file: src/main/java/io/socarel/core/iter/TreeIterators.java
package io.socarel.core.iter;

import io.socarel.core.Tree;
import io.socarel.core.Visit;
import io.socarel.core.content.NodeContent;

import java.util.Objects;

/**
 * Entry point to every traversal strategy of a tree.
 * <p>
 * Each method returns an {@link Iterable} so it can drive a for-each loop;
 * every {@code iterator()} call hands out a fresh single-pass cursor.
 * <p>
 * Strategies:
 *  - sequential / inverseSequential: arena order, pruned nodes included.
 *  - bfs / inverseBfs:               level order.
 *  - preDfs / inversePreDfs:         node before its subtrees.
 *  - postDfs / inversePostDfs:       subtrees before the node.
 *  - inDfs / inverseInDfs:           node after its first subtree.
 *  - children:                       immediate children only.
 * The "inverse" variants take siblings right to left. Only the two
 * sequential strategies can see nodes that were unlinked.
 * <p>
 * The start node defaults to the root (the last arena slot for
 * inverseSequential). A start handle outside the arena yields nothing.
 */
public final class TreeIterators<C extends NodeContent> {

    private final Tree<C> tree;
    private final int start;
    // false: each strategy picks its own default start
    private final boolean explicitStart;

    public TreeIterators(Tree<C> tree) {
        this(tree, Tree.ROOT, false);
    }

    public TreeIterators(Tree<C> tree, int start) {
        this(tree, start, true);
    }

    private TreeIterators(Tree<C> tree, int start, boolean explicitStart) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.start = start;
        this.explicitStart = explicitStart;
    }

    public Iterable<Visit<C>> sequential() {
        return () -> new SequentialIterator<>(tree, startOr(Tree.ROOT), true);
    }

    public Iterable<Visit<C>> inverseSequential() {
        // resolved per cursor: the arena may have grown since this view was made
        return () -> new SequentialIterator<>(tree, startOr(tree.size() - 1), false);
    }

    public Iterable<Visit<C>> bfs() {
        return () -> new BfsIterator<>(tree, startOr(Tree.ROOT), true);
    }

    public Iterable<Visit<C>> inverseBfs() {
        return () -> new BfsIterator<>(tree, startOr(Tree.ROOT), false);
    }

    public Iterable<Visit<C>> preDfs() {
        return () -> new PreOrderIterator<>(tree, startOr(Tree.ROOT), true);
    }

    public Iterable<Visit<C>> inversePreDfs() {
        return () -> new PreOrderIterator<>(tree, startOr(Tree.ROOT), false);
    }

    public Iterable<Visit<C>> postDfs() {
        return () -> new PostOrderIterator<>(tree, startOr(Tree.ROOT), true);
    }

    public Iterable<Visit<C>> inversePostDfs() {
        return () -> new PostOrderIterator<>(tree, startOr(Tree.ROOT), false);
    }

    public Iterable<Visit<C>> inDfs() {
        return () -> new InOrderIterator<>(tree, startOr(Tree.ROOT), true);
    }

    public Iterable<Visit<C>> inverseInDfs() {
        return () -> new InOrderIterator<>(tree, startOr(Tree.ROOT), false);
    }

    public Iterable<Visit<C>> children() {
        return () -> new ChildrenIterator<>(tree, startOr(Tree.ROOT));
    }

    private int startOr(int fallback) {
        return explicitStart ? start : fallback;
    }
}
