// file: src/main/java/io/socarel/core/iter/TreeCursor.java
package io.socarel.core.iter;

import io.socarel.core.Node;
import io.socarel.core.Tree;
import io.socarel.core.Visit;
import io.socarel.core.content.NodeContent;

import java.util.ConcurrentModificationException;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Base for all traversal strategies.
 * <p>
 * A cursor reads the tree's arena directly, it never copies it, so the tree
 * must not be modified while the cursor is in use. Any mutation is detected
 * on the next hasNext()/next() call and reported as
 * {@link ConcurrentModificationException}.
 * <p>
 * Cursors are single pass. Stopping early is always safe.
 */
abstract class TreeCursor<C extends NodeContent> implements Iterator<Visit<C>> {

    protected final Tree<C> tree;
    private final int expectedVersion;

    TreeCursor(Tree<C> tree) {
        this.tree = tree;
        this.expectedVersion = tree.version();
    }

    /** True if another handle can be produced. May adjust internal state. */
    abstract boolean hasMore();

    /** Produce the next handle. Only called after hasMore() returned true. */
    abstract int advance();

    @Override
    public final boolean hasNext() {
        checkForComodification();
        return hasMore();
    }

    @Override
    public final Visit<C> next() {
        checkForComodification();
        if (!hasMore()) throw new NoSuchElementException();
        int handle = advance();
        return new Visit<>(node(handle), handle);
    }

    final Node<C> node(int handle) {
        return tree.node(handle).orElseThrow(() -> new IllegalStateException("broken handle: " + handle));
    }

    final boolean inRange(int handle) {
        return handle >= 0 && handle < tree.size();
    }

    /**
     * Push live children of {@code node} onto {@code deque}'s tail, in sibling
     * order when {@code leftToRight}, reversed otherwise.
     */
    static void addLast(Deque<Integer> deque, Node<?> node, boolean leftToRight) {
        int n = node.childSlotCount();
        for (int i = 0; i < n; i++) {
            int child = node.childSlot(leftToRight ? i : n - 1 - i);
            if (child != Node.SEVERED) deque.addLast(child);
        }
    }

    private void checkForComodification() {
        if (tree.version() != expectedVersion) {
            throw new ConcurrentModificationException("tree modified during traversal");
        }
    }
}
