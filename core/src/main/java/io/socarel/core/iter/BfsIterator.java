// file: src/main/java/io/socarel/core/iter/BfsIterator.java
package io.socarel.core.iter;

import io.socarel.core.Tree;
import io.socarel.core.content.NodeContent;

import java.util.ArrayDeque;

/**
 * Breadth first (level order) traversal with a FIFO queue of handles.
 * <p>
 * The inverse variant enqueues each node's children right to left, so every
 * level is still visited before the next one but siblings come out mirrored
 * per parent.
 */
public final class BfsIterator<C extends NodeContent> extends TreeCursor<C> {

    private final ArrayDeque<Integer> queue = new ArrayDeque<>();
    private final boolean leftToRight;

    public BfsIterator(Tree<C> tree, int start, boolean leftToRight) {
        super(tree);
        this.leftToRight = leftToRight;
        if (inRange(start)) queue.add(start);
    }

    @Override boolean hasMore() { return !queue.isEmpty(); }

    @Override int advance() {
        int current = queue.poll();
        addLast(queue, node(current), leftToRight);
        return current;
    }
}
