// file: src/main/java/io/socarel/core/iter/SequentialIterator.java
package io.socarel.core.iter;

import io.socarel.core.Tree;
import io.socarel.core.content.NodeContent;

/**
 * Walks the arena by index, ascending or descending.
 * <p>
 * This is a view of the raw storage: unlinked (pruned) nodes are yielded
 * too. Useful for diagnostics and for bulk scans where topology does not
 * matter.
 */
public final class SequentialIterator<C extends NodeContent> extends TreeCursor<C> {

    private final int step;
    private int position;

    public SequentialIterator(Tree<C> tree, int start, boolean ascending) {
        super(tree);
        this.step = ascending ? 1 : -1;
        this.position = start;
    }

    @Override boolean hasMore() { return inRange(position); }

    @Override int advance() {
        int current = position;
        position += step;
        return current;
    }
}
