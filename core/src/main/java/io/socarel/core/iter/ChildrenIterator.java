// file: src/main/java/io/socarel/core/iter/ChildrenIterator.java
package io.socarel.core.iter;

import io.socarel.core.Node;
import io.socarel.core.Tree;
import io.socarel.core.content.NodeContent;

/**
 * Immediate live children of one node, left to right.
 */
public final class ChildrenIterator<C extends NodeContent> extends TreeCursor<C> {

    private final Node<C> parent; // null when the start handle is out of range
    private int slot;

    public ChildrenIterator(Tree<C> tree, int start) {
        super(tree);
        this.parent = inRange(start) ? node(start) : null;
    }

    @Override boolean hasMore() {
        if (parent == null) return false;
        while (slot < parent.childSlotCount() && parent.childSlot(slot) == Node.SEVERED) {
            slot++;
        }
        return slot < parent.childSlotCount();
    }

    @Override int advance() {
        return parent.childSlot(slot++);
    }
}
