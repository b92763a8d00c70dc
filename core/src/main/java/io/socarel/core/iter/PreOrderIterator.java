// file: src/main/java/io/socarel/core/iter/PreOrderIterator.java
package io.socarel.core.iter;

import io.socarel.core.Node;
import io.socarel.core.Tree;
import io.socarel.core.content.NodeContent;

import java.util.ArrayDeque;

/**
 * Pre-order depth first traversal: a node, then its subtrees.
 * <p>
 * LIFO stack of handles. For left-to-right order the children are pushed
 * in reverse so the leftmost one is popped first; the inverse variant pushes
 * them in sibling order.
 */
public final class PreOrderIterator<C extends NodeContent> extends TreeCursor<C> {

    private final ArrayDeque<Integer> stack = new ArrayDeque<>();
    private final boolean leftToRight;

    public PreOrderIterator(Tree<C> tree, int start, boolean leftToRight) {
        super(tree);
        this.leftToRight = leftToRight;
        if (inRange(start)) stack.push(start);
    }

    @Override boolean hasMore() { return !stack.isEmpty(); }

    @Override int advance() {
        int current = stack.pop();
        Node<C> node = node(current);
        int n = node.childSlotCount();
        for (int i = 0; i < n; i++) {
            int child = node.childSlot(leftToRight ? n - 1 - i : i);
            if (child != Node.SEVERED) stack.push(child);
        }
        return current;
    }
}
