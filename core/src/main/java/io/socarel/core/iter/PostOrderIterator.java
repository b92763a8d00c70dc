// file: src/main/java/io/socarel/core/iter/PostOrderIterator.java
package io.socarel.core.iter;

import io.socarel.core.Node;
import io.socarel.core.Tree;
import io.socarel.core.content.NodeContent;

import java.util.ArrayDeque;

/**
 * Post-order depth first traversal: subtrees first, then the node.
 * <p>
 * Stack of (handle, expanded) frames. A frame popped unexpanded is pushed
 * back as expanded with its children on top of it; a frame popped expanded
 * (or a leaf) is emitted.
 */
public final class PostOrderIterator<C extends NodeContent> extends TreeCursor<C> {

    private record Frame(int handle, boolean expanded) {}

    private final ArrayDeque<Frame> stack = new ArrayDeque<>();
    private final boolean leftToRight;

    public PostOrderIterator(Tree<C> tree, int start, boolean leftToRight) {
        super(tree);
        this.leftToRight = leftToRight;
        if (inRange(start)) stack.push(new Frame(start, false));
    }

    @Override boolean hasMore() { return !stack.isEmpty(); }

    @Override int advance() {
        while (true) {
            Frame frame = stack.pop();
            Node<C> node = node(frame.handle());
            if (frame.expanded() || node.childCount() == 0) {
                return frame.handle();
            }
            stack.push(new Frame(frame.handle(), true));
            int n = node.childSlotCount();
            for (int i = 0; i < n; i++) {
                int child = node.childSlot(leftToRight ? n - 1 - i : i);
                if (child != Node.SEVERED) stack.push(new Frame(child, false));
            }
        }
    }
}
