// file: src/main/java/io/socarel/core/iter/InOrderIterator.java
package io.socarel.core.iter;

import io.socarel.core.Tree;
import io.socarel.core.content.NodeContent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * In-order depth first traversal generalized to n-ary trees.
 * <p>
 * A node is visited after the subtree of its first child and before the
 * subtrees of the remaining children; a leaf is visited on arrival. With at
 * most two children per node this is the classic binary in-order walk.
 * <p>
 * The inverse variant takes children right to left: it walks the mirror
 * image of the tree, visiting a node after its last child's subtree.
 */
public final class InOrderIterator<C extends NodeContent> extends TreeCursor<C> {

    private static final class Frame {
        final int handle;
        final List<Integer> children;
        int next;         // next child to descend into
        boolean visited;

        Frame(int handle, List<Integer> children) {
            this.handle = handle;
            this.children = children;
        }

        boolean exhausted() {
            return visited && next >= children.size();
        }
    }

    private final ArrayDeque<Frame> stack = new ArrayDeque<>();
    private final boolean leftToRight;

    public InOrderIterator(Tree<C> tree, int start, boolean leftToRight) {
        super(tree);
        this.leftToRight = leftToRight;
        if (inRange(start)) stack.push(frame(start));
    }

    @Override boolean hasMore() {
        // Any frame left after this is either unvisited or still has a
        // child subtree to descend into, so it will produce a handle.
        while (!stack.isEmpty() && stack.peek().exhausted()) {
            stack.pop();
        }
        return !stack.isEmpty();
    }

    @Override int advance() {
        while (true) {
            Frame top = stack.peek();
            if (!top.visited && (top.next >= 1 || top.children.isEmpty())) {
                top.visited = true;
                if (top.children.isEmpty()) stack.pop();
                return top.handle;
            }
            if (top.next < top.children.size()) {
                stack.push(frame(top.children.get(top.next++)));
            } else {
                stack.pop();
            }
        }
    }

    private Frame frame(int handle) {
        List<Integer> children = node(handle).children();
        if (!leftToRight) {
            List<Integer> reversed = new ArrayList<>(children.size());
            for (int i = children.size() - 1; i >= 0; i--) reversed.add(children.get(i));
            children = reversed;
        }
        return new Frame(handle, children);
    }
}
