// file: src/main/java/io/socarel/core/Regenerated.java
package io.socarel.core;

import io.socarel.core.content.NodeContent;

import java.util.OptionalInt;

/**
 * Result of {@link Tree#regenerate()}: the compacted tree plus the
 * translation from old handles to new ones.
 */
public final class Regenerated<C extends NodeContent> {

    static final int PRUNED = -1;

    private final Tree<C> tree;
    private final int[] mapping; // old handle -> new handle, or PRUNED

    Regenerated(Tree<C> tree, int[] mapping) {
        this.tree = tree;
        this.mapping = mapping;
    }

    public Tree<C> tree() { return tree; }

    /** New handle of an old one; empty if it was pruned or never existed. */
    public OptionalInt newHandle(int oldHandle) {
        if (oldHandle < 0 || oldHandle >= mapping.length || mapping[oldHandle] == PRUNED) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(mapping[oldHandle]);
    }

    /** Number of nodes dropped by the rebuild. */
    public int prunedCount() {
        return mapping.length - tree.size();
    }
}
