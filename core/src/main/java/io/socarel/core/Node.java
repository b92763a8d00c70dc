// file: src/main/java/io/socarel/core/Node.java
package io.socarel.core;

import io.socarel.core.content.NodeContent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * One slot of a tree's node arena.
 * <p>
 * A node knows nothing about other nodes beyond their handles:
 *  - parent:           handle of the parent, or NONE for the root.
 *  - childSlots:       child handles in insertion (sibling) order. Unlinked
 *                      children leave a {@link #SEVERED} tombstone behind,
 *                      so the positions of the remaining siblings never move.
 *  - childIndex:       child name (content value) -> handle, for O(1) lookup.
 *  - positionInParent: index of this node inside its parent's childSlots.
 * <p>
 * Mutators are package-private: only {@link Tree} changes linkage, which is
 * what keeps parent.childSlots[positionInParent] == handle for linked nodes.
 */
public final class Node<C extends NodeContent> {

    /** Tombstone left in a child slot by unlink. */
    public static final int SEVERED = -1;

    static final int NONE = -1;

    private C content;
    private final int level;
    private final int parent;
    private final int positionInParent;

    private final List<Integer> childSlots = new ArrayList<>();
    private final Map<String, Integer> childIndex = new HashMap<>();
    private int liveChildren;

    Node(C content, int level, int parent, int positionInParent) {
        this.content = Objects.requireNonNull(content, "content");
        this.level = level;
        this.parent = parent;
        this.positionInParent = positionInParent;
    }

    static <C extends NodeContent> Node<C> root(C content) {
        return new Node<>(content, 1, NONE, NONE);
    }

    public C content() { return content; }

    /** Depth from the root; the root is level 1. */
    public int level() { return level; }

    public boolean isRoot() { return parent == NONE; }

    public OptionalInt parent() {
        return parent == NONE ? OptionalInt.empty() : OptionalInt.of(parent);
    }

    public OptionalInt positionInParent() {
        return positionInParent == NONE ? OptionalInt.empty() : OptionalInt.of(positionInParent);
    }

    /** Live children, left to right. Tombstones are skipped. */
    public List<Integer> children() {
        if (liveChildren == childSlots.size()) {
            return Collections.unmodifiableList(childSlots);
        }
        List<Integer> live = new ArrayList<>(liveChildren);
        for (int h : childSlots) {
            if (h != SEVERED) live.add(h);
        }
        return Collections.unmodifiableList(live);
    }

    /** Number of live children. */
    public int childCount() { return liveChildren; }

    /** Number of child slots ever used, tombstones included. */
    public int childSlotCount() { return childSlots.size(); }

    /** Raw child slot: a child handle or {@link #SEVERED}. */
    public int childSlot(int position) { return childSlots.get(position); }

    /** O(1) lookup of a live child by name. */
    public OptionalInt child(String name) {
        Integer h = childIndex.get(name);
        return h == null ? OptionalInt.empty() : OptionalInt.of(h);
    }

    // ---------- linkage (Tree only) ----------

    void setContent(C content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    void addChild(String name, int handle) {
        childSlots.add(handle);
        childIndex.put(name, handle);
        liveChildren++;
    }

    /**
     * Sever the child at {@code position}. The name entry is dropped only
     * when it still points at the severed handle.
     */
    void removeChild(String name, int position) {
        int handle = childSlots.get(position);
        if (handle == SEVERED) return;
        childSlots.set(position, SEVERED);
        childIndex.remove(name, handle);
        liveChildren--;
    }

    int updateChild(String oldName, String newName) {
        Integer handle = childIndex.get(oldName);
        if (handle == null) {
            throw new SocarelException(ErrorKind.CHILD_NOT_FOUND, "child not found: " + oldName);
        }
        childIndex.remove(oldName);
        childIndex.put(newName, handle);
        return handle;
    }

    int rawParent() { return parent; }

    int rawPositionInParent() { return positionInParent; }

    @Override
    public String toString() {
        return "Node{" +
                "content=" + content.serialize() +
                ", level=" + level +
                ", parent=" + (parent == NONE ? "-" : parent) +
                ", children=" + childSlots +
                '}';
    }
}
