// file: src/main/java/io/socarel/core/Tree.java
package io.socarel.core;

import io.socarel.core.content.NodeContent;
import io.socarel.core.content.RawContent;
import io.socarel.core.iter.TreeIterators;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/**
 * N-ary tree stored in a node arena.
 * <p>
 * Nodes live in a growable array and refer to each other only by handle
 * (array index). The root always sits at handle 0.
 * <p>
 * Lifecycle:
 *  - created empty,
 *  - setRoot() establishes the root exactly once,
 *  - every other node is created by link() under an existing node,
 *  - unlink() disconnects a node from its parent but never removes it from
 *    the arena: the node and its subtree stay indexable by handle, they are
 *    just unreachable from the root. The arena never shrinks.
 * <p>
 * Unlink is O(1) instead of a recursive O(k) delete of the subtree; memory
 * held by pruned subtrees is reclaimed only by an explicit {@link #regenerate()}.
 * <p>
 * Sibling names (content values) are unique among live children of a node:
 * link() and updateContent() reject a name that a live sibling already uses.
 * <p>
 * Not thread safe. Iterators obtained from {@link #iterators()} fail fast with
 * {@link java.util.ConcurrentModificationException} if the tree is structurally
 * modified while they are in use.
 */
public final class Tree<C extends NodeContent> {
    private static final Logger log = Logger.getLogger(Tree.class.getName());

    public static final int ROOT = 0;

    private final NodeContent.Parser<C> parser;
    private final List<Node<C>> nodes = new ArrayList<>();

    // Bumped on every mutation; iterators compare against it.
    private int version;

    public Tree(NodeContent.Parser<C> parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /** Tree whose nodes hold their raw input strings. */
    public static Tree<RawContent> raw() {
        return new Tree<>(RawContent.PARSER);
    }

    public NodeContent.Parser<C> parser() { return parser; }

    // ---------- mutation ----------

    /**
     * Create the root node.
     *
     * @return the root handle, always {@link #ROOT}
     * @throws SocarelException ROOT_ALREADY_EXISTS, CONTENT_PARSE_FAILED
     */
    public int setRoot(String raw) {
        if (!nodes.isEmpty()) {
            throw new SocarelException(ErrorKind.ROOT_ALREADY_EXISTS, "root already exists");
        }
        C content = parse(raw);
        nodes.add(Node.root(content));
        version++;
        log.fine(() -> "root set: " + content.value());
        return ROOT;
    }

    /**
     * Create a node and attach it as the last child of {@code parent}.
     * Linking under a pruned node is allowed; the new node is pruned with it.
     *
     * @return handle of the new node (the previous arena size)
     * @throws SocarelException PARENT_NOT_FOUND, CONTENT_PARSE_FAILED, CHILD_ALREADY_EXISTS
     */
    public int link(String raw, int parent) {
        if (!inRange(parent)) {
            throw new SocarelException(ErrorKind.PARENT_NOT_FOUND, "parent not found: " + parent);
        }
        C content = parse(raw);
        Node<C> p = nodes.get(parent);
        if (p.child(content.value()).isPresent()) {
            throw new SocarelException(
                    ErrorKind.CHILD_ALREADY_EXISTS,
                    "node " + parent + " already has a child named \"" + content.value() + "\"");
        }
        int handle = attach(content, parent);
        log.fine(() -> "linked " + handle + " (" + content.value() + ") under " + parent);
        return handle;
    }

    /**
     * Disconnect a node from its parent. The node and its descendants stay in
     * the arena and keep their handles; {@link #size()} does not change.
     *
     * @return the unlinked handle
     * @throws SocarelException CHILD_NOT_FOUND if the handle is out of range,
     *         is the root, or is already unlinked
     */
    public int unlink(int handle) {
        if (!inRange(handle)) {
            throw new SocarelException(ErrorKind.CHILD_NOT_FOUND, "node not found: " + handle);
        }
        Node<C> node = nodes.get(handle);
        if (node.isRoot()) {
            throw new SocarelException(ErrorKind.CHILD_NOT_FOUND, "root node has no parent");
        }
        Node<C> parent = nodes.get(node.rawParent());
        int position = node.rawPositionInParent();
        if (parent.childSlot(position) != handle) {
            throw new SocarelException(ErrorKind.CHILD_NOT_FOUND, "node already unlinked: " + handle);
        }
        parent.removeChild(node.content().value(), position);
        version++;
        log.fine(() -> "unlinked " + handle + " from " + node.rawParent());
        return handle;
    }

    /**
     * Replace a node's content, keeping its position, level and children.
     * The parent's child index is re-keyed from the old value to the new one.
     *
     * @return the updated handle
     * @throws SocarelException CHILD_NOT_FOUND (out of range or not linked to its
     *         parent), CONTENT_PARSE_FAILED, CHILD_ALREADY_EXISTS
     */
    public int updateContent(String raw, int handle) {
        if (!inRange(handle)) {
            throw new SocarelException(ErrorKind.CHILD_NOT_FOUND, "node not found: " + handle);
        }
        C content = parse(raw);
        Node<C> node = nodes.get(handle);
        String oldName = node.content().value();
        String newName = content.value();

        if (!node.isRoot()) {
            Node<C> parent = nodes.get(node.rawParent());
            if (parent.childSlot(node.rawPositionInParent()) != handle) {
                throw new SocarelException(ErrorKind.CHILD_NOT_FOUND, "child not found: " + oldName);
            }
            if (!oldName.equals(newName)) {
                if (parent.child(newName).isPresent()) {
                    throw new SocarelException(
                            ErrorKind.CHILD_ALREADY_EXISTS,
                            "node " + node.rawParent() + " already has a child named \"" + newName + "\"");
                }
                parent.updateChild(oldName, newName);
            }
        }
        node.setContent(content);
        version++;
        log.fine(() -> "updated " + handle + ": " + oldName + " -> " + newName);
        return handle;
    }

    // ---------- lookup ----------

    /**
     * Follow {@code path} from {@code start}, one child name per hop.
     * The path does not include the start node's own name; an empty path
     * resolves to {@code start} itself. O(path length).
     */
    public OptionalInt findPath(int start, List<String> path) {
        Objects.requireNonNull(path, "path");
        if (!inRange(start)) return OptionalInt.empty();
        int current = start;
        for (String name : path) {
            OptionalInt next = nodes.get(current).child(name);
            if (next.isEmpty()) return OptionalInt.empty();
            current = next.getAsInt();
        }
        return OptionalInt.of(current);
    }

    public OptionalInt findPath(int start, String... path) {
        return findPath(start, Arrays.asList(path));
    }

    public Optional<C> content(int handle) {
        return inRange(handle) ? Optional.of(nodes.get(handle).content()) : Optional.empty();
    }

    public Optional<Node<C>> node(int handle) {
        return inRange(handle) ? Optional.of(nodes.get(handle)) : Optional.empty();
    }

    /** Arena size: every node ever created, pruned ones included. */
    public int size() { return nodes.size(); }

    public boolean isEmpty() { return nodes.isEmpty(); }

    /**
     * True when {@code handle} is reachable from the root through live links.
     * O(depth).
     */
    public boolean isLinked(int handle) {
        if (!inRange(handle)) return false;
        int current = handle;
        Node<C> node = nodes.get(current);
        while (!node.isRoot()) {
            Node<C> parent = nodes.get(node.rawParent());
            if (parent.childSlot(node.rawPositionInParent()) != current) return false;
            current = node.rawParent();
            node = parent;
        }
        return current == ROOT;
    }

    // ---------- traversal ----------

    /** Traversals starting at the root (inverse sequential: at the last node). */
    public TreeIterators<C> iterators() {
        return new TreeIterators<>(this);
    }

    /** Traversals starting at {@code start}. */
    public TreeIterators<C> iterators(int start) {
        return new TreeIterators<>(this, start);
    }

    /**
     * Changes on every mutation. Iterators record it when created and fail
     * fast once it moves.
     */
    public int version() { return version; }

    // ---------- compaction ----------

    /**
     * Rebuild the live part of this tree into a fresh arena.
     * <p>
     * Live nodes are copied breadth first from the root, so handles are
     * renumbered in BFS order; pruned nodes are dropped. Content values are
     * reused as-is (no re-parsing). This tree is left untouched and none of
     * its handles are valid for the new tree: translate them through
     * {@link Regenerated#newHandle(int)}. O(n).
     */
    public Regenerated<C> regenerate() {
        Tree<C> fresh = new Tree<>(parser);
        int[] mapping = new int[nodes.size()];
        Arrays.fill(mapping, Regenerated.PRUNED);

        if (!nodes.isEmpty()) {
            fresh.nodes.add(Node.root(nodes.get(ROOT).content()));
            mapping[ROOT] = ROOT;

            ArrayDeque<Integer> queue = new ArrayDeque<>();
            queue.add(ROOT);
            while (!queue.isEmpty()) {
                int old = queue.poll();
                Node<C> node = nodes.get(old);
                for (int i = 0; i < node.childSlotCount(); i++) {
                    int child = node.childSlot(i);
                    if (child == Node.SEVERED) continue;
                    mapping[child] = fresh.attach(nodes.get(child).content(), mapping[old]);
                    queue.add(child);
                }
            }
        }
        log.fine(() -> "regenerated: " + nodes.size() + " -> " + fresh.size() + " nodes");
        return new Regenerated<>(fresh, mapping);
    }

    // ---------- helpers ----------

    private int attach(C content, int parent) {
        Node<C> p = nodes.get(parent);
        int handle = nodes.size();
        nodes.add(new Node<>(content, p.level() + 1, parent, p.childSlotCount()));
        p.addChild(content.value(), handle);
        version++;
        return handle;
    }

    private C parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        C content;
        try {
            content = parser.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new SocarelException(ErrorKind.CONTENT_PARSE_FAILED, "cannot parse content: \"" + raw + "\"", e);
        }
        if (content == null) {
            throw new SocarelException(ErrorKind.CONTENT_PARSE_FAILED, "cannot parse content: \"" + raw + "\"");
        }
        return content;
    }

    private boolean inRange(int handle) {
        return handle >= 0 && handle < nodes.size();
    }

    @Override
    public String toString() {
        return "Tree{nodes=" + nodes + '}';
    }
}
