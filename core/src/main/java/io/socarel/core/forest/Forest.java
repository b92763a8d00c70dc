// file: src/main/java/io/socarel/core/forest/Forest.java
package io.socarel.core.forest;

import io.socarel.core.ErrorKind;
import io.socarel.core.SocarelException;
import io.socarel.core.Tree;
import io.socarel.core.content.NodeContent;
import io.socarel.core.content.RawContent;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Named collection of independent trees.
 * <p>
 * Every operation takes the raw tree name and parses it with the forest's
 * identifier parser first, so a name the parser rejects fails with
 * TREE_ID_PARSE_FAILED before the map is consulted.
 * <p>
 * The forest owns its trees. One tree instance is held under at most one
 * identifier: {@link #add} rejects an instance this forest already holds.
 * Handing the same instance to a second forest is not detected and is the
 * caller's responsibility to avoid. Iteration order is unspecified.
 */
public final class Forest<I extends TreeId, C extends NodeContent> {
    private static final Logger log = Logger.getLogger(Forest.class.getName());

    private final TreeId.Parser<I> idParser;
    private final NodeContent.Parser<C> contentParser;
    private final Map<I, Tree<C>> trees = new HashMap<>();

    public Forest(TreeId.Parser<I> idParser, NodeContent.Parser<C> contentParser) {
        this.idParser = Objects.requireNonNull(idParser, "idParser");
        this.contentParser = Objects.requireNonNull(contentParser, "contentParser");
    }

    /** Forest keyed by plain names holding raw-content trees. */
    public static Forest<RawTreeId, RawContent> raw() {
        return new Forest<>(RawTreeId.PARSER, RawContent.PARSER);
    }

    /**
     * Create an empty tree under {@code name}.
     *
     * @throws SocarelException TREE_ID_PARSE_FAILED, TREE_ID_ALREADY_EXISTS
     */
    public Tree<C> create(String name) {
        Tree<C> tree = new Tree<>(contentParser);
        add(name, tree);
        return tree;
    }

    /**
     * Register a caller-built tree under {@code name}.
     *
     * @throws SocarelException TREE_ID_PARSE_FAILED, TREE_ID_ALREADY_EXISTS
     * @throws IllegalArgumentException if this forest already holds the same tree instance
     */
    public void add(String name, Tree<C> tree) {
        Objects.requireNonNull(tree, "tree");
        I id = parse(name);
        if (trees.containsKey(id)) {
            throw new SocarelException(ErrorKind.TREE_ID_ALREADY_EXISTS, "tree ID already exists: " + id.id());
        }
        for (var e : trees.entrySet()) {
            if (e.getValue() == tree) {
                throw new IllegalArgumentException("tree already held under ID: " + e.getKey().id());
            }
        }
        trees.put(id, tree);
        log.fine(() -> "tree added: " + id.id());
    }

    /**
     * Detach and return the tree stored under {@code name}.
     *
     * @throws SocarelException TREE_ID_PARSE_FAILED, TREE_NOT_FOUND
     */
    public Tree<C> remove(String name) {
        I id = parse(name);
        Tree<C> tree = trees.remove(id);
        if (tree == null) throw notFound(id);
        log.fine(() -> "tree removed: " + id.id());
        return tree;
    }

    /**
     * Tree stored under {@code name}. The returned tree is live: mutating it
     * mutates the forest's tree.
     *
     * @throws SocarelException TREE_ID_PARSE_FAILED, TREE_NOT_FOUND
     */
    public Tree<C> get(String name) {
        I id = parse(name);
        Tree<C> tree = trees.get(id);
        if (tree == null) throw notFound(id);
        return tree;
    }

    /** Same as {@link #get(String)}; kept for callers that want to state intent. */
    public Tree<C> getMut(String name) {
        return get(name);
    }

    public boolean contains(String name) {
        return trees.containsKey(parse(name));
    }

    public int size() { return trees.size(); }

    public boolean isEmpty() { return trees.isEmpty(); }

    public Set<I> ids() {
        return Collections.unmodifiableSet(trees.keySet());
    }

    /** Read-only view of every (identifier, tree) pair. Order is unspecified. */
    public Set<Map.Entry<I, Tree<C>>> iterate() {
        return Collections.unmodifiableMap(trees).entrySet();
    }

    // ---------- helpers ----------

    private I parse(String name) {
        Objects.requireNonNull(name, "name");
        I id;
        try {
            id = idParser.parse(name);
        } catch (IllegalArgumentException e) {
            throw new SocarelException(ErrorKind.TREE_ID_PARSE_FAILED, "cannot parse tree ID: \"" + name + "\"", e);
        }
        if (id == null) {
            throw new SocarelException(ErrorKind.TREE_ID_PARSE_FAILED, "cannot parse tree ID: \"" + name + "\"");
        }
        return id;
    }

    private static SocarelException notFound(TreeId id) {
        return new SocarelException(ErrorKind.TREE_NOT_FOUND, "tree not found: " + id.id());
    }
}
