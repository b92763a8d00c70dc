// file: cli/src/main/java/io/socarel/cli/TreeJson.java
package io.socarel.cli;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.socarel.core.Tree;
import io.socarel.core.content.NodeContent;
import io.socarel.core.content.RawContent;
import io.socarel.core.forest.Forest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON view of trees and forests.
 * <p>
 * Rendering covers the live structure only (what a traversal from the root
 * sees); pruned nodes are not part of the output:
 * <pre>
 *   {"handle":0,"level":1,"content":"A","children":[{"handle":1,...}]}
 * </pre>
 * Reading accepts the same nesting with only "content" required:
 * <pre>
 *   {"content":"A","children":[{"content":"B"},{"content":"C"}]}
 * </pre>
 * Nodes read from JSON are linked breadth first, so handles follow level order.
 * <p>
 * Every tree level costs two JSON nesting levels (the node object and its
 * "children" array). Trees up to {@link #MAX_LEVELS} levels deep are
 * supported in both directions; deeper ones are rejected with
 * IllegalArgumentException.
 */
public final class TreeJson {

    /** Deepest tree (root = level 1) that can be rendered or read. */
    public static final int MAX_LEVELS = 1_000;

    // two per tree level, one more for the forest wrapper object
    private static final int MAX_NESTING = 2 * MAX_LEVELS + 1;

    private static final ObjectMapper MAPPER = new ObjectMapper(
            JsonFactory.builder()
                    .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(MAX_NESTING).build())
                    .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(MAX_NESTING).build())
                    .build())
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TreeJson() {}

    /**
     * Live structure of {@code tree} below the root; null node for an empty tree.
     *
     * @throws IllegalArgumentException if a live node sits deeper than {@link #MAX_LEVELS}
     */
    public static JsonNode toJson(Tree<?> tree) {
        if (tree.isEmpty()) return MAPPER.nullNode();
        return subtree(tree);
    }

    private static <C extends NodeContent> JsonNode subtree(Tree<C> tree) {
        Map<Integer, ArrayNode> childrenOf = new HashMap<>();
        ObjectNode root = null;
        // pre-order: every parent is rendered before its children
        for (var v : tree.iterators().preDfs()) {
            if (v.node().level() > MAX_LEVELS) {
                throw new IllegalArgumentException(
                        "tree deeper than " + MAX_LEVELS + " levels cannot be rendered as JSON");
            }
            ObjectNode node = MAPPER.createObjectNode();
            node.put("handle", v.handle());
            node.put("level", v.node().level());
            node.put("content", v.content().serialize());
            childrenOf.put(v.handle(), node.putArray("children"));

            if (root == null) {
                root = node;
            } else {
                childrenOf.get(v.node().parent().getAsInt()).add(node);
            }
        }
        return root;
    }

    /** Every tree of the forest, keyed by identifier, sorted by identifier. */
    public static JsonNode toJson(Forest<?, ?> forest) {
        Map<String, Tree<?>> sorted = new TreeMap<>();
        for (var e : forest.iterate()) {
            sorted.put(e.getKey().id(), e.getValue());
        }
        ObjectNode out = MAPPER.createObjectNode();
        sorted.forEach((id, tree) -> out.set(id, toJson(tree)));
        return out;
    }

    public static String render(Tree<?> tree) {
        return write(toJson(tree));
    }

    public static String render(Forest<?, ?> forest) {
        return write(toJson(forest));
    }

    /**
     * Build a raw-content tree from nested JSON.
     *
     * @throws IllegalArgumentException if the text is not JSON or a node has no
     *         textual "content" or a non-array "children"
     * @throws io.socarel.core.SocarelException if two siblings share a content value
     */
    public static Tree<RawContent> readTree(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid tree JSON: " + e.getOriginalMessage(), e);
        }
        return build(root);
    }

    public static Tree<RawContent> readTree(Path path) {
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid tree JSON in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load tree from " + path, e);
        }
        return build(root);
    }

    // ---------- helpers ----------

    private record Pending(JsonNode json, int parent) {}

    private static Tree<RawContent> build(JsonNode root) {
        Tree<RawContent> tree = Tree.raw();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return tree;
        }
        int rootHandle = tree.setRoot(contentOf(root));

        ArrayDeque<Pending> queue = new ArrayDeque<>();
        enqueueChildren(queue, root, rootHandle);
        while (!queue.isEmpty()) {
            Pending p = queue.poll();
            int handle = tree.link(contentOf(p.json()), p.parent());
            if (tree.node(handle).orElseThrow().level() > MAX_LEVELS) {
                throw new IllegalArgumentException("tree JSON deeper than " + MAX_LEVELS + " levels");
            }
            enqueueChildren(queue, p.json(), handle);
        }
        return tree;
    }

    private static String contentOf(JsonNode node) {
        JsonNode content = node.get("content");
        if (!node.isObject() || content == null || !content.isTextual()) {
            throw new IllegalArgumentException("tree node needs a textual \"content\": " + node);
        }
        return content.asText();
    }

    private static void enqueueChildren(ArrayDeque<Pending> queue, JsonNode node, int parent) {
        JsonNode children = node.get("children");
        if (children == null || children.isNull()) return;
        if (!children.isArray()) {
            throw new IllegalArgumentException("\"children\" must be an array: " + children);
        }
        for (JsonNode child : children) {
            queue.add(new Pending(child, parent));
        }
    }

    private static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot render JSON", e);
        }
    }
}
