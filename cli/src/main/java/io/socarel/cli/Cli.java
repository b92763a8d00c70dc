// file: cli/src/main/java/io/socarel/cli/Cli.java
package io.socarel.cli;

import io.socarel.core.SocarelException;
import io.socarel.core.Tree;
import io.socarel.core.Visit;
import io.socarel.core.content.RawContent;
import io.socarel.core.forest.Forest;
import io.socarel.core.iter.TreeIterators;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalInt;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Demonstration CLI for the tree library.
 *
 * Usage:
 *   socarel [--verbose] [--tree-file tree.json] demo
 *   socarel [--tree-file tree.json] traverse <strategy> [start-handle]
 *   socarel [--tree-file tree.json] find <name>...
 *   socarel [--tree-file tree.json] json
 *
 * Examples:
 *   socarel traverse post-dfs
 *   socarel traverse children 1
 *   socarel find B E H
 *
 * Exit codes: 0 ok, 1 usage or tree error, 2 unexpected failure.
 */
public final class Cli {
    private static final Logger log = Logger.getLogger(Cli.class.getName());

    private final PrintStream out;
    private final PrintStream err;

    Cli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new Cli(System.out, System.err).run(args));
    }

    int run(String[] args) {
        try {
            CliConfig cfg = CliConfig.fromArgs(args);
            if (cfg.verbose()) {
                enableVerboseLogging();
            }
            log.fine(() -> "command: " + cfg.command() + " " + cfg.args());

            switch (cfg.command()) {
                case "help" -> out.print(CliConfig.usage());
                case "demo" -> demo();
                case "traverse" -> {
                    if (cfg.args().isEmpty() || cfg.args().size() > 2) {
                        throw new CliException("traverse requires <strategy> [start-handle]");
                    }
                    traverse(workingTree(cfg), cfg.args());
                }
                case "find" -> find(workingTree(cfg), cfg.args());
                case "json" -> out.println(TreeJson.render(workingTree(cfg)));
                default -> throw new CliException("unknown command: " + cfg.command());
            }
            return 0;
        } catch (CliException | IllegalArgumentException e) {
            err.println("error: " + e.getMessage());
            err.print(CliConfig.usage());
            return 1;
        } catch (SocarelException e) {
            err.println("error: " + e.getMessage() + " (" + e.kind() + ")");
            return 1;
        } catch (UncheckedIOException e) {
            err.println("error: " + e.getMessage());
            return 1;
        } catch (Exception e) {
            e.printStackTrace(err);
            return 2;
        }
    }

    /** The walkthrough: build, inspect, edit and prune one tree of a forest. */
    private void demo() {
        var forest = Forest.raw();
        forest.create("my_tree");
        out.println("Forest = " + TreeJson.render(forest));

        Tree<RawContent> tree = forest.getMut("my_tree");
        int root = tree.setRoot("my root node");
        int child1 = tree.link("child node 1", root);
        int grandchild = tree.link("grandchild node", child1);
        int child2 = tree.link("child node 2", root);

        out.println("My Tree = " + TreeJson.render(tree));
        out.println("Root content = " + content(tree, root));
        out.println("Child 1 content = " + content(tree, child1));
        out.println("Child 2 content = " + content(tree, child2));
        out.println("Grandchild content = " + content(tree, grandchild));

        tree.updateContent("new child 1 content", child1);
        out.println("New Child 1 content = " + content(tree, child1));
        out.println("Grandchild path = " + handleOrNotFound(tree.findPath(root, "new child 1 content", "grandchild node")));

        tree.unlink(child1);
        out.println("My Tree after unlink = " + TreeJson.render(tree));
        out.println("Arena size after unlink = " + tree.size());

        var regen = tree.regenerate();
        out.println("Arena size after regenerate = " + regen.tree().size());
    }

    private void traverse(Tree<RawContent> tree, List<String> args) {
        String strategy = args.get(0);
        TreeIterators<RawContent> iterators = args.size() == 2
                ? tree.iterators(parseHandle(args.get(1)))
                : tree.iterators();
        for (Visit<RawContent> v : strategy(iterators, strategy)) {
            out.println(v.handle() + "\t" + v.content().serialize());
        }
    }

    private void find(Tree<RawContent> tree, List<String> path) {
        out.println(handleOrNotFound(tree.findPath(Tree.ROOT, path)));
    }

    static Iterable<Visit<RawContent>> strategy(TreeIterators<RawContent> it, String name) {
        return switch (name) {
            case "sequential" -> it.sequential();
            case "inverse-sequential" -> it.inverseSequential();
            case "bfs" -> it.bfs();
            case "inverse-bfs" -> it.inverseBfs();
            case "pre-dfs" -> it.preDfs();
            case "inverse-pre-dfs" -> it.inversePreDfs();
            case "post-dfs" -> it.postDfs();
            case "inverse-post-dfs" -> it.inversePostDfs();
            case "in-dfs" -> it.inDfs();
            case "inverse-in-dfs" -> it.inverseInDfs();
            case "children" -> it.children();
            default -> throw new CliException("unknown strategy: " + name);
        };
    }

    /**
     * Tree loaded from --tree-file, or the sample tree
     * A -> (B -> (D, E -> H), C -> (F, G)).
     */
    static Tree<RawContent> workingTree(CliConfig cfg) {
        if (cfg.treeFile() != null) {
            return TreeJson.readTree(Path.of(cfg.treeFile()));
        }
        Tree<RawContent> tree = Tree.raw();
        int a = tree.setRoot("A");
        int b = tree.link("B", a);
        int c = tree.link("C", a);
        tree.link("D", b);
        int e = tree.link("E", b);
        tree.link("F", c);
        tree.link("G", c);
        tree.link("H", e);
        return tree;
    }

    private static String handleOrNotFound(OptionalInt handle) {
        return handle.isPresent() ? String.valueOf(handle.getAsInt()) : "(not found)";
    }

    private static String content(Tree<RawContent> tree, int handle) {
        return tree.content(handle).map(RawContent::value).orElse("(none)");
    }

    private static int parseHandle(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new CliException("start handle must be an integer: " + s);
        }
    }

    private static void enableVerboseLogging() {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.FINE);
        for (Handler h : root.getHandlers()) {
            h.setLevel(Level.FINE);
        }
    }

    private static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
