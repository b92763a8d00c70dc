// file: cli/src/main/java/io/socarel/cli/CliConfig.java
package io.socarel.cli;

import java.util.Arrays;
import java.util.List;

/**
 * Command line configuration.
 *
 * Supports:
 *  - verbose:  log tree mutations (FINE) to stderr
 *  - treeFile: optional JSON file to load the working tree from,
 *              instead of the built-in sample tree
 *  - command:  demo | traverse | find | json | help
 *  - args:     command arguments
 */
public record CliConfig(
        boolean verbose,
        String treeFile,
        String command,
        List<String> args
) {

    public CliConfig {
        args = List.copyOf(args);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags (before the command):
     *   --verbose,   -v
     *   --tree-file, -f  <path>
     *   --help,      -h
     *
     * Without a command, "demo" runs.
     *
     * @throws IllegalArgumentException for unknown flags or a flag missing its value
     */
    public static CliConfig fromArgs(String[] args) {
        boolean verbose = false;
        String treeFile = null;

        int i = 0;
        for (; i < args.length && args[i].startsWith("-"); i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new CliConfig(verbose, treeFile, "help", List.of());
                }

                case "--verbose", "-v" -> verbose = true;

                case "--tree-file", "-f" -> {
                    ensureValue(args, i);
                    treeFile = args[++i];
                }

                default -> throw new IllegalArgumentException("unknown option: " + args[i]);
            }
        }

        if (i >= args.length) {
            return new CliConfig(verbose, treeFile, "demo", List.of());
        }
        String command = args[i];
        List<String> rest = Arrays.asList(args).subList(i + 1, args.length);
        return new CliConfig(verbose, treeFile, command, rest);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("missing value for option: " + args[i]);
        }
    }

    static String usage() {
        return """
            Usage: socarel [options] [command] [args]

            Commands:
              demo                        Build a forest, edit a tree, print it as JSON (default)
              traverse <strategy> [start] Print handle and content per visited node
              find <name>...              Resolve a path of child names from the root
              json                        Print the working tree as JSON
              help                        Show this help message

            Strategies:
              sequential, inverse-sequential, bfs, inverse-bfs, pre-dfs, inverse-pre-dfs,
              post-dfs, inverse-post-dfs, in-dfs, inverse-in-dfs, children

            Options:
              --tree-file, -f   JSON tree to work on (default: built-in sample tree)
              --verbose,   -v   Log tree mutations
              --help,      -h   Show this help message
            """;
    }
}
