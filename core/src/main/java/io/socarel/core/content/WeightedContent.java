// file: src/main/java/io/socarel/core/content/WeightedContent.java
package io.socarel.core.content;

import java.util.Objects;

/**
 * Content with a weight attached to the connection from its parent.
 * <p>
 * Raw format: {@code "<weight>:<text>"}
 *  - exactly one ':' separator,
 *  - weight is a non-negative integer, surrounding whitespace ignored,
 *  - text is kept as-is and becomes the node's value (child name).
 * <p>
 * Example: {@code "10:my node 1"} has weight 10 and value "my node 1".
 */
public record WeightedContent(long weight, String text) implements NodeContent {

    public static final Parser<WeightedContent> PARSER = WeightedContent::parse;

    public WeightedContent {
        Objects.requireNonNull(text, "text");
        if (weight < 0) throw new IllegalArgumentException("weight must be >= 0");
        if (text.indexOf(':') >= 0) throw new IllegalArgumentException("text must not contain ':'");
    }

    public static WeightedContent parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        int sep = raw.indexOf(':');
        if (sep < 0 || raw.indexOf(':', sep + 1) >= 0) {
            throw new IllegalArgumentException("expected exactly one ':' in \"" + raw + "\"");
        }
        String weight = raw.substring(0, sep).trim();
        if (weight.isEmpty() || weight.startsWith("-") || weight.startsWith("+")) {
            throw new IllegalArgumentException("weight must be a non-negative integer: \"" + weight + "\"");
        }
        try {
            return new WeightedContent(Long.parseLong(weight), raw.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("weight must be a non-negative integer: \"" + weight + "\"", e);
        }
    }

    @Override public String value() { return text; }

    @Override public String serialize() { return weight + ":" + text; }
}
