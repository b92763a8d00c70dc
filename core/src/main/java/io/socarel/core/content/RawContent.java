// file: src/main/java/io/socarel/core/content/RawContent.java
package io.socarel.core.content;

import java.util.Objects;

/**
 * Default content: holds the input string verbatim, without parsing it.
 */
public record RawContent(String value) implements NodeContent {

    public static final Parser<RawContent> PARSER = RawContent::new;

    public RawContent {
        Objects.requireNonNull(value, "value");
    }

    @Override public String toString() { return value; }
}
