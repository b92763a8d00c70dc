// file: src/main/java/io/socarel/core/content/NodeContent.java
package io.socarel.core.content;

/**
 * Typed payload of a tree node.
 * <p>
 * A content value is produced from its raw string form by a {@link Parser}
 * and can be reduced back to a string:
 *  - value():     canonical payload, used as the child name for lookups
 *                 and path matching. Not necessarily the raw input.
 *  - serialize(): raw form that parses back to an equal value.
 * <p>
 * Law: for any raw string {@code s} accepted by a parser {@code p},
 * {@code p.parse(p.parse(s).serialize()).value()} equals {@code p.parse(s).value()}.
 */
public interface NodeContent {

    /** Canonical payload (child name). Never null. */
    String value();

    /** Raw form of this content. Defaults to {@link #value()}. */
    default String serialize() {
        return value();
    }

    /**
     * Converts the raw string form into a content value.
     * Implementations throw {@link IllegalArgumentException} when the input
     * does not match their micro-format.
     */
    @FunctionalInterface
    interface Parser<C extends NodeContent> {
        C parse(String raw);
    }
}
