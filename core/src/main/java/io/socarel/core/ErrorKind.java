// file: src/main/java/io/socarel/core/ErrorKind.java
package io.socarel.core;

/**
 * Failure categories reported by trees and forests.
 * <p>
 * Each kind carries a stable numeric code so callers that surface errors
 * to their own presentation layer (exit codes, logs) can do so without
 * matching on message text.
 */
public enum ErrorKind {
    ROOT_ALREADY_EXISTS(1),
    PARENT_NOT_FOUND(2),
    CONTENT_PARSE_FAILED(3),
    CHILD_NOT_FOUND(4),
    CHILD_ALREADY_EXISTS(5),
    TREE_ID_ALREADY_EXISTS(10),
    TREE_ID_PARSE_FAILED(11),
    TREE_NOT_FOUND(12);

    private final int code;

    ErrorKind(int code) {
        this.code = code;
    }

    public int code() { return code; }

    /** True for kinds raised by {@link io.socarel.core.forest.Forest}. */
    public boolean isForestError() {
        return code >= 10;
    }
}
