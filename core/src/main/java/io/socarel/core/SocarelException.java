// file: src/main/java/io/socarel/core/SocarelException.java
package io.socarel.core;

import java.util.Objects;

/**
 * Raised by tree and forest operations that cannot be applied.
 * <p>
 * Every failure is detected before the operation touches any state, so
 * catching this exception always leaves the tree (or forest) exactly as it
 * was before the call.
 */
public final class SocarelException extends RuntimeException {

    private final ErrorKind kind;

    public SocarelException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SocarelException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() { return kind; }

    public int code() { return kind.code(); }

    @Override
    public String toString() {
        return kind + ":`" + getMessage() + "`(" + kind.code() + ")";
    }
}
