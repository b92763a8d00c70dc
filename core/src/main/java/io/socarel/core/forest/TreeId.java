// file: src/main/java/io/socarel/core/forest/TreeId.java
package io.socarel.core.forest;

/**
 * Key of a tree inside a {@link Forest}.
 * <p>
 * Identifiers are parsed from raw names by a {@link Parser} and compared
 * purely by {@link #id()}. Implementations should delegate
 * {@code equals}/{@code hashCode} to {@link #equalsById} / {@link #hashById}.
 */
public interface TreeId {

    /** Canonical identifier string. */
    String id();

    static boolean equalsById(TreeId self, Object other) {
        if (self == other) return true;
        if (other == null || self.getClass() != other.getClass()) return false;
        return self.id().equals(((TreeId) other).id());
    }

    static int hashById(TreeId self) {
        return self.id().hashCode();
    }

    /** Throws {@link IllegalArgumentException} for names it does not accept. */
    @FunctionalInterface
    interface Parser<I extends TreeId> {
        I parse(String name);
    }
}
