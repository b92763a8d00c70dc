// file: src/main/java/io/socarel/core/forest/RawTreeId.java
package io.socarel.core.forest;

/**
 * Default tree identifier: the name itself. Blank names are rejected.
 */
public final class RawTreeId implements TreeId {

    public static final Parser<RawTreeId> PARSER = RawTreeId::new;

    private final String id;

    public RawTreeId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("tree id must not be blank");
        }
        this.id = id;
    }

    @Override public String id() { return id; }

    @Override public boolean equals(Object o) { return TreeId.equalsById(this, o); }

    @Override public int hashCode() { return TreeId.hashById(this); }

    @Override public String toString() { return id; }
}
