// file: src/main/java/io/socarel/core/Visit.java
package io.socarel.core;

import io.socarel.core.content.NodeContent;

/**
 * One step of a traversal: the node and the arena handle it lives at.
 */
public record Visit<C extends NodeContent>(Node<C> node, int handle) {

    public C content() { return node.content(); }
}
