package com.nodeflow.node;

import com.nodeflow.api.Node;
import com.nodeflow.engine.Flow;

/**
 * Creates a node bound to a flow. Used by {@link Flow#createNode} and by the
 * loader, which looks factories up by type identifier.
 *
 * @param <N> node type
 */
@FunctionalInterface
public interface NodeFactory<N extends Node> {
    N create(Flow flow);
}
