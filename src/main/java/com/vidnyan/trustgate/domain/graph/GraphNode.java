package com.vidnyan.trustgate.domain.graph;

import com.vidnyan.trustgate.domain.meta.MetaNode;

import java.util.Optional;

/**
 * A node in a program graph.
 *
 * @param meta the Meta-AST node it stands for; null for synthetic nodes such as ENTRY
 */
public record GraphNode(
    int id,
    String label,
    MetaNode meta,
    int line
) {

    public Optional<MetaNode> metaNode() {
        return Optional.ofNullable(meta);
    }
}
