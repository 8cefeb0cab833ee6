package com.vidnyan.trustgate.domain.meta;

import java.util.List;

/**
 * Root container of a normalised tree.
 * The derived views are recomputed on each call.
 */
public record MetaAst(
    MetaNode root,
    String language,
    boolean hasErrors,
    String source
) {

    public static final String MODULE_SCOPE = "<module>";

    /**
     * Get all call nodes in pre-order.
     */
    public List<MetaNode> allCalls() {
        return root.findAll(NodeKind.CALL);
    }

    /**
     * Get all function nodes in pre-order.
     */
    public List<MetaNode> allFunctions() {
        return root.findAll(NodeKind.FUNCTION);
    }

    /**
     * Get all import nodes in pre-order.
     */
    public List<MetaNode> allImports() {
        return root.findAll(NodeKind.IMPORT);
    }
}
