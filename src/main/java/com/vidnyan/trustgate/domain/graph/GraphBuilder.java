package com.vidnyan.trustgate.domain.graph;

import com.vidnyan.trustgate.domain.meta.MetaAst;

/**
 * Derives one kind of program graph from a Meta-AST.
 * Implementations keep no state between calls and must tolerate trees built
 * from partially malformed source.
 */
public interface GraphBuilder {

    GraphKind kind();

    ProgramGraph build(MetaAst ast);

    /**
     * Get the builder name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
