package com.vidnyan.trustgate.domain.syntax;

/**
 * A language grammar able to turn source text into a concrete syntax tree.
 * Implemented by parser adapters; one instance is shared per language, so
 * implementations must keep all parse state local to {@link #parse(String)}.
 */
public interface Grammar {

    /**
     * Parse source text.
     * Malformed input yields a tree containing ERROR or missing nodes.
     *
     * @throws ParseFailureException when no tree at all can be produced
     */
    SyntaxTree parse(String source);
}
