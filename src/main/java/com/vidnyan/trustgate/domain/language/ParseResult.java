package com.vidnyan.trustgate.domain.language;

import com.vidnyan.trustgate.domain.syntax.SyntaxNode;
import com.vidnyan.trustgate.domain.syntax.SyntaxTree;

/**
 * A syntax tree together with the source it was parsed from.
 *
 * @param hasErrors whether the tree contains ERROR or missing nodes
 */
public record ParseResult(
    SyntaxTree tree,
    String source,
    LanguageDefinition language,
    boolean hasErrors
) {

    public SyntaxNode root() {
        return tree.root();
    }

    /**
     * Source text covered by a node of this tree.
     */
    public String textOf(SyntaxNode node) {
        return node.text(source);
    }
}
