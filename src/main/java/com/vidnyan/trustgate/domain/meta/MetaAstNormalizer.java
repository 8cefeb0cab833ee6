package com.vidnyan.trustgate.domain.meta;

import com.vidnyan.trustgate.domain.language.LanguageDefinition;
import com.vidnyan.trustgate.domain.language.ParseResult;
import com.vidnyan.trustgate.domain.syntax.SyntaxNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.Set;

/**
 * Rewrites a concrete syntax tree into a {@link MetaAst}.
 * Node types are mapped through the language's table; unmapped types become
 * UNKNOWN nodes whose children are still visited. Punctuation is pruned and
 * scope is threaded top-down through named functions and classes.
 */
@Slf4j
public class MetaAstNormalizer {

    /**
     * Nodes deeper than this become childless UNKNOWN nodes.
     */
    public static final int MAX_DEPTH = 1024;

    static final int MAX_TEXT = 200;

    private static final Set<String> PRUNED = Set.of(
            "(", ")", "{", "}", "[", "]", ",", ":", ";", "comment");

    private static final String ASYNC_KEYWORD = "async";

    /**
     * Normalise a parse result.
     */
    public MetaAst normalise(ParseResult parse) {
        MetaNode root = visit(parse.root(), parse, MetaAst.MODULE_SCOPE, 0);
        log.debug("Normalised {} tree into {} nodes", parse.language().id(), root.preOrder().size());
        return new MetaAst(root, parse.language().id(), parse.hasErrors(), parse.source());
    }

    private MetaNode visit(SyntaxNode node, ParseResult parse, String scope, int depth) {
        LanguageDefinition language = parse.language();
        if (depth > MAX_DEPTH) {
            return describe(NodeKind.UNKNOWN, node, parse, scope).build();
        }
        NodeKind kind = language.kindOf(node.type());
        MetaNode.Builder builder = describe(kind, node, parse, scope);
        Optional<String> name = extractName(kind, node, parse);
        name.ifPresent(builder::name);

        String childScope = scope;
        if ((kind == NodeKind.FUNCTION || kind == NodeKind.CLASS) && name.isPresent()) {
            childScope = scope + "." + name.get();
        }
        for (SyntaxNode child : node.children()) {
            if (PRUNED.contains(child.type())) {
                continue;
            }
            builder.child(visit(child, parse, childScope, depth + 1));
        }
        return builder.build();
    }

    private MetaNode.Builder describe(NodeKind kind, SyntaxNode node, ParseResult parse, String scope) {
        LanguageDefinition language = parse.language();
        boolean async = language.asyncMarkers().contains(node.type())
                || node.firstChild().map(c -> ASYNC_KEYWORD.equals(c.type())).orElse(false);
        return MetaNode.builder(kind)
                .text(truncate(parse.textOf(node)))
                .line(node.start().row() + 1)
                .endLine(node.end().row() + 1)
                .column(node.start().column())
                .endColumn(node.end().column())
                .scope(scope)
                .async(async)
                .exceptionPoint(language.exceptionMarkers().contains(node.type()))
                .syntax(node);
    }

    private Optional<String> extractName(NodeKind kind, SyntaxNode node, ParseResult parse) {
        return switch (kind) {
            case FUNCTION, CLASS -> declaredName(node).map(parse::textOf);
            case CALL -> node.field("function").map(parse::textOf);
            case IMPORT -> Optional.of(parse.textOf(node).strip());
            case VARIABLE, LITERAL -> Optional.of(parse.textOf(node));
            default -> Optional.empty();
        };
    }

    /**
     * The "name" field, else the first identifier child that is neither the
     * parameter nor the body of an arrow function.
     */
    private Optional<SyntaxNode> declaredName(SyntaxNode node) {
        Optional<SyntaxNode> named = node.field("name");
        if (named.isPresent()) {
            return named;
        }
        SyntaxNode parameter = node.field("parameter").orElse(null);
        SyntaxNode body = node.field("body").orElse(null);
        return node.children().stream()
                .filter(c -> "identifier".equals(c.type()) && c != parameter && c != body)
                .findFirst();
    }

    static String truncate(String text) {
        if (text.length() <= MAX_TEXT) {
            return text;
        }
        return text.substring(0, MAX_TEXT) + "\u2026";
    }
}
