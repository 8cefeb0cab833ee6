package com.vidnyan.trustgate.domain.language;

import com.vidnyan.trustgate.domain.syntax.Grammar;
import com.vidnyan.trustgate.domain.syntax.ParseFailureException;
import com.vidnyan.trustgate.domain.syntax.SyntaxTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Parses source text with the registered grammar of its language.
 * Malformed input yields a tree flagged with {@code hasErrors}; only a grammar
 * that cannot produce any tree raises {@link ParseFailureException}.
 */
@Slf4j
@RequiredArgsConstructor
public class SourceParser {

    private final LanguageRegistry registry;

    /**
     * Parse code in the language with the given id or alias.
     */
    public ParseResult parse(String code, String language) {
        return parse(code, registry.resolve(language));
    }

    /**
     * Parse code in the given language.
     */
    public ParseResult parse(String code, LanguageDefinition language) {
        String source = code == null ? "" : code;
        Grammar grammar = registry.grammarFor(language);
        SyntaxTree tree;
        try {
            tree = grammar.parse(source);
        } catch (StackOverflowError e) {
            throw new ParseFailureException("Input nests too deeply for the " + language.id() + " grammar", e);
        }
        if (tree == null || tree.root() == null) {
            throw new ParseFailureException("Grammar for " + language.id() + " returned no tree");
        }
        boolean hasErrors = tree.containsErrors();
        log.debug("Parsed {} chars of {} (errors: {})", source.length(), language.id(), hasErrors);
        return new ParseResult(tree, source, language, hasErrors);
    }

    /**
     * Detect a language from a file name.
     */
    public Optional<LanguageDefinition> detectLanguage(String filename) {
        return registry.detect(filename);
    }
}
