package com.vidnyan.trustgate.domain.language;

import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.syntax.Grammar;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Everything the engine needs to know about one source language.
 *
 * @param id               canonical lower-case id ("python")
 * @param aliases          alternative ids accepted on input ("py")
 * @param extensions       file suffixes including the dot (".py")
 * @param grammarFactory   creates the grammar; invoked at most once per registry
 * @param nodeKinds        syntax node type to normalised kind
 * @param taintCatalog     taint sources and sinks
 * @param asyncMarkers     syntax node types that mark an async boundary
 * @param exceptionMarkers syntax node types that raise or handle exceptions
 */
public record LanguageDefinition(
    String id,
    Set<String> aliases,
    List<String> extensions,
    Supplier<Grammar> grammarFactory,
    Map<String, NodeKind> nodeKinds,
    TaintCatalog taintCatalog,
    Set<String> asyncMarkers,
    Set<String> exceptionMarkers
) {

    public LanguageDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(grammarFactory, "grammarFactory");
        id = id.toLowerCase(Locale.ROOT);
        aliases = aliases.stream().map(a -> a.toLowerCase(Locale.ROOT)).collect(Collectors.toUnmodifiableSet());
        extensions = List.copyOf(extensions);
        nodeKinds = Map.copyOf(nodeKinds);
        taintCatalog = taintCatalog == null ? TaintCatalog.empty() : taintCatalog;
        asyncMarkers = Set.copyOf(asyncMarkers);
        exceptionMarkers = Set.copyOf(exceptionMarkers);
    }

    /**
     * Normalised kind for a syntax node type.
     */
    public NodeKind kindOf(String nodeType) {
        return nodeKinds.getOrDefault(nodeType, NodeKind.UNKNOWN);
    }

    /**
     * Check an id or alias, ignoring case.
     */
    public boolean answersTo(String idOrAlias) {
        String key = idOrAlias.toLowerCase(Locale.ROOT);
        return id.equals(key) || aliases.contains(key);
    }

    /**
     * Check whether a file name ends with one of this language's extensions.
     */
    public boolean claims(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(lower::endsWith);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private Set<String> aliases = Set.of();
        private List<String> extensions = List.of();
        private Supplier<Grammar> grammarFactory;
        private Map<String, NodeKind> nodeKinds = Map.of();
        private TaintCatalog taintCatalog = TaintCatalog.empty();
        private Set<String> asyncMarkers = Set.of();
        private Set<String> exceptionMarkers = Set.of();

        private Builder(String id) {
            this.id = id;
        }

        public Builder aliases(String... values) { this.aliases = Set.of(values); return this; }
        public Builder extensions(String... values) { this.extensions = List.of(values); return this; }
        public Builder grammar(Supplier<Grammar> factory) { this.grammarFactory = factory; return this; }
        public Builder nodeKinds(Map<String, NodeKind> kinds) { this.nodeKinds = kinds; return this; }
        public Builder taintCatalog(TaintCatalog catalog) { this.taintCatalog = catalog; return this; }
        public Builder asyncMarkers(String... values) { this.asyncMarkers = Set.of(values); return this; }
        public Builder exceptionMarkers(String... values) { this.exceptionMarkers = Set.of(values); return this; }

        public LanguageDefinition build() {
            return new LanguageDefinition(id, aliases, extensions, grammarFactory, nodeKinds,
                    taintCatalog, asyncMarkers, exceptionMarkers);
        }
    }
}
