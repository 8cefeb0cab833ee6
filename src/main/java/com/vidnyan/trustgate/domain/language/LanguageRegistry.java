package com.vidnyan.trustgate.domain.language;

import com.vidnyan.trustgate.domain.syntax.Grammar;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registered languages in registration order, plus the lazily built grammar table.
 * The first registered language is the default. Registration is synchronised;
 * lookups read an immutable snapshot. Grammars are created at most once per
 * language, even under concurrent first access.
 */
@Slf4j
public class LanguageRegistry {

    private volatile List<LanguageDefinition> languages = List.of();
    private final ConcurrentMap<String, Grammar> grammars = new ConcurrentHashMap<>();

    /**
     * Create a registry holding the languages of the given plugins, in order.
     */
    public static LanguageRegistry of(List<? extends LanguagePlugin> plugins) {
        LanguageRegistry registry = new LanguageRegistry();
        plugins.forEach(registry::register);
        return registry;
    }

    /**
     * Register a plugin's language.
     * A language whose id or alias is already taken is rejected with a warning.
     */
    public void register(LanguagePlugin plugin) {
        LanguageDefinition language = plugin.language();
        if (register(language)) {
            log.info("Registered language '{}' from {} (extensions {})",
                    language.id(), plugin.name(), language.extensions());
        }
    }

    /**
     * Register a language.
     *
     * @return false when the id or one of the aliases is already registered
     */
    public synchronized boolean register(LanguageDefinition language) {
        List<String> keys = new ArrayList<>(language.aliases());
        keys.add(language.id());
        for (String key : keys) {
            Optional<LanguageDefinition> clash = find(key);
            if (clash.isPresent()) {
                log.warn("Language '{}' ignored: '{}' is already registered by '{}'",
                        language.id(), key, clash.get().id());
                return false;
            }
        }
        List<String> claimed = language.extensions().stream()
                .filter(ext -> languages.stream().anyMatch(l -> l.extensions().contains(ext)))
                .toList();
        if (!claimed.isEmpty()) {
            log.warn("Extensions {} of '{}' are already claimed; earlier registration wins", claimed, language.id());
        }
        List<LanguageDefinition> next = new ArrayList<>(languages);
        next.add(language);
        languages = List.copyOf(next);
        return true;
    }

    /**
     * Find a language by id or alias, ignoring case.
     */
    public Optional<LanguageDefinition> find(String idOrAlias) {
        if (idOrAlias == null || idOrAlias.isBlank()) {
            return Optional.empty();
        }
        String key = idOrAlias.strip();
        return languages.stream().filter(l -> l.answersTo(key)).findFirst();
    }

    /**
     * Resolve a language id; blank or unknown ids fall back to the default language.
     */
    public LanguageDefinition resolve(String idOrAlias) {
        Optional<LanguageDefinition> found = find(idOrAlias);
        if (found.isPresent()) {
            return found.get();
        }
        LanguageDefinition fallback = defaultLanguage();
        if (idOrAlias != null && !idOrAlias.isBlank()) {
            log.warn("Unknown language '{}', falling back to '{}'", idOrAlias, fallback.id());
        }
        return fallback;
    }

    /**
     * Detect the language of a file from its extension.
     */
    public Optional<LanguageDefinition> detect(String filename) {
        if (filename == null || filename.isBlank()) {
            return Optional.empty();
        }
        return languages.stream().filter(l -> l.claims(filename)).findFirst();
    }

    /**
     * Get the first registered language.
     */
    public LanguageDefinition defaultLanguage() {
        List<LanguageDefinition> snapshot = languages;
        if (snapshot.isEmpty()) {
            throw new IllegalStateException("No languages registered");
        }
        return snapshot.get(0);
    }

    /**
     * Get registered languages in registration order.
     */
    public List<LanguageDefinition> languages() {
        return languages;
    }

    /**
     * Get the ids of all registered languages.
     */
    public List<String> supportedLanguages() {
        return languages.stream().map(LanguageDefinition::id).toList();
    }

    /**
     * Get the grammar for a language, creating it on first use.
     */
    public Grammar grammarFor(LanguageDefinition language) {
        return grammars.computeIfAbsent(language.id(), id -> {
            log.info("Initialising grammar for '{}'", id);
            return language.grammarFactory().get();
        });
    }
}
