package com.vidnyan.trustgate.domain.language;

/**
 * Supplies a language to the {@link LanguageRegistry}.
 * Built-in languages use the same extension point as third-party ones.
 */
public interface LanguagePlugin {

    /**
     * Get the plugin name for logging.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Get the language this plugin contributes.
     */
    LanguageDefinition language();
}
