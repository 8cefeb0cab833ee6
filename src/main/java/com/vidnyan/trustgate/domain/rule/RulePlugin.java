package com.vidnyan.trustgate.domain.rule;

import java.util.List;

/**
 * Supplies additional rules to a {@link RuleSet}.
 */
public interface RulePlugin {

    /**
     * Get the plugin name for logging.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    List<Rule> rules();
}
