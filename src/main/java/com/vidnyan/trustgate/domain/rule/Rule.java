package com.vidnyan.trustgate.domain.rule;

import java.util.List;
import java.util.Objects;

/**
 * A verification rule.
 * Immutable value object; built-in and plugin rules share this shape.
 *
 * @param languages language ids the rule applies to; empty means all
 */
public record Rule(
    String id,
    String name,
    Severity severity,
    RuleEvaluator evaluator,
    List<String> languages,
    List<String> tags,
    boolean enabled
) {

    public Rule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(evaluator, "evaluator");
        severity = severity == null ? Severity.ERROR : severity;
        languages = languages == null ? List.of() : List.copyOf(languages);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Check whether the rule runs for a language.
     * A blank language matches every rule.
     */
    public boolean appliesTo(String language) {
        return languages.isEmpty() || language == null || language.isBlank() || languages.contains(language);
    }

    public Rule withEnabled(boolean value) {
        return value == enabled ? this : new Rule(id, name, severity, evaluator, languages, tags, value);
    }

    /**
     * Builder for Rule.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private Severity severity = Severity.ERROR;
        private RuleEvaluator evaluator;
        private List<String> languages = List.of();
        private List<String> tags = List.of();
        private boolean enabled = true;

        public Builder id(String id) { this.id = id; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder severity(Severity sev) { this.severity = sev; return this; }
        public Builder evaluator(RuleEvaluator evaluator) { this.evaluator = evaluator; return this; }
        public Builder languages(String... ids) { this.languages = List.of(ids); return this; }
        public Builder tags(String... tags) { this.tags = List.of(tags); return this; }
        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }

        public Rule build() {
            return new Rule(id, name == null ? id : name, severity, evaluator, languages, tags, enabled);
        }
    }
}
