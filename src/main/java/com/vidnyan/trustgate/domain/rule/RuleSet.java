package com.vidnyan.trustgate.domain.rule;

import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * An ordered, immutable collection of rules.
 * Rules keep their registration order; additions are appended, so merged
 * plugin rules always run after the built-ins. Every modifier returns a new set.
 */
@Slf4j
public final class RuleSet {

    private final List<Rule> rules;

    private RuleSet(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RuleSet empty() {
        return new RuleSet(List.of());
    }

    /**
     * Create a set from rules in order. A duplicate id is rejected with a warning.
     */
    public static RuleSet of(List<Rule> rules) {
        return empty().withAll(rules);
    }

    public List<Rule> rules() {
        return rules;
    }

    public int size() {
        return rules.size();
    }

    public Optional<Rule> find(String id) {
        return rules.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    /**
     * Rules that are enabled and apply to the language, in order.
     */
    public List<Rule> enabledRules(String language) {
        return rules.stream()
                .filter(Rule::enabled)
                .filter(r -> r.appliesTo(language))
                .toList();
    }

    /**
     * Append a rule unless its id is already taken.
     */
    public RuleSet with(Rule rule) {
        return withAll(List.of(rule));
    }

    public RuleSet withAll(Collection<Rule> additions) {
        List<Rule> next = new ArrayList<>(rules);
        Set<String> ids = new HashSet<>();
        rules.forEach(r -> ids.add(r.id()));
        for (Rule rule : additions) {
            if (!ids.add(rule.id())) {
                log.warn("Rule '{}' ignored: id already registered", rule.id());
                continue;
            }
            next.add(rule);
        }
        return new RuleSet(next);
    }

    /**
     * Append the rules of a plugin.
     */
    public RuleSet merge(RulePlugin plugin) {
        List<Rule> additions = plugin.rules();
        log.info("Merging {} rules from {}", additions.size(), plugin.name());
        return withAll(additions);
    }

    public RuleSet merge(List<? extends RulePlugin> plugins) {
        RuleSet merged = this;
        for (RulePlugin plugin : plugins) {
            merged = merged.merge(plugin);
        }
        return merged;
    }

    public RuleSet disable(Collection<String> ids) {
        return toggle(ids, false);
    }

    public RuleSet disable(String... ids) {
        return disable(List.of(ids));
    }

    public RuleSet enable(Collection<String> ids) {
        return toggle(ids, true);
    }

    public RuleSet enable(String... ids) {
        return enable(List.of(ids));
    }

    private RuleSet toggle(Collection<String> ids, boolean enabled) {
        for (String id : ids) {
            if (find(id).isEmpty()) {
                log.warn("Cannot {} unknown rule '{}'", enabled ? "enable" : "disable", id);
            }
        }
        return new RuleSet(rules.stream()
                .map(r -> ids.contains(r.id()) ? r.withEnabled(enabled) : r)
                .toList());
    }

    public List<String> ids() {
        return rules.stream().map(Rule::id).toList();
    }

    @Override
    public String toString() {
        return "RuleSet" + ids();
    }
}
