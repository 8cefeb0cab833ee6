package com.vidnyan.trustgate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.trustgate.TrustGateProperties;
import com.vidnyan.trustgate.adapter.out.evaluator.BuiltinRules;
import com.vidnyan.trustgate.adapter.out.parser.BuiltinLanguages;
import com.vidnyan.trustgate.application.service.ResultCache;
import com.vidnyan.trustgate.domain.graph.CallGraphBuilder;
import com.vidnyan.trustgate.domain.graph.ControlFlowGraphBuilder;
import com.vidnyan.trustgate.domain.graph.DataFlowGraphBuilder;
import com.vidnyan.trustgate.domain.graph.TaintFlowGraphBuilder;
import com.vidnyan.trustgate.domain.language.LanguagePlugin;
import com.vidnyan.trustgate.domain.language.LanguageRegistry;
import com.vidnyan.trustgate.domain.language.SourceParser;
import com.vidnyan.trustgate.domain.meta.MetaAstNormalizer;
import com.vidnyan.trustgate.domain.rule.RuleEngine;
import com.vidnyan.trustgate.domain.rule.RulePlugin;
import com.vidnyan.trustgate.domain.rule.RuleSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring configuration for the engine.
 * Built-in languages and rules come first; plugin beans found in the context
 * are appended after them.
 */
@Slf4j
@Configuration
public class TrustGateConfiguration {

    /**
     * ObjectMapper for report serialisation.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public LanguageRegistry languageRegistry(ObjectProvider<LanguagePlugin> plugins) {
        List<LanguagePlugin> all = new ArrayList<>(BuiltinLanguages.plugins());
        plugins.orderedStream().forEach(all::add);
        LanguageRegistry registry = LanguageRegistry.of(all);
        log.info("Supported languages: {} (default '{}')",
                registry.supportedLanguages(), registry.defaultLanguage().id());
        return registry;
    }

    @Bean
    public SourceParser sourceParser(LanguageRegistry registry) {
        return new SourceParser(registry);
    }

    @Bean
    public MetaAstNormalizer metaAstNormalizer() {
        return new MetaAstNormalizer();
    }

    @Bean
    public ControlFlowGraphBuilder controlFlowGraphBuilder() {
        return new ControlFlowGraphBuilder();
    }

    @Bean
    public DataFlowGraphBuilder dataFlowGraphBuilder() {
        return new DataFlowGraphBuilder();
    }

    @Bean
    public TaintFlowGraphBuilder taintFlowGraphBuilder(LanguageRegistry registry) {
        return new TaintFlowGraphBuilder(registry);
    }

    @Bean
    public CallGraphBuilder callGraphBuilder() {
        return new CallGraphBuilder();
    }

    /**
     * Built-in rules, then plugin rules, minus the disabled ones.
     */
    @Bean
    public RuleSet ruleSet(ObjectProvider<RulePlugin> plugins, TrustGateProperties properties) {
        RuleSet rules = BuiltinRules.ruleSet().merge(plugins.orderedStream().toList());
        if (!properties.getDisabledRules().isEmpty()) {
            rules = rules.disable(properties.getDisabledRules());
        }
        log.info("Registered {} rules:", rules.size());
        rules.rules().forEach(r -> log.info("  - {} ({}{})", r.id(), r.severity().id(),
                r.enabled() ? "" : ", disabled"));
        return rules;
    }

    @Bean
    public RuleEngine ruleEngine() {
        return new RuleEngine();
    }

    @Bean
    public ResultCache resultCache(TrustGateProperties properties) {
        int capacity = properties.isCacheEnabled() ? properties.getCacheCapacity() : 0;
        log.info("Result cache capacity: {}", capacity);
        return new ResultCache(capacity);
    }
}
