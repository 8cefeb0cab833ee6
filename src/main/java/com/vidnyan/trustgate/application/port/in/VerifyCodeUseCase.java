package com.vidnyan.trustgate.application.port.in;

import com.vidnyan.trustgate.domain.graph.GraphExport;
import com.vidnyan.trustgate.domain.report.BatchReport;
import com.vidnyan.trustgate.domain.report.VerificationReport;
import com.vidnyan.trustgate.domain.rule.Rule;
import com.vidnyan.trustgate.domain.rule.RuleSet;
import com.vidnyan.trustgate.domain.rule.Severity;

import java.util.List;

/**
 * Primary use case: verify source code without executing it.
 * This is the entry point for HTTP, CLI and editor front-ends.
 */
public interface VerifyCodeUseCase {

    /**
     * Verify one piece of code. Never throws; failures are reported as findings.
     */
    VerificationReport verify(VerificationRequest request);

    default VerificationReport verify(String code, String language) {
        return verify(VerificationRequest.of(code, language));
    }

    /**
     * Verify every item in order; items share nothing but the result cache.
     */
    BatchReport verifyAll(List<VerificationRequest> requests);

    /**
     * Build one program graph and strip it down for visualisation.
     *
     * @param graphType one of {@code cfg}, {@code dfg}, {@code tfg}, {@code call_graph}
     * @throws IllegalArgumentException for an unknown graph type, or code the grammar cannot turn into a tree
     */
    GraphExport exportGraph(String code, String language, String graphType);

    /**
     * Describe the rules of the default rule set.
     */
    List<RuleInfo> listRules();

    /**
     * Verification request parameters.
     *
     * @param language language id or alias; blank means the default language
     * @param filename optional file name, used to detect the language
     * @param ruleSet  rules to run instead of the default set; null for the default
     * @param useCache whether a cached report may be returned and the result stored
     */
    record VerificationRequest(
        String code,
        String language,
        String filename,
        RuleSet ruleSet,
        boolean useCache
    ) {
        public static VerificationRequest of(String code, String language) {
            return new VerificationRequest(code, language, null, null, true);
        }

        public static VerificationRequest forFile(String code, String filename) {
            return new VerificationRequest(code, null, filename, null, true);
        }

        public VerificationRequest withFilename(String name) {
            return new VerificationRequest(code, language, name, ruleSet, useCache);
        }

        public VerificationRequest withRuleSet(RuleSet rules) {
            return new VerificationRequest(code, language, filename, rules, useCache);
        }

        public VerificationRequest withoutCache() {
            return new VerificationRequest(code, language, filename, ruleSet, false);
        }
    }

    /**
     * Public description of a rule.
     *
     * @param languages language ids, or {@code ["all"]}
     */
    record RuleInfo(
        String id,
        String name,
        Severity severity,
        List<String> tags,
        List<String> languages,
        boolean enabled
    ) {
        public static RuleInfo of(Rule rule) {
            return new RuleInfo(rule.id(), rule.name(), rule.severity(), rule.tags(),
                    rule.languages().isEmpty() ? List.of("all") : rule.languages(), rule.enabled());
        }
    }
}
