package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.rule.Rule;
import com.vidnyan.trustgate.domain.rule.RulePlugin;
import com.vidnyan.trustgate.domain.rule.RuleSet;
import com.vidnyan.trustgate.domain.rule.Severity;

import java.util.List;

/**
 * The seven rules shipped with the engine, in evaluation order.
 */
public class BuiltinRules implements RulePlugin {

    static final String PYTHON = "python";

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.builder()
                        .id(ShellInjectionEvaluator.ID).name("Shell / Code Injection")
                        .severity(Severity.ERROR).evaluator(new ShellInjectionEvaluator())
                        .tags("security")
                        .build(),
                Rule.builder()
                        .id(TaintFlowEvaluator.ID).name("Taint Source to Sink")
                        .severity(Severity.ERROR).evaluator(new TaintFlowEvaluator())
                        .tags("security")
                        .build(),
                Rule.builder()
                        .id(UnusedImportEvaluator.ID).name("Unused Import")
                        .severity(Severity.WARNING).evaluator(new UnusedImportEvaluator())
                        .languages(PYTHON).tags("quality")
                        .build(),
                Rule.builder()
                        .id(TypeMismatchEvaluator.ID).name("Type Mismatch in Arithmetic")
                        .severity(Severity.ERROR).evaluator(new TypeMismatchEvaluator())
                        .tags("correctness")
                        .build(),
                Rule.builder()
                        .id(BareExceptEvaluator.ID).name("Bare Except Clause")
                        .severity(Severity.WARNING).evaluator(new BareExceptEvaluator())
                        .languages(PYTHON).tags("quality")
                        .build(),
                Rule.builder()
                        .id(HardcodedSecretEvaluator.ID).name("Hardcoded Secret")
                        .severity(Severity.ERROR).evaluator(new HardcodedSecretEvaluator())
                        .tags("security")
                        .build(),
                Rule.builder()
                        .id(UnreachableCodeEvaluator.ID).name("Unreachable Code")
                        .severity(Severity.WARNING).evaluator(new UnreachableCodeEvaluator())
                        .tags("quality")
                        .build());
    }

    /**
     * Create a rule set holding only the built-in rules.
     */
    public static RuleSet ruleSet() {
        return RuleSet.of(new BuiltinRules().rules());
    }
}
