package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.rule.EvaluationContext;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.RuleEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Flags calls that evaluate code, run OS commands or import modules dynamically.
 * A call matches by its full name or by its last dotted segment, in any language.
 */
public class ShellInjectionEvaluator implements RuleEvaluator {

    public static final String ID = "shell_injection";

    static final Set<String> DANGEROUS = Set.of(
            "eval", "exec", "compile", "__import__",
            "os.system", "os.popen",
            "subprocess.call", "subprocess.run", "subprocess.Popen",
            "child_process.exec", "child_process.execSync", "child_process.spawn",
            "importlib.import_module");

    @Override
    public List<Finding> evaluate(EvaluationContext context) {
        List<Finding> findings = new ArrayList<>();
        for (MetaNode call : context.ast().allCalls()) {
            String name = call.nameOrEmpty();
            if (!isDangerous(name)) {
                continue;
            }
            findings.add(context.finding()
                    .message(String.format("Dangerous call to `%s`: potential code/command injection", name))
                    .fixHint(String.format("Avoid `%s` or sanitise all inputs before passing them.", name))
                    .at(call)
                    .build());
        }
        return findings;
    }

    static boolean isDangerous(String callName) {
        if (DANGEROUS.contains(callName)) {
            return true;
        }
        int dot = callName.lastIndexOf('.');
        return dot >= 0 && DANGEROUS.contains(callName.substring(dot + 1));
    }
}
