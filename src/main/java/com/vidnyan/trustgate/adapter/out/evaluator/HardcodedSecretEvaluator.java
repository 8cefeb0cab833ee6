package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.rule.EvaluationContext;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.RuleEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags assignments of a quoted string to a variable whose name looks like a secret.
 */
public class HardcodedSecretEvaluator implements RuleEvaluator {

    public static final String ID = "hardcoded_secret";

    static final Set<String> SECRET_NAMES = Set.of(
            "password", "passwd", "secret", "api_key", "apikey",
            "token", "auth_token", "private_key", "secret_key");

    @Override
    public List<Finding> evaluate(EvaluationContext context) {
        List<Finding> findings = new ArrayList<>();
        for (MetaNode assignment : context.ast().root().findAll(NodeKind.ASSIGNMENT)) {
            if (assignment.children().isEmpty()) {
                continue;
            }
            MetaNode target = assignment.children().get(0);
            if (!looksSecret(target.nameOrEmpty()) || !assignsString(assignment)) {
                continue;
            }
            findings.add(context.finding()
                    .message(String.format("Hardcoded secret in variable `%s`", target.nameOrEmpty()))
                    .fixHint("Use environment variables or a secrets manager instead.")
                    .spanning(assignment)
                    .build());
        }
        return findings;
    }

    static boolean looksSecret(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return !lower.isEmpty() && SECRET_NAMES.stream().anyMatch(lower::contains);
    }

    private static boolean assignsString(MetaNode assignment) {
        List<MetaNode> children = assignment.children();
        for (MetaNode value : children.subList(1, children.size())) {
            if (!value.is(NodeKind.LITERAL)) {
                continue;
            }
            String text = value.text().strip();
            if (text.startsWith("'") || text.startsWith("\"") || text.startsWith("`")) {
                return true;
            }
        }
        return false;
    }
}
