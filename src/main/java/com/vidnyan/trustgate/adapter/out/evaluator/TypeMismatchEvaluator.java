package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.rule.EvaluationContext;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.RuleEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Flags binary operations mixing a string literal with a literal of another type.
 * Only the first and last child of the operation are inspected, and only when
 * both are literals whose type can be read off their text.
 */
public class TypeMismatchEvaluator implements RuleEvaluator {

    public static final String ID = "type_mismatch";

    static final String STR = "str";

    private static final Pattern INT = Pattern.compile("[+-]?\\d+(_\\d+)*");
    private static final Pattern FLOAT = Pattern.compile(
            "[+-]?(\\d+(_\\d+)*(\\.(\\d+(_\\d+)*)?)?|\\.\\d+(_\\d+)*)([eE][+-]?\\d+)?");

    @Override
    public List<Finding> evaluate(EvaluationContext context) {
        List<Finding> findings = new ArrayList<>();
        for (MetaNode op : context.ast().root().findAll(NodeKind.BINARY_OP)) {
            List<MetaNode> children = op.children();
            if (children.size() < 2) {
                continue;
            }
            Optional<String> left = literalType(children.get(0));
            Optional<String> right = literalType(children.get(children.size() - 1));
            if (left.isEmpty() || right.isEmpty() || left.get().equals(right.get())) {
                continue;
            }
            if (STR.equals(left.get()) || STR.equals(right.get())) {
                findings.add(context.finding()
                        .message(String.format("Potential type error: mixing `%s` and `%s` in arithmetic",
                                left.get(), right.get()))
                        .fixHint("Ensure both operands are the same type or use explicit conversion.")
                        .spanning(op)
                        .build());
            }
        }
        return findings;
    }

    /**
     * Infer the type of a literal from its text.
     */
    static Optional<String> literalType(MetaNode node) {
        if (!node.is(NodeKind.LITERAL)) {
            return Optional.empty();
        }
        String text = node.text().strip();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        if (text.startsWith("'") || text.startsWith("\"") || text.startsWith("`")) {
            return Optional.of(STR);
        }
        if (text.startsWith("b'") || text.startsWith("b\"")) {
            return Optional.of("bytes");
        }
        return switch (text) {
            case "True", "False", "true", "false" -> Optional.of("bool");
            case "None", "null", "undefined" -> Optional.of("none");
            default -> numericType(text);
        };
    }

    private static Optional<String> numericType(String text) {
        if (INT.matcher(text).matches()) {
            return Optional.of("int");
        }
        if (FLOAT.matcher(text).matches()) {
            return Optional.of("float");
        }
        return Optional.empty();
    }
}
