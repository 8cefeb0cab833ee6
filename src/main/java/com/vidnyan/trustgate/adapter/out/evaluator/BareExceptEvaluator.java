package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.rule.EvaluationContext;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.RuleEvaluator;
import com.vidnyan.trustgate.domain.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags try statements with an {@code except:} clause, or one catching
 * {@code Exception} or {@code BaseException}. One finding per try statement.
 */
public class BareExceptEvaluator implements RuleEvaluator {

    public static final String ID = "bare_except";

    private static final Set<String> CATCH_ALL = Set.of("Exception", "BaseException");

    private static final Set<String> EXCEPT_CLAUSES = Set.of("except_clause", "except_group_clause");

    private static final Set<String> NOT_CAUGHT = Set.of("block", "comment");

    /** Used when the node carries no syntax tree. */
    private static final Pattern BROAD_HEADER = Pattern.compile(
            "^\\s*except\\s*(\\*\\s*)?(\\(?\\s*(Exception|BaseException)\\s*\\)?\\s*(as\\s+\\w+\\s*)?)?:",
            Pattern.MULTILINE);

    @Override
    public List<Finding> evaluate(EvaluationContext context) {
        String source = context.ast().source();
        List<Finding> findings = new ArrayList<>();
        for (MetaNode tryNode : context.ast().root().findAll(NodeKind.TRY_EXCEPT)) {
            if (catchesEverything(tryNode, source)) {
                findings.add(context.finding()
                        .message("Bare `except` swallows all exceptions; catch specific types")
                        .fixHint("Replace with `except SpecificError:` to avoid masking bugs.")
                        .at(tryNode)
                        .build());
            }
        }
        return findings;
    }

    static boolean catchesEverything(MetaNode tryNode, String source) {
        Optional<SyntaxNode> syntax = tryNode.syntax();
        if (syntax.isEmpty()) {
            return BROAD_HEADER.matcher(tryNode.text()).find();
        }
        for (SyntaxNode clause : syntax.get().children()) {
            if (!EXCEPT_CLAUSES.contains(clause.type())) {
                continue;
            }
            Optional<SyntaxNode> value = caughtType(clause);
            if (value.isEmpty()) {
                return true;
            }
            String caught = value.get().text(source)
                    .replaceFirst("\\s+as\\s+.*$", "")
                    .replaceAll("[()\\s]", "");
            if (CATCH_ALL.contains(caught)) {
                return true;
            }
        }
        return false;
    }

    // Grammar releases differ on whether the caught expression is a "value" field.
    private static Optional<SyntaxNode> caughtType(SyntaxNode clause) {
        Optional<SyntaxNode> value = clause.field("value");
        if (value.isPresent()) {
            return value;
        }
        return clause.children().stream()
                .filter(SyntaxNode::isNamed)
                .filter(child -> !NOT_CAUGHT.contains(child.type()))
                .findFirst();
    }
}
