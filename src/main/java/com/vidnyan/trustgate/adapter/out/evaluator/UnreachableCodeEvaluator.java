package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.rule.EvaluationContext;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.RuleEvaluator;

import java.util.*;

/**
 * Flags statements following a return or raise in the same block.
 * Every block lying inside a function is checked once, so statements in
 * nested functions are not reported twice.
 */
public class UnreachableCodeEvaluator implements RuleEvaluator {

    public static final String ID = "unreachable_code";

    @Override
    public List<Finding> evaluate(EvaluationContext context) {
        Set<MetaNode> blocks = Collections.newSetFromMap(new IdentityHashMap<>());
        List<MetaNode> ordered = new ArrayList<>();
        for (MetaNode function : context.ast().allFunctions()) {
            for (MetaNode block : function.findAll(NodeKind.BLOCK)) {
                if (blocks.add(block)) {
                    ordered.add(block);
                }
            }
        }

        List<Finding> findings = new ArrayList<>();
        for (MetaNode block : ordered) {
            boolean terminated = false;
            for (MetaNode statement : block.children()) {
                if (terminated) {
                    findings.add(context.finding()
                            .message("Unreachable code after return/raise statement")
                            .at(statement)
                            .build());
                }
                if (statement.is(NodeKind.RETURN) || statement.is(NodeKind.RAISE)) {
                    terminated = true;
                }
            }
        }
        return findings;
    }
}
