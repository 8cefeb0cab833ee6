package com.vidnyan.trustgate.adapter.out.evaluator;

import com.vidnyan.trustgate.domain.meta.MetaAst;
import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.rule.EvaluationContext;
import com.vidnyan.trustgate.domain.rule.Finding;
import com.vidnyan.trustgate.domain.rule.RuleEvaluator;
import com.vidnyan.trustgate.domain.syntax.SyntaxNode;

import java.util.*;

/**
 * Flags imported names that are never referenced.
 * <p>
 * Each import binds the last segment of every imported dotted name, or its
 * alias. A name counts as used when it appears as a variable outside any
 * import, or as the first segment of a call name. Wildcard imports bind nothing.
 */
public class UnusedImportEvaluator implements RuleEvaluator {

    public static final String ID = "unused_import";

    @Override
    public List<Finding> evaluate(EvaluationContext context) {
        MetaAst ast = context.ast();
        List<MetaNode> imports = ast.allImports();
        if (imports.isEmpty()) {
            return List.of();
        }
        Set<String> used = usedNames(ast, imports);

        List<Finding> findings = new ArrayList<>();
        for (MetaNode imp : imports) {
            for (String name : boundNames(imp, ast.source())) {
                if (name.isEmpty() || used.contains(name)) {
                    continue;
                }
                findings.add(context.finding()
                        .message(String.format("Import `%s` is never used", name))
                        .fixHint(String.format("Remove the unused import `%s`.", name))
                        .at(imp)
                        .build());
            }
        }
        return findings;
    }

    private Set<String> usedNames(MetaAst ast, List<MetaNode> imports) {
        Set<MetaNode> inImports = Collections.newSetFromMap(new IdentityHashMap<>());
        imports.forEach(imp -> inImports.addAll(imp.preOrder()));

        Set<String> used = new HashSet<>();
        for (MetaNode node : ast.root().preOrder()) {
            if (node.is(NodeKind.VARIABLE) && !inImports.contains(node)) {
                node.name().ifPresent(used::add);
            }
        }
        for (MetaNode call : ast.allCalls()) {
            String name = call.nameOrEmpty();
            if (!name.isEmpty()) {
                used.add(name.split("\\.", 2)[0]);
            }
        }
        return used;
    }

    /**
     * Names an import statement introduces into its scope.
     */
    static List<String> boundNames(MetaNode imp, String source) {
        Optional<SyntaxNode> syntax = imp.syntax();
        if (syntax.isEmpty()) {
            return List.of(fromText(imp.nameOrEmpty()));
        }
        SyntaxNode statement = syntax.get();
        SyntaxNode module = statement.field("module_name").orElse(null);
        List<String> names = new ArrayList<>();
        for (SyntaxNode child : statement.children()) {
            if (child == module) {
                continue;
            }
            switch (child.type()) {
                case "wildcard_import" -> {
                    return List.of();
                }
                case "dotted_name" -> names.add(lastSegment(child.text(source)));
                case "aliased_import" -> child.field("alias")
                        .or(() -> child.field("name"))
                        .ifPresent(n -> names.add(lastSegment(n.text(source))));
                default -> {
                }
            }
        }
        return names.isEmpty() ? List.of(fromText(imp.nameOrEmpty())) : names;
    }

    private static String fromText(String statement) {
        String text = statement.strip();
        int alias = text.lastIndexOf(" as ");
        if (alias >= 0) {
            return text.substring(alias + 4).strip();
        }
        String[] words = text.split("\\s+");
        return lastSegment(words[words.length - 1]);
    }

    private static String lastSegment(String dotted) {
        String compact = dotted.replaceAll("\\s+", "");
        int dot = compact.lastIndexOf('.');
        return dot >= 0 ? compact.substring(dot + 1) : compact;
    }
}
