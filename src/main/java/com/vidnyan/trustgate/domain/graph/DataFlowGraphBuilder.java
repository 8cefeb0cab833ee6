package com.vidnyan.trustgate.domain.graph;

import com.vidnyan.trustgate.domain.meta.MetaAst;
import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;
import com.vidnyan.trustgate.domain.syntax.SyntaxNode;

import java.util.*;

/**
 * Builds a def/use graph.
 * <p>
 * The left-hand variable of an assignment is a def, as is each function
 * parameter; every other variable reference is a use. Edges run from every
 * def of a name to every use of that name on the same or a later line. There
 * is no control-flow awareness: defs in mutually exclusive branches both reach
 * a later use.
 */
public class DataFlowGraphBuilder implements GraphBuilder {

    public static final String DEF = "def";
    public static final String PARAM = "param";
    public static final String USE = "use";

    @Override
    public GraphKind kind() {
        return GraphKind.DFG;
    }

    @Override
    public ProgramGraph build(MetaAst ast) {
        ProgramGraph.Builder dfg = ProgramGraph.builder(GraphKind.DFG);
        Map<MetaNode, Binding> bindings = collectBindings(ast.root());

        Map<String, List<Fact>> defs = new HashMap<>();
        List<Fact> uses = new ArrayList<>();
        for (MetaNode node : ast.root().preOrder()) {
            if (!node.is(NodeKind.VARIABLE) || node.nameOrEmpty().isEmpty()) {
                continue;
            }
            String variable = node.nameOrEmpty();
            Binding binding = bindings.get(node);
            if (binding == null) {
                GraphNode use = dfg.addNode(USE + ":" + variable, node, node.line());
                uses.add(new Fact(variable, use.id(), node.line()));
            } else if (binding.role() != null) {
                MetaNode owner = binding.owner();
                GraphNode def = dfg.addNode(binding.role() + ":" + variable, owner, owner.line());
                defs.computeIfAbsent(variable, k -> new ArrayList<>())
                        .add(new Fact(variable, def.id(), owner.line()));
            }
        }

        for (Fact use : uses) {
            for (Fact def : defs.getOrDefault(use.variable(), List.of())) {
                if (def.line() <= use.line()) {
                    dfg.addEdge(def.nodeId(), use.nodeId(), use.variable());
                }
            }
        }
        return dfg.build();
    }

    /**
     * Find the variables that are not plain uses.
     * Declared names of functions and classes get a null role and are skipped.
     */
    private Map<MetaNode, Binding> collectBindings(MetaNode root) {
        Map<MetaNode, Binding> bindings = new IdentityHashMap<>();
        for (MetaNode node : root.preOrder()) {
            switch (node.kind()) {
                case ASSIGNMENT -> {
                    if (!node.children().isEmpty() && node.children().get(0).is(NodeKind.VARIABLE)) {
                        bindings.put(node.children().get(0), new Binding(DEF, node));
                    }
                }
                case FUNCTION, CLASS -> {
                    declaredName(node).ifPresent(name -> bindings.put(name, new Binding(null, name)));
                    for (MetaNode child : node.children()) {
                        if (child.is(NodeKind.PARAMETER)) {
                            for (MetaNode parameter : child.children()) {
                                parameter.findFirst(NodeKind.VARIABLE)
                                        .ifPresent(v -> bindings.put(v, new Binding(PARAM, v)));
                            }
                        }
                    }
                    loneParameter(node).ifPresent(v -> bindings.put(v, new Binding(PARAM, v)));
                }
                default -> {
                }
            }
        }
        return bindings;
    }

    private static Optional<MetaNode> declaredName(MetaNode definition) {
        if (definition.name().isEmpty()) {
            return Optional.empty();
        }
        return definition.children().stream()
                .filter(c -> c.is(NodeKind.VARIABLE) && c.nameOrEmpty().equals(definition.nameOrEmpty()))
                .findFirst();
    }

    /**
     * The unparenthesised parameter of an arrow function ({@code x => x + 1}).
     */
    private static Optional<MetaNode> loneParameter(MetaNode function) {
        Optional<SyntaxNode> parameter = function.syntax().flatMap(s -> s.field("parameter"));
        if (parameter.isEmpty()) {
            return Optional.empty();
        }
        return function.children().stream()
                .filter(c -> c.is(NodeKind.VARIABLE) && c.syntax().orElse(null) == parameter.get())
                .findFirst();
    }

    private record Binding(String role, MetaNode owner) {}

    private record Fact(String variable, int nodeId, int line) {}
}
