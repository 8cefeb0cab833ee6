package com.vidnyan.trustgate.domain.graph;

import com.vidnyan.trustgate.domain.meta.MetaAst;
import com.vidnyan.trustgate.domain.meta.MetaNode;
import com.vidnyan.trustgate.domain.meta.NodeKind;

import java.util.*;

/**
 * Builds one intra-procedural control-flow graph for the whole input.
 * <p>
 * Statement nodes are chained from the current frontier. A conditional visits
 * each of its blocks as a branch and falls through when it has fewer than two.
 * A loop header receives back edges from its body and stays the only exit.
 * EXIT is connected from the final frontier and from every node without an
 * outgoing edge, so it is always reachable from ENTRY.
 */
public class ControlFlowGraphBuilder implements GraphBuilder {

    public static final String ENTRY = "ENTRY";
    public static final String EXIT = "EXIT";
    public static final String BACK_EDGE = "back";

    private static final int LABEL_TEXT = 40;

    @Override
    public GraphKind kind() {
        return GraphKind.CFG;
    }

    @Override
    public ProgramGraph build(MetaAst ast) {
        ProgramGraph.Builder cfg = ProgramGraph.builder(GraphKind.CFG);
        GraphNode entry = cfg.addNode(ENTRY, null, 0);
        cfg.entry(entry.id());

        List<Integer> frontier = visit(ast.root(), cfg, List.of(entry.id()));

        Set<Integer> leaves = new LinkedHashSet<>(frontier);
        Set<Integer> sources = new HashSet<>();
        for (GraphEdge edge : cfg.edges()) {
            sources.add(edge.src());
        }
        for (GraphNode node : cfg.nodes()) {
            if (!sources.contains(node.id())) {
                leaves.add(node.id());
            }
        }

        GraphNode exit = cfg.addNode(EXIT, null, 0);
        cfg.exit(exit.id());
        if (leaves.isEmpty()) {
            leaves.add(entry.id());
        }
        for (int leaf : leaves) {
            cfg.addEdge(leaf, exit.id(), "");
        }
        return cfg.build();
    }

    private List<Integer> visit(MetaNode node, ProgramGraph.Builder cfg, List<Integer> previous) {
        if (node.kind().isStatement()) {
            GraphNode step = cfg.addNode(statementLabel(node), node, node.line());
            link(cfg, previous, step.id(), "");
            return List.of(step.id());
        }
        return switch (node.kind()) {
            case CONDITIONAL -> visitConditional(node, cfg, previous);
            case LOOP -> visitLoop(node, cfg, previous);
            case FUNCTION -> visitFunction(node, cfg, previous);
            default -> visitSequence(node.children(), cfg, previous);
        };
    }

    private List<Integer> visitConditional(MetaNode node, ProgramGraph.Builder cfg, List<Integer> previous) {
        GraphNode condition = cfg.addNode("IF", node, node.line());
        link(cfg, previous, condition.id(), "");

        List<Integer> exits = new ArrayList<>();
        int branches = 0;
        for (MetaNode child : node.children()) {
            if (child.is(NodeKind.BLOCK)) {
                exits.addAll(visitSequence(child.children(), cfg, List.of(condition.id())));
                branches++;
            }
        }
        if (branches < 2) {
            exits.add(condition.id());
        }
        return exits;
    }

    private List<Integer> visitLoop(MetaNode node, ProgramGraph.Builder cfg, List<Integer> previous) {
        GraphNode header = cfg.addNode("LOOP", node, node.line());
        link(cfg, previous, header.id(), "");

        List<Integer> body = List.of(header.id());
        for (MetaNode child : node.children()) {
            if (child.is(NodeKind.BLOCK)) {
                body = visitSequence(child.children(), cfg, body);
            }
        }
        link(cfg, body, header.id(), BACK_EDGE);
        return List.of(header.id());
    }

    private List<Integer> visitFunction(MetaNode node, ProgramGraph.Builder cfg, List<Integer> previous) {
        GraphNode function = cfg.addNode("FUNC: " + node.name().orElse("?"), node, node.line());
        link(cfg, previous, function.id(), "");

        List<Integer> body = List.of(function.id());
        for (MetaNode child : node.children()) {
            if (child.is(NodeKind.BLOCK)) {
                body = visitSequence(child.children(), cfg, body);
            }
        }
        return body;
    }

    private List<Integer> visitSequence(List<MetaNode> nodes, ProgramGraph.Builder cfg, List<Integer> previous) {
        List<Integer> current = previous;
        for (MetaNode child : nodes) {
            current = visit(child, cfg, current);
        }
        return current;
    }

    private static void link(ProgramGraph.Builder cfg, List<Integer> from, int to, String label) {
        for (int id : from) {
            cfg.addEdge(id, to, label);
        }
    }

    static String statementLabel(MetaNode node) {
        String detail = node.name().orElseGet(() -> {
            String text = node.text();
            return text.length() > LABEL_TEXT ? text.substring(0, LABEL_TEXT) : text;
        });
        return node.kind().name() + ": " + detail;
    }
}
