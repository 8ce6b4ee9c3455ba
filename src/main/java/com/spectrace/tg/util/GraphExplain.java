package com.spectrace.tg.util;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.engine.Edge;
import com.spectrace.tg.engine.TraceGraph;
import com.spectrace.tg.engine.TraceNode;
import com.spectrace.tg.metrics.RollupMetrics;

/**
 * Diagnostic utility for inspecting graph state and structure.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions, logging errors, or test
 * failure messages. Not a report renderer.
 */
public final class GraphExplain {
    private final TraceGraph graph;

    public GraphExplain(TraceGraph graph) {
        this.graph = graph;
    }

    /**
     * Dumps detailed state of a single node.
     */
    public String explainNode(String id) {
        TraceNode node = graph.getNode(id);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(id).append('\n')
                .append("  Kind: ").append(node.kind()).append('\n')
                .append("  Role: ").append(graph.role(id)).append('\n');
        if (node.location() != null)
            sb.append("  Location: ").append(node.location()).append('\n');
        node.fields().forEach((k, v) -> {
            if (!k.equals("body") && !k.equals("text"))
                sb.append("  ").append(k).append(": ").append(v).append('\n');
        });
        appendEdges(sb, "Parents", node.incoming(), true);
        appendEdges(sb, "Children", node.outgoing(), false);
        graph.metrics(id).ifPresent(m -> sb.append("  Metrics: ").append(summary(m)).append('\n'));
        return sb.toString();
    }

    /**
     * Dumps the hierarchy under every root as an indented tree. Contains
     * edges are omitted; a node reached twice is marked and not expanded again.
     */
    public String dumpTree() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Graph (").append(graph.nodeCount()).append(" nodes, ").append(graph.edgeCount())
                .append(" edges):\n");
        Set<String> expanded = new HashSet<>();
        graph.roots().forEach(root -> dump(sb, root, null, 1, expanded));
        long orphans = graph.orphans().count();
        if (orphans > 0)
            sb.append("Orphans: ").append(orphans).append('\n');
        return sb.toString();
    }

    private void dump(StringBuilder sb, TraceNode node, Edge via, int depth, Set<String> expanded) {
        sb.append("  ".repeat(depth));
        if (via != null) {
            sb.append(via.kind());
            if (!via.targetsWholeNode())
                sb.append(via.assertionTargets());
            sb.append(' ');
        }
        sb.append(node.kind()).append(' ').append(node.id());
        String title = node.text("title");
        if (title != null)
            sb.append(" \"").append(title).append('"');
        if (!expanded.add(node.id())) {
            sb.append(" (see above)\n");
            return;
        }
        sb.append('\n');
        for (Edge e : node.outgoing())
            if (e.kind() != EdgeKind.CONTAINS)
                dump(sb, graph.getNode(e.targetId()), e, depth + 1, expanded);
    }

    private static void appendEdges(StringBuilder sb, String label, List<Edge> edges, boolean incoming) {
        sb.append("  ").append(label).append(" (").append(edges.size()).append("): ");
        for (int i = 0; i < edges.size(); i++) {
            Edge e = edges.get(i);
            sb.append(incoming ? e.sourceId() : e.targetId()).append(" [").append(e.kind());
            if (!e.targetsWholeNode())
                sb.append(' ').append(String.join(",", e.assertionTargets()));
            sb.append(']');
            if (i < edges.size() - 1)
                sb.append(", ");
        }
        sb.append('\n');
    }

    private static String summary(RollupMetrics m) {
        return String.format(Locale.ROOT, "assertions %d/%d covered (%.1f%%, %.1f%% with indirect), tests %d "
                + "(%d passed, %d failed, %d skipped), code refs %d",
                m.getCoveredAssertions(), m.getTotalAssertions(), m.getCoveragePct(), m.getIndirectCoveragePct(),
                m.getTotalTests(), m.getPassedTests(), m.getFailedTests(), m.getSkippedTests(), m.getTotalCodeRefs());
    }
}
