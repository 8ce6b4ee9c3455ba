package com.spectrace.tg.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.NodeKind;
import com.spectrace.tg.io.PendingLink;

/**
 * Looks pending link targets up in the finished node table.
 *
 * Matching tolerates case and underscore-for-dash differences, so
 * {@code req_P00001} finds {@code REQ-p00001}. A reference to an assertion id
 * resolves to the owning requirement with that label. Conflict copies are
 * never link targets.
 */
final class ReferenceResolver {
    private final TraceGraph graph;
    private final Map<String, String> index = new HashMap<>();

    /**
     * @param parent  the node the edges will hang from, or null if the target is unknown
     * @param labels  assertion labels that exist on the parent
     * @param missing labels, or the whole reference, that could not be found
     */
    record Target(TraceNode parent, List<String> labels, List<String> missing) {
    }

    ReferenceResolver(TraceGraph graph) {
        this.graph = graph;
        graph.nodes().forEach(n -> {
            if ((n.kind() == NodeKind.REQUIREMENT || n.kind() == NodeKind.USER_JOURNEY
                    || n.kind() == NodeKind.ASSERTION) && !n.isConflict())
                index.putIfAbsent(normalize(n.id()), n.id());
        });
    }

    static String normalize(String ref) {
        return ref.strip().toUpperCase(Locale.ROOT).replace('_', '-');
    }

    Target lookup(PendingLink link) {
        String id = index.get(normalize(link.target()));
        if (id == null)
            return new Target(null, List.of(), List.of(link.rawTarget()));
        TraceNode node = graph.getNode(id);
        List<String> wanted = link.assertionLabels();
        if (node.kind() == NodeKind.ASSERTION) {
            if (!wanted.isEmpty())
                return new Target(null, List.of(), List.of(link.rawTarget()));
            TraceNode owner = owner(node);
            if (owner == null)
                return new Target(null, List.of(), List.of(link.rawTarget()));
            return new Target(owner, List.of(node.text("label")), List.of());
        }
        List<String> found = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String label : wanted) {
            if (hasAssertion(node, label)) {
                if (!found.contains(label))
                    found.add(label);
            } else {
                missing.add(node.id() + "-" + label);
            }
        }
        return new Target(node, found, missing);
    }

    private TraceNode owner(TraceNode assertion) {
        for (Edge e : assertion.incoming())
            if (e.kind() == EdgeKind.CONTAINS)
                return graph.getNode(e.sourceId());
        return null;
    }

    static boolean hasAssertion(TraceNode node, String label) {
        for (Edge e : node.outgoing())
            if (e.kind() == EdgeKind.CONTAINS && e.targetId().equals(node.id() + "-" + label))
                return true;
        return false;
    }
}
