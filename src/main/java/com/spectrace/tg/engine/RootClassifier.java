package com.spectrace.tg.engine;

import java.util.List;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.NodeKind;

/**
 * Decides whether a node is a root, an orphan or a child.
 *
 * A node is parentless when nothing points at it through Implements, Refines
 * or Validates. A parentless node is a root only if at least one of its
 * children is of a kind outside the configured satellite set; remainder text
 * never counts. Conflict copies are always orphans. User journeys are
 * entry points and always roots.
 *
 * Classification reads the live structure, so it is always current after
 * mutations.
 */
final class RootClassifier {

    private RootClassifier() {
        // Utility class
    }

    static NodeRole role(TraceGraph graph, TraceNode node) {
        NodeKind kind = node.kind();
        if (kind == NodeKind.ASSERTION || kind == NodeKind.TEST_RESULT || kind == NodeKind.REMAINDER)
            return NodeRole.STRUCTURAL;
        if (kind == NodeKind.USER_JOURNEY)
            return NodeRole.ROOT;
        if (node.isConflict())
            return NodeRole.ORPHAN;
        for (Edge e : node.incoming())
            if (isParentEdge(e.kind()))
                return NodeRole.CHILD;

        List<NodeKind> satellites = graph.config().getSatelliteKinds();
        for (Edge e : node.outgoing()) {
            NodeKind childKind = graph.getNode(e.targetId()).kind();
            if (childKind != NodeKind.REMAINDER && !satellites.contains(childKind))
                return NodeRole.ROOT;
        }
        return NodeRole.ORPHAN;
    }

    static boolean isParentEdge(EdgeKind kind) {
        return kind == EdgeKind.IMPLEMENTS || kind == EdgeKind.REFINES || kind == EdgeKind.VALIDATES;
    }
}
