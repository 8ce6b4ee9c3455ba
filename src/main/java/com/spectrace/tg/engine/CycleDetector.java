package com.spectrace.tg.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Depth-first search for cycles over Implements and Refines edges.
 *
 * Contains, Validates and Addresses edges never form authority loops and are
 * not followed. Each distinct cycle is reported once, as the node path that
 * closes on its first element: {@code [A, B, C, A]}.
 */
final class CycleDetector {
    private enum Color {
        WHITE, GRAY, BLACK
    }

    private final TraceGraph graph;
    private final Map<String, Color> color = new HashMap<>();
    private final List<String> path = new ArrayList<>();
    private final List<List<String>> cycles = new ArrayList<>();
    private final Set<String> seen = new HashSet<>();

    private CycleDetector(TraceGraph graph) {
        this.graph = graph;
    }

    static List<List<String>> findCycles(TraceGraph graph) {
        CycleDetector d = new CycleDetector(graph);
        graph.nodes().map(TraceNode::id).toList().forEach(id -> {
            if (d.color.getOrDefault(id, Color.WHITE) == Color.WHITE)
                d.visit(id);
        });
        return d.cycles;
    }

    /** Depth-first walk from one white node, with an explicit stack so long chains cannot overflow. */
    private void visit(String root) {
        Deque<Frame> stack = new ArrayDeque<>();
        enter(stack, root);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next == top.edges.size()) {
                stack.pop();
                path.remove(path.size() - 1);
                color.put(top.id, Color.BLACK);
                continue;
            }
            Edge e = top.edges.get(top.next++);
            if (!e.kind().isAuthority())
                continue;
            String next = e.targetId();
            Color c = color.getOrDefault(next, Color.WHITE);
            if (c == Color.WHITE) {
                enter(stack, next);
            } else if (c == Color.GRAY) {
                List<String> cycle = new ArrayList<>(path.subList(path.lastIndexOf(next), path.size()));
                cycle.add(next);
                if (seen.add(canonical(cycle)))
                    cycles.add(cycle);
            }
        }
    }

    private void enter(Deque<Frame> stack, String id) {
        color.put(id, Color.GRAY);
        path.add(id);
        stack.push(new Frame(id, graph.getNode(id).outgoing()));
    }

    private static final class Frame {
        final String id;
        final List<Edge> edges;
        int next;

        Frame(String id, List<Edge> edges) {
            this.id = id;
            this.edges = edges;
        }
    }

    /** Rotation-independent key of a closed path. */
    private static String canonical(List<String> cycle) {
        List<String> ring = cycle.subList(0, cycle.size() - 1);
        int start = 0;
        for (int i = 1; i < ring.size(); i++)
            if (ring.get(i).compareTo(ring.get(start)) < 0)
                start = i;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ring.size(); i++)
            sb.append(ring.get((start + i) % ring.size())).append('\u0000');
        return sb.toString();
    }
}
