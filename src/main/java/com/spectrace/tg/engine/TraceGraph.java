package com.spectrace.tg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

import com.spectrace.tg.api.DuplicateIdException;
import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.NodeKind;
import com.spectrace.tg.api.NodeNotFoundException;
import com.spectrace.tg.api.SourceLocation;
import com.spectrace.tg.io.IdPatterns;
import com.spectrace.tg.io.TraceConfig;
import com.spectrace.tg.metrics.CoverageAnnotator;
import com.spectrace.tg.metrics.RollupMetrics;

/**
 * The traceability graph: owner of every node and edge.
 *
 * <p>
 * Nodes live in an id-indexed table; edges are plain {@code (source, target,
 * kind)} records listed on both endpoints. Nodes never point at each other
 * directly, so deleting a node can leave at worst a dangling id, never a
 * dangling object.
 *
 * <p>
 * Outside this package the graph is read-only. Structural changes go through
 * {@link #mutations()}, which logs each change for undo. Iteration methods
 * return lazy streams over the live table; do not mutate while a stream is
 * open.
 *
 * <p>
 * Single writer: the graph is not thread-safe.
 */
public final class TraceGraph {
    private final TraceConfig config;
    private final IdPatterns ids;
    private final LinkedHashMap<String, TraceNode> nodes = new LinkedHashMap<>();
    private final List<BrokenReference> broken = new ArrayList<>();
    private final Map<String, RollupMetrics> metrics = new HashMap<>();
    private GraphMutator mutator;

    TraceGraph(TraceConfig config) {
        this.config = config;
        this.ids = IdPatterns.of(config);
    }

    /** An empty graph, for assembling nodes by mutation only. */
    public static TraceGraph empty(TraceConfig config) {
        return new TraceGraph(config);
    }

    public TraceConfig config() {
        return config;
    }

    public IdPatterns ids() {
        return ids;
    }

    // ---------- lookup ----------

    /** O(1) lookup. */
    public TraceNode getNode(String id) {
        TraceNode node = nodes.get(id);
        if (node == null)
            throw new NodeNotFoundException(id);
        return node;
    }

    public Optional<TraceNode> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        int n = 0;
        for (TraceNode node : nodes.values())
            n += node.outgoingEdges().size();
        return n;
    }

    // ---------- iteration ----------

    public Stream<TraceNode> nodes() {
        return nodes.values().stream();
    }

    public Stream<TraceNode> nodesOfKind(NodeKind kind) {
        return nodes().filter(n -> n.kind() == kind);
    }

    /** Parentless nodes with meaningful children, classified against the current structure. */
    public Stream<TraceNode> roots() {
        return nodes().filter(n -> RootClassifier.role(this, n) == NodeRole.ROOT);
    }

    public Stream<TraceNode> orphans() {
        return nodes().filter(n -> RootClassifier.role(this, n) == NodeRole.ORPHAN);
    }

    public NodeRole role(String id) {
        return RootClassifier.role(this, getNode(id));
    }

    public List<Edge> outgoing(String id) {
        return getNode(id).outgoing();
    }

    public List<Edge> incoming(String id) {
        return getNode(id).incoming();
    }

    /** Distinct targets of the node's outgoing edges, in edge order. */
    public Stream<TraceNode> children(String id) {
        return outgoing(id).stream().map(Edge::targetId).distinct().map(nodes::get);
    }

    public Stream<TraceNode> children(String id, EdgeKind kind) {
        return outgoing(id).stream().filter(e -> e.kind() == kind).map(Edge::targetId).distinct().map(nodes::get);
    }

    /** Distinct sources of the node's incoming edges, in edge order. */
    public Stream<TraceNode> parents(String id) {
        return incoming(id).stream().map(Edge::sourceId).distinct().map(nodes::get);
    }

    /** References that did not resolve during the build, in resolution order. */
    public List<BrokenReference> brokenReferences() {
        return Collections.unmodifiableList(broken);
    }

    // ---------- metrics side table ----------

    /** Metrics from the last annotation, or empty if the node was not annotated or the graph changed since. */
    public Optional<RollupMetrics> metrics(String id) {
        getNode(id);
        return Optional.ofNullable(metrics.get(id));
    }

    public boolean hasMetrics() {
        return !metrics.isEmpty();
    }

    /**
     * Recomputes coverage metrics for every node, replacing any earlier table.
     *
     * @return the new table, keyed by node id
     */
    public Map<String, RollupMetrics> annotate() {
        Map<String, RollupMetrics> computed = CoverageAnnotator.compute(this);
        replaceMetrics(computed);
        return computed;
    }

    /** Replaces every metrics record at once. */
    void replaceMetrics(Map<String, RollupMetrics> computed) {
        metrics.clear();
        metrics.putAll(computed);
    }

    void invalidateMetrics() {
        metrics.clear();
    }

    // ---------- mutation ----------

    /** The mutation and undo API. One instance per graph. */
    public GraphMutator mutations() {
        if (mutator == null)
            mutator = new GraphMutator(this);
        return mutator;
    }

    /**
     * A stable text rendering of nodes, fields and edge order. Two graphs with
     * equal snapshots are structurally equal.
     */
    public String structuralSnapshot() {
        StringBuilder sb = new StringBuilder(nodes.size() * 64);
        List<TraceNode> sorted = new ArrayList<>(nodes.values());
        sorted.sort(Comparator.comparing(TraceNode::id));
        for (TraceNode n : sorted) {
            sb.append(n.kind()).append(' ').append(n.id()).append(' ').append(n.fields()).append('\n');
            for (Edge e : n.outgoingEdges())
                sb.append("  out ").append(e).append('\n');
            for (Edge e : n.incomingEdges())
                sb.append("  in  ").append(e).append('\n');
        }
        return sb.toString();
    }

    // ---------- package-private structure ----------

    TraceNode createNode(NodeKind kind, String id, Map<String, ?> fields, SourceLocation location) {
        if (nodes.containsKey(id))
            throw new DuplicateIdException(id);
        TraceNode node = new TraceNode(kind, id, fields, location);
        nodes.put(id, node);
        return node;
    }

    int positionOf(String id) {
        int i = 0;
        for (String key : nodes.keySet()) {
            if (key.equals(id))
                return i;
            i++;
        }
        return -1;
    }

    /** Puts a previously removed node back at its former position. */
    void insertNode(TraceNode node, int position) {
        if (position < 0 || position >= nodes.size()) {
            nodes.put(node.id(), node);
            return;
        }
        List<TraceNode> order = new ArrayList<>(nodes.values());
        order.add(position, node);
        nodes.clear();
        for (TraceNode n : order)
            nodes.put(n.id(), n);
    }

    /** Removes a node whose edges have already been unlinked. */
    void removeNode(String id) {
        TraceNode node = nodes.remove(id);
        if (node != null && (!node.outgoingEdges().isEmpty() || !node.incomingEdges().isEmpty()))
            throw new IllegalStateException("Node " + id + " still has edges");
    }

    /** Appends a new edge to both endpoints. */
    Edge link(String sourceId, String targetId, EdgeKind kind, List<String> assertionTargets,
            SourceLocation location) {
        TraceNode source = getNode(sourceId);
        TraceNode target = getNode(targetId);
        Edge edge = new Edge(sourceId, targetId, kind, assertionTargets, location);
        source.outgoingEdges().add(edge);
        target.incomingEdges().add(edge);
        return edge;
    }

    EdgeSlot unlink(Edge edge) {
        List<Edge> out = getNode(edge.sourceId()).outgoingEdges();
        List<Edge> in = getNode(edge.targetId()).incomingEdges();
        int outIndex = indexOfIdentity(out, edge);
        int inIndex = indexOfIdentity(in, edge);
        if (outIndex < 0 || inIndex < 0)
            throw new IllegalStateException("Edge not linked: " + edge);
        out.remove(outIndex);
        in.remove(inIndex);
        return new EdgeSlot(edge, outIndex, inIndex);
    }

    void relink(EdgeSlot slot) {
        Edge edge = slot.edge();
        getNode(edge.sourceId()).outgoingEdges().add(slot.outIndex(), edge);
        getNode(edge.targetId()).incomingEdges().add(slot.inIndex(), edge);
    }

    Edge findEdge(String sourceId, String targetId, EdgeKind kind, List<String> assertionTargets) {
        TraceNode source = nodes.get(sourceId);
        if (source == null)
            return null;
        for (Edge e : source.outgoingEdges())
            if (e.sameAs(sourceId, targetId, kind, assertionTargets))
                return e;
        return null;
    }

    /** Changes a node id and every edge endpoint naming it, keeping the node's table position. */
    void rename(String oldId, String newId) {
        TraceNode node = getNode(oldId);
        if (nodes.containsKey(newId))
            throw new DuplicateIdException(newId);
        List<TraceNode> order = new ArrayList<>(nodes.values());
        node.setId(newId);
        for (Edge e : node.outgoingEdges())
            e.renameEndpoint(oldId, newId);
        for (Edge e : node.incomingEdges())
            e.renameEndpoint(oldId, newId);
        nodes.clear();
        for (TraceNode n : order)
            nodes.put(n.id(), n);
    }

    void addBroken(BrokenReference ref) {
        broken.add(ref);
    }

    private static int indexOfIdentity(List<Edge> edges, Edge edge) {
        for (int i = 0; i < edges.size(); i++)
            if (edges.get(i) == edge)
                return i;
        return -1;
    }
}
