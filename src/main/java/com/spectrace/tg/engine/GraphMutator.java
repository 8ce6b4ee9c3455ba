package com.spectrace.tg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.spectrace.tg.api.ConfirmationRequiredException;
import com.spectrace.tg.api.DuplicateIdException;
import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.InvalidMutationSequenceException;
import com.spectrace.tg.api.NodeKind;
import com.spectrace.tg.api.UnknownNodeIdException;

import lombok.extern.log4j.Log4j2;

/**
 * Structural edits on a {@link TraceGraph} with an append-only audit log and
 * exact undo.
 *
 * <p>
 * Every operation validates all of its arguments before touching the graph,
 * so a failing call leaves the graph unchanged. A successful call appends one
 * {@link MutationEntry} and returns it. Destructive operations require
 * {@code confirm == true}.
 *
 * <p>
 * Undo reverses entries strictly newest first. Removed edges are put back at
 * their original positions in both endpoint lists, so an undone graph is
 * structurally equal to the graph before the mutation.
 *
 * <p>
 * Any mutation or undo discards the graph's metrics; re-run the coverage
 * annotator to refresh them.
 */
@Log4j2
public final class GraphMutator {
    private final TraceGraph graph;
    private final List<MutationEntry> entries = new ArrayList<>();
    private long nextSequence = 1;

    private record NodeSlot(TraceNode node, int position) {
    }

    GraphMutator(TraceGraph graph) {
        this.graph = graph;
    }

    /** Applied mutations, oldest first. */
    public List<MutationEntry> history() {
        return Collections.unmodifiableList(entries);
    }

    // ---------- node mutations ----------

    /**
     * Renames a node and rewrites every edge endpoint naming it. A
     * requirement's assertion and section children are renamed with it.
     */
    public MutationEntry renameNode(String oldId, String newId) {
        TraceNode node = require(oldId);
        if (newId == null || newId.isBlank())
            throw new IllegalArgumentException("New id must not be blank");
        if (node.kind() == NodeKind.ASSERTION)
            throw new IllegalArgumentException("Assertion ids follow their requirement; rename " + oldId
                    + "'s requirement or use addAssertion/deleteAssertion");
        if (graph.contains(newId))
            throw new DuplicateIdException(newId);

        Map<String, String> renames = new LinkedHashMap<>();
        renames.put(oldId, newId);
        for (Edge e : node.outgoing()) {
            if (e.kind() != EdgeKind.CONTAINS)
                continue;
            String child = e.targetId();
            String renamed = null;
            if (child.startsWith(oldId + "-"))
                renamed = newId + child.substring(oldId.length());
            else if (child.startsWith("rem:" + oldId + ":"))
                renamed = "rem:" + newId + child.substring(4 + oldId.length());
            if (renamed != null) {
                if (graph.contains(renamed) || renames.containsValue(renamed))
                    throw new DuplicateIdException(renamed);
                renames.put(child, renamed);
            }
        }

        // retained duplicates keep pointing at the node they lost to
        List<String> copies = graph.nodes()
                .filter(n -> n.isConflict() && oldId.equals(n.text("conflictWith")))
                .map(TraceNode::id)
                .toList();

        renames.forEach(graph::rename);
        for (String copy : copies)
            graph.getNode(copy).setField("conflictWith", newId);
        List<String[]> applied = new ArrayList<>();
        renames.forEach((from, to) -> applied.add(new String[] { from, to }));
        return record(MutationKind.RENAME_NODE, List.of(oldId, newId), oldId + " -> " + newId, g -> {
            for (String copy : copies)
                g.getNode(copy).setField("conflictWith", oldId);
            for (int i = applied.size() - 1; i >= 0; i--)
                g.rename(applied.get(i)[1], applied.get(i)[0]);
        });
    }

    /** Sets a field; a null value clears it. */
    public MutationEntry updateField(String id, String field, Object value) {
        TraceNode node = require(id);
        if (!node.kind().hasField(field))
            throw new IllegalArgumentException(node.kind() + " has no field '" + field + "'");
        if (node.kind() == NodeKind.ASSERTION && field.equals("label"))
            throw new IllegalArgumentException("Assertion labels are part of the id; delete and re-add instead");
        Object previous = node.setField(field, value);
        return record(MutationKind.UPDATE_FIELD, List.of(id), id + "." + field + " = " + value,
                g -> g.getNode(id).setField(field, previous));
    }

    /**
     * Adds a requirement, optionally implementing an existing parent.
     *
     * @param parentId parent requirement, or null for a new top-level requirement
     */
    public MutationEntry addRequirement(String id, String title, String level, String status, String parentId) {
        if (!graph.ids().isRequirementId(id))
            throw new IllegalArgumentException("Not a valid requirement id: " + id);
        if (graph.contains(id))
            throw new DuplicateIdException(id);
        if (parentId != null && require(parentId).kind() != NodeKind.REQUIREMENT)
            throw new IllegalArgumentException(parentId + " is not a requirement");

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", title);
        fields.put("level", level != null ? graph.config().resolveLevel(level) : graph.ids().levelOf(id));
        fields.put("status", status != null ? status : "Draft");
        graph.createNode(NodeKind.REQUIREMENT, id, fields, null);
        List<String> affected = new ArrayList<>(List.of(id));
        if (parentId != null) {
            graph.link(parentId, id, EdgeKind.IMPLEMENTS, List.of(), null);
            affected.add(parentId);
        }
        return record(MutationKind.ADD_REQUIREMENT, affected, id + (parentId != null ? " implements " + parentId : ""),
                g -> removeAdded(g, List.of(id)));
    }

    /** Deletes a requirement together with its assertions and section text. */
    public MutationEntry deleteRequirement(String id, boolean confirm) {
        TraceNode node = require(id);
        if (node.kind() != NodeKind.REQUIREMENT)
            throw new IllegalArgumentException(id + " is not a requirement");
        confirm("deleteRequirement", id, confirm);

        Set<String> doomed = new LinkedHashSet<>();
        doomed.add(id);
        for (Edge e : node.outgoing())
            if (e.kind() == EdgeKind.CONTAINS)
                doomed.add(e.targetId());
        return record(MutationKind.DELETE_REQUIREMENT, new ArrayList<>(doomed), "delete " + id, detach(doomed));
    }

    public MutationEntry addAssertion(String requirementId, String label, String text) {
        TraceNode req = require(requirementId);
        if (req.kind() != NodeKind.REQUIREMENT)
            throw new IllegalArgumentException(requirementId + " is not a requirement");
        if (label == null || !graph.ids().isAssertionLabel(label))
            throw new IllegalArgumentException("Invalid assertion label: " + label);
        String id = requirementId + "-" + label;
        if (graph.contains(id))
            throw new DuplicateIdException(id);

        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("label", label);
        fields.put("text", text);
        graph.createNode(NodeKind.ASSERTION, id, fields, null);
        graph.link(requirementId, id, EdgeKind.CONTAINS, List.of(), null);
        return record(MutationKind.ADD_ASSERTION, List.of(requirementId, id), "add " + id,
                g -> removeAdded(g, List.of(id)));
    }

    /** Deletes an assertion and every edge that targets only that assertion. */
    public MutationEntry deleteAssertion(String requirementId, String label, boolean confirm) {
        TraceNode req = require(requirementId);
        String id = requirementId + "-" + label;
        TraceNode assertion = graph.findNode(id).orElse(null);
        if (assertion == null || assertion.kind() != NodeKind.ASSERTION)
            throw new UnknownNodeIdException(id);
        confirm("deleteAssertion", id, confirm);

        List<EdgeSlot> slots = new ArrayList<>();
        for (Edge e : new ArrayList<>(req.outgoing()))
            if (e.kind() != EdgeKind.CONTAINS && e.assertionTargets().equals(List.of(label)))
                slots.add(graph.unlink(e));
        MutationEntry.Reversal restoreEdges = restore(List.of(), slots);
        MutationEntry.Reversal restoreNode = detach(Set.of(id));
        return record(MutationKind.DELETE_ASSERTION, List.of(requirementId, id), "delete " + id, g -> {
            restoreNode.revert(g);
            restoreEdges.revert(g);
        });
    }

    // ---------- edge mutations ----------

    /**
     * Adds a link from child to parent. With assertion labels, one edge is
     * added per label.
     */
    public MutationEntry addEdge(String parentId, String childId, EdgeKind kind, List<String> assertionLabels) {
        TraceNode parent = require(parentId);
        TraceNode child = require(childId);
        checkLinkable(parent, child, kind);
        List<String> labels = assertionLabels == null ? List.of() : List.copyOf(new LinkedHashSet<>(assertionLabels));
        for (String label : labels)
            if (!ReferenceResolver.hasAssertion(parent, label))
                throw new IllegalArgumentException(parentId + " has no assertion " + label);
        List<List<String>> targets = new ArrayList<>();
        if (labels.isEmpty())
            targets.add(List.of());
        else
            labels.forEach(l -> targets.add(List.of(l)));
        for (List<String> t : targets)
            if (graph.findEdge(parentId, childId, kind, t) != null)
                throw new IllegalArgumentException("Edge already exists: " + parentId + " " + kind + t + " " + childId);

        List<Edge> added = new ArrayList<>();
        for (List<String> t : targets)
            added.add(graph.link(parentId, childId, kind, t, null));
        return record(MutationKind.ADD_EDGE, List.of(parentId, childId),
                childId + " " + kind + " " + parentId + (labels.isEmpty() ? "" : " " + labels), g -> {
                    for (int i = added.size() - 1; i >= 0; i--)
                        g.unlink(added.get(i));
                });
    }

    /** Retypes every {@code from} edge between parent and child. */
    public MutationEntry changeEdgeKind(String parentId, String childId, EdgeKind from, EdgeKind to) {
        TraceNode parent = require(parentId);
        TraceNode child = require(childId);
        if (from == EdgeKind.CONTAINS)
            throw new IllegalArgumentException("Contains edges cannot be retyped");
        checkLinkable(parent, child, to);
        List<Edge> edges = matching(parent, childId, from);
        for (Edge e : edges)
            if (graph.findEdge(parentId, childId, to, e.assertionTargets()) != null)
                throw new IllegalArgumentException("Edge already exists: " + parentId + " " + to + " " + childId);

        edges.forEach(e -> e.setKind(to));
        return record(MutationKind.CHANGE_EDGE_KIND, List.of(parentId, childId),
                childId + " " + from + " -> " + to + " " + parentId, g -> edges.forEach(e -> e.setKind(from)));
    }

    /** Removes every edge of the kind between parent and child, whatever its assertion labels. */
    public MutationEntry deleteEdge(String parentId, String childId, EdgeKind kind, boolean confirm) {
        TraceNode parent = require(parentId);
        require(childId);
        if (kind == EdgeKind.CONTAINS)
            throw new IllegalArgumentException("Contains edges are removed with their node");
        List<Edge> edges = matching(parent, childId, kind);
        confirm("deleteEdge", childId + " " + kind + " " + parentId, confirm);

        List<EdgeSlot> slots = new ArrayList<>();
        for (Edge e : edges)
            slots.add(graph.unlink(e));
        return record(MutationKind.DELETE_EDGE, List.of(parentId, childId), childId + " -" + kind + "-x " + parentId,
                restore(List.of(), slots));
    }

    // ---------- undo ----------

    /** Reverses the most recent mutation. */
    public MutationEntry undoLast() {
        if (entries.isEmpty())
            throw new InvalidMutationSequenceException("Nothing to undo");
        MutationEntry entry = entries.remove(entries.size() - 1);
        entry.reversal().revert(graph);
        graph.invalidateMetrics();
        log.debug("Undid {}", entry);
        return entry;
    }

    /**
     * Reverses every mutation back to and including {@code sequence}, newest
     * first.
     *
     * @return the undone entries in the order they were reversed
     */
    public List<MutationEntry> undoTo(long sequence) {
        int index = -1;
        for (int i = 0; i < entries.size(); i++)
            if (entries.get(i).sequence() == sequence)
                index = i;
        if (index < 0)
            throw new InvalidMutationSequenceException("No mutation with sequence " + sequence + " in the log");
        List<MutationEntry> undone = new ArrayList<>();
        while (entries.size() > index)
            undone.add(undoLast());
        return undone;
    }

    // ---------- internals ----------

    private TraceNode require(String id) {
        if (id == null)
            throw new UnknownNodeIdException("null");
        return graph.findNode(id).orElseThrow(() -> new UnknownNodeIdException(id));
    }

    private static void confirm(String operation, String target, boolean confirm) {
        if (!confirm)
            throw new ConfirmationRequiredException(operation, target);
    }

    private static void checkLinkable(TraceNode parent, TraceNode child, EdgeKind kind) {
        if (kind == EdgeKind.CONTAINS)
            throw new IllegalArgumentException("Contains edges are created only by the graph builder");
        if (!child.kind().mayDeclare(kind))
            throw new IllegalArgumentException(child.kind() + " cannot declare " + kind);
        boolean parentOk = parent.kind() == NodeKind.REQUIREMENT
                || (kind == EdgeKind.ADDRESSES && parent.kind() == NodeKind.USER_JOURNEY);
        if (!parentOk || parent == child)
            throw new IllegalArgumentException(child.id() + " cannot " + kind + " " + parent.id());
    }

    private static List<Edge> matching(TraceNode parent, String childId, EdgeKind kind) {
        List<Edge> edges = new ArrayList<>();
        for (Edge e : parent.outgoing())
            if (e.kind() == kind && e.targetId().equals(childId))
                edges.add(e);
        if (edges.isEmpty())
            throw new IllegalArgumentException("No " + kind + " edge from " + childId + " to " + parent.id());
        return edges;
    }

    /** Unlinks every edge touching the nodes, then removes the nodes, remembering positions. */
    private MutationEntry.Reversal detach(Set<String> ids) {
        List<EdgeSlot> edges = new ArrayList<>();
        for (String id : ids) {
            TraceNode node = graph.getNode(id);
            for (Edge e : new ArrayList<>(node.outgoing()))
                edges.add(graph.unlink(e));
            for (Edge e : new ArrayList<>(node.incoming()))
                edges.add(graph.unlink(e));
        }
        List<NodeSlot> nodes = new ArrayList<>();
        for (String id : ids) {
            TraceNode node = graph.getNode(id);
            nodes.add(new NodeSlot(node, graph.positionOf(id)));
            graph.removeNode(id);
        }
        return restore(nodes, edges);
    }

    private static MutationEntry.Reversal restore(List<NodeSlot> nodes, List<EdgeSlot> edges) {
        return g -> {
            for (int i = nodes.size() - 1; i >= 0; i--)
                g.insertNode(nodes.get(i).node(), nodes.get(i).position());
            for (int i = edges.size() - 1; i >= 0; i--)
                g.relink(edges.get(i));
        };
    }

    /** Reverses an addition: drops the nodes' edges, then the nodes. */
    private static void removeAdded(TraceGraph g, List<String> ids) {
        for (String id : ids) {
            TraceNode node = g.getNode(id);
            for (Edge e : new ArrayList<>(node.outgoing()))
                g.unlink(e);
            for (Edge e : new ArrayList<>(node.incoming()))
                g.unlink(e);
        }
        ids.forEach(g::removeNode);
    }

    private MutationEntry record(MutationKind kind, List<String> affected, String description,
            MutationEntry.Reversal reversal) {
        MutationEntry entry = new MutationEntry(nextSequence++, kind, affected, description, reversal);
        entries.add(entry);
        graph.invalidateMetrics();
        log.debug("Applied {}", entry);
        return entry;
    }
}
