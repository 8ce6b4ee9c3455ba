package com.spectrace.tg.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.NodeKind;
import com.spectrace.tg.api.SourceLocation;

/**
 * A node in the traceability graph.
 *
 * Holds only its own fields and the edges touching it; other nodes are
 * reached through the owning {@link TraceGraph} by id. The field set is fixed
 * by the {@link NodeKind}.
 */
public final class TraceNode {
    private String id;
    private final NodeKind kind;
    private final Map<String, Object> fields;
    private final SourceLocation location;
    private final List<Edge> outgoing = new ArrayList<>();
    private final List<Edge> incoming = new ArrayList<>();

    TraceNode(NodeKind kind, String id, Map<String, ?> fields, SourceLocation location) {
        this.kind = kind;
        this.id = id;
        // declared field order, whatever order fields are set or cleared in
        this.fields = new TreeMap<>(Comparator.comparingInt(kind.fields()::indexOf));
        this.location = location;
        fields.forEach(this::setField);
    }

    public String id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    /** Field value, or null when unset. */
    public Object field(String name) {
        return fields.get(name);
    }

    public String text(String name) {
        Object v = fields.get(name);
        return v == null ? null : v.toString();
    }

    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    /** Source location, or null for nodes created by mutation or synthesis. */
    public SourceLocation location() {
        return location;
    }

    public List<Edge> outgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    public List<Edge> incoming() {
        return Collections.unmodifiableList(incoming);
    }

    public boolean isConflict() {
        return Boolean.TRUE.equals(fields.get("conflict"));
    }

    public String status() {
        return text("status");
    }

    /** True if any incoming edge of the given kind exists. */
    public boolean hasIncoming(EdgeKind edgeKind) {
        for (Edge e : incoming)
            if (e.kind() == edgeKind)
                return true;
        return false;
    }

    /** Sets or clears a field. Returns the previous value. */
    Object setField(String name, Object value) {
        if (!kind.hasField(name))
            throw new IllegalArgumentException(kind + " has no field '" + name + "'; allowed: " + kind.fields());
        return value == null ? fields.remove(name) : fields.put(name, value);
    }

    void setId(String id) {
        this.id = id;
    }

    List<Edge> outgoingEdges() {
        return outgoing;
    }

    List<Edge> incomingEdges() {
        return incoming;
    }

    @Override
    public String toString() {
        return kind + "(" + id + ")";
    }
}
