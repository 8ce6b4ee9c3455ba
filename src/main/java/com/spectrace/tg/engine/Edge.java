package com.spectrace.tg.engine;

import java.util.List;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.SourceLocation;

/**
 * A directed relationship between two nodes, held by id.
 *
 * The source is the parent (the referenced node) and the target the child
 * (the node that declared the reference, or the lexical child of a
 * CONTAINS edge). Endpoints and kind change only through the graph's
 * mutation API, which keeps both endpoint edge lists consistent.
 */
public final class Edge {
    private String sourceId;
    private String targetId;
    private EdgeKind kind;
    private final List<String> assertionTargets;
    private final SourceLocation location;

    Edge(String sourceId, String targetId, EdgeKind kind, List<String> assertionTargets, SourceLocation location) {
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.kind = kind;
        this.assertionTargets = List.copyOf(assertionTargets);
        this.location = location;
    }

    public String sourceId() {
        return sourceId;
    }

    public String targetId() {
        return targetId;
    }

    public EdgeKind kind() {
        return kind;
    }

    /** Assertion labels of the parent this edge is about; empty when it targets the whole node. */
    public List<String> assertionTargets() {
        return assertionTargets;
    }

    public boolean targetsWholeNode() {
        return assertionTargets.isEmpty();
    }

    public boolean targetsAssertion(String label) {
        return assertionTargets.contains(label);
    }

    /** Where the reference was written, or null for structural and mutation-created edges. */
    public SourceLocation location() {
        return location;
    }

    boolean sameAs(String source, String target, EdgeKind k, List<String> targets) {
        return sourceId.equals(source) && targetId.equals(target) && kind == k && assertionTargets.equals(targets);
    }

    void renameEndpoint(String oldId, String newId) {
        if (sourceId.equals(oldId))
            sourceId = newId;
        if (targetId.equals(oldId))
            targetId = newId;
    }

    void setKind(EdgeKind kind) {
        this.kind = kind;
    }

    @Override
    public String toString() {
        String labels = assertionTargets.isEmpty() ? "" : " " + assertionTargets;
        return sourceId + " -" + kind + labels + "-> " + targetId;
    }
}
