package com.spectrace.tg.api;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The kinds of node in a traceability graph.
 *
 * Each kind carries a fixed field set. Fields outside the set are rejected by
 * the node, so a Code node can never grow a "status" and a Requirement can
 * never lose its "title" slot.
 *
 * Each kind also knows which relationship kinds it may declare toward a parent
 * and which one a misdeclared link is coerced to.
 */
public enum NodeKind {
    REQUIREMENT(List.of("title", "level", "status", "body", "hash", "conflict", "conflictWith"),
            EdgeKind.IMPLEMENTS, EnumSet.of(EdgeKind.IMPLEMENTS, EdgeKind.REFINES, EdgeKind.ADDRESSES)),
    ASSERTION(List.of("label", "text"), null, EnumSet.noneOf(EdgeKind.class)),
    CODE(List.of("text", "conflict", "conflictWith"), EdgeKind.IMPLEMENTS, EnumSet.of(EdgeKind.IMPLEMENTS)),
    TEST(List.of("function", "text", "conflict", "conflictWith"), EdgeKind.VALIDATES,
            EnumSet.of(EdgeKind.VALIDATES)),
    TEST_RESULT(List.of("name", "classname", "status", "duration", "message"), null,
            EnumSet.noneOf(EdgeKind.class)),
    USER_JOURNEY(List.of("title", "actor", "goal", "conflict", "conflictWith"), EdgeKind.ADDRESSES,
            EnumSet.of(EdgeKind.ADDRESSES)),
    REMAINDER(List.of("text", "contentType", "heading"), null, EnumSet.noneOf(EdgeKind.class));

    private final List<String> fields;
    private final EdgeKind defaultLinkKind;
    private final Set<EdgeKind> allowedLinkKinds;

    NodeKind(List<String> fields, EdgeKind defaultLinkKind, Set<EdgeKind> allowedLinkKinds) {
        this.fields = fields;
        this.defaultLinkKind = defaultLinkKind;
        this.allowedLinkKinds = allowedLinkKinds;
    }

    /** Field names a node of this kind may hold, in display order. */
    public List<String> fields() {
        return fields;
    }

    public boolean hasField(String field) {
        return fields.contains(field);
    }

    /** Link kind a misdeclared reference is coerced to, or null if this kind declares no links. */
    public EdgeKind defaultLinkKind() {
        return defaultLinkKind;
    }

    public boolean mayDeclare(EdgeKind kind) {
        return allowedLinkKinds.contains(kind);
    }
}
