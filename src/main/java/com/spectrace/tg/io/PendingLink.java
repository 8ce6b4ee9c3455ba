package com.spectrace.tg.io;

import java.util.List;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.SourceLocation;

/**
 * A reference captured during parsing, resolved exactly once when the graph
 * is built.
 *
 * @param sourceId        id of the node that declared the reference
 * @param rawTarget       the reference as written, for diagnostics
 * @param target          the reference with any multi-assertion suffix removed
 * @param kind            declared relationship kind
 * @param assertionLabels labels split off a suffix such as {@code -A-B-C}; empty for a whole-node reference
 * @param location        where the reference was written
 */
public record PendingLink(String sourceId, String rawTarget, String target, EdgeKind kind,
        List<String> assertionLabels, SourceLocation location) {

    public PendingLink {
        assertionLabels = List.copyOf(assertionLabels);
    }

    /** Builds a link, splitting a multi-assertion suffix off the reference. */
    public static PendingLink parse(String sourceId, String raw, EdgeKind kind, IdPatterns ids,
            SourceLocation location) {
        String qualified = ids.qualify(raw);
        List<String> parts = ids.splitSuffixed(qualified);
        return new PendingLink(sourceId, raw.trim(), parts.get(0), kind, parts.subList(1, parts.size()), location);
    }

    /** The same link declared by another node, used when a node id changes during ingestion. */
    public PendingLink withSource(String newSourceId) {
        return new PendingLink(newSourceId, rawTarget, target, kind, assertionLabels, location);
    }
}
