package com.spectrace.tg.engine;

import java.time.Instant;
import java.util.List;

/**
 * Immutable audit record of one structural mutation.
 *
 * Carries the state needed to reverse the change; that state is only
 * reachable by the graph's undo operations.
 */
public final class MutationEntry {
    private final long sequence;
    private final MutationKind kind;
    private final List<String> affectedIds;
    private final String description;
    private final Instant timestamp;
    private final Reversal reversal;

    /** Puts the graph back the way it was before the mutation. */
    interface Reversal {
        void revert(TraceGraph graph);
    }

    MutationEntry(long sequence, MutationKind kind, List<String> affectedIds, String description, Reversal reversal) {
        this.sequence = sequence;
        this.kind = kind;
        this.affectedIds = List.copyOf(affectedIds);
        this.description = description;
        this.timestamp = Instant.now();
        this.reversal = reversal;
    }

    public long sequence() {
        return sequence;
    }

    public MutationKind kind() {
        return kind;
    }

    public List<String> affectedIds() {
        return affectedIds;
    }

    public String description() {
        return description;
    }

    public Instant timestamp() {
        return timestamp;
    }

    Reversal reversal() {
        return reversal;
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + kind + " " + description;
    }
}
