package com.spectrace.tg.api;

/** A node id is already taken and no conflict policy applies. */
public class DuplicateIdException extends TraceGraphException {
    private final String nodeId;

    public DuplicateIdException(String nodeId) {
        super("Duplicate node id: " + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
