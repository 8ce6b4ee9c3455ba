package com.spectrace.tg.api;

public class NodeNotFoundException extends TraceGraphException {
    private final String nodeId;

    public NodeNotFoundException(String nodeId) {
        this("Unknown node: ", nodeId);
    }

    protected NodeNotFoundException(String prefix, String nodeId) {
        super(prefix + nodeId);
        this.nodeId = nodeId;
    }

    public String nodeId() {
        return nodeId;
    }
}
