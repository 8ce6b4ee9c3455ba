package com.spectrace.tg.api;

/** A mutation named a node that is not in the graph. The graph is unchanged. */
public class UnknownNodeIdException extends NodeNotFoundException {

    public UnknownNodeIdException(String nodeId) {
        super("Mutation target does not exist: ", nodeId);
    }
}
