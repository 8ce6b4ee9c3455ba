package com.spectrace.tg.api;

/** Undo was asked for a sequence number that is not in the mutation log. */
public class InvalidMutationSequenceException extends TraceGraphException {

    public InvalidMutationSequenceException(String message) {
        super(message);
    }
}
