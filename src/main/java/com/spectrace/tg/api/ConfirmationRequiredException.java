package com.spectrace.tg.api;

/** A destructive mutation was called without its confirmation flag. The graph is unchanged. */
public class ConfirmationRequiredException extends TraceGraphException {

    public ConfirmationRequiredException(String operation, String target) {
        super(operation + " on " + target + " is destructive and requires confirm=true");
    }
}
