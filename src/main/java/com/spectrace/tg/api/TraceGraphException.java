package com.spectrace.tg.api;

/** Base class for failures a caller causes through the graph API. */
public class TraceGraphException extends RuntimeException {

    public TraceGraphException(String message) {
        super(message);
    }
}
