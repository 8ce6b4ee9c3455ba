package com.spectrace.tg.io;

import com.spectrace.tg.api.SourceLocation;

/** A parser could not fully make sense of text it claimed, or chose not to claim. */
public record ParseWarning(String parser, String message, SourceLocation location) {

    @Override
    public String toString() {
        return "[" + parser + "] " + message + " at " + location;
    }
}
