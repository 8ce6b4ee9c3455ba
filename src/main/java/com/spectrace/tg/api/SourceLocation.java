package com.spectrace.tg.api;

/**
 * A line range in a source file. Lines are 1-based and inclusive.
 */
public record SourceLocation(String path, int line, int endLine) {

    public static SourceLocation at(String path, int line) {
        return new SourceLocation(path, line, line);
    }

    @Override
    public String toString() {
        return endLine > line ? path + ":" + line + "-" + endLine : path + ":" + line;
    }
}
