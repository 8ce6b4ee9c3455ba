package com.spectrace.tg.api;

import java.util.List;

/**
 * One finding about the corpus, produced while parsing or building.
 *
 * @param severity error, warning or info
 * @param kind     what kind of finding this is
 * @param message  human-readable description
 * @param nodeIds  affected node ids, possibly empty
 * @param location where in the sources the finding originates, or null
 */
public record Diagnostic(Severity severity, DiagnosticKind kind, String message, List<String> nodeIds,
        SourceLocation location) {

    public Diagnostic {
        nodeIds = List.copyOf(nodeIds);
    }

    public static Diagnostic error(DiagnosticKind kind, String message, SourceLocation location, String... ids) {
        return new Diagnostic(Severity.ERROR, kind, message, List.of(ids), location);
    }

    public static Diagnostic warning(DiagnosticKind kind, String message, SourceLocation location, String... ids) {
        return new Diagnostic(Severity.WARNING, kind, message, List.of(ids), location);
    }

    public static Diagnostic info(DiagnosticKind kind, String message, SourceLocation location, String... ids) {
        return new Diagnostic(Severity.INFO, kind, message, List.of(ids), location);
    }

    @Override
    public String toString() {
        String where = location != null ? " (" + location + ")" : "";
        return severity + " " + kind + ": " + message + where;
    }
}
