package com.spectrace.tg.engine;

import java.util.List;

import com.spectrace.tg.api.Diagnostic;
import com.spectrace.tg.api.DiagnosticKind;
import com.spectrace.tg.api.Severity;

/** A built graph and every diagnostic produced while parsing and building it. */
public record BuildResult(TraceGraph graph, List<Diagnostic> diagnostics) {

    public BuildResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> diagnostics(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).toList();
    }

    public List<Diagnostic> diagnostics(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }
}
