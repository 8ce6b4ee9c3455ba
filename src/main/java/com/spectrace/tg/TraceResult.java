package com.spectrace.tg;

import java.util.List;

import com.spectrace.tg.api.Diagnostic;
import com.spectrace.tg.api.DiagnosticKind;
import com.spectrace.tg.api.Severity;
import com.spectrace.tg.engine.TraceGraph;

/**
 * An annotated graph plus every diagnostic from parsing and building. Callers
 * decide which severities block their workflow.
 */
public record TraceResult(TraceGraph graph, List<Diagnostic> diagnostics) {

    public TraceResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR);
    }

    public List<Diagnostic> diagnostics(Severity severity) {
        return diagnostics.stream().filter(d -> d.severity() == severity).toList();
    }

    public List<Diagnostic> diagnostics(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }
}
