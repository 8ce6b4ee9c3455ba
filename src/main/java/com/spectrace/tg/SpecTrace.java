package com.spectrace.tg;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.spectrace.tg.api.DiagnosticListener;
import com.spectrace.tg.api.SourceDomain;
import com.spectrace.tg.engine.BuildResult;
import com.spectrace.tg.engine.TraceGraphBuilder;
import com.spectrace.tg.io.IdPatterns;
import com.spectrace.tg.io.ParsePipeline;
import com.spectrace.tg.io.SourceUnit;
import com.spectrace.tg.io.TraceConfig;
import com.spectrace.tg.metrics.CoverageAnnotator;
import com.spectrace.tg.util.LoggingDiagnosticListener;

import lombok.extern.log4j.Log4j2;

/**
 * SpecTrace: requirement traceability graph engine.
 *
 * <h2>Pipeline</h2>
 * <ul>
 * <li><b>Parse:</b> each {@link SourceUnit} runs through the line-claiming
 * parser set of its domain. Every line ends up in exactly one fragment.</li>
 * <li><b>Build:</b> fragments become nodes; references resolve into edges
 * or broken-reference diagnostics; cycles and orphans are reported.</li>
 * <li><b>Annotate:</b> tiered coverage and test counts are rolled up from
 * leaves to roots.</li>
 * </ul>
 *
 * The returned graph can then be queried, or edited through
 * {@link com.spectrace.tg.engine.TraceGraph#mutations()} with full undo.
 *
 * <p>
 * Files are found and read by the caller; this class performs no I/O.
 */
@Log4j2
public final class SpecTrace {

    private SpecTrace() {
        // Prevent instantiation of utility class
    }

    /** Builds with diagnostics streamed to the log. */
    public static TraceResult build(List<SourceUnit> units, TraceConfig config) {
        return build(units, config, new LoggingDiagnosticListener());
    }

    /**
     * Parses, builds and annotates a graph.
     *
     * @param units    source text, in the order references should be resolved
     * @param config   id grammar and policies
     * @param listener receives each diagnostic as it is produced
     */
    public static TraceResult build(List<SourceUnit> units, TraceConfig config, DiagnosticListener listener) {
        IdPatterns ids = IdPatterns.of(config);
        Map<SourceDomain, ParsePipeline> pipelines = new EnumMap<>(SourceDomain.class);
        TraceGraphBuilder builder = new TraceGraphBuilder(config, listener);
        for (SourceUnit unit : units)
            builder.add(pipelines.computeIfAbsent(unit.domain(), d -> ParsePipeline.forDomain(d, ids)).parse(unit));

        BuildResult built = builder.build();
        CoverageAnnotator.annotate(built.graph());
        log.info("Trace complete: {} units, {} nodes", units.size(), built.graph().nodeCount());
        return new TraceResult(built.graph(), built.diagnostics());
    }
}
