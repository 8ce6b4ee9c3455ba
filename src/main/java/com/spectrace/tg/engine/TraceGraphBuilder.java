package com.spectrace.tg.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.spectrace.tg.api.Diagnostic;
import com.spectrace.tg.api.DiagnosticKind;
import com.spectrace.tg.api.DiagnosticListener;
import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.NodeKind;
import com.spectrace.tg.api.Resolution;
import com.spectrace.tg.api.SourceLocation;
import com.spectrace.tg.io.AssertionRecord;
import com.spectrace.tg.io.ContentFragment;
import com.spectrace.tg.io.IdPatterns;
import com.spectrace.tg.io.ParseWarning;
import com.spectrace.tg.io.ParsedUnit;
import com.spectrace.tg.io.PendingLink;
import com.spectrace.tg.io.SectionRecord;
import com.spectrace.tg.io.TestResultRecord;
import com.spectrace.tg.io.TraceConfig;

import lombok.extern.log4j.Log4j2;

/**
 * Turns parsed units into a {@link TraceGraph}.
 *
 * <p>
 * <b>Usage:</b>
 *
 * <pre>{@code
 * TraceGraphBuilder builder = new TraceGraphBuilder(config, listener);
 * for (ParsedUnit unit : units)
 *     builder.add(unit);
 * BuildResult result = builder.build();
 * }</pre>
 *
 * <p>
 * {@link #add} runs the node pass for one unit and queues its references.
 * {@link #build} then:
 * <ol>
 * <li>attaches test results to their tests,</li>
 * <li>resolves every queued reference exactly once, in file order,</li>
 * <li>detects Implements/Refines cycles,</li>
 * <li>reports orphans.</li>
 * </ol>
 * Corpus problems never throw; they are returned as diagnostics. A builder
 * builds once.
 */
@Log4j2
public final class TraceGraphBuilder {
    private final TraceConfig config;
    private final IdPatterns ids;
    private final DiagnosticListener listener;
    private final TraceGraph graph;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<PendingLink> pending = new ArrayList<>();
    private final List<String> results = new ArrayList<>();
    private final Map<String, Integer> expectedBroken = new HashMap<>();
    private boolean built;

    public TraceGraphBuilder(TraceConfig config) {
        this(config, d -> {
        });
    }

    public TraceGraphBuilder(TraceConfig config, DiagnosticListener listener) {
        this.config = config;
        this.graph = new TraceGraph(config);
        this.ids = graph.ids();
        this.listener = listener;
    }

    /** Node pass for one parsed unit. */
    public TraceGraphBuilder add(ParsedUnit unit) {
        if (built)
            throw new IllegalStateException("Graph already built");
        for (ParseWarning w : unit.warnings())
            emit(Diagnostic.warning(DiagnosticKind.PARSE_WARNING, w.parser() + ": " + w.message(), w.location()));
        if (unit.isFailed()) {
            emit(Diagnostic.error(DiagnosticKind.PARSE_FAILURE, "Could not parse " + unit.path() + ": " + unit.failure(),
                    SourceLocation.at(unit.path(), 1)));
            return this;
        }
        expectedBroken.merge(unit.path(), unit.expectedBrokenLinks(), Integer::sum);
        for (ContentFragment f : unit.fragments())
            addFragment(unit.path(), f);
        return this;
    }

    public BuildResult build() {
        if (built)
            throw new IllegalStateException("Graph already built");
        built = true;
        listener.onPassComplete("nodes", diagnostics.size());

        int before = diagnostics.size();
        ReferenceResolver resolver = new ReferenceResolver(graph);
        linkResults(resolver);
        for (PendingLink link : pending)
            resolve(link, resolver);
        pending.clear();
        listener.onPassComplete("resolve", diagnostics.size() - before);

        before = diagnostics.size();
        for (List<String> cycle : CycleDetector.findCycles(graph)) {
            String message = "Cycle: " + String.join(" -> ", cycle);
            TraceNode first = graph.getNode(cycle.get(0));
            String[] members = cycle.subList(0, cycle.size() - 1).toArray(new String[0]);
            emit(config.isAllowCycles()
                    ? Diagnostic.info(DiagnosticKind.CYCLE, message, first.location(), members)
                    : Diagnostic.error(DiagnosticKind.CYCLE, message, first.location(), members));
        }
        listener.onPassComplete("cycles", diagnostics.size() - before);

        before = diagnostics.size();
        graph.orphans().toList().forEach(n -> {
            String message = "Orphan " + n.kind() + " " + n.id() + " has no parent and no meaningful children";
            emit(config.isAllowOrphans()
                    ? Diagnostic.info(DiagnosticKind.ORPHAN, message, n.location(), n.id())
                    : Diagnostic.warning(DiagnosticKind.ORPHAN, message, n.location(), n.id()));
        });
        listener.onPassComplete("classify", diagnostics.size() - before);

        log.info("Built trace graph: {} nodes, {} edges, {} broken references, {} diagnostics", graph.nodeCount(),
                graph.edgeCount(), graph.brokenReferences().size(), diagnostics.size());
        return new BuildResult(graph, diagnostics);
    }

    // ---------- node pass ----------

    private void addFragment(String path, ContentFragment f) {
        SourceLocation location = new SourceLocation(path, f.startLine(), f.endLine());
        switch (f.type()) {
            case REQUIREMENT -> addRequirement(path, f, location);
            case JOURNEY -> {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("title", f.field("title"));
                fields.put("actor", f.field("actor"));
                fields.put("goal", f.field("goal"));
                queueLinks(addNode(NodeKind.USER_JOURNEY, f.field("id"), fields, location), f);
            }
            case CODE_REF -> queueLinks(addNode(NodeKind.CODE, f.field("id"),
                    Map.<String, Object>of("text", f.rawText()), location), f);
            case TEST_REF -> {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("function", f.field("function"));
                fields.put("text", f.rawText());
                queueLinks(addNode(NodeKind.TEST, f.field("id"), fields, location), f);
            }
            case TEST_RESULT -> {
                for (TestResultRecord r : f.results()) {
                    Map<String, Object> fields = new LinkedHashMap<>();
                    fields.put("name", r.name());
                    fields.put("classname", r.classname());
                    fields.put("status", r.status());
                    fields.put("duration", r.duration());
                    fields.put("message", r.message());
                    TraceNode node = addNode(NodeKind.TEST_RESULT, r.id(), fields, SourceLocation.at(path, r.line()));
                    if (node != null)
                        results.add(node.id());
                }
            }
            case COMMENT, FIXTURE, REMAINDER -> {
                Map<String, Object> fields = new LinkedHashMap<>();
                fields.put("text", f.rawText());
                fields.put("contentType", switch (f.type()) {
                    case COMMENT -> "comment";
                    case FIXTURE -> "fixture";
                    default -> f.field("contentType");
                });
                fields.put("heading", f.field("heading"));
                addNode(NodeKind.REMAINDER, "rem:" + path + ":" + f.startLine(), fields, location);
            }
        }
    }

    private void addRequirement(String path, ContentFragment f, SourceLocation location) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (String name : List.of("title", "level", "status", "body", "hash"))
            fields.put(name, f.field(name));
        TraceNode req = addNode(NodeKind.REQUIREMENT, f.field("id"), fields, location);
        if (req == null)
            return;

        // assertions and sections interleaved in document order
        List<Object> children = new ArrayList<>();
        children.addAll(f.assertions());
        children.addAll(f.sections());
        children.sort(Comparator.comparingInt(c -> c instanceof AssertionRecord a ? a.line() : ((SectionRecord) c).line()));
        for (Object child : children) {
            if (child instanceof AssertionRecord a) {
                Map<String, Object> af = new LinkedHashMap<>();
                af.put("label", a.label());
                af.put("text", a.text());
                TraceNode node = addNode(NodeKind.ASSERTION, req.id() + "-" + a.label(), af,
                        SourceLocation.at(path, a.line()));
                if (node != null)
                    graph.link(req.id(), node.id(), EdgeKind.CONTAINS, List.of(), null);
            } else if (child instanceof SectionRecord s) {
                Map<String, Object> sf = new LinkedHashMap<>();
                sf.put("text", s.content());
                sf.put("contentType", "section");
                sf.put("heading", s.heading());
                TraceNode node = addNode(NodeKind.REMAINDER, "rem:" + req.id() + ":" + s.line(), sf,
                        new SourceLocation(path, s.line(), s.endLine()));
                if (node != null)
                    graph.link(req.id(), node.id(), EdgeKind.CONTAINS, List.of(), null);
            }
        }
        queueLinks(req, f);
    }

    /**
     * Creates a node, applying the duplicate id policy.
     *
     * @return the node, or null if it was dropped
     */
    private TraceNode addNode(NodeKind kind, String id, Map<String, Object> fields, SourceLocation location) {
        if (!graph.contains(id))
            return graph.createNode(kind, id, fields, location);
        if (kind == NodeKind.CODE || kind == NodeKind.TEST) {
            String lineId = id + ":" + location.line();
            if (!graph.contains(lineId))
                return graph.createNode(kind, lineId, fields, location);
        }
        if (!config.isRetainConflicts() || !kind.hasField("conflict")) {
            emit(Diagnostic.error(DiagnosticKind.DUPLICATE_ID, "Duplicate id " + id + "; second definition dropped",
                    location, id));
            return null;
        }
        String conflictId = id + "__conflict";
        for (int n = 2; graph.contains(conflictId); n++)
            conflictId = id + "__conflict" + n;
        Map<String, Object> conflictFields = new LinkedHashMap<>(fields);
        conflictFields.put("conflict", Boolean.TRUE);
        conflictFields.put("conflictWith", id);
        emit(Diagnostic.warning(DiagnosticKind.DUPLICATE_ID,
                "Duplicate id " + id + "; retained as " + conflictId, location, id, conflictId));
        return graph.createNode(kind, conflictId, conflictFields, location);
    }

    private void queueLinks(TraceNode node, ContentFragment f) {
        if (node == null || node.isConflict())
            return;
        for (PendingLink link : f.links())
            pending.add(link.sourceId().equals(node.id()) ? link : link.withSource(node.id()));
    }

    // ---------- results ----------

    private void linkResults(ReferenceResolver resolver) {
        Map<String, List<TraceNode>> testsByFunction = new HashMap<>();
        graph.nodesOfKind(NodeKind.TEST).forEach(t -> {
            String fn = t.text("function");
            if (fn != null)
                testsByFunction.computeIfAbsent(fn, k -> new ArrayList<>()).add(t);
        });

        for (String resultId : results) {
            TraceNode result = graph.getNode(resultId);
            String name = result.text("name").replaceFirst("\\[.*$", "");
            String classname = result.text("classname");
            TraceNode test = pickTest(testsByFunction.getOrDefault(name, List.of()), classname);
            if (test != null) {
                graph.link(test.id(), resultId, EdgeKind.CONTAINS, List.of(), null);
                continue;
            }
            List<String> refs = ids.referencesInName(name);
            if (refs.isEmpty()) {
                emit(Diagnostic.info(DiagnosticKind.UNLINKED_TEST_RESULT,
                        "Result " + result.text("name") + " matches no test", result.location(), resultId));
                continue;
            }
            String owner = classname == null || classname.isEmpty() ? result.location().path() : classname;
            String syntheticId = "test:" + owner + "::" + name;
            TraceNode synthetic = graph.findNode(syntheticId).orElse(null);
            if (synthetic == null) {
                synthetic = graph.createNode(NodeKind.TEST, syntheticId, Map.of("function", name), result.location());
                testsByFunction.computeIfAbsent(name, k -> new ArrayList<>()).add(synthetic);
                for (String ref : refs)
                    pending.add(PendingLink.parse(syntheticId, ref, EdgeKind.VALIDATES, ids, result.location()));
                log.debug("Synthesised {} for result {}", syntheticId, resultId);
            }
            graph.link(synthetic.id(), resultId, EdgeKind.CONTAINS, List.of(), null);
        }
    }

    private static TraceNode pickTest(List<TraceNode> candidates, String classname) {
        if (candidates.isEmpty())
            return null;
        if (candidates.size() == 1 || classname == null || classname.isEmpty())
            return candidates.get(0);
        String dotted = classname.replace('/', '.');
        for (TraceNode t : candidates) {
            if (t.location() == null)
                continue;
            String path = t.location().path();
            int dot = path.lastIndexOf('.');
            String stem = (dot > path.lastIndexOf('/') ? path.substring(0, dot) : path).replace('/', '.');
            if (stem.endsWith(dotted) || dotted.endsWith(stem) || dotted.startsWith(stem + "."))
                return t;
        }
        return candidates.get(0);
    }

    // ---------- resolution ----------

    private void resolve(PendingLink link, ReferenceResolver resolver) {
        TraceNode source = graph.findNode(link.sourceId()).orElse(null);
        if (source == null)
            return;
        ReferenceResolver.Target target = resolver.lookup(link);
        for (String missing : target.missing())
            broken(link, missing);
        TraceNode parent = target.parent();
        if (parent == null || (!link.assertionLabels().isEmpty() && target.labels().isEmpty()))
            return;

        EdgeKind kind = link.kind();
        if (!source.kind().mayDeclare(kind)) {
            EdgeKind coerced = source.kind().defaultLinkKind();
            emit(Diagnostic.warning(DiagnosticKind.INVALID_RELATIONSHIP_KIND, source.kind() + " " + source.id()
                    + " declares " + kind + " on " + link.rawTarget() + "; treated as " + coerced, link.location(),
                    source.id(), parent.id()));
            kind = coerced;
        }
        boolean parentOk = parent.kind() == NodeKind.REQUIREMENT
                || (kind == EdgeKind.ADDRESSES && parent.kind() == NodeKind.USER_JOURNEY);
        if (!parentOk || parent == source) {
            emit(Diagnostic.warning(DiagnosticKind.INVALID_RELATIONSHIP_KIND, source.id() + " cannot " + kind
                    + " " + parent.kind() + " " + parent.id(), link.location(), source.id(), parent.id()));
            return;
        }
        if (kind == EdgeKind.IMPLEMENTS && source.kind() == NodeKind.REQUIREMENT
                && !config.mayImplement(source.text("level"), parent.text("level"))) {
            emit(Diagnostic.warning(DiagnosticKind.INVALID_RELATIONSHIP_KIND, source.text("level") + " requirement "
                    + source.id() + " may not implement " + parent.text("level") + " requirement " + parent.id(),
                    link.location(), source.id(), parent.id()));
        }

        if (target.labels().isEmpty()) {
            linkOnce(parent.id(), source.id(), kind, List.of(), link.location());
        } else {
            for (String label : target.labels())
                linkOnce(parent.id(), source.id(), kind, List.of(label), link.location());
        }
    }

    private void linkOnce(String parentId, String childId, EdgeKind kind, List<String> labels,
            SourceLocation location) {
        if (graph.findEdge(parentId, childId, kind, labels) == null)
            graph.link(parentId, childId, kind, labels, location);
    }

    private void broken(PendingLink link, String what) {
        String path = link.location() != null ? link.location().path() : "";
        int remaining = expectedBroken.getOrDefault(path, 0);
        if (remaining > 0) {
            expectedBroken.put(path, remaining - 1);
            graph.addBroken(new BrokenReference(link, Resolution.SUPPRESSED, "unknown " + what));
            emit(Diagnostic.info(DiagnosticKind.SUPPRESSED_REFERENCE,
                    "Expected broken reference " + what + " from " + link.sourceId(), link.location(),
                    link.sourceId()));
        } else {
            graph.addBroken(new BrokenReference(link, Resolution.BROKEN, "unknown " + what));
            emit(Diagnostic.warning(DiagnosticKind.BROKEN_REFERENCE,
                    "Broken reference " + what + " from " + link.sourceId(), link.location(), link.sourceId()));
        }
    }

    private void emit(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        listener.onDiagnostic(diagnostic);
    }
}
