package com.spectrace.tg.metrics;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.NodeKind;
import com.spectrace.tg.engine.Edge;
import com.spectrace.tg.engine.TraceGraph;
import com.spectrace.tg.engine.TraceNode;
import com.spectrace.tg.io.TraceConfig;

import lombok.extern.log4j.Log4j2;

/**
 * Computes {@link RollupMetrics} for every node in one post-order pass.
 *
 * <p>
 * <b>Assertions</b> are scored by their requirement. Each assertion takes the
 * strongest tier offered by the requirement's Implements and Validates edges:
 * <ul>
 * <li>DIRECT: a test validates it, or code implements it, by label</li>
 * <li>EXPLICIT: a child requirement implements it by label</li>
 * <li>INFERRED: a child requirement implements the whole requirement (strict mode only)</li>
 * <li>INDIRECT: a test validates the whole requirement</li>
 * </ul>
 * Refines and Addresses edges never contribute.
 *
 * <p>
 * <b>Tests and code</b> are counted once per distinct node anywhere in the
 * subtree, so diamonds do not double count. A test is failed if any linked
 * result failed or errored, else passed if any passed, else skipped if any
 * was skipped; a test without results counts toward the total only.
 *
 * <p>
 * Children whose status is excluded contribute nothing to their parents;
 * their own metrics are still computed. Every run starts from scratch and
 * replaces the graph's metrics table, so repeated runs on an unchanged graph
 * give equal results.
 */
@Log4j2
public final class CoverageAnnotator {
    private final TraceGraph graph;
    private final TraceConfig config;
    private final Map<String, RollupMetrics> metrics = new HashMap<>();
    private final Map<String, Set<String>> testsBelow = new HashMap<>();
    private final Map<String, Set<String>> codeBelow = new HashMap<>();
    private final Set<String> visiting = new HashSet<>();

    private CoverageAnnotator(TraceGraph graph) {
        this.graph = graph;
        this.config = graph.config();
    }

    /**
     * Recomputes metrics for the whole graph and stores them in the graph.
     *
     * @return the computed table, keyed by node id
     */
    public static Map<String, RollupMetrics> annotate(TraceGraph graph) {
        return graph.annotate();
    }

    /**
     * Computes metrics for every node without storing them.
     *
     * @return an unmodifiable table keyed by node id
     */
    public static Map<String, RollupMetrics> compute(TraceGraph graph) {
        CoverageAnnotator annotator = new CoverageAnnotator(graph);
        graph.nodes().filter(n -> n.kind() != NodeKind.ASSERTION).toList().forEach(annotator::visit);
        graph.nodesOfKind(NodeKind.ASSERTION).forEach(a -> annotator.metrics.computeIfAbsent(a.id(), k -> {
            RollupMetrics m = new RollupMetrics();
            m.countAssertion(null);
            m.derivePercentages();
            return m;
        }));
        log.debug("Annotated {} nodes", annotator.metrics.size());
        return Collections.unmodifiableMap(annotator.metrics);
    }

    /** Post-order walk from one node, with an explicit stack so long chains cannot overflow. */
    private void visit(TraceNode start) {
        if (metrics.containsKey(start.id()))
            return;
        Deque<Frame> stack = new ArrayDeque<>();
        enter(stack, start);
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.next < top.children.size()) {
                TraceNode child = top.children.get(top.next++);
                // a child still on the stack closes a cycle and contributes nothing
                if (!metrics.containsKey(child.id()) && !visiting.contains(child.id()))
                    enter(stack, child);
                continue;
            }
            stack.pop();
            finish(top);
        }
    }

    private void enter(Deque<Frame> stack, TraceNode node) {
        visiting.add(node.id());
        List<TraceNode> children = new ArrayList<>();
        for (Edge e : node.outgoing()) {
            if (!e.kind().contributesToCoverage())
                continue;
            TraceNode child = graph.getNode(e.targetId());
            if (!excluded(child))
                children.add(child);
        }
        stack.push(new Frame(node, children));
    }

    private void finish(Frame frame) {
        TraceNode node = frame.node;
        String id = node.id();
        Set<String> tests = new LinkedHashSet<>();
        Set<String> code = new LinkedHashSet<>();
        if (node.kind() == NodeKind.TEST)
            tests.add(id);
        else if (node.kind() == NodeKind.CODE)
            code.add(id);
        for (TraceNode child : frame.children) {
            tests.addAll(testsBelow.getOrDefault(child.id(), Set.of()));
            code.addAll(codeBelow.getOrDefault(child.id(), Set.of()));
        }

        RollupMetrics m = new RollupMetrics();
        for (String testId : tests)
            countTest(m, graph.getNode(testId));
        m.setTotalCodeRefs(code.size());
        if (node.kind() == NodeKind.REQUIREMENT)
            scoreAssertions(node, m);
        m.derivePercentages();

        testsBelow.put(id, tests);
        codeBelow.put(id, code);
        metrics.put(id, m);
        visiting.remove(id);
    }

    private static final class Frame {
        final TraceNode node;
        final List<TraceNode> children;
        int next;

        Frame(TraceNode node, List<TraceNode> children) {
            this.node = node;
            this.children = children;
        }
    }

    private void scoreAssertions(TraceNode requirement, RollupMetrics m) {
        for (Edge contains : requirement.outgoing()) {
            if (contains.kind() != EdgeKind.CONTAINS)
                continue;
            TraceNode assertion = graph.getNode(contains.targetId());
            if (assertion.kind() != NodeKind.ASSERTION)
                continue;
            String label = assertion.text("label");

            List<CoverageContribution> contributions = new ArrayList<>();
            CoverageTier best = null;
            for (Edge e : requirement.outgoing()) {
                TraceNode child = graph.getNode(e.targetId());
                CoverageTier tier = tierOf(e, child, label);
                if (tier == null)
                    continue;
                contributions.add(new CoverageContribution(child.id(), tier));
                if (tier.isStrongerThan(best))
                    best = tier;
            }
            contributions.sort(Comparator.comparing(CoverageContribution::tier));

            m.countAssertion(best);
            m.putContributions(label, contributions);

            RollupMetrics am = new RollupMetrics();
            am.countAssertion(best);
            am.putContributions(label, contributions);
            am.derivePercentages();
            metrics.put(assertion.id(), am);
        }
    }

    /** Tier an edge contributes to an assertion label, or null. */
    private CoverageTier tierOf(Edge e, TraceNode child, String label) {
        if (!e.kind().contributesToCoverage() || excluded(child))
            return null;
        NodeKind kind = child.kind();
        if (e.targetsAssertion(label)) {
            if ((kind == NodeKind.TEST && e.kind() == EdgeKind.VALIDATES)
                    || (kind == NodeKind.CODE && e.kind() == EdgeKind.IMPLEMENTS))
                return CoverageTier.DIRECT;
            if (kind == NodeKind.REQUIREMENT && e.kind() == EdgeKind.IMPLEMENTS)
                return CoverageTier.EXPLICIT;
        } else if (e.targetsWholeNode()) {
            if (kind == NodeKind.REQUIREMENT && e.kind() == EdgeKind.IMPLEMENTS && config.isStrictMode())
                return CoverageTier.INFERRED;
            if (kind == NodeKind.TEST && e.kind() == EdgeKind.VALIDATES)
                return CoverageTier.INDIRECT;
        }
        return null;
    }

    private void countTest(RollupMetrics m, TraceNode test) {
        m.setTotalTests(m.getTotalTests() + 1);
        boolean passed = false;
        boolean failed = false;
        boolean skipped = false;
        for (Edge e : test.outgoing()) {
            if (e.kind() != EdgeKind.CONTAINS)
                continue;
            TraceNode result = graph.getNode(e.targetId());
            if (result.kind() != NodeKind.TEST_RESULT)
                continue;
            String status = result.text("status");
            if ("failed".equals(status) || "error".equals(status))
                failed = true;
            else if ("passed".equals(status))
                passed = true;
            else if ("skipped".equals(status))
                skipped = true;
        }
        if (failed)
            m.setFailedTests(m.getFailedTests() + 1);
        else if (passed)
            m.setPassedTests(m.getPassedTests() + 1);
        else if (skipped)
            m.setSkippedTests(m.getSkippedTests() + 1);
    }

    private boolean excluded(TraceNode node) {
        return node.kind() == NodeKind.REQUIREMENT && config.isExcludedStatus(node.status());
    }
}
