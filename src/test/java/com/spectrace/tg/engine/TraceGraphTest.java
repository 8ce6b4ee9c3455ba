package com.spectrace.tg.engine;

import java.util.List;
import java.util.Map;

import com.spectrace.tg.api.DuplicateIdException;
import com.spectrace.tg.api.EdgeKind;
import com.spectrace.tg.api.NodeKind;
import com.spectrace.tg.api.NodeNotFoundException;
import com.spectrace.tg.io.TraceConfig;
import com.spectrace.tg.metrics.RollupMetrics;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class TraceGraphTest {

    private TraceGraph graph;

    @Before
    public void setUp() {
        // P <- D1 (Implements A), P <- D2, D1 <- code
        graph = TraceGraph.empty(new TraceConfig());
        graph.createNode(NodeKind.REQUIREMENT, "REQ-p00001", Map.of("title", "P", "status", "Active"), null);
        graph.createNode(NodeKind.ASSERTION, "REQ-p00001-A", Map.of("label", "A", "text", "Shall."), null);
        graph.createNode(NodeKind.REQUIREMENT, "REQ-d00001", Map.of("title", "D1"), null);
        graph.createNode(NodeKind.REQUIREMENT, "REQ-d00002", Map.of("title", "D2"), null);
        graph.createNode(NodeKind.CODE, "code:a.py:1", Map.of("text", "# Implements: REQ-d00001"), null);
        graph.link("REQ-p00001", "REQ-p00001-A", EdgeKind.CONTAINS, List.of(), null);
        graph.link("REQ-p00001", "REQ-d00001", EdgeKind.IMPLEMENTS, List.of("A"), null);
        graph.link("REQ-p00001", "REQ-d00002", EdgeKind.IMPLEMENTS, List.of(), null);
        graph.link("REQ-d00001", "code:a.py:1", EdgeKind.IMPLEMENTS, List.of(), null);
    }

    @Test
    public void testLookup() {
        assertEquals(5, graph.nodeCount());
        assertEquals(4, graph.edgeCount());
        assertTrue(graph.contains("REQ-d00001"));
        assertTrue(graph.findNode("REQ-x").isEmpty());
        assertEquals("D1", graph.getNode("REQ-d00001").text("title"));
    }

    @Test(expected = NodeNotFoundException.class)
    public void testUnknownNode() {
        graph.getNode("REQ-p09999");
    }

    @Test(expected = DuplicateIdException.class)
    public void testDuplicateCreate() {
        graph.createNode(NodeKind.REQUIREMENT, "REQ-d00001", Map.of(), null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFieldOutsideKindRejected() {
        graph.createNode(NodeKind.CODE, "code:b.py:1", Map.of("status", "Active"), null);
    }

    @Test
    public void testNavigation() {
        assertEquals(List.of("REQ-p00001-A", "REQ-d00001", "REQ-d00002"),
                graph.children("REQ-p00001").map(TraceNode::id).toList());
        assertEquals(List.of("REQ-d00001", "REQ-d00002"),
                graph.children("REQ-p00001", EdgeKind.IMPLEMENTS).map(TraceNode::id).toList());
        assertEquals(List.of("REQ-p00001"), graph.parents("REQ-d00001").map(TraceNode::id).toList());
        assertEquals(1, graph.incoming("code:a.py:1").size());
        assertEquals(3, graph.nodesOfKind(NodeKind.REQUIREMENT).count());
    }

    @Test
    public void testRoles() {
        assertEquals(NodeRole.ROOT, graph.role("REQ-p00001"));
        assertEquals(NodeRole.CHILD, graph.role("REQ-d00001"));
        assertEquals(NodeRole.STRUCTURAL, graph.role("REQ-p00001-A"));
        assertEquals(List.of("REQ-p00001"), graph.roots().map(TraceNode::id).toList());
        assertEquals(0, graph.orphans().count());
    }

    @Test
    public void testRefinesOnlyParentStillChild() {
        graph.createNode(NodeKind.REQUIREMENT, "REQ-d00003", Map.of(), null);
        graph.link("REQ-d00002", "REQ-d00003", EdgeKind.REFINES, List.of(), null);
        assertEquals(NodeRole.CHILD, graph.role("REQ-d00003"));

        graph.createNode(NodeKind.REQUIREMENT, "REQ-p00002", Map.of(), null);
        assertEquals(NodeRole.ORPHAN, graph.role("REQ-p00002"));
    }

    @Test
    public void testRenameKeepsPositionAndEdges() {
        graph.rename("REQ-d00001", "REQ-d00009");

        assertEquals(List.of("REQ-p00001", "REQ-p00001-A", "REQ-d00009", "REQ-d00002", "code:a.py:1"),
                graph.nodes().map(TraceNode::id).toList());
        assertEquals("REQ-d00009", graph.incoming("code:a.py:1").get(0).sourceId());
        assertEquals("REQ-d00009", graph.outgoing("REQ-p00001").get(1).targetId());
        assertFalse(graph.contains("REQ-d00001"));
    }

    @Test
    public void testUnlinkAndRelinkRestoreOrder() {
        String before = graph.structuralSnapshot();
        Edge middle = graph.outgoing("REQ-p00001").get(1);

        EdgeSlot slot = graph.unlink(middle);
        assertEquals(1, slot.outIndex());
        assertEquals(3, graph.edgeCount());
        assertNotEquals(before, graph.structuralSnapshot());

        graph.relink(slot);
        assertEquals(before, graph.structuralSnapshot());
    }

    @Test
    public void testInsertNodeAtPosition() {
        TraceNode d2 = graph.getNode("REQ-d00002");
        int position = graph.positionOf("REQ-d00002");
        for (Edge e : List.copyOf(d2.incoming()))
            graph.unlink(e);
        graph.removeNode("REQ-d00002");
        assertEquals(-1, graph.positionOf("REQ-d00002"));

        graph.insertNode(d2, position);
        assertEquals(3, graph.positionOf("REQ-d00002"));
    }

    @Test(expected = IllegalStateException.class)
    public void testRemoveLinkedNodeFails() {
        graph.removeNode("REQ-d00001");
    }

    @Test
    public void testMetricsTableReplacedWhole() {
        assertFalse(graph.hasMetrics());
        assertTrue(graph.metrics("REQ-p00001").isEmpty());
        graph.replaceMetrics(Map.of("REQ-p00001", new RollupMetrics()));
        assertTrue(graph.metrics("REQ-p00001").isPresent());
        graph.invalidateMetrics();
        assertFalse(graph.hasMetrics());
    }

    @Test
    public void testSnapshotIndependentOfInsertionOrder() {
        TraceGraph other = TraceGraph.empty(new TraceConfig());
        other.createNode(NodeKind.REQUIREMENT, "B", Map.of(), null);
        other.createNode(NodeKind.REQUIREMENT, "A", Map.of(), null);
        TraceGraph same = TraceGraph.empty(new TraceConfig());
        same.createNode(NodeKind.REQUIREMENT, "A", Map.of(), null);
        same.createNode(NodeKind.REQUIREMENT, "B", Map.of(), null);
        assertEquals(other.structuralSnapshot(), same.structuralSnapshot());
    }
}
