package xyz.vvrf.flowgraph.core;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;

public class GraphTest {

    @Test
    public void shouldRejectDuplicateNodeId() {
        Graph graph = Graph.newGraph("g");
        graph.addNode(Node.start("n1", "g"));

        DuplicateIdException e = Assertions.assertThrows(DuplicateIdException.class,
                () -> graph.addNode(Node.process("n1", "again", null)));
        Assertions.assertEquals("n1", e.getDuplicateId());
        Assertions.assertEquals(1, graph.getNodes().size());
    }

    @Test
    public void shouldRejectEdgeWithMissingEndpoint() {
        Graph graph = Graph.newGraph("g");
        graph.addNode(Node.start("s", "g"));

        DanglingReferenceException e = Assertions.assertThrows(DanglingReferenceException.class,
                () -> graph.addEdge(new Edge("s", "missing")));
        Assertions.assertEquals("missing", e.getReference());
        Assertions.assertThrows(DanglingReferenceException.class, () -> graph.addEdge(new Edge("missing", "s")));
        Assertions.assertTrue(graph.getEdges().isEmpty());
    }

    @Test
    public void shouldReturnExistingEdgeOnDuplicateAdd() {
        Graph graph = Graph.newGraph("g");
        graph.addNode(Node.start("s", "g"));
        graph.addNode(Node.process("a", "A", null));

        Edge first = graph.addEdge(new Edge("s", "a", "x"));
        Edge second = graph.addEdge(new Edge("s", "a", "x", "cond", Collections.singletonMap("k", "v")));

        Assertions.assertSame(first, second);
        Assertions.assertEquals(1, graph.getEdges().size());
        Assertions.assertEquals(1, graph.getOutgoingEdges("s").size());
        Assertions.assertEquals(1, graph.getIncomingEdges("a").size());
    }

    @Test
    public void shouldTreatDifferentLabelsAsDistinctEdges() {
        Graph graph = Graph.newGraph("g");
        graph.addNode(Node.decision("d", "D?", null));
        graph.addNode(Node.process("a", "A", null));

        graph.addEdge(new Edge("d", "a", "Yes"));
        graph.addEdge(new Edge("d", "a", "No"));
        graph.addEdge(new Edge("d", "a"));

        Assertions.assertEquals(3, graph.getEdges().size());
    }

    @Test
    public void shouldRejectMutationAfterFreeze() {
        Graph graph = Graph.newGraph("g");
        graph.addNode(Node.start("s", "g"));
        graph.addNode(Node.end("e", "End", null));
        graph.freeze();

        Assertions.assertTrue(graph.isFrozen());
        Assertions.assertThrows(IllegalStateException.class, () -> graph.addNode(Node.process("p", "P", null)));
        Assertions.assertThrows(IllegalStateException.class, () -> graph.addEdge(new Edge("s", "e")));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> graph.getMetadata().put("k", "v"));
    }

    @Test
    public void shouldFindStartNodeAndSubflowLinks() {
        Graph graph = Graph.newGraph("g");
        graph.addNode(Node.start("s", "g"));
        graph.addNode(Node.subflowLink("l", "Other", null, null));

        Assertions.assertEquals("s", graph.getStartNode().get().getId());
        Assertions.assertEquals(1, graph.getSubflowLinks().size());
        Assertions.assertEquals("l", graph.getSubflowLinks().get(0).getId());
        Assertions.assertFalse(graph.getNode("nope").isPresent());
    }

    @Test
    public void shouldBindSubflowTargetOnlyOnce() {
        Node link = Node.subflowLink("l", "Other", null, null);
        Assertions.assertFalse(link.getTargetGraphId().isPresent());

        link.bindTarget("g-1");
        link.bindTarget("g-1");
        Assertions.assertEquals("g-1", link.getTargetGraphId().get());
        Assertions.assertThrows(IllegalStateException.class, () -> link.bindTarget("g-2"));
        Assertions.assertThrows(IllegalStateException.class, () -> Node.process("p", "P", null).bindTarget("g-1"));
    }

    @Test
    public void shouldExposeDescriptionFromMetadata() {
        StepDefinition definition = StepDefinition.of("Check", "Look at the dashboard");
        Node node = Node.process("p", definition.getLabel(), definition.getMetadata());

        Assertions.assertEquals("Look at the dashboard", node.getDescription().get());
        Assertions.assertFalse(Node.process("q", "Q", null).getDescription().isPresent());
    }

    @Test
    public void shouldResolveNodeKindByTypeName() {
        Assertions.assertEquals(NodeKind.SUBFLOW_LINK, NodeKind.fromTypeName("SubFlowNode"));
        Assertions.assertEquals(NodeKind.DECISION, NodeKind.fromTypeName("DECISION"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> NodeKind.fromTypeName("Node"));
    }
}
