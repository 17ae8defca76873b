package xyz.vvrf.flowgraph.core;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class MultiGraphTest {

    @Test
    public void shouldMakeFirstGraphMainByDefault() {
        MultiGraph multiGraph = new MultiGraph("all");
        Graph a = multiGraph.addGraph(Graph.newGraph("A"));
        multiGraph.addGraph(Graph.newGraph("B"));

        Assertions.assertEquals(a.getId(), multiGraph.getMainGraphId());
        Assertions.assertEquals("A", multiGraph.getMainGraph().get().getName());
    }

    @Test
    public void shouldSwitchMainWhenAddedAsMain() {
        MultiGraph multiGraph = new MultiGraph("all");
        multiGraph.addGraph(Graph.newGraph("A"));
        Graph b = multiGraph.addGraph(Graph.newGraph("B"), true);
        multiGraph.addGraph(Graph.newGraph("C"));

        Assertions.assertEquals(b.getId(), multiGraph.getMainGraphId());
        Assertions.assertEquals(3, multiGraph.getGraphs().size());
        Assertions.assertEquals("C", multiGraph.findGraphByName("C").get().getName());
    }

    @Test
    public void shouldRejectDuplicateGraphId() {
        MultiGraph multiGraph = new MultiGraph("all");
        Graph graph = Graph.newGraph("A");
        multiGraph.addGraph(graph);

        Assertions.assertThrows(DuplicateIdException.class, () -> multiGraph.addGraph(graph));
        Assertions.assertThrows(DuplicateIdException.class, () -> multiGraph.addGraph(new Graph(graph.getId(), "Other", null)));
    }

    @Test
    public void shouldHaveNoMainWhenEmpty() {
        MultiGraph multiGraph = new MultiGraph("empty");
        Assertions.assertFalse(multiGraph.getMainGraph().isPresent());
        Assertions.assertNull(multiGraph.getMainGraphId());
    }
}
