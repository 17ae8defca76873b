package xyz.vvrf.flowgraph.link;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import xyz.vvrf.flowgraph.assembly.FlowAssembler;
import xyz.vvrf.flowgraph.core.*;
import xyz.vvrf.flowgraph.monitor.AssemblyListener;
import xyz.vvrf.flowgraph.registry.SimpleFlowRegistry;

import java.util.Arrays;
import java.util.Collections;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static xyz.vvrf.flowgraph.test.util.GraphTestSupport.nodeByLabel;
import static xyz.vvrf.flowgraph.test.util.GraphTestSupport.sequentialOptions;

public class MultiGraphLinkerTest {

    private SimpleFlowRegistry registry;
    private FlowAssembler assembler;

    @BeforeEach
    public void setUp() {
        registry = new SimpleFlowRegistry();
        assembler = new FlowAssembler(sequentialOptions());
    }

    @Test
    public void shouldResolveMutualReferences() {
        registry.register("A", ctx -> ctx.step("Work in A").subflow("B"));
        registry.register("B", ctx -> ctx.step("Work in B").subflow("A"));

        MultiGraph multiGraph = new MultiGraphLinker(registry, assembler).collectReferenced("A");

        Graph a = multiGraph.findGraphByName("A").get();
        Graph b = multiGraph.findGraphByName("B").get();
        Assertions.assertEquals(2, multiGraph.getGraphs().size());
        Assertions.assertEquals(a.getId(), multiGraph.getMainGraphId());
        Assertions.assertEquals(b.getId(), nodeByLabel(a, "B").getTargetGraphId().get());
        Assertions.assertEquals(a.getId(), nodeByLabel(b, "A").getTargetGraphId().get());
    }

    @Test
    public void shouldCollectTransitiveReferencesOnly() {
        registry.register("Root", ctx -> ctx.subflow("Middle"));
        registry.register("Middle", ctx -> ctx.decision("Deep?").subflow("Leaf").endDecision());
        registry.register("Leaf", ctx -> ctx.step("Done"));
        registry.register("Unrelated", ctx -> ctx.step("Elsewhere"));

        MultiGraphLinker linker = new MultiGraphLinker(registry, assembler);
        MultiGraph multiGraph = linker.collectReferenced("Root");

        Assertions.assertEquals(3, multiGraph.getGraphs().size());
        Assertions.assertTrue(multiGraph.findGraphByName("Leaf").isPresent());
        Assertions.assertFalse(multiGraph.findGraphByName("Unrelated").isPresent());
        Assertions.assertFalse(linker.getGraph("Unrelated").isPresent());
    }

    @Test
    public void shouldAssembleEachReferencedFlowOnce() {
        registry.register("Main", ctx -> ctx.subflow("Shared").step("Between").subflow("Shared"));
        registry.register("Shared", ctx -> ctx.step("Common"));

        MultiGraph multiGraph = new MultiGraphLinker(registry, assembler).collectReferenced("Main");

        Assertions.assertEquals(2, multiGraph.getGraphs().size());
        String sharedId = multiGraph.findGraphByName("Shared").get().getId();
        for (Node link : multiGraph.getMainGraph().get().getSubflowLinks()) {
            Assertions.assertEquals(sharedId, link.getTargetGraphId().get());
        }
    }

    @Test
    public void shouldFailOnUnknownReference() {
        registry.register("A", ctx -> ctx.subflow("Missing"));

        DanglingReferenceException error = Assertions.assertThrows(DanglingReferenceException.class,
                () -> new MultiGraphLinker(registry, assembler).collectReferenced("A"));
        Assertions.assertEquals("Missing", error.getReference());
    }

    @Test
    public void shouldFailOnUnknownRootName() {
        Assertions.assertThrows(DanglingReferenceException.class,
                () -> new MultiGraphLinker(registry, assembler).build("Nothing"));
    }

    @Test
    public void shouldUseIncludedGraphInsteadOfRegistry() {
        Graph external = assembler.assemble("Helper", ctx -> ctx.step("Provided"));
        registry.register("Main", ctx -> ctx.subflow("Helper"));

        MultiGraph multiGraph = new MultiGraphLinker(registry, assembler).include(external).collectReferenced("Main");

        Assertions.assertSame(external, multiGraph.findGraphByName("Helper").get());
        Assertions.assertEquals(external.getId(), nodeByLabel(multiGraph.getMainGraph().get(), "Helper").getTargetGraphId().get());
    }

    @Test
    public void shouldFollowLinksBoundByGraphObject() {
        Graph target = assembler.assemble("Target", ctx -> ctx.step("T"));
        Graph root = assembler.assemble("Root", ctx -> ctx.subflow(target));
        MultiGraphLinker linker = new MultiGraphLinker(registry, assembler);

        Assertions.assertThrows(DanglingReferenceException.class, () -> linker.collectReferenced(root));

        MultiGraph multiGraph = new MultiGraphLinker(registry, assembler).include(target).collectReferenced(root);
        Assertions.assertTrue(multiGraph.containsGraph(target.getId()));
    }

    @Test
    public void shouldRejectDifferentGraphWithSameName() {
        MultiGraphLinker linker = new MultiGraphLinker(registry, assembler);
        linker.include(assembler.assemble("Same", ctx -> ctx.step("One")));

        Assertions.assertThrows(DuplicateIdException.class,
                () -> linker.include(assembler.assemble("Same", ctx -> ctx.step("Two"))));
    }

    @Test
    public void shouldLinkAllRegisteredFlowsWithMarkedMain() {
        registry.register("Helper", ctx -> ctx.step("Help"));
        registry.registerMain("Main", ctx -> ctx.subflow("Helper"));
        registry.register("Standalone", ctx -> ctx.step("Alone"));

        MultiGraph multiGraph = new MultiGraphLinker(registry, assembler).linkAll("System", null);

        Assertions.assertEquals("System", multiGraph.getName());
        Assertions.assertEquals(3, multiGraph.getGraphs().size());
        Assertions.assertEquals("Main", multiGraph.getMainGraph().get().getName());
    }

    @Test
    public void shouldLinkAllWithExplicitMain() {
        registry.register("First", ctx -> ctx.step("1"));
        registry.register("Second", ctx -> ctx.step("2"));

        Assertions.assertEquals("Second",
                new MultiGraphLinker(registry, assembler).linkAll("System", "Second").getMainGraph().get().getName());
        Assertions.assertEquals("First",
                new MultiGraphLinker(registry, assembler).linkAll("System", null).getMainGraph().get().getName());
    }

    @Test
    public void shouldNotifyListenersWithResolvedCount() {
        AssemblyListener listener = Mockito.mock(AssemblyListener.class);
        AssemblyListener failing = Mockito.mock(AssemblyListener.class);
        Mockito.doThrow(new IllegalStateException("boom")).when(failing).onGraphsLinked(Mockito.any(), Mockito.anyInt());
        registry.register("A", ctx -> ctx.subflow("B"));
        registry.register("B", ctx -> ctx.subflow("A"));

        MultiGraph multiGraph = new MultiGraphLinker(registry, assembler, Arrays.asList(failing, listener)).collectReferenced("A");

        Mockito.verify(listener).onGraphsLinked(same(multiGraph), eq(2));
    }

    @Test
    public void shouldAcceptEmptyListenerList() {
        registry.register("A", ctx -> ctx.step("x"));

        MultiGraph multiGraph = new MultiGraphLinker(registry, assembler, Collections.emptyList()).collectReferenced("A");

        Assertions.assertEquals(1, multiGraph.getGraphs().size());
    }
}
