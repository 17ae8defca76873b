package xyz.vvrf.flowgraph.assembly;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.core.LoopKind;
import xyz.vvrf.flowgraph.core.Node;
import xyz.vvrf.flowgraph.core.NodeKind;
import xyz.vvrf.flowgraph.util.GraphUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

import static xyz.vvrf.flowgraph.test.util.GraphTestSupport.*;

public class FlowAssemblerTest {

    private final FlowAssembler assembler = new FlowAssembler(sequentialOptions());

    @Test
    public void shouldAssembleStraightLineAsSimplePath() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx.step("A").step("B").step("C"));

        Assertions.assertEquals(Arrays.asList("Flow", "A", "B", "C", "End"), labels(graph));
        Assertions.assertEquals(Arrays.asList(
                edge("Flow", "A"), edge("A", "B"), edge("B", "C"), edge("C", "End")), edgeSignatures(graph));
        Assertions.assertEquals(NodeKind.START, nodeByLabel(graph, "Flow").getKind());
        Assertions.assertEquals(NodeKind.END, nodeByLabel(graph, "End").getKind());
        GraphUtils.validateGraphStructure(graph);
    }

    @Test
    public void shouldAssembleEmptyProcedureAsStartToEnd() {
        Graph graph = assembler.assemble("Empty", ctx -> {
        });

        Assertions.assertEquals(Arrays.asList(edge("Empty", "End")), edgeSignatures(graph));
    }

    @Test
    public void shouldMergeTwoSidedDecision() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx
                .step("A")
                .decision("Q?", "Y", "N", false)
                .step("B")
                .otherwise()
                .step("C")
                .endDecision());

        Assertions.assertEquals(new HashSet<>(Arrays.asList("Flow", "A", "Q?", "B", "C", "End")), new HashSet<>(labels(graph)));
        Assertions.assertEquals(6, graph.getNodes().size());
        Assertions.assertEquals(new HashSet<>(Arrays.asList(
                edge("Flow", "A"), edge("A", "Q?"), edge("Q?", "B", "Y"), edge("Q?", "C", "N"),
                edge("B", "End"), edge("C", "End"))), new HashSet<>(edgeSignatures(graph)));
        Assertions.assertEquals(6, graph.getEdges().size());
    }

    @Test
    public void shouldFallThroughElseLabelWhenNoElseBody() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx
                .decision("Q?")
                .step("B")
                .endDecision()
                .step("D"));

        List<String> edges = edgeSignatures(graph);
        Assertions.assertTrue(edges.contains(edge("Q?", "B", "Yes")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("Q?", "D", "No")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("B", "D")), describe(graph));
        Assertions.assertEquals(2, graph.getOutgoingEdges(nodeByLabel(graph, "Q?").getId()).size());
    }

    @Test
    public void shouldSwapLabelsForNegatedCondition() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx
                .decision("Ready?", "Yes", "No", true)
                .step("Wait")
                .otherwise()
                .step("Go")
                .endDecision());

        List<String> edges = edgeSignatures(graph);
        Assertions.assertTrue(edges.contains(edge("Ready?", "Wait", "No")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("Ready?", "Go", "Yes")), describe(graph));
    }

    @Test
    public void shouldChainOtherwiseIfAsNestedDecision() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx
                .decision("X?")
                .step("A")
                .otherwiseIf("Y?")
                .step("B")
                .otherwise()
                .step("C")
                .endDecision()
                .step("D"));

        Assertions.assertEquals(new HashSet<>(Arrays.asList(
                edge("Flow", "X?"),
                edge("X?", "A", "Yes"), edge("X?", "Y?", "No"),
                edge("Y?", "B", "Yes"), edge("Y?", "C", "No"),
                edge("A", "D"), edge("B", "D"), edge("C", "D"),
                edge("D", "End"))), new HashSet<>(edgeSignatures(graph)));
    }

    @Test
    public void shouldChainOtherwiseIfWithoutFinalElse() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx
                .decision("X?")
                .step("A")
                .otherwiseIf("Y?")
                .step("B")
                .endDecision()
                .step("D"));

        List<String> edges = edgeSignatures(graph);
        Assertions.assertTrue(edges.contains(edge("Y?", "D", "No")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("A", "D")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("B", "D")), describe(graph));
    }

    @Test
    public void shouldNotMergeBranchEndingWithExplicitEnd() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx
                .decision("Broken?")
                .end("Abort")
                .endDecision()
                .step("Continue"));

        List<String> edges = edgeSignatures(graph);
        Assertions.assertTrue(edges.contains(edge("Broken?", "Abort", "Yes")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("Broken?", "Continue", "No")), describe(graph));
        Assertions.assertTrue(graph.getOutgoingEdges(nodeByLabel(graph, "Abort").getId()).isEmpty());
        Assertions.assertEquals(2, GraphUtils.countNodes(graph, NodeKind.END));
    }

    @Test
    public void shouldLeaveNoExitAfterBareReturn() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx
                .decision("Done?")
                .step("Cleanup")
                .exit()
                .endDecision()
                .step("Work"));

        Node cleanup = nodeByLabel(graph, "Cleanup");
        Assertions.assertTrue(graph.getOutgoingEdges(cleanup.getId()).isEmpty());
        Assertions.assertTrue(edgeSignatures(graph).contains(edge("Done?", "Work", "No")), describe(graph));
        Assertions.assertEquals(1, GraphUtils.countNodes(graph, NodeKind.END));
    }

    @Test
    public void shouldNotAppendEndWhenFlowAlreadyTerminated() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx.step("A").end("Finished"));

        Assertions.assertEquals(Arrays.asList("Flow", "A", "Finished"), labels(graph));
        Assertions.assertEquals(1, GraphUtils.countNodes(graph, NodeKind.END));
    }

    @Test
    public void shouldFreezeResultGraph() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx.step("A"));

        Assertions.assertTrue(graph.isFrozen());
        Assertions.assertThrows(IllegalStateException.class, () -> graph.addNode(Node.process("x", "X", null)));
    }

    @Test
    public void shouldUseSequentialIdsWhenConfigured() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx.step("A").decision("Q?").endDecision());

        Assertions.assertEquals("start_1", nodeByLabel(graph, "Flow").getId());
        Assertions.assertEquals("process_2", nodeByLabel(graph, "A").getId());
        Assertions.assertEquals("decision_3", nodeByLabel(graph, "Q?").getId());
        Assertions.assertEquals("end_4", nodeByLabel(graph, "End").getId());
    }

    @Test
    public void shouldUseGraphNameAsStartLabelAndUuidIdsByDefault() {
        Graph graph = new FlowAssembler().assemble("Checkout", ctx -> ctx.step("Pay"));

        Node start = graph.getStartNode().get();
        Assertions.assertEquals("Checkout", start.getLabel());
        Assertions.assertEquals(36, start.getId().length());
    }

    @Test
    public void shouldApplyConfiguredLabels() {
        AssemblyOptions options = AssemblyOptions.builder()
                .idStrategy(NodeIdStrategy.SEQUENTIAL)
                .yesLabel("是")
                .noLabel("否")
                .endLabel("结束")
                .build();
        Graph graph = new FlowAssembler(options).assemble("Flow", ctx -> ctx.decision("Q?").step("A").endDecision());

        List<String> edges = edgeSignatures(graph);
        Assertions.assertTrue(edges.contains(edge("Q?", "A", "是")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("Q?", "结束", "否")), describe(graph));
    }

    @Test
    public void shouldKeepStepMetadata() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx.step("A", Collections.singletonMap("description", "first step")));

        Assertions.assertEquals("first step", nodeByLabel(graph, "A").getDescription().get());
    }

    @Test
    public void shouldAddUnresolvedSubflowLinkByName() {
        Graph graph = assembler.assemble("Flow", ctx -> ctx.step("A").subflow("Triage").step("B"));

        Node link = nodeByLabel(graph, "Triage");
        Assertions.assertEquals(NodeKind.SUBFLOW_LINK, link.getKind());
        Assertions.assertFalse(link.getTargetGraphId().isPresent());
        Assertions.assertEquals(Arrays.asList(
                edge("Flow", "A"), edge("A", "Triage"), edge("Triage", "B"), edge("B", "End")), edgeSignatures(graph));
    }

    @Test
    public void shouldBindSubflowLinkToKnownGraph() {
        Graph other = assembler.assemble("Other", ctx -> ctx.step("X"));
        Graph graph = assembler.assemble("Flow", ctx -> ctx.subflow(other));

        Node link = nodeByLabel(graph, "Other");
        Assertions.assertEquals(other.getId(), link.getTargetGraphId().get());
    }

    @Test
    public void shouldAssembleSameGraphFromEventList() {
        List<FlowEvent> events = Arrays.asList(
                FlowEvent.step("A"),
                FlowEvent.decision("Q?", "Y", "N", false),
                FlowEvent.step("B"),
                FlowEvent.otherwise(),
                FlowEvent.step("C"),
                FlowEvent.endDecision());

        Graph fromEvents = assembler.assemble("Flow", events);
        Graph fromScript = assembler.assemble("Flow", ctx -> ctx
                .step("A").decision("Q?", "Y", "N", false).step("B").otherwise().step("C").endDecision());

        Assertions.assertEquals(edgeSignatures(fromScript), edgeSignatures(fromEvents));
        Assertions.assertEquals(labels(fromScript), labels(fromEvents));
    }

    @Test
    public void shouldAssembleLoopsFromEventList() {
        List<FlowEvent> events = Arrays.asList(
                FlowEvent.loopStart(LoopKind.UNCONDITIONAL, null),
                FlowEvent.step("Poll"),
                FlowEvent.decision("Ready?"),
                FlowEvent.breakLoop(),
                FlowEvent.endDecision(),
                FlowEvent.loopEnd(),
                FlowEvent.subflow("Next"),
                FlowEvent.end(null));

        Graph graph = assembler.assemble("Flow", events);

        List<String> edges = edgeSignatures(graph);
        Assertions.assertTrue(edges.contains(edge("Ready?", "Next", "Yes")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("Ready?", "(loop)", "No")), describe(graph));
        Assertions.assertTrue(edges.contains(edge("Next", "End")), describe(graph));
    }
}
