package xyz.vvrf.flowgraph.monitor;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import xyz.vvrf.flowgraph.assembly.FlowAssembler;
import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.core.MissingBranchContextException;

import java.util.Collections;

import static xyz.vvrf.flowgraph.test.util.GraphTestSupport.sequentialOptions;

public class LoggingAssemblyListenerTest {

    private final FlowAssembler assembler = new FlowAssembler(sequentialOptions(),
            Collections.singletonList(new LoggingAssemblyListener()));

    @Test
    public void shouldNotInterfereWithAssembly() {
        Graph graph = assembler.assemble("Logged", ctx -> ctx.step("A"));

        Assertions.assertEquals(3, graph.getNodes().size());
    }

    @Test
    public void shouldNotSwallowAssemblyFailure() {
        Assertions.assertThrows(MissingBranchContextException.class,
                () -> assembler.assemble("Logged", ctx -> ctx.endDecision()));
    }
}
