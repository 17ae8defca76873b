package xyz.vvrf.flowgraph.registry;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import xyz.vvrf.flowgraph.assembly.FlowScript;

import java.util.Arrays;
import java.util.ArrayList;

public class SimpleFlowRegistryTest {

    @Test
    public void shouldKeepRegistrationOrder() {
        SimpleFlowRegistry registry = new SimpleFlowRegistry();
        registry.register("c", ctx -> ctx.step("c"));
        registry.register("a", ctx -> ctx.step("a"));
        registry.register("b", ctx -> ctx.step("b"));

        Assertions.assertEquals(Arrays.asList("c", "a", "b"), new ArrayList<>(registry.getFlowNames()));
        Assertions.assertTrue(registry.contains("a"));
        Assertions.assertFalse(registry.getScript("z").isPresent());
    }

    @Test
    public void shouldRejectDuplicateName() {
        SimpleFlowRegistry registry = new SimpleFlowRegistry();
        FlowScript script = ctx -> ctx.step("x");
        registry.register("flow", script);

        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register("flow", ctx -> ctx.step("y")));
        Assertions.assertSame(script, registry.getScript("flow").get());
    }

    @Test
    public void shouldTrackMainFlow() {
        SimpleFlowRegistry registry = new SimpleFlowRegistry();
        registry.register("helper", ctx -> ctx.step("h"));
        Assertions.assertFalse(registry.getMainFlowName().isPresent());

        registry.registerMain("main", ctx -> ctx.subflow("helper"));

        Assertions.assertEquals("main", registry.getMainFlowName().get());
    }

    @Test
    public void shouldRejectNullArguments() {
        SimpleFlowRegistry registry = new SimpleFlowRegistry();

        Assertions.assertThrows(NullPointerException.class, () -> registry.register(null, ctx -> ctx.step("x")));
        Assertions.assertThrows(NullPointerException.class, () -> registry.register("x", null));
    }
}
