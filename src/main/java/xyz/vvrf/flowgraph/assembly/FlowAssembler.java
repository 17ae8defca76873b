package xyz.vvrf.flowgraph.assembly;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.FlowGraphException;
import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.monitor.AssemblyListener;
import xyz.vvrf.flowgraph.util.GraphUtils;

import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;

/**
 * 流程图组装的唯一入口：为名称 N 新建图，按顺序喂入事件，返回已冻结的结果图。
 * <p>
 * 组装器本身无状态，可以被多个线程同时使用；每次调用都拥有独立的 {@link AssemblyContext}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class FlowAssembler {

    private final AssemblyOptions options;
    private final List<AssemblyListener> listeners;

    public FlowAssembler(AssemblyOptions options, List<AssemblyListener> listeners) {
        this.options = Objects.requireNonNull(options, "组装选项不能为空");
        this.listeners = listeners != null
                ? Collections.unmodifiableList(new ArrayList<>(listeners))
                : Collections.emptyList();
        log.info("FlowAssembler 已初始化。选项: {}, 监听器数量: {}", options, this.listeners.size());
    }

    public FlowAssembler(AssemblyOptions options) {
        this(options, Collections.emptyList());
    }

    public FlowAssembler() {
        this(AssemblyOptions.defaults());
    }

    public AssemblyOptions getOptions() {
        return options;
    }

    /**
     * 通过脚本组装流程图。
     *
     * @throws FlowGraphException 输入格式错误，第一个错误即中止组装；其他运行时异常同样原样抛出
     */
    public Graph assemble(String name, FlowScript script) {
        Objects.requireNonNull(name, "流程名称不能为空");
        Objects.requireNonNull(script, "流程脚本不能为空");

        log.info("开始组装流程 '{}'", name);
        safeNotifyListeners(l -> l.onAssemblyStart(name));
        long startNanos = System.nanoTime();
        Graph graph;
        try {
            AssemblyContext context = new AssemblyContext(Graph.newGraph(name), options);
            script.describe(context);
            graph = context.finish();
            GraphUtils.validateGraphStructure(graph);
        } catch (RuntimeException e) {
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            log.error("流程 '{}' 组装失败: {}", name, e.getMessage());
            safeNotifyListeners(l -> l.onAssemblyFailure(name, e, duration));
            throw e;
        }

        List<String> unreachable = GraphUtils.findUnreachableNodes(graph);
        if (!unreachable.isEmpty()) {
            log.warn("流程 '{}' 中有 {} 个节点从开始节点不可达: {}", name, unreachable.size(), unreachable);
        }
        if (options.isPrintStructure() && log.isInfoEnabled()) {
            log.info("流程 '{}' 最终结构 (文本):{}", name, GraphUtils.formatStructure(graph));
        }
        graph.freeze();

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        log.info("流程 '{}' 组装完成: {} 个节点, {} 条边", name, graph.getNodes().size(), graph.getEdges().size());
        safeNotifyListeners(l -> l.onAssemblyComplete(name, graph, duration));
        return graph;
    }

    /**
     * 通过事件列表组装流程图。
     */
    public Graph assemble(String name, List<FlowEvent> events) {
        Objects.requireNonNull(events, "事件列表不能为空");
        return assemble(name, context -> {
            for (FlowEvent event : events) {
                apply(context, event);
            }
        });
    }

    /**
     * 把一个事件应用到上下文。
     */
    public static void apply(AssemblyContext context, FlowEvent event) {
        AssemblyOptions opts = context.getOptions();
        String yes = event.getYesLabel() != null ? event.getYesLabel() : opts.getYesLabel();
        String no = event.getNoLabel() != null ? event.getNoLabel() : opts.getNoLabel();
        switch (event.getType()) {
            case STEP:
                context.step(event.getLabel(), event.getMetadata());
                break;
            case REUSABLE_STEP:
                context.step(event.getDefinition());
                break;
            case DECISION:
                context.decision(event.getLabel(), yes, no, event.isNegated());
                break;
            case OTHERWISE:
                context.otherwise();
                break;
            case OTHERWISE_IF:
                context.otherwiseIf(event.getLabel(), yes, no, event.isNegated());
                break;
            case END_DECISION:
                context.endDecision();
                break;
            case LOOP_START:
                context.loopStart(event.getLoopKind(), event.getLabel(), yes, no, event.isNegated());
                break;
            case LOOP_END:
                context.loopEnd();
                break;
            case BREAK:
                context.breakLoop();
                break;
            case CONTINUE:
                context.continueLoop();
                break;
            case EXPLICIT_END:
                context.end(event.getLabel() != null ? event.getLabel() : opts.getEndLabel());
                break;
            case EXIT:
                context.exit();
                break;
            case SUBFLOW_CALL:
                if (event.getTarget() != null) {
                    context.subflow(event.getTarget());
                } else {
                    context.subflow(event.getLabel());
                }
                break;
            default:
                throw new IllegalStateException("未知的事件类型: " + event.getType());
        }
    }

    private void safeNotifyListeners(Consumer<AssemblyListener> notification) {
        if (listeners.isEmpty()) {
            return;
        }
        for (AssemblyListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("组装监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
