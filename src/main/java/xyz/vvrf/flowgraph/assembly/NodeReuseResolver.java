package xyz.vvrf.flowgraph.assembly;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.Edge;
import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.core.Node;
import xyz.vvrf.flowgraph.core.NodeKind;
import xyz.vvrf.flowgraph.core.StepDefinition;

import java.util.*;
import java.util.function.Function;

/**
 * 可复用步骤的节点复用解析器。
 * <p>
 * 为每个步骤定义按创建顺序记录已经落地的实例。共享模式下，一次调用先以
 * {@link ExitRef.PendingReusable} 的形式留在前沿中，等到知道下一个目标节点时才通过
 * {@link #selectInstance(StepDefinition, String)} 决定具体实例：
 * <ol>
 *     <li>第一个已经有边指向该目标的实例；</li>
 *     <li>否则第一个还没有任何出边、也没有被任何调用点选中过的实例；</li>
 *     <li>否则新建一个实例。</li>
 * </ol>
 * 实例一经选中即视为已占用。待定出口是从后往前解析的：先为较晚的调用点选定实例，再递归连接它的入口，
 * 此时该实例指向目标的边尚未加上，占用标记保证较早的同一步骤调用点不会落到这个实例上。
 * 以 null 目标 (提前返回) 选中的实例永远不会有出边，同样保持占用。
 * 实例注册表只属于一次组装，不会在组装之间共享。
 */
@Slf4j
public class NodeReuseResolver {

    private final StepReuseMode mode;
    private final Graph graph;
    private final Function<NodeKind, String> idGenerator;
    private final Map<String, List<String>> instancesByDefinition = new LinkedHashMap<>();
    private final Set<String> claimed = new HashSet<>();

    public NodeReuseResolver(StepReuseMode mode, Graph graph, Function<NodeKind, String> idGenerator) {
        this.mode = Objects.requireNonNull(mode, "复用模式不能为空");
        this.graph = Objects.requireNonNull(graph, "图不能为空");
        this.idGenerator = Objects.requireNonNull(idGenerator, "ID 生成器不能为空");
    }

    public StepReuseMode getMode() {
        return mode;
    }

    /**
     * 处理一次可复用步骤调用，返回调用之后的前沿。
     * 非共享模式下立即创建节点并接入入口前沿；共享模式下返回一个待定条目。
     */
    public Frontier invoke(StepDefinition definition, Frontier incoming, FrontierTracker tracker) {
        Objects.requireNonNull(definition, "步骤定义不能为空");
        if (mode == StepReuseMode.ALWAYS_NEW) {
            String instanceId = newInstance(definition);
            tracker.connect(incoming, instanceId);
            return Frontier.of(instanceId, null);
        }
        return Frontier.of(new FrontierEntry(ExitRef.pending(definition, incoming.getEntries()), null));
    }

    /**
     * 为某个目标选择 (或创建) 一个实例。
     *
     * @param targetId 下一个目标节点；为 null 表示调用之后没有后继 (例如提前返回)
     * @return 实例节点 ID
     */
    public String selectInstance(StepDefinition definition, String targetId) {
        List<String> instances = instancesByDefinition.getOrDefault(definition.getId(), Collections.emptyList());
        if (targetId != null) {
            for (String instanceId : instances) {
                if (hasEdgeTo(instanceId, targetId)) {
                    log.debug("步骤 '{}': 复用已指向 '{}' 的实例 {}", definition.getLabel(), targetId, instanceId);
                    return claim(instanceId);
                }
            }
        }
        for (String instanceId : instances) {
            // 不能把目标自身当作实例，否则连续两次调用同一步骤会形成自环
            if (!instanceId.equals(targetId) && !claimed.contains(instanceId)
                    && graph.getOutgoingEdges(instanceId).isEmpty()) {
                log.debug("步骤 '{}': 复用尚无出边的实例 {}", definition.getLabel(), instanceId);
                return claim(instanceId);
            }
        }
        return claim(newInstance(definition));
    }

    /**
     * 无条件创建并注册一个新实例。
     */
    public String newInstance(StepDefinition definition) {
        Node node = Node.process(idGenerator.apply(NodeKind.PROCESS), definition.getLabel(), definition.getMetadata());
        graph.addNode(node);
        instancesByDefinition.computeIfAbsent(definition.getId(), k -> new ArrayList<>()).add(node.getId());
        log.debug("步骤 '{}': 创建第 {} 个实例 {}", definition.getLabel(),
                instancesByDefinition.get(definition.getId()).size(), node.getId());
        return node.getId();
    }

    /**
     * 某个定义已经落地的实例 ID，按创建顺序。
     */
    public List<String> getInstances(StepDefinition definition) {
        return Collections.unmodifiableList(instancesByDefinition.getOrDefault(definition.getId(), Collections.emptyList()));
    }

    private String claim(String instanceId) {
        claimed.add(instanceId);
        return instanceId;
    }

    private boolean hasEdgeTo(String instanceId, String targetId) {
        for (Edge edge : graph.getOutgoingEdges(instanceId)) {
            if (edge.getTargetId().equals(targetId)) {
                return true;
            }
        }
        return false;
    }
}
