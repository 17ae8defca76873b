package xyz.vvrf.flowgraph.assembly;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.Edge;
import xyz.vvrf.flowgraph.core.Graph;

import java.util.Objects;

/**
 * 把前沿中的悬空出口连接到目标节点。
 * 待定的可复用出口在这里才被解析成具体实例，同时把该调用点的入口前沿接入该实例。
 */
@Slf4j
public class FrontierTracker {

    private final Graph graph;
    private final NodeReuseResolver resolver;

    public FrontierTracker(Graph graph, NodeReuseResolver resolver) {
        this.graph = Objects.requireNonNull(graph, "图不能为空");
        this.resolver = Objects.requireNonNull(resolver, "复用解析器不能为空");
    }

    /**
     * 为前沿中的每个条目添加一条指向 targetId 的边，边标签取条目上的待定标签。
     * 调用方随后应替换自己的前沿。
     */
    public void connect(Frontier frontier, String targetId) {
        Objects.requireNonNull(targetId, "目标节点 ID 不能为空");
        for (FrontierEntry entry : frontier.getEntries()) {
            String sourceId = resolve(entry.getExit(), targetId);
            graph.addEdge(new Edge(sourceId, targetId, entry.getLabel()));
        }
    }

    /**
     * 前沿不再有后继 (提前返回) 时调用：待定的可复用出口仍然要落地成节点并接入其入口。
     */
    public void materialize(Frontier frontier) {
        for (FrontierEntry entry : frontier.getEntries()) {
            resolve(entry.getExit(), null);
        }
    }

    private String resolve(ExitRef exit, String targetId) {
        switch (exit.getKind()) {
            case CONCRETE_NODE:
                return ((ExitRef.ConcreteNode) exit).getNodeId();
            case PENDING_REUSABLE:
                ExitRef.PendingReusable pending = (ExitRef.PendingReusable) exit;
                String instanceId = resolver.selectInstance(pending.getDefinition(), targetId);
                Frontier incoming = Frontier.empty();
                pending.getIncoming().forEach(incoming::add);
                connect(incoming, instanceId);
                return instanceId;
            default:
                throw new IllegalStateException("未知的出口类型: " + exit.getKind());
        }
    }
}
