package xyz.vvrf.flowgraph.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.Edge;
import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.core.Node;
import xyz.vvrf.flowgraph.core.NodeKind;

import java.util.*;

/**
 * 提供流程图结构验证、可达性分析和文本输出的工具方法。
 * 只读取图，不做任何修改。
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 验证已组装流程图的结构完整性。
     * <ul>
     *     <li>恰好一个开始节点，且没有入边；</li>
     *     <li>结束节点没有出边；</li>
     *     <li>所有边的端点都存在。</li>
     * </ul>
     *
     * @throws IllegalStateException 如果验证失败
     */
    public static void validateGraphStructure(Graph graph) throws IllegalStateException {
        String graphName = graph.getName();
        log.debug("Graph '{}': Starting graph structure validation...", graphName);

        List<Node> starts = new ArrayList<>();
        for (Node node : graph.getNodes()) {
            switch (node.getKind()) {
                case START:
                    starts.add(node);
                    if (!graph.getIncomingEdges(node.getId()).isEmpty()) {
                        throw new IllegalStateException(String.format("Graph '%s': Start node '%s' must not have incoming edges.",
                                graphName, node.getId()));
                    }
                    break;
                case END:
                    if (!graph.getOutgoingEdges(node.getId()).isEmpty()) {
                        throw new IllegalStateException(String.format("Graph '%s': End node '%s' must not have outgoing edges.",
                                graphName, node.getId()));
                    }
                    break;
                case PROCESS:
                case DECISION:
                case SUBFLOW_LINK:
                    break;
                default:
                    throw new IllegalStateException("Unknown node kind: " + node.getKind());
            }
        }
        if (starts.size() != 1) {
            throw new IllegalStateException(String.format("Graph '%s': Expected exactly one start node but found %d.",
                    graphName, starts.size()));
        }

        for (Edge edge : graph.getEdges()) {
            if (!graph.containsNode(edge.getSourceId()) || !graph.containsNode(edge.getTargetId())) {
                throw new IllegalStateException(String.format("Graph '%s': Edge references non-existent node: %s.", graphName, edge));
            }
        }
        log.debug("Graph '{}': Graph structure validation passed.", graphName);
    }

    /**
     * 从开始节点出发无法到达的节点 ID，按节点插入顺序。
     * 例如 break / continue / 提前返回之后的语句会产生这类节点。
     */
    public static List<String> findUnreachableNodes(Graph graph) {
        Optional<Node> start = graph.getStartNode();
        if (!start.isPresent()) {
            List<String> all = new ArrayList<>();
            graph.getNodes().forEach(n -> all.add(n.getId()));
            return all;
        }
        Set<String> reached = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start.get().getId());
        reached.add(start.get().getId());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Edge edge : graph.getOutgoingEdges(current)) {
                if (reached.add(edge.getTargetId())) {
                    queue.add(edge.getTargetId());
                }
            }
        }
        List<String> unreachable = new ArrayList<>();
        for (Node node : graph.getNodes()) {
            if (!reached.contains(node.getId())) {
                unreachable.add(node.getId());
            }
        }
        return unreachable;
    }

    /**
     * 构建邻接表 (源节点 -> 目标节点列表)，每个节点都有一个条目，按节点插入顺序。
     */
    public static Map<String, List<String>> buildAdjacencyList(Graph graph) {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (Node node : graph.getNodes()) {
            List<String> targets = new ArrayList<>();
            for (Edge edge : graph.getOutgoingEdges(node.getId())) {
                targets.add(edge.getTargetId());
            }
            adj.put(node.getId(), targets);
        }
        return adj;
    }

    /**
     * 统计某类节点的数量。
     */
    public static int countNodes(Graph graph, NodeKind kind) {
        int count = 0;
        for (Node node : graph.getNodes()) {
            if (node.getKind() == kind) {
                count++;
            }
        }
        return count;
    }

    /**
     * 图的文本表示：先列出节点，再列出边。
     */
    public static String formatStructure(Graph graph) {
        StringBuilder builder = new StringBuilder("\n节点:\n");
        builder.append(String.format("%-38s | %-12s | %s\n", "ID", "类型", "标签"));
        for (Node node : graph.getNodes()) {
            builder.append(String.format("%-38s | %-12s | %s\n", node.getId(), node.getKind().getTypeName(), node.getLabel()));
        }

        builder.append("\n边:\n");
        builder.append(String.format("%-38s ---> %-38s | %s\n", "源", "目标", "标签"));
        for (Edge edge : graph.getEdges()) {
            builder.append(String.format("%-38s ---> %-38s | %s\n",
                    edge.getSourceId(), edge.getTargetId(), edge.getLabel() == null ? "" : edge.getLabel()));
        }
        return builder.toString();
    }
}
