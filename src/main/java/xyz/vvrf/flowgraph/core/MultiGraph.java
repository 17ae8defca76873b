package xyz.vvrf.flowgraph.core;

import java.util.*;

/**
 * 多个可以相互链接的流程图的容器。
 * 图之间通过 {@link NodeKind#SUBFLOW_LINK} 节点引用，允许循环引用。
 * 第一个加入的图，或任何以 isMain=true 加入的图，成为主图。
 */
public final class MultiGraph {

    private final String name;
    private final Map<String, Object> metadata;
    private final Map<String, Graph> graphs = new LinkedHashMap<>();
    private String mainGraphId;

    public MultiGraph(String name, Map<String, Object> metadata) {
        this.name = Objects.requireNonNull(name, "名称不能为空");
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    public MultiGraph(String name) {
        this(name, null);
    }

    /**
     * 加入一个图。
     *
     * @throws DuplicateIdException 如果同 ID 的图已存在
     */
    public Graph addGraph(Graph graph, boolean isMain) {
        Objects.requireNonNull(graph, "图不能为空");
        if (graphs.containsKey(graph.getId())) {
            throw new DuplicateIdException(graph.getId(),
                    String.format("图 ID '%s' 在 '%s' 中已存在。", graph.getId(), name));
        }
        graphs.put(graph.getId(), graph);
        if (isMain || mainGraphId == null) {
            mainGraphId = graph.getId();
        }
        return graph;
    }

    public Graph addGraph(Graph graph) {
        return addGraph(graph, false);
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public Optional<Graph> getGraph(String graphId) {
        return Optional.ofNullable(graphs.get(graphId));
    }

    public Optional<Graph> findGraphByName(String graphName) {
        return graphs.values().stream().filter(g -> g.getName().equals(graphName)).findFirst();
    }

    public Optional<Graph> getMainGraph() {
        return mainGraphId == null ? Optional.empty() : Optional.ofNullable(graphs.get(mainGraphId));
    }

    public String getMainGraphId() {
        return mainGraphId;
    }

    /**
     * 所有图 (id -> Graph)，按加入顺序，只读。
     */
    public Map<String, Graph> getGraphs() {
        return Collections.unmodifiableMap(graphs);
    }

    public boolean containsGraph(String graphId) {
        return graphs.containsKey(graphId);
    }

    @Override
    public String toString() {
        return String.format("MultiGraph[name='%s', graphs=%d, main=%s]", name, graphs.size(), mainGraphId);
    }
}
