package xyz.vvrf.flowgraph.core;

import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * 单个过程的流程图：节点映射 (id -> Node) 加上按插入顺序排列的边。
 * <p>
 * 由组装器为每个过程新建，只在该过程的组装期间被修改；
 * 组装完成后调用 {@link #freeze()}，此后所有修改操作都会抛出 {@link IllegalStateException}。
 */
@Slf4j
public final class Graph {

    private final String id;
    private final String name;
    private final Map<String, Object> metadata;
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    // 邻接索引，保持与 edges 同步
    private final Map<String, List<Edge>> outgoing = new HashMap<>();
    private final Map<String, List<Edge>> incoming = new HashMap<>();
    private boolean frozen = false;

    public Graph(String id, String name, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "图 ID 不能为空");
        this.name = Objects.requireNonNull(name, "图名称不能为空");
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
    }

    /**
     * 创建一个空图，ID 随机生成。
     */
    public static Graph newGraph(String name) {
        return new Graph(UUID.randomUUID().toString(), name, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Map<String, Object> getMetadata() {
        return frozen ? Collections.unmodifiableMap(metadata) : metadata;
    }

    /**
     * 添加节点。
     *
     * @throws DuplicateIdException 如果同 ID 的节点已存在
     */
    public Node addNode(Node node) {
        Objects.requireNonNull(node, "节点不能为空");
        checkMutable();
        if (nodes.containsKey(node.getId())) {
            throw new DuplicateIdException(node.getId(),
                    String.format("节点 ID '%s' 在图 '%s' 中已存在。", node.getId(), name));
        }
        nodes.put(node.getId(), node);
        log.debug("图 '{}': 添加节点 {}", name, node);
        return node;
    }

    /**
     * 添加边。相同 (source, target, label) 的边已存在时不做修改，直接返回已有的边。
     *
     * @throws DanglingReferenceException 如果任一端点不在图中
     */
    public Edge addEdge(Edge edge) {
        Objects.requireNonNull(edge, "边不能为空");
        checkMutable();
        if (!nodes.containsKey(edge.getSourceId())) {
            throw new DanglingReferenceException(edge.getSourceId(),
                    String.format("图 '%s': 边的源节点 '%s' 不存在。", name, edge.getSourceId()));
        }
        if (!nodes.containsKey(edge.getTargetId())) {
            throw new DanglingReferenceException(edge.getTargetId(),
                    String.format("图 '%s': 边的目标节点 '%s' 不存在。", name, edge.getTargetId()));
        }
        for (Edge existing : outgoing.getOrDefault(edge.getSourceId(), Collections.emptyList())) {
            if (existing.sameConnection(edge)) {
                log.debug("图 '{}': 忽略重复边 {}", name, edge);
                return existing;
            }
        }
        edges.add(edge);
        outgoing.computeIfAbsent(edge.getSourceId(), k -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(edge.getTargetId(), k -> new ArrayList<>()).add(edge);
        log.debug("图 '{}': 添加边 {}", name, edge);
        return edge;
    }

    public Optional<Node> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /**
     * 所有节点，按插入顺序，只读。
     */
    public Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * 所有边，按插入顺序，只读。
     */
    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public List<Edge> getOutgoingEdges(String nodeId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(nodeId, Collections.emptyList()));
    }

    public List<Edge> getIncomingEdges(String nodeId) {
        return Collections.unmodifiableList(incoming.getOrDefault(nodeId, Collections.emptyList()));
    }

    public Optional<Node> getStartNode() {
        return nodes.values().stream().filter(n -> n.getKind() == NodeKind.START).findFirst();
    }

    /**
     * 所有子流程链接节点。
     */
    public List<Node> getSubflowLinks() {
        List<Node> links = new ArrayList<>();
        for (Node node : nodes.values()) {
            if (node.isSubflowLink()) {
                links.add(node);
            }
        }
        return links;
    }

    public Graph freeze() {
        this.frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException(String.format("图 '%s' 已完成组装，不可再修改。", name));
        }
    }

    @Override
    public String toString() {
        return String.format("Graph[id=%s, name='%s', nodes=%d, edges=%d]", id, name, nodes.size(), edges.size());
    }
}
