package xyz.vvrf.flowgraph.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.*;

import java.util.*;

/**
 * 流程图与 JSON 交换格式之间的转换。
 * <p>
 * 单图格式：
 * <pre>
 * {
 *   "id": ..., "name": ..., "metadata": {...},
 *   "nodes": [{"id", "type", "label", "metadata", "targetGraphId"?}],
 *   "edges": [{"id": "e0", "source", "target", "label", "condition", "metadata"}],
 *   "graph": {"incomingEdges": {节点 ID: [边 ID]}, "outgoingEdges": {节点 ID: [边 ID]}}
 * }
 * </pre>
 * "graph" 部分是给下游导航用的预计算索引，读取时忽略。
 * <p>
 * 多图格式中每个图的边 ID 以 {@code c<序号>_} 为前缀，并为每个已解析的子流程链接追加一条
 * 指向目标图开始节点的隐藏跨图边，读取时会跳过这些边。
 */
@Slf4j
public class GraphJsonSerializer {

    public static final String MULTI_GRAPH_TYPE = "MultiGraph";
    public static final String META_CROSS_GRAPH = "crossGraph";
    public static final String META_HIDDEN = "hidden";
    public static final String CROSS_EDGE_LABEL_PREFIX = "Go to: ";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper objectMapper;

    public GraphJsonSerializer(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper 不能为空");
    }

    public GraphJsonSerializer() {
        this(new ObjectMapper());
    }

    // ----- 写 -----

    public String toJson(Graph graph) {
        return write(toTree(graph));
    }

    public ObjectNode toTree(Graph graph) {
        Objects.requireNonNull(graph, "图不能为空");
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", graph.getId());
        root.put("name", graph.getName());
        root.set("metadata", objectMapper.valueToTree(graph.getMetadata()));

        ArrayNode nodes = root.putArray("nodes");
        for (Node node : graph.getNodes()) {
            ObjectNode nodeData = nodes.addObject();
            nodeData.put("id", node.getId());
            nodeData.put("type", node.getKind().getTypeName());
            nodeData.put("label", node.getLabel());
            nodeData.set("metadata", objectMapper.valueToTree(node.getMetadata()));
            if (node.isSubflowLink()) {
                nodeData.put("targetGraphId", node.getTargetGraphId().orElse(null));
            }
        }

        ArrayNode edges = root.putArray("edges");
        ObjectNode incoming = objectMapper.createObjectNode();
        ObjectNode outgoing = objectMapper.createObjectNode();
        List<Edge> graphEdges = graph.getEdges();
        for (int i = 0; i < graphEdges.size(); i++) {
            Edge edge = graphEdges.get(i);
            String edgeId = "e" + i;
            ObjectNode edgeData = edges.addObject();
            edgeData.put("id", edgeId);
            edgeData.put("source", edge.getSourceId());
            edgeData.put("target", edge.getTargetId());
            edgeData.put("label", edge.getLabel());
            edgeData.put("condition", edge.getCondition());
            edgeData.set("metadata", objectMapper.valueToTree(edge.getMetadata()));
            appendIndex(incoming, edge.getTargetId(), edgeId, false);
            appendIndex(outgoing, edge.getSourceId(), edgeId, false);
        }

        ObjectNode index = root.putObject("graph");
        index.set("incomingEdges", incoming);
        index.set("outgoingEdges", outgoing);
        return root;
    }

    public String multiToJson(MultiGraph multiGraph) {
        return write(multiToTree(multiGraph));
    }

    public ObjectNode multiToTree(MultiGraph multiGraph) {
        Objects.requireNonNull(multiGraph, "多图不能为空");
        Map<String, String> startNodes = new HashMap<>();
        for (Graph graph : multiGraph.getGraphs().values()) {
            graph.getStartNode().ifPresent(start -> startNodes.put(graph.getId(), start.getId()));
        }

        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", MULTI_GRAPH_TYPE);
        root.put("name", multiGraph.getName());
        root.set("metadata", objectMapper.valueToTree(multiGraph.getMetadata()));
        root.put("mainGraphId", multiGraph.getMainGraphId());
        ObjectNode graphs = root.putObject("graphs");

        int graphIndex = 0;
        for (Graph graph : multiGraph.getGraphs().values()) {
            ObjectNode graphData = toTree(graph);
            String prefix = "c" + graphIndex + "_";
            prefixEdgeIds(graphData, prefix);

            ArrayNode edges = (ArrayNode) graphData.get("edges");
            ObjectNode index = (ObjectNode) graphData.get("graph");
            int crossIndex = 0;
            for (Node link : graph.getSubflowLinks()) {
                Optional<String> targetId = link.getTargetGraphId();
                if (!targetId.isPresent() || !startNodes.containsKey(targetId.get())) {
                    continue;
                }
                String targetStart = startNodes.get(targetId.get());
                String targetName = multiGraph.getGraph(targetId.get()).map(Graph::getName).orElse("Subflow");
                String edgeId = prefix + "cross" + crossIndex++;

                ObjectNode crossEdge = edges.addObject();
                crossEdge.put("id", edgeId);
                crossEdge.put("source", link.getId());
                crossEdge.put("target", targetStart);
                crossEdge.put("label", CROSS_EDGE_LABEL_PREFIX + targetName);
                crossEdge.putNull("condition");
                ObjectNode meta = crossEdge.putObject("metadata");
                meta.put(META_CROSS_GRAPH, true);
                meta.put(META_HIDDEN, true);

                // 跨图边排在链接节点出边的最前面
                appendIndex((ObjectNode) index.get("outgoingEdges"), link.getId(), edgeId, true);
                appendIndex((ObjectNode) index.get("incomingEdges"), targetStart, edgeId, false);
            }
            graphs.set(graph.getId(), graphData);
            graphIndex++;
        }
        return root;
    }

    // ----- 读 -----

    /**
     * 从 JSON 重建一个已冻结的图。
     *
     * @throws GraphSerializationException 输入不是合法的单图格式
     */
    public Graph fromJson(String json) {
        return fromTree(read(json), false);
    }

    public MultiGraph multiFromJson(String json) {
        JsonNode root = read(json);
        MultiGraph multiGraph = new MultiGraph(root.path("name").asText("LoadedMultiGraph"), toMap(root.get("metadata")));
        String mainGraphId = root.path("mainGraphId").isTextual() ? root.get("mainGraphId").asText() : null;
        JsonNode graphs = root.get("graphs");
        if (graphs == null || !graphs.isObject()) {
            throw new GraphSerializationException("多图 JSON 缺少 'graphs' 对象。");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = graphs.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            ObjectNode graphData = field.getValue().deepCopy();
            // 以外层键为准
            graphData.put("id", field.getKey());
            Graph graph = fromTree(graphData, true);
            multiGraph.addGraph(graph, field.getKey().equals(mainGraphId));
        }
        log.debug("从 JSON 读取多图 '{}': {} 个图", multiGraph.getName(), multiGraph.getGraphs().size());
        return multiGraph;
    }

    private Graph fromTree(JsonNode data, boolean skipCrossGraphEdges) {
        if (data == null || !data.isObject()) {
            throw new GraphSerializationException("图 JSON 必须是一个对象。");
        }
        String id = data.path("id").isTextual() ? data.get("id").asText() : UUID.randomUUID().toString();
        Graph graph = new Graph(id, data.path("name").asText("LoadedGraph"), toMap(data.get("metadata")));

        Set<String> nodeIds = new HashSet<>();
        for (JsonNode nodeData : data.path("nodes")) {
            String nodeId = requireText(nodeData, "id", "节点");
            NodeKind kind;
            try {
                kind = NodeKind.fromTypeName(requireText(nodeData, "type", "节点"));
            } catch (IllegalArgumentException e) {
                throw new GraphSerializationException(String.format("节点 '%s': %s", nodeId, e.getMessage()), e);
            }
            String label = nodeData.path("label").asText("");
            Map<String, Object> metadata = toMap(nodeData.get("metadata"));
            Node node;
            if (kind == NodeKind.SUBFLOW_LINK) {
                JsonNode target = nodeData.get("targetGraphId");
                node = Node.subflowLink(nodeId, label, target != null && target.isTextual() ? target.asText() : null, metadata);
            } else {
                node = Node.of(nodeId, kind, label, metadata);
            }
            graph.addNode(node);
            nodeIds.add(nodeId);
        }

        for (JsonNode edgeData : data.path("edges")) {
            String source = requireText(edgeData, "source", "边");
            String target = requireText(edgeData, "target", "边");
            Map<String, Object> metadata = toMap(edgeData.get("metadata"));
            if (skipCrossGraphEdges
                    && (Boolean.TRUE.equals(metadata.get(META_CROSS_GRAPH)) || !nodeIds.contains(source) || !nodeIds.contains(target))) {
                continue;
            }
            graph.addEdge(new Edge(source, target, textOrNull(edgeData, "label"), textOrNull(edgeData, "condition"), metadata));
        }
        return graph.freeze();
    }

    private void prefixEdgeIds(ObjectNode graphData, String prefix) {
        for (JsonNode edge : graphData.get("edges")) {
            ((ObjectNode) edge).put("id", prefix + edge.get("id").asText());
        }
        ObjectNode index = (ObjectNode) graphData.get("graph");
        for (String direction : Arrays.asList("incomingEdges", "outgoingEdges")) {
            Iterator<JsonNode> lists = index.get(direction).elements();
            while (lists.hasNext()) {
                ArrayNode ids = (ArrayNode) lists.next();
                for (int i = 0; i < ids.size(); i++) {
                    ids.set(i, ids.textNode(prefix + ids.get(i).asText()));
                }
            }
        }
    }

    private static void appendIndex(ObjectNode index, String nodeId, String edgeId, boolean first) {
        ArrayNode ids = index.has(nodeId) ? (ArrayNode) index.get(nodeId) : index.putArray(nodeId);
        if (first) {
            ids.insert(0, edgeId);
        } else {
            ids.add(edgeId);
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            throw new GraphSerializationException("metadata 必须是一个对象: " + node);
        }
        return objectMapper.convertValue(node, MAP_TYPE);
    }

    private static String requireText(JsonNode node, String field, String what) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new GraphSerializationException(String.format("%s缺少字符串字段 '%s': %s", what, field, node));
        }
        return value.asText();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private JsonNode read(String json) {
        Objects.requireNonNull(json, "JSON 不能为空");
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new GraphSerializationException("无法解析 JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String write(JsonNode tree) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new GraphSerializationException("无法序列化为 JSON: " + e.getOriginalMessage(), e);
        }
    }
}
