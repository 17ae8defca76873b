package xyz.vvrf.flowgraph.core;

import java.util.*;

/**
 * 流程图中的一个节点（数据类）。
 * id、kind、标签与元数据创建后不可变。
 * 只有 {@link NodeKind#SUBFLOW_LINK} 节点携带目标图 ID，并且只能绑定一次。
 */
public final class Node {

    public static final String METADATA_DESCRIPTION = "description";

    private final String id;
    private final NodeKind kind;
    private final String label;
    private final Map<String, Object> metadata;
    private String targetGraphId; // 仅 SUBFLOW_LINK 使用

    private Node(String id, NodeKind kind, String label, Map<String, Object> metadata, String targetGraphId) {
        this.id = Objects.requireNonNull(id, "节点 ID 不能为空");
        this.kind = Objects.requireNonNull(kind, "节点类型不能为空");
        this.label = label != null ? label : "";
        this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        this.targetGraphId = targetGraphId;
    }

    public static Node of(String id, NodeKind kind, String label, Map<String, Object> metadata) {
        if (kind == NodeKind.SUBFLOW_LINK) {
            return subflowLink(id, label, null, metadata);
        }
        return new Node(id, kind, label, metadata, null);
    }

    public static Node start(String id, String label) {
        return new Node(id, NodeKind.START, label, null, null);
    }

    public static Node process(String id, String label, Map<String, Object> metadata) {
        return new Node(id, NodeKind.PROCESS, label, metadata, null);
    }

    public static Node decision(String id, String label, Map<String, Object> metadata) {
        return new Node(id, NodeKind.DECISION, label, metadata, null);
    }

    public static Node end(String id, String label, Map<String, Object> metadata) {
        return new Node(id, NodeKind.END, label, metadata, null);
    }

    /**
     * 创建子流程链接节点。
     *
     * @param targetGraphId 目标图 ID，前向引用或循环引用时可以为 null，稍后由链接器绑定。
     */
    public static Node subflowLink(String id, String label, String targetGraphId, Map<String, Object> metadata) {
        return new Node(id, NodeKind.SUBFLOW_LINK, label, metadata, targetGraphId);
    }

    public String getId() {
        return id;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 返回元数据的只读视图。
     */
    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Optional<String> getDescription() {
        Object description = metadata.get(METADATA_DESCRIPTION);
        return description instanceof String ? Optional.of((String) description) : Optional.empty();
    }

    public Optional<String> getTargetGraphId() {
        return Optional.ofNullable(targetGraphId);
    }

    public boolean isSubflowLink() {
        return kind == NodeKind.SUBFLOW_LINK;
    }

    /**
     * 绑定子流程链接的目标图。已绑定到同一个图时为空操作。
     *
     * @throws IllegalStateException 如果节点不是 SUBFLOW_LINK，或已绑定到其他图
     */
    public void bindTarget(String graphId) {
        Objects.requireNonNull(graphId, "目标图 ID 不能为空");
        if (kind != NodeKind.SUBFLOW_LINK) {
            throw new IllegalStateException(String.format("节点 '%s' (%s) 不是子流程链接，无法绑定目标图。", id, kind));
        }
        if (targetGraphId != null && !targetGraphId.equals(graphId)) {
            throw new IllegalStateException(String.format("子流程链接 '%s' 已绑定到图 '%s'，不能改绑到 '%s'。", id, targetGraphId, graphId));
        }
        this.targetGraphId = graphId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node that = (Node) o;
        return id.equals(that.id) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        if (kind == NodeKind.SUBFLOW_LINK) {
            return String.format("Node[%s id=%s, label='%s', target=%s]", kind, id, label, targetGraphId);
        }
        return String.format("Node[%s id=%s, label='%s']", kind, id, label);
    }
}
