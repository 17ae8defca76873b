package xyz.vvrf.flowgraph.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 流程图中的一条有向边（不可变数据类）。
 * 重复判定只看 (source, target, label) 三元组，condition 与 metadata 不参与。
 */
public final class Edge {
    private final String sourceId;
    private final String targetId;
    private final String label;
    private final String condition;
    private final Map<String, Object> metadata;

    /**
     * 创建一条边。
     *
     * @param sourceId  源节点 ID (不能为空)
     * @param targetId  目标节点 ID (不能为空)
     * @param label     显示标签 (可为 null)
     * @param condition 条件表达式 (可为 null)
     * @param metadata  元数据 (可为 null，将被复制)
     */
    public Edge(String sourceId, String targetId, String label, String condition, Map<String, Object> metadata) {
        this.sourceId = Objects.requireNonNull(sourceId, "源节点 ID 不能为空");
        this.targetId = Objects.requireNonNull(targetId, "目标节点 ID 不能为空");
        this.label = label;
        this.condition = condition;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public Edge(String sourceId, String targetId, String label) {
        this(sourceId, targetId, label, null, null);
    }

    public Edge(String sourceId, String targetId) {
        this(sourceId, targetId, null, null, null);
    }

    public String getSourceId() {
        return sourceId;
    }

    public String getTargetId() {
        return targetId;
    }

    public String getLabel() {
        return label;
    }

    public String getCondition() {
        return condition;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * 判断与另一条边是否构成重复（相同的源、目标与标签）。
     */
    public boolean sameConnection(Edge other) {
        return other != null
                && sourceId.equals(other.sourceId)
                && targetId.equals(other.targetId)
                && Objects.equals(label, other.label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Edge that = (Edge) o;
        return sourceId.equals(that.sourceId) &&
                targetId.equals(that.targetId) &&
                Objects.equals(label, that.label) &&
                Objects.equals(condition, that.condition) &&
                metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, targetId, label, condition, metadata);
    }

    @Override
    public String toString() {
        return String.format("Edge[%s -> %s, label=%s]", sourceId, targetId, label == null ? "-" : label);
    }
}
