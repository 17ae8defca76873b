package xyz.vvrf.flowgraph.core;

import java.util.*;

/**
 * 可复用步骤的定义（不可变数据类）。
 * 同一个定义可以在一个过程中被多处调用；共享模式下这些调用会尽量合并到同一个图节点上。
 * 定义的身份由 {@link #getId()} 决定。
 */
public final class StepDefinition {
    private final String id;
    private final String label;
    private final Map<String, Object> metadata;

    public StepDefinition(String id, String label, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "步骤定义 ID 不能为空");
        this.label = Objects.requireNonNull(label, "步骤标签不能为空");
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    /**
     * 以标签作为 ID 创建定义。
     */
    public static StepDefinition of(String label) {
        return new StepDefinition(label, label, null);
    }

    public static StepDefinition of(String label, String description) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (description != null) {
            metadata.put(Node.METADATA_DESCRIPTION, description);
        }
        return new StepDefinition(label, label, metadata);
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((StepDefinition) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("StepDef[id=%s, label='%s']", id, label);
    }
}
