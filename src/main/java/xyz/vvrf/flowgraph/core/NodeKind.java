package xyz.vvrf.flowgraph.core;

/**
 * 流程图节点的封闭变体集合。
 * 所有消费方都应对其做穷尽的 switch；新增变体时编译器会提示所有需要更新的位置。
 */
public enum NodeKind {
    START("StartNode"),
    PROCESS("ProcessNode"),
    DECISION("DecisionNode"),
    END("EndNode"),
    SUBFLOW_LINK("SubFlowNode");

    private final String typeName;

    NodeKind(String typeName) {
        this.typeName = typeName;
    }

    /**
     * 交换格式中使用的类型名称。
     */
    public String getTypeName() {
        return typeName;
    }

    public static NodeKind fromTypeName(String typeName) {
        for (NodeKind kind : values()) {
            if (kind.typeName.equals(typeName) || kind.name().equals(typeName)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知的节点类型: " + typeName);
    }
}
