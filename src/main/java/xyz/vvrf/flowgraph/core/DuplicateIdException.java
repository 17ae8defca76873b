package xyz.vvrf.flowgraph.core;

/**
 * 节点 ID 或图 ID 在所属容器中已存在。
 * 通常说明 ID 生成器发生碰撞或组装器存在缺陷。
 */
public class DuplicateIdException extends FlowGraphException {

    private final String duplicateId;

    public DuplicateIdException(String duplicateId, String message) {
        super(message);
        this.duplicateId = duplicateId;
    }

    public String getDuplicateId() {
        return duplicateId;
    }
}
