package xyz.vvrf.flowgraph.core;

/**
 * 引用了不存在的对象：边的端点不在图中，或子流程链接无法解析到已知的图。
 */
public class DanglingReferenceException extends FlowGraphException {

    private final String reference;

    public DanglingReferenceException(String reference, String message) {
        super(message);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
