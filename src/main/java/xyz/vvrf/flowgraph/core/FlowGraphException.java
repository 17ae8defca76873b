package xyz.vvrf.flowgraph.core;

/**
 * 流程图组装过程中所有错误的基类。
 * 这些错误都表示输入格式错误，不可恢复，也不会被重试。
 */
public class FlowGraphException extends RuntimeException {

    public FlowGraphException(String message) {
        super(message);
    }

    public FlowGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
