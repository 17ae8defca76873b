package xyz.vvrf.flowgraph.serialization;

import xyz.vvrf.flowgraph.core.FlowGraphException;

/**
 * 交换格式无法解析或内容不完整。
 */
public class GraphSerializationException extends FlowGraphException {

    public GraphSerializationException(String message) {
        super(message);
    }

    public GraphSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
