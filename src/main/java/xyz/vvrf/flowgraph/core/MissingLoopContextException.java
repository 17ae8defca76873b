package xyz.vvrf.flowgraph.core;

/**
 * break / continue / loopEnd 出现在任何循环之外。
 */
public class MissingLoopContextException extends FlowGraphException {

    public MissingLoopContextException(String message) {
        super(message);
    }
}
