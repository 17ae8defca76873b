package xyz.vvrf.flowgraph.core;

/**
 * 分支体事件（else、chained else-if、结束分支）出现时没有打开的判断。
 */
public class MissingBranchContextException extends FlowGraphException {

    public MissingBranchContextException(String message) {
        super(message);
    }
}
