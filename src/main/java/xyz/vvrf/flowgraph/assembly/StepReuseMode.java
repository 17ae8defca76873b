package xyz.vvrf.flowgraph.assembly;

/**
 * 可复用步骤的节点复用模式。
 */
public enum StepReuseMode {
    /**
     * 多个调用点尽量合并到同一个节点上，后继不同的调用点才会得到新的实例。
     */
    SHARED,
    /**
     * 每次调用都创建新的节点。
     */
    ALWAYS_NEW
}
