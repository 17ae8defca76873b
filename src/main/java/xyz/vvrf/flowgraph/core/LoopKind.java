package xyz.vvrf.flowgraph.core;

/**
 * 循环的三种形态。
 */
public enum LoopKind {
    /**
     * 前置条件循环：判断节点作为循环头，"继续" 分支进入循环体，"退出" 分支离开循环。
     */
    PRE_TEST,
    /**
     * 无条件循环：普通锚点节点代替判断节点，只能通过 break 离开。
     */
    UNCONDITIONAL,
    /**
     * 计数 / 迭代循环：按前置条件循环处理，判断节点为合成的 "还有元素吗?"。
     */
    COUNTED
}
