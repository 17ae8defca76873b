package xyz.vvrf.flowgraph.assembly;

/**
 * 以代码形式描述一个过程的控制流：按顺序向上下文发送事件。
 */
@FunctionalInterface
public interface FlowScript {

    void describe(AssemblyContext context);
}
