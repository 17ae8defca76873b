package xyz.vvrf.flowgraph.assembly;

/**
 * 控制流事件的类型。
 */
public enum FlowEventType {
    STEP,
    REUSABLE_STEP,
    DECISION,
    OTHERWISE,
    OTHERWISE_IF,
    END_DECISION,
    LOOP_START,
    LOOP_END,
    BREAK,
    CONTINUE,
    EXPLICIT_END,
    EXIT,
    SUBFLOW_CALL
}
