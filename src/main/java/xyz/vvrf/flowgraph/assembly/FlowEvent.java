package xyz.vvrf.flowgraph.assembly;

import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.core.LoopKind;
import xyz.vvrf.flowgraph.core.StepDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 控制流事件的数据形式，供不以代码方式产生事件的上游 (例如外部的分析器) 使用。
 * 通过静态工厂方法创建；未用到的字段为 null。
 */
public final class FlowEvent {

    private final FlowEventType type;
    private final String label;
    private final String yesLabel;
    private final String noLabel;
    private final boolean negated;
    private final LoopKind loopKind;
    private final Map<String, Object> metadata;
    private final StepDefinition definition;
    private final Graph target;

    private FlowEvent(FlowEventType type, String label, String yesLabel, String noLabel, boolean negated,
                      LoopKind loopKind, Map<String, Object> metadata, StepDefinition definition, Graph target) {
        this.type = Objects.requireNonNull(type, "事件类型不能为空");
        this.label = label;
        this.yesLabel = yesLabel;
        this.noLabel = noLabel;
        this.negated = negated;
        this.loopKind = loopKind;
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Collections.emptyMap();
        this.definition = definition;
        this.target = target;
    }

    private static FlowEvent simple(FlowEventType type) {
        return new FlowEvent(type, null, null, null, false, null, null, null, null);
    }

    public static FlowEvent step(String label) {
        return step(label, null);
    }

    public static FlowEvent step(String label, Map<String, Object> metadata) {
        return new FlowEvent(FlowEventType.STEP, Objects.requireNonNull(label, "步骤标签不能为空"),
                null, null, false, null, metadata, null, null);
    }

    public static FlowEvent step(StepDefinition definition) {
        return new FlowEvent(FlowEventType.REUSABLE_STEP, null, null, null, false, null, null,
                Objects.requireNonNull(definition, "步骤定义不能为空"), null);
    }

    /**
     * yesLabel / noLabel 为 null 时使用组装选项中的默认标签。
     */
    public static FlowEvent decision(String label, String yesLabel, String noLabel, boolean negated) {
        return new FlowEvent(FlowEventType.DECISION, label, yesLabel, noLabel, negated, null, null, null, null);
    }

    public static FlowEvent decision(String label) {
        return decision(label, null, null, false);
    }

    public static FlowEvent otherwise() {
        return simple(FlowEventType.OTHERWISE);
    }

    public static FlowEvent otherwiseIf(String label, String yesLabel, String noLabel, boolean negated) {
        return new FlowEvent(FlowEventType.OTHERWISE_IF, label, yesLabel, noLabel, negated, null, null, null, null);
    }

    public static FlowEvent otherwiseIf(String label) {
        return otherwiseIf(label, null, null, false);
    }

    public static FlowEvent endDecision() {
        return simple(FlowEventType.END_DECISION);
    }

    public static FlowEvent loopStart(LoopKind kind, String label, String yesLabel, String noLabel, boolean negated) {
        return new FlowEvent(FlowEventType.LOOP_START, label, yesLabel, noLabel, negated,
                Objects.requireNonNull(kind, "循环类型不能为空"), null, null, null);
    }

    public static FlowEvent loopStart(LoopKind kind, String label) {
        return loopStart(kind, label, null, null, false);
    }

    public static FlowEvent loopEnd() {
        return simple(FlowEventType.LOOP_END);
    }

    public static FlowEvent breakLoop() {
        return simple(FlowEventType.BREAK);
    }

    public static FlowEvent continueLoop() {
        return simple(FlowEventType.CONTINUE);
    }

    /**
     * label 为 null 时使用组装选项中的结束标签。
     */
    public static FlowEvent end(String label) {
        return new FlowEvent(FlowEventType.EXPLICIT_END, label, null, null, false, null, null, null, null);
    }

    public static FlowEvent exit() {
        return simple(FlowEventType.EXIT);
    }

    public static FlowEvent subflow(String name) {
        return new FlowEvent(FlowEventType.SUBFLOW_CALL, Objects.requireNonNull(name, "子流程名称不能为空"),
                null, null, false, null, null, null, null);
    }

    public static FlowEvent subflow(Graph target) {
        Objects.requireNonNull(target, "子流程目标图不能为空");
        return new FlowEvent(FlowEventType.SUBFLOW_CALL, target.getName(), null, null, false, null, null, null, target);
    }

    public FlowEventType getType() {
        return type;
    }

    public String getLabel() {
        return label;
    }

    public String getYesLabel() {
        return yesLabel;
    }

    public String getNoLabel() {
        return noLabel;
    }

    public boolean isNegated() {
        return negated;
    }

    public LoopKind getLoopKind() {
        return loopKind;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public StepDefinition getDefinition() {
        return definition;
    }

    public Graph getTarget() {
        return target;
    }

    @Override
    public String toString() {
        return label == null ? type.name() : type + "(" + label + ")";
    }
}
