package xyz.vvrf.flowgraph.assembly;

import java.util.Objects;

/**
 * 组装选项（不可变）。通过 {@link #builder()} 创建，或使用 {@link #defaults()}。
 */
public final class AssemblyOptions {

    public static final String DEFAULT_YES_LABEL = "Yes";
    public static final String DEFAULT_NO_LABEL = "No";
    public static final String DEFAULT_END_LABEL = "End";
    public static final String DEFAULT_LOOP_ANCHOR_LABEL = "(loop)";
    public static final String DEFAULT_COUNTED_LOOP_FORMAT = "More %s in %s?";

    private static final AssemblyOptions DEFAULTS = builder().build();

    private final StepReuseMode stepReuseMode;
    private final NodeIdStrategy idStrategy;
    private final boolean printStructure;
    private final String yesLabel;
    private final String noLabel;
    private final String endLabel;
    private final String loopAnchorLabel;
    private final String countedLoopFormat;

    private AssemblyOptions(Builder builder) {
        this.stepReuseMode = builder.stepReuseMode;
        this.idStrategy = builder.idStrategy;
        this.printStructure = builder.printStructure;
        this.yesLabel = builder.yesLabel;
        this.noLabel = builder.noLabel;
        this.endLabel = builder.endLabel;
        this.loopAnchorLabel = builder.loopAnchorLabel;
        this.countedLoopFormat = builder.countedLoopFormat;
    }

    public static AssemblyOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public StepReuseMode getStepReuseMode() {
        return stepReuseMode;
    }

    public NodeIdStrategy getIdStrategy() {
        return idStrategy;
    }

    public boolean isPrintStructure() {
        return printStructure;
    }

    public String getYesLabel() {
        return yesLabel;
    }

    public String getNoLabel() {
        return noLabel;
    }

    public String getEndLabel() {
        return endLabel;
    }

    public String getLoopAnchorLabel() {
        return loopAnchorLabel;
    }

    public String getCountedLoopFormat() {
        return countedLoopFormat;
    }

    /**
     * 计数循环判断节点的标签。
     */
    public String countedLoopLabel(String item, String collection) {
        return String.format(countedLoopFormat, item, collection);
    }

    @Override
    public String toString() {
        return "AssemblyOptions{" +
                "stepReuseMode=" + stepReuseMode +
                ", idStrategy=" + idStrategy +
                ", printStructure=" + printStructure +
                ", yesLabel='" + yesLabel + '\'' +
                ", noLabel='" + noLabel + '\'' +
                ", endLabel='" + endLabel + '\'' +
                '}';
    }

    public static final class Builder {
        private StepReuseMode stepReuseMode = StepReuseMode.SHARED;
        private NodeIdStrategy idStrategy = NodeIdStrategy.UUID;
        private boolean printStructure = false;
        private String yesLabel = DEFAULT_YES_LABEL;
        private String noLabel = DEFAULT_NO_LABEL;
        private String endLabel = DEFAULT_END_LABEL;
        private String loopAnchorLabel = DEFAULT_LOOP_ANCHOR_LABEL;
        private String countedLoopFormat = DEFAULT_COUNTED_LOOP_FORMAT;

        private Builder() {
        }

        public Builder stepReuseMode(StepReuseMode stepReuseMode) {
            this.stepReuseMode = Objects.requireNonNull(stepReuseMode, "复用模式不能为空");
            return this;
        }

        public Builder idStrategy(NodeIdStrategy idStrategy) {
            this.idStrategy = Objects.requireNonNull(idStrategy, "ID 策略不能为空");
            return this;
        }

        public Builder printStructure(boolean printStructure) {
            this.printStructure = printStructure;
            return this;
        }

        public Builder yesLabel(String yesLabel) {
            this.yesLabel = Objects.requireNonNull(yesLabel, "yes 标签不能为空");
            return this;
        }

        public Builder noLabel(String noLabel) {
            this.noLabel = Objects.requireNonNull(noLabel, "no 标签不能为空");
            return this;
        }

        public Builder endLabel(String endLabel) {
            this.endLabel = Objects.requireNonNull(endLabel, "结束标签不能为空");
            return this;
        }

        public Builder loopAnchorLabel(String loopAnchorLabel) {
            this.loopAnchorLabel = Objects.requireNonNull(loopAnchorLabel, "循环锚点标签不能为空");
            return this;
        }

        public Builder countedLoopFormat(String countedLoopFormat) {
            this.countedLoopFormat = Objects.requireNonNull(countedLoopFormat, "计数循环标签格式不能为空");
            return this;
        }

        public AssemblyOptions build() {
            return new AssemblyOptions(this);
        }
    }
}
