package xyz.vvrf.flowgraph.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.vvrf.flowgraph.assembly.AssemblyOptions;
import xyz.vvrf.flowgraph.assembly.NodeIdStrategy;
import xyz.vvrf.flowgraph.assembly.StepReuseMode;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * 流程图组装引擎的配置属性类。
 * 绑定 'flowgraph' 前缀下的属性。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flowgraph")
@Validated
public class FlowGraphProperties {

    @Valid
    private final Assembly assembly = new Assembly();
    @Valid
    private final Labels labels = new Labels();
    @Valid
    private final Monitor monitor = new Monitor();

    @Getter
    @Setter
    public static class Assembly {
        /**
         * 可复用步骤的节点复用模式。
         */
        @NotNull
        private StepReuseMode stepReuse = StepReuseMode.SHARED;

        /**
         * 节点 ID 生成策略。图 ID 始终为 UUID。
         */
        @NotNull
        private NodeIdStrategy idStrategy = NodeIdStrategy.UUID;

        /**
         * 组装完成后是否以 INFO 级别输出图的文本结构。
         */
        private boolean printStructure = false;
    }

    @Getter
    @Setter
    public static class Labels {
        @NotBlank
        private String yes = AssemblyOptions.DEFAULT_YES_LABEL;
        @NotBlank
        private String no = AssemblyOptions.DEFAULT_NO_LABEL;
        /**
         * 自动追加的结束节点的标签。
         */
        @NotBlank
        private String end = AssemblyOptions.DEFAULT_END_LABEL;
        /**
         * 无条件循环锚点节点的标签。
         */
        @NotBlank
        private String loopAnchor = AssemblyOptions.DEFAULT_LOOP_ANCHOR_LABEL;
        /**
         * 计数循环判断节点的标签格式，依次代入元素名和集合名。
         */
        @NotBlank
        private String countedLoopFormat = AssemblyOptions.DEFAULT_COUNTED_LOOP_FORMAT;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册 LoggingAssemblyListener。
         */
        private boolean loggingEnabled = true;
    }

    /**
     * 转换为组装选项。
     */
    public AssemblyOptions toAssemblyOptions() {
        return AssemblyOptions.builder()
                .stepReuseMode(assembly.stepReuse)
                .idStrategy(assembly.idStrategy)
                .printStructure(assembly.printStructure)
                .yesLabel(labels.yes)
                .noLabel(labels.no)
                .endLabel(labels.end)
                .loopAnchorLabel(labels.loopAnchor)
                .countedLoopFormat(labels.countedLoopFormat)
                .build();
    }

    @Override
    public String toString() {
        return "FlowGraphProperties{" +
                "assembly={stepReuse=" + assembly.stepReuse +
                ", idStrategy=" + assembly.idStrategy +
                ", printStructure=" + assembly.printStructure +
                "}, labels={yes='" + labels.yes + '\'' +
                ", no='" + labels.no + '\'' +
                ", end='" + labels.end + '\'' +
                ", loopAnchor='" + labels.loopAnchor + '\'' +
                ", countedLoopFormat='" + labels.countedLoopFormat + '\'' +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
