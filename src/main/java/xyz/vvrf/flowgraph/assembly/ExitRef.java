package xyz.vvrf.flowgraph.assembly;

import xyz.vvrf.flowgraph.core.StepDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 前沿条目中的出口引用：要么是一个具体节点，要么是一个尚未落地的可复用步骤调用。
 * 两种情况在连接点由 {@link FrontierTracker} 显式区分处理。
 */
public abstract class ExitRef {

    public enum Kind {
        CONCRETE_NODE,
        PENDING_REUSABLE
    }

    private ExitRef() {
    }

    public abstract Kind getKind();

    public static ConcreteNode concrete(String nodeId) {
        return new ConcreteNode(nodeId);
    }

    public static PendingReusable pending(StepDefinition definition, List<FrontierEntry> incoming) {
        return new PendingReusable(definition, incoming);
    }

    /**
     * 已经存在于图中的节点。
     */
    public static final class ConcreteNode extends ExitRef {
        private final String nodeId;

        private ConcreteNode(String nodeId) {
            this.nodeId = Objects.requireNonNull(nodeId, "节点 ID 不能为空");
        }

        @Override
        public Kind getKind() {
            return Kind.CONCRETE_NODE;
        }

        public String getNodeId() {
            return nodeId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return nodeId.equals(((ConcreteNode) o).nodeId);
        }

        @Override
        public int hashCode() {
            return nodeId.hashCode();
        }

        @Override
        public String toString() {
            return "Concrete(" + nodeId + ")";
        }
    }

    /**
     * 共享模式下的一次可复用步骤调用。
     * 具体落到哪个实例要等到知道下一个目标节点时才能决定；
     * 决定之后，调用点的入口前沿 {@link #getIncoming()} 才会连接到该实例。
     */
    public static final class PendingReusable extends ExitRef {
        private final StepDefinition definition;
        private final List<FrontierEntry> incoming;

        private PendingReusable(StepDefinition definition, List<FrontierEntry> incoming) {
            this.definition = Objects.requireNonNull(definition, "步骤定义不能为空");
            this.incoming = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(incoming, "入口前沿不能为空")));
        }

        @Override
        public Kind getKind() {
            return Kind.PENDING_REUSABLE;
        }

        public StepDefinition getDefinition() {
            return definition;
        }

        public List<FrontierEntry> getIncoming() {
            return incoming;
        }

        @Override
        public String toString() {
            return "Pending(" + definition.getId() + ", incoming=" + incoming.size() + ")";
        }
    }
}
