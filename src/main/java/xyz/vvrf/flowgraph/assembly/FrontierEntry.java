package xyz.vvrf.flowgraph.assembly;

import java.util.Objects;

/**
 * 前沿中的一个悬空出口：出口引用加上待连接边的标签 (可为 null)。
 */
public final class FrontierEntry {
    private final ExitRef exit;
    private final String label;

    public FrontierEntry(ExitRef exit, String label) {
        this.exit = Objects.requireNonNull(exit, "出口引用不能为空");
        this.label = label;
    }

    public static FrontierEntry of(String nodeId, String label) {
        return new FrontierEntry(ExitRef.concrete(nodeId), label);
    }

    public ExitRef getExit() {
        return exit;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FrontierEntry that = (FrontierEntry) o;
        return exit.equals(that.exit) && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(exit, label);
    }

    @Override
    public String toString() {
        return label == null ? exit.toString() : exit + "[" + label + "]";
    }
}
