package xyz.vvrf.flowgraph.assembly;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 等待连接到下一个节点的悬空出口集合，保持加入顺序。
 */
public final class Frontier {

    private final List<FrontierEntry> entries;

    private Frontier(List<FrontierEntry> entries) {
        this.entries = entries;
    }

    public static Frontier empty() {
        return new Frontier(new ArrayList<>());
    }

    public static Frontier of(String nodeId, String label) {
        Frontier frontier = empty();
        frontier.add(FrontierEntry.of(nodeId, label));
        return frontier;
    }

    public static Frontier of(FrontierEntry entry) {
        Frontier frontier = empty();
        frontier.add(entry);
        return frontier;
    }

    public Frontier add(FrontierEntry entry) {
        entries.add(entry);
        return this;
    }

    /**
     * 合并另一个前沿的所有条目 (分支合并)。
     */
    public Frontier addAll(Frontier other) {
        entries.addAll(other.entries);
        return this;
    }

    public List<FrontierEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Frontier copy() {
        return new Frontier(new ArrayList<>(entries));
    }

    @Override
    public String toString() {
        return "Frontier" + entries;
    }
}
