package xyz.vvrf.flowgraph.link;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.assembly.FlowAssembler;
import xyz.vvrf.flowgraph.assembly.FlowScript;
import xyz.vvrf.flowgraph.core.*;
import xyz.vvrf.flowgraph.monitor.AssemblyListener;
import xyz.vvrf.flowgraph.registry.FlowRegistry;

import java.util.*;
import java.util.function.Consumer;

/**
 * 多图链接器：把分别组装的流程图组合成一个 {@link MultiGraph}，并解析它们之间的子流程引用。
 * <p>
 * 分两个阶段进行：
 * <ol>
 *     <li>构建：从一个流程名称出发，用工作队列组装它以及它引用的所有流程，每个流程只组装一次，
 *     循环引用自然终止；</li>
 *     <li>解析：所有图都已知之后，按标签匹配图名称，为仍未绑定目标的子流程链接绑定目标图 ID。</li>
 * </ol>
 * 链接器维护一个按名称索引的图目录，可以通过 {@link #include(Graph)} 加入外部构建的图。
 * 非线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class MultiGraphLinker {

    private final FlowRegistry registry;
    private final FlowAssembler assembler;
    private final List<AssemblyListener> listeners;
    private final Map<String, Graph> catalogByName = new LinkedHashMap<>();
    private final Map<String, Graph> catalogById = new HashMap<>();

    public MultiGraphLinker(FlowRegistry registry, FlowAssembler assembler, List<AssemblyListener> listeners) {
        this.registry = Objects.requireNonNull(registry, "流程注册表不能为空");
        this.assembler = Objects.requireNonNull(assembler, "组装器不能为空");
        this.listeners = listeners != null ? new ArrayList<>(listeners) : Collections.emptyList();
    }

    public MultiGraphLinker(FlowRegistry registry, FlowAssembler assembler) {
        this(registry, assembler, Collections.emptyList());
    }

    /**
     * 把一个已经构建好的图加入目录。
     *
     * @throws DuplicateIdException 目录中已有同名的另一个图
     */
    public MultiGraphLinker include(Graph graph) {
        Objects.requireNonNull(graph, "图不能为空");
        Graph existing = catalogByName.get(graph.getName());
        if (existing != null && existing != graph) {
            throw new DuplicateIdException(graph.getName(),
                    String.format("名称为 '%s' 的图已存在 (ID: %s)。", graph.getName(), existing.getId()));
        }
        catalogByName.put(graph.getName(), graph);
        catalogById.put(graph.getId(), graph);
        return this;
    }

    /**
     * 第一阶段：组装名为 name 的流程以及它传递引用的所有流程。已在目录中的流程不会重复组装。
     *
     * @return 名为 name 的图
     * @throws DanglingReferenceException 某个被引用的名称既不在目录中也没有注册
     */
    public Graph build(String name) {
        Objects.requireNonNull(name, "流程名称不能为空");
        Deque<String> worklist = new ArrayDeque<>();
        worklist.add(name);
        while (!worklist.isEmpty()) {
            String current = worklist.poll();
            if (catalogByName.containsKey(current)) {
                continue;
            }
            FlowScript script = registry.getScript(current).orElseThrow(() -> new DanglingReferenceException(current,
                    String.format("引用的流程 '%s' 没有注册，也不在已知图中。", current)));
            Graph graph = assembler.assemble(current, script);
            include(graph);
            for (Node link : graph.getSubflowLinks()) {
                if (!link.getTargetGraphId().isPresent() && !catalogByName.containsKey(link.getLabel())) {
                    worklist.add(link.getLabel());
                }
            }
        }
        return catalogByName.get(name);
    }

    public MultiGraph collectReferenced(String rootName) {
        return collectReferenced(build(rootName));
    }

    /**
     * 计算从 root 出发沿子流程引用的传递闭包，并解析闭包内所有未绑定的链接。root 成为主图。
     *
     * @throws DanglingReferenceException 某个链接无法解析到已知的图
     */
    public MultiGraph collectReferenced(Graph root) {
        Objects.requireNonNull(root, "根图不能为空");
        include(root);

        MultiGraph multiGraph = new MultiGraph(root.getName());
        multiGraph.addGraph(root, true);
        Deque<Graph> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Graph graph = queue.poll();
            for (Node link : graph.getSubflowLinks()) {
                Graph referenced = lookup(graph, link);
                if (!multiGraph.containsGraph(referenced.getId())) {
                    multiGraph.addGraph(referenced);
                    queue.add(referenced);
                }
            }
        }
        int resolved = resolveLinks(multiGraph);
        log.info("从 '{}' 收集到 {} 个图，按名称解析了 {} 个子流程链接", root.getName(), multiGraph.getGraphs().size(), resolved);
        safeNotifyListeners(l -> l.onGraphsLinked(multiGraph, resolved));
        return multiGraph;
    }

    /**
     * 组装注册表中的全部流程，链接成一个多图。
     *
     * @param multiGraphName 多图名称
     * @param mainFlowName   主流程名称；为 null 时使用注册表标记的主流程，再否则使用第一个注册的流程
     */
    public MultiGraph linkAll(String multiGraphName, String mainFlowName) {
        Objects.requireNonNull(multiGraphName, "多图名称不能为空");
        for (String name : registry.getFlowNames()) {
            build(name);
        }
        String main = mainFlowName != null ? mainFlowName : registry.getMainFlowName().orElse(null);
        if (main != null && !catalogByName.containsKey(main)) {
            build(main);
        }

        MultiGraph multiGraph = new MultiGraph(multiGraphName);
        for (Graph graph : catalogByName.values()) {
            multiGraph.addGraph(graph, graph.getName().equals(main));
        }
        int resolved = resolveLinks(multiGraph);
        log.info("多图 '{}' 链接完成: {} 个图，主图 '{}'，按名称解析了 {} 个子流程链接",
                multiGraphName, multiGraph.getGraphs().size(),
                multiGraph.getMainGraph().map(Graph::getName).orElse("-"), resolved);
        safeNotifyListeners(l -> l.onGraphsLinked(multiGraph, resolved));
        return multiGraph;
    }

    public Optional<Graph> getGraph(String name) {
        return Optional.ofNullable(catalogByName.get(name));
    }

    /**
     * 第二阶段：按标签为未绑定的链接绑定目标图。
     */
    private int resolveLinks(MultiGraph multiGraph) {
        int resolved = 0;
        for (Graph graph : multiGraph.getGraphs().values()) {
            for (Node link : graph.getSubflowLinks()) {
                if (link.getTargetGraphId().isPresent()) {
                    continue;
                }
                Graph target = multiGraph.findGraphByName(link.getLabel()).orElseThrow(() -> new DanglingReferenceException(
                        link.getLabel(), String.format("图 '%s' 中的子流程链接 '%s' 无法解析: 没有名为 '%s' 的图。",
                        graph.getName(), link.getId(), link.getLabel())));
                link.bindTarget(target.getId());
                log.debug("图 '{}': 子流程链接 {} -> 图 '{}' ({})", graph.getName(), link.getId(), target.getName(), target.getId());
                resolved++;
            }
        }
        return resolved;
    }

    private Graph lookup(Graph owner, Node link) {
        Optional<String> targetId = link.getTargetGraphId();
        if (targetId.isPresent()) {
            Graph target = catalogById.get(targetId.get());
            if (target == null) {
                throw new DanglingReferenceException(targetId.get(), String.format(
                        "图 '%s' 中的子流程链接 '%s' 指向未知的图 ID '%s'，请先通过 include 加入该图。",
                        owner.getName(), link.getId(), targetId.get()));
            }
            return target;
        }
        Graph byName = catalogByName.get(link.getLabel());
        return byName != null ? byName : build(link.getLabel());
    }

    private void safeNotifyListeners(Consumer<AssemblyListener> notification) {
        for (AssemblyListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("组装监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
