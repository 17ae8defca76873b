package xyz.vvrf.flowgraph.assembly;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.*;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 一次组装的上下文：按顺序接收描述一个过程的控制流事件，逐步构建对应的 {@link Graph}。
 * <p>
 * 每次组装都有独立的上下文，事件的产生方显式持有并传递它，不存在全局状态。
 * 上下文不是线程安全的。
 * <p>
 * 使用示例：
 * <pre>{@code
 * ctx.step("读取订单");
 * ctx.decision("库存充足?");
 *     ctx.step("发货");
 * ctx.otherwise();
 *     ctx.step("缺货通知");
 * ctx.endDecision();
 * }</pre>
 */
@Slf4j
public class AssemblyContext {

    private final Graph graph;
    private final AssemblyOptions options;
    private final Function<NodeKind, String> idGenerator;
    private final NodeReuseResolver reuseResolver;
    private final FrontierTracker tracker;
    private final BranchAssembler branches;
    private final LoopAssembler loops;
    private Frontier current;
    private boolean finished = false;

    /**
     * 为一个新建的空图创建上下文，并添加以图名称为标签的开始节点。
     */
    public AssemblyContext(Graph graph, AssemblyOptions options) {
        this.graph = Objects.requireNonNull(graph, "图不能为空");
        this.options = Objects.requireNonNull(options, "组装选项不能为空");
        this.idGenerator = options.getIdStrategy().newGenerator();
        this.reuseResolver = new NodeReuseResolver(options.getStepReuseMode(), graph, idGenerator);
        this.tracker = new FrontierTracker(graph, reuseResolver);
        this.branches = new BranchAssembler(tracker);
        this.loops = new LoopAssembler(tracker);

        Node start = graph.addNode(Node.start(idGenerator.apply(NodeKind.START), graph.getName()));
        this.current = Frontier.of(start.getId(), null);
    }

    // ----- 顺序步骤 -----

    /**
     * 一次性步骤，总是创建新的处理节点。
     */
    public AssemblyContext step(String label) {
        return step(label, Collections.emptyMap());
    }

    public AssemblyContext step(String label, Map<String, Object> metadata) {
        Objects.requireNonNull(label, "步骤标签不能为空");
        Node node = addNode(Node.process(idGenerator.apply(NodeKind.PROCESS), label, metadata));
        advanceTo(node.getId());
        return this;
    }

    /**
     * 可复用步骤，交给 {@link NodeReuseResolver} 决定落到哪个节点实例。
     */
    public AssemblyContext step(StepDefinition definition) {
        checkOpen();
        current = reuseResolver.invoke(definition, current, tracker);
        return this;
    }

    // ----- 分支 -----

    public AssemblyContext decision(String label) {
        return decision(label, options.getYesLabel(), options.getNoLabel(), false);
    }

    /**
     * 打开一个判断。
     *
     * @param negated 条件是否被取反；取反时 then 分支使用 noLabel，else 分支使用 yesLabel
     */
    public AssemblyContext decision(String label, String yesLabel, String noLabel, boolean negated) {
        openDecision(label, yesLabel, noLabel, negated, false);
        return this;
    }

    public AssemblyContext otherwise() {
        checkOpen();
        current = branches.otherwise(current, loops.branchFloor());
        return this;
    }

    public AssemblyContext otherwiseIf(String label) {
        return otherwiseIf(label, options.getYesLabel(), options.getNoLabel(), false);
    }

    /**
     * 链式分支：切换到 else 部分并在其中打开一个嵌套判断，嵌套判断与父判断一起由 {@link #endDecision()} 关闭。
     */
    public AssemblyContext otherwiseIf(String label, String yesLabel, String noLabel, boolean negated) {
        otherwise();
        openDecision(label, yesLabel, noLabel, negated, true);
        return this;
    }

    public AssemblyContext endDecision() {
        checkOpen();
        current = branches.close(current, loops.branchFloor());
        return this;
    }

    // ----- 循环 -----

    public AssemblyContext loopStart(LoopKind kind, String label) {
        return loopStart(kind, label, options.getYesLabel(), options.getNoLabel(), false);
    }

    /**
     * 打开一个循环。
     * PRE_TEST 与 COUNTED 以判断节点为循环头；UNCONDITIONAL 以锚点处理节点为循环头，标签参数被忽略。
     */
    public AssemblyContext loopStart(LoopKind kind, String label, String yesLabel, String noLabel, boolean negated) {
        checkOpen();
        Objects.requireNonNull(kind, "循环类型不能为空");
        Node head;
        switch (kind) {
            case PRE_TEST:
            case COUNTED:
                head = addNode(Node.decision(idGenerator.apply(NodeKind.DECISION), label, null));
                break;
            case UNCONDITIONAL:
                head = addNode(Node.process(idGenerator.apply(NodeKind.PROCESS), options.getLoopAnchorLabel(), null));
                break;
            default:
                throw new IllegalStateException("未知的循环类型: " + kind);
        }
        String continueLabel = negated ? noLabel : yesLabel;
        String exitLabel = negated ? yesLabel : noLabel;
        current = loops.open(kind, head.getId(), continueLabel, exitLabel, current, branches.depth());
        return this;
    }

    public AssemblyContext whileLoop(String label) {
        return loopStart(LoopKind.PRE_TEST, label);
    }

    public AssemblyContext whileLoop(String label, boolean negated) {
        return loopStart(LoopKind.PRE_TEST, label, options.getYesLabel(), options.getNoLabel(), negated);
    }

    public AssemblyContext infiniteLoop() {
        return loopStart(LoopKind.UNCONDITIONAL, options.getLoopAnchorLabel());
    }

    /**
     * 计数 / 迭代循环，判断节点标签由 {@link AssemblyOptions#countedLoopLabel(String, String)} 生成。
     */
    public AssemblyContext forEach(String item, String collection) {
        return loopStart(LoopKind.COUNTED, options.countedLoopLabel(item, collection));
    }

    public AssemblyContext loopEnd() {
        checkOpen();
        current = loops.close(current, branches.depth());
        return this;
    }

    public AssemblyContext breakLoop() {
        checkOpen();
        current = loops.breakLoop(current);
        return this;
    }

    public AssemblyContext continueLoop() {
        checkOpen();
        current = loops.continueLoop(current);
        return this;
    }

    // ----- 终止 -----

    public AssemblyContext end() {
        return end(options.getEndLabel());
    }

    /**
     * 显式结束节点，之后没有任何出口。
     */
    public AssemblyContext end(String label) {
        Node node = addNode(Node.end(idGenerator.apply(NodeKind.END), label, null));
        tracker.connect(current, node.getId());
        current = Frontier.empty();
        return this;
    }

    /**
     * 不带结束节点的提前返回。
     */
    public AssemblyContext exit() {
        checkOpen();
        tracker.materialize(current);
        current = Frontier.empty();
        return this;
    }

    // ----- 子流程 -----

    /**
     * 按名称引用另一个流程，目标图稍后由 {@code MultiGraphLinker} 解析。
     */
    public AssemblyContext subflow(String name) {
        Objects.requireNonNull(name, "子流程名称不能为空");
        return addSubflow(name, null);
    }

    public AssemblyContext subflow(Graph target) {
        Objects.requireNonNull(target, "子流程目标图不能为空");
        return addSubflow(target.getName(), target.getId());
    }

    // ----- 结束组装 -----

    /**
     * 结束组装：前沿非空时追加结束节点。
     *
     * @throws UnclosedConstructException 仍有判断或循环没有关闭
     */
    public Graph finish() {
        checkOpen();
        if (branches.depth() > 0 || loops.depth() > 0) {
            throw new UnclosedConstructException(String.format(
                    "流程 '%s' 结束时仍有 %d 个判断、%d 个循环没有关闭。", graph.getName(), branches.depth(), loops.depth()));
        }
        if (!current.isEmpty()) {
            end(options.getEndLabel());
        }
        finished = true;
        return graph;
    }

    public Graph getGraph() {
        return graph;
    }

    public AssemblyOptions getOptions() {
        return options;
    }

    /**
     * 当前的悬空出口，只读副本。
     */
    public Frontier getFrontier() {
        return current.copy();
    }

    NodeReuseResolver getReuseResolver() {
        return reuseResolver;
    }

    private void openDecision(String label, String yesLabel, String noLabel, boolean negated, boolean chained) {
        Objects.requireNonNull(label, "判断标签不能为空");
        Node node = addNode(Node.decision(idGenerator.apply(NodeKind.DECISION), label, null));
        String bodyLabel = negated ? noLabel : yesLabel;
        String elseLabel = negated ? yesLabel : noLabel;
        current = branches.open(node.getId(), bodyLabel, elseLabel, current, chained);
    }

    private AssemblyContext addSubflow(String label, String targetGraphId) {
        Node node = addNode(Node.subflowLink(idGenerator.apply(NodeKind.SUBFLOW_LINK), label, targetGraphId, null));
        advanceTo(node.getId());
        return this;
    }

    private void advanceTo(String nodeId) {
        tracker.connect(current, nodeId);
        current = Frontier.of(nodeId, null);
    }

    private Node addNode(Node node) {
        checkOpen();
        return graph.addNode(node);
    }

    private void checkOpen() {
        if (finished) {
            throw new IllegalStateException(String.format("流程 '%s' 的组装已经结束。", graph.getName()));
        }
    }
}
