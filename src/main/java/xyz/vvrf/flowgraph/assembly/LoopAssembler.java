package xyz.vvrf.flowgraph.assembly;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.LoopKind;
import xyz.vvrf.flowgraph.core.MissingLoopContextException;
import xyz.vvrf.flowgraph.core.UnclosedConstructException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * 循环组装：循环上下文栈、回边、break / continue。
 * <p>
 * 循环体结束时，剩余前沿中的每个出口都以原有标签回连到循环头。
 * 有条件循环的出口前沿为 {@code [(循环头, 退出标签)]} 加上累计的 break 出口；
 * 无条件循环只能通过 break 离开。
 */
@Slf4j
public class LoopAssembler {

    private final FrontierTracker tracker;
    private final Deque<LoopContext> stack = new ArrayDeque<>();

    public LoopAssembler(FrontierTracker tracker) {
        this.tracker = Objects.requireNonNull(tracker, "前沿连接器不能为空");
    }

    /**
     * 打开循环：当前前沿接入循环头，返回循环体的起始前沿。
     *
     * @param continueLabel 进入循环体的边标签，无条件循环为 null
     * @param exitLabel     离开循环的边标签，无条件循环忽略
     * @param branchDepth   打开循环时分支栈的深度
     */
    public Frontier open(LoopKind kind, String headId, String continueLabel, String exitLabel,
                         Frontier current, int branchDepth) {
        tracker.connect(current, headId);
        stack.push(new LoopContext(headId, kind, exitLabel, branchDepth));
        return Frontier.of(headId, kind == LoopKind.UNCONDITIONAL ? null : continueLabel);
    }

    /**
     * 关闭最内层循环：生成回边，返回循环之后的前沿。
     *
     * @throws UnclosedConstructException 循环内打开的判断尚未关闭
     */
    public Frontier close(Frontier current, int branchDepth) {
        LoopContext context = innermost("loopEnd");
        if (branchDepth > context.branchDepth) {
            throw new UnclosedConstructException(String.format(
                    "循环 '%s' 结束时仍有 %d 个判断没有关闭。", context.headId, branchDepth - context.branchDepth));
        }
        stack.pop();
        tracker.connect(current, context.headId);
        Frontier exits = Frontier.empty();
        if (context.kind != LoopKind.UNCONDITIONAL) {
            exits.add(FrontierEntry.of(context.headId, context.exitLabel));
        }
        exits.addAll(context.breaks);
        log.debug("关闭循环 {} ({})，出口 {} 个", context.headId, context.kind, exits.size());
        return exits;
    }

    /**
     * 当前前沿回连到循环头，之后没有任何出口。
     */
    public Frontier continueLoop(Frontier current) {
        LoopContext context = innermost("continue");
        tracker.connect(current, context.headId);
        return Frontier.empty();
    }

    /**
     * 当前前沿并入最内层循环的 break 出口，之后没有任何出口。
     */
    public Frontier breakLoop(Frontier current) {
        LoopContext context = innermost("break");
        context.breaks.addAll(current);
        return Frontier.empty();
    }

    /**
     * 最内层循环打开时的分支深度；没有循环时为 0。
     */
    public int branchFloor() {
        return stack.isEmpty() ? 0 : stack.peek().branchDepth;
    }

    public int depth() {
        return stack.size();
    }

    private LoopContext innermost(String operation) {
        if (stack.isEmpty()) {
            throw new MissingLoopContextException(String.format("%s 必须位于一个循环之内。", operation));
        }
        return stack.peek();
    }

    private static final class LoopContext {
        private final String headId;
        private final LoopKind kind;
        private final String exitLabel;
        private final int branchDepth;
        private final Frontier breaks = Frontier.empty();

        private LoopContext(String headId, LoopKind kind, String exitLabel, int branchDepth) {
            this.headId = headId;
            this.kind = kind;
            this.exitLabel = exitLabel;
            this.branchDepth = branchDepth;
        }
    }
}
