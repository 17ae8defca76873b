package xyz.vvrf.flowgraph.assembly;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.MissingBranchContextException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * 分支组装：维护打开的判断节点栈，并在分支结束时合并两侧的前沿。
 * <p>
 * 没有 else 分支时，判断节点本身以 else 标签直接落到合并点。
 * 链式分支 ({@code otherwiseIf}) 以一个嵌套判断实现，它与父分支一起关闭。
 */
@Slf4j
public class BranchAssembler {

    private final FrontierTracker tracker;
    private final Deque<BranchContext> stack = new ArrayDeque<>();

    public BranchAssembler(FrontierTracker tracker) {
        this.tracker = Objects.requireNonNull(tracker, "前沿连接器不能为空");
    }

    /**
     * 打开一个分支：把当前前沿接入判断节点，返回 then 分支的起始前沿。
     *
     * @param chained 是否作为父分支的 else-if 打开
     */
    public Frontier open(String decisionId, String bodyLabel, String elseLabel, Frontier current, boolean chained) {
        tracker.connect(current, decisionId);
        stack.push(new BranchContext(decisionId, bodyLabel, elseLabel, chained));
        return Frontier.of(decisionId, bodyLabel);
    }

    /**
     * 切换到最内层分支的 else 部分。
     *
     * @param floor 当前最内层循环打开时的分支深度，不能越过它操作外层分支
     */
    public Frontier otherwise(Frontier current, int floor) {
        BranchContext context = innermost("otherwise", floor);
        if (context.inElse) {
            throw new MissingBranchContextException(String.format(
                    "判断节点 '%s' 已经处于 else 部分，不能再次调用 otherwise。", context.decisionId));
        }
        context.collected = current;
        context.inElse = true;
        return Frontier.of(context.decisionId, context.elseLabel);
    }

    /**
     * 关闭最内层分支 (以及因 else-if 链接上的父分支)，返回合并后的前沿。
     */
    public Frontier close(Frontier current, int floor) {
        innermost("endDecision", floor);
        Frontier merged = current;
        BranchContext context;
        do {
            context = stack.pop();
            merged = merge(context, merged);
            log.debug("关闭判断节点 {}，合并后前沿 {} 个出口", context.decisionId, merged.size());
        } while (context.chained && !stack.isEmpty());
        return merged;
    }

    public int depth() {
        return stack.size();
    }

    private Frontier merge(BranchContext context, Frontier current) {
        if (!context.inElse) {
            return current.copy().add(FrontierEntry.of(context.decisionId, context.elseLabel));
        }
        return context.collected.copy().addAll(current);
    }

    private BranchContext innermost(String operation, int floor) {
        if (stack.size() <= floor) {
            throw new MissingBranchContextException(stack.isEmpty()
                    ? String.format("%s 必须位于一个打开的判断之内。", operation)
                    : String.format("%s 不能在循环内部关闭或切换循环外打开的判断。", operation));
        }
        return stack.peek();
    }

    private static final class BranchContext {
        private final String decisionId;
        private final String bodyLabel;
        private final String elseLabel;
        private final boolean chained;
        private Frontier collected;
        private boolean inElse;

        private BranchContext(String decisionId, String bodyLabel, String elseLabel, boolean chained) {
            this.decisionId = decisionId;
            this.bodyLabel = bodyLabel;
            this.elseLabel = elseLabel;
            this.chained = chained;
        }

        @Override
        public String toString() {
            return "Branch[" + decisionId + ", body=" + bodyLabel + ", else=" + elseLabel + "]";
        }
    }
}
