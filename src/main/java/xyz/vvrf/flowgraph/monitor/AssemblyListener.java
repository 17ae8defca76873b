package xyz.vvrf.flowgraph.monitor;

import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.core.MultiGraph;

import java.time.Duration;

/**
 * 用于监控流程图组装与链接事件的监听器接口。
 * 监听器抛出的异常会被记录，但不会中断组装。
 *
 * @author ruifeng.wen
 */
public interface AssemblyListener {

    /**
     * 开始组装一个流程时调用。
     *
     * @param flowName 流程名称 (即图名称)
     */
    void onAssemblyStart(String flowName);

    /**
     * 流程组装成功完成时调用。
     *
     * @param flowName 流程名称
     * @param graph    已冻结的结果图
     * @param duration 组装耗时
     */
    void onAssemblyComplete(String flowName, Graph graph, Duration duration);

    /**
     * 流程组装失败时调用，随后异常会继续抛给调用方。
     *
     * @param flowName 流程名称
     * @param error    导致失败的错误
     * @param duration 失败前的耗时
     */
    void onAssemblyFailure(String flowName, Throwable error, Duration duration);

    /**
     * 多图链接完成时调用。
     *
     * @param multiGraph    链接结果
     * @param resolvedLinks 本次按名称解析的子流程链接数量
     */
    void onGraphsLinked(MultiGraph multiGraph, int resolvedLinks);
}
