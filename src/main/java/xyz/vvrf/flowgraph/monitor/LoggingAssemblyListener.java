package xyz.vvrf.flowgraph.monitor;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.core.MultiGraph;

import java.time.Duration;

@Slf4j
public class LoggingAssemblyListener implements AssemblyListener {

    @Override
    public void onAssemblyStart(String flowName) {
        log.info("[MONITOR] 流程:[{}] 开始组装。", flowName);
    }

    @Override
    public void onAssemblyComplete(String flowName, Graph graph, Duration duration) {
        log.info("[MONITOR] 流程:[{}] 组装完成。 耗时:[{}ms], 节点:[{}], 边:[{}]",
                flowName, duration.toMillis(), graph.getNodes().size(), graph.getEdges().size());
    }

    @Override
    public void onAssemblyFailure(String flowName, Throwable error, Duration duration) {
        log.error("[MONITOR] 流程:[{}] 组装失败。 耗时:[{}ms], 错误:[{}]",
                flowName, duration.toMillis(), error.getMessage(), error);
    }

    @Override
    public void onGraphsLinked(MultiGraph multiGraph, int resolvedLinks) {
        log.info("[MONITOR] 多图:[{}] 链接完成。 图数量:[{}], 主图:[{}], 按名称解析的链接:[{}]",
                multiGraph.getName(), multiGraph.getGraphs().size(), multiGraph.getMainGraphId(), resolvedLinks);
    }
}
