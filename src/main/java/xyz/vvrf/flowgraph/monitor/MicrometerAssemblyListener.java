package xyz.vvrf.flowgraph.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.core.Graph;
import xyz.vvrf.flowgraph.core.MultiGraph;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Slf4j
public class MicrometerAssemblyListener implements AssemblyListener {

    private final MeterRegistry meterRegistry;

    // 指标名称
    public static final String METRIC_ASSEMBLY_TIME = "flowgraph.assembly.time";
    public static final String METRIC_ASSEMBLY_TOTAL = "flowgraph.assembly.total";
    public static final String METRIC_LINK_RESOLVED_TOTAL = "flowgraph.link.resolved.total";

    // 标签键
    private static final String TAG_FLOW_NAME = "flow.name";
    private static final String TAG_STATUS = "status";
    private static final String TAG_ERROR = "error";

    // 状态标签值
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILURE = "FAILURE";

    public MicrometerAssemblyListener(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onAssemblyStart(String flowName) {
        // 在结束时统一记录
    }

    @Override
    public void onAssemblyComplete(String flowName, Graph graph, Duration duration) {
        Tags tags = Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_STATUS, STATUS_SUCCESS)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onAssemblyFailure(String flowName, Throwable error, Duration duration) {
        String errorTagValue = error != null ? error.getClass().getSimpleName() : "Unknown";
        Tags tags = Tags.of(
                Tag.of(TAG_FLOW_NAME, flowName),
                Tag.of(TAG_STATUS, STATUS_FAILURE),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onGraphsLinked(MultiGraph multiGraph, int resolvedLinks) {
        try {
            Counter.builder(METRIC_LINK_RESOLVED_TOTAL)
                    .tag("multigraph.name", multiGraph.getName())
                    .description("按名称解析的子流程链接总数")
                    .register(meterRegistry)
                    .increment(resolvedLinks);
        } catch (Exception e) {
            log.error("增加链接计数器指标失败: {}", e.getMessage(), e);
        }
    }

    private void recordTimer(Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(METRIC_ASSEMBLY_TIME)
                    .tags(tags)
                    .description("流程图组装耗时")
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标失败: {}", e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_ASSEMBLY_TOTAL)
                    .tags(tags)
                    .description("按状态统计的流程图组装总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
