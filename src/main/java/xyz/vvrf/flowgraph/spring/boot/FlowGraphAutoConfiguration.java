package xyz.vvrf.flowgraph.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;
import xyz.vvrf.flowgraph.assembly.AssemblyOptions;
import xyz.vvrf.flowgraph.assembly.FlowAssembler;
import xyz.vvrf.flowgraph.link.MultiGraphLinker;
import xyz.vvrf.flowgraph.monitor.AssemblyListener;
import xyz.vvrf.flowgraph.monitor.LoggingAssemblyListener;
import xyz.vvrf.flowgraph.monitor.MicrometerAssemblyListener;
import xyz.vvrf.flowgraph.registry.FlowRegistry;
import xyz.vvrf.flowgraph.registry.SpringScanningFlowRegistry;
import xyz.vvrf.flowgraph.serialization.GraphJsonSerializer;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 流程图组装引擎的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link FlowGraphProperties}，转换为 {@link AssemblyOptions}。
 * 2. 提供 {@link FlowAssembler}、{@link FlowRegistry}、{@link MultiGraphLinker} 与 {@link GraphJsonSerializer}。
 * 3. 提供默认的监听器，并收集所有的 {@link AssemblyListener} Bean 到一个列表 Bean ("flowAssemblyListeners")。
 * <p>
 * **用户职责:**
 * 1. 实现 {@link xyz.vvrf.flowgraph.assembly.FlowScript} 描述每个流程。
 * 2. 使用 {@link xyz.vvrf.flowgraph.annotation.FlowProcedure} 注解实现类，指定流程名称。
 * 3. 注入 {@link MultiGraphLinker} 构建并链接流程，或直接注入 {@link FlowAssembler} 组装单个流程。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(FlowGraphProperties.class)
@Slf4j
public class FlowGraphAutoConfiguration {

    public FlowGraphAutoConfiguration() {
        log.info("流程图组装引擎自动配置 (FlowGraphAutoConfiguration) 已加载。");
    }

    @Bean
    @ConditionalOnMissingBean(AssemblyOptions.class)
    public AssemblyOptions flowGraphAssemblyOptions(FlowGraphProperties properties) {
        log.info("正在根据配置创建 AssemblyOptions: {}", properties);
        return properties.toAssemblyOptions();
    }

    @Bean
    @ConditionalOnMissingBean(LoggingAssemblyListener.class)
    @ConditionalOnProperty(prefix = "flowgraph.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingAssemblyListener loggingAssemblyListener() {
        return new LoggingAssemblyListener();
    }

    /**
     * 收集在应用上下文中定义的所有 AssemblyListener Bean，作为名为 "flowAssemblyListeners" 的不可变列表 Bean 提供。
     */
    @Bean(name = "flowAssemblyListeners")
    @ConditionalOnMissingBean(name = "flowAssemblyListeners")
    public List<AssemblyListener> flowAssemblyListeners(ObjectProvider<AssemblyListener> listenersProvider) {
        log.info("正在收集 AssemblyListener Bean...");
        List<AssemblyListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 AssemblyListener Bean。");
        } else {
            log.info("收集到 {} 个 AssemblyListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean(FlowAssembler.class)
    public FlowAssembler flowAssembler(AssemblyOptions options, @Qualifier("flowAssemblyListeners") List<AssemblyListener> flowAssemblyListeners) {
        log.info("正在创建 FlowAssembler Bean...");
        return new FlowAssembler(options, flowAssemblyListeners);
    }

    @Bean
    @ConditionalOnMissingBean(FlowRegistry.class)
    public SpringScanningFlowRegistry flowRegistry() {
        return new SpringScanningFlowRegistry();
    }

    /**
     * 链接器持有按名称索引的图目录，因此每次注入都得到一个新的实例。
     */
    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    @ConditionalOnMissingBean(MultiGraphLinker.class)
    public MultiGraphLinker multiGraphLinker(FlowRegistry flowRegistry, FlowAssembler flowAssembler,
                                             @Qualifier("flowAssemblyListeners") List<AssemblyListener> flowAssemblyListeners) {
        return new MultiGraphLinker(flowRegistry, flowAssembler, flowAssemblyListeners);
    }

    @Bean
    @ConditionalOnMissingBean(GraphJsonSerializer.class)
    public GraphJsonSerializer graphJsonSerializer(ObjectProvider<ObjectMapper> objectMapper) {
        return new GraphJsonSerializer(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerListenerConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerAssemblyListener.class)
        public MicrometerAssemblyListener micrometerAssemblyListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，注册 MicrometerAssemblyListener。");
            return new MicrometerAssemblyListener(meterRegistry);
        }
    }
}
