package xyz.vvrf.flowgraph.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.flowgraph.annotation.FlowProcedure;
import xyz.vvrf.flowgraph.assembly.FlowScript;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一个 {@link FlowRegistry} 实现，它会自动发现并注册使用 {@link FlowProcedure} 注解的 Spring Bean。
 * 在初始化后扫描 ApplicationContext。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningFlowRegistry implements FlowRegistry, ApplicationContextAware, InitializingBean {

    private ApplicationContext applicationContext;
    // 内部使用 SimpleFlowRegistry 来存储注册信息
    private final SimpleFlowRegistry delegateRegistry = new SimpleFlowRegistry();

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() throws Exception {
        if (applicationContext == null) {
            throw new BeanCreationException("在 SpringScanningFlowRegistry 中 ApplicationContext 未设置");
        }
        log.info("开始扫描 @FlowProcedure Bean...");
        scanAndRegisterFlows();
    }

    private void scanAndRegisterFlows() {
        Map<String, Object> beansWithAnnotation = applicationContext.getBeansWithAnnotation(FlowProcedure.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beansWithAnnotation.entrySet()) {
            String beanName = entry.getKey();
            Object beanInstance = entry.getValue();
            FlowProcedure annotation = applicationContext.findAnnotationOnBean(beanName, FlowProcedure.class);

            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @FlowProcedure 注解，尽管 getBeansWithAnnotation 返回了它。", beanName);
                continue;
            }
            if (!(beanInstance instanceof FlowScript)) {
                log.error("Bean '{}' 使用了 @FlowProcedure 注解，但未实现 FlowScript 接口。跳过注册。", beanName);
                continue;
            }

            String flowName = determineFlowName(annotation, beanName);
            try {
                if (annotation.main()) {
                    delegateRegistry.registerMain(flowName, (FlowScript) beanInstance);
                } else {
                    delegateRegistry.register(flowName, (FlowScript) beanInstance);
                }
                registeredCount++;
            } catch (IllegalArgumentException e) {
                // 记录注册错误（例如重复名称），但继续扫描
                log.error("注册流程 Bean '{}' (名称: '{}') 失败: {}", beanName, flowName, e.getMessage());
            }
        }
        log.info("@FlowProcedure 扫描完成。共注册了 {} 个流程。", registeredCount);
    }

    private String determineFlowName(FlowProcedure annotation, String beanName) {
        String name = annotation.name();
        if (name.isEmpty()) {
            name = annotation.value();
        }
        if (name.isEmpty()) {
            log.warn("在 Bean '{}' 的 @FlowProcedure 注解中未提供 'name' 或 'value'。将使用 Bean 名称作为流程名称。", beanName);
            return beanName;
        }
        return name;
    }

    @Override
    public void register(String name, FlowScript script) {
        log.warn("尝试在 SpringScanningFlowRegistry 上手动注册流程 '{}'。推荐使用自动扫描。", name);
        delegateRegistry.register(name, script);
    }

    @Override
    public Optional<FlowScript> getScript(String name) {
        return delegateRegistry.getScript(name);
    }

    @Override
    public Set<String> getFlowNames() {
        return delegateRegistry.getFlowNames();
    }

    @Override
    public Optional<String> getMainFlowName() {
        return delegateRegistry.getMainFlowName();
    }
}
