package xyz.vvrf.flowgraph.annotation;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 标记一个 {@link xyz.vvrf.flowgraph.assembly.FlowScript} 实现为可被发现的流程过程。
 * 使用此注解的 Bean 会被 {@link xyz.vvrf.flowgraph.registry.SpringScanningFlowRegistry} 自动注册。
 * <p>
 * 包含 {@link Component} 以便 Spring 在组件扫描期间自动检测这些类。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface FlowProcedure {

    /**
     * 流程名称，{@link #name()} 的别名。
     */
    @AliasFor("name")
    String value() default "";

    /**
     * 流程名称，即组装出的图名称，也是其他流程以子流程引用它时使用的名称。
     * 未提供时使用 Bean 名称。
     */
    @AliasFor("value")
    String name() default "";

    /**
     * 链接全部流程时是否作为主图。
     */
    boolean main() default false;
}
