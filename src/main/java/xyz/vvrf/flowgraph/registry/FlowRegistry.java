package xyz.vvrf.flowgraph.registry;

import xyz.vvrf.flowgraph.assembly.FlowScript;

import java.util.Optional;
import java.util.Set;

/**
 * 流程注册表接口。
 * 负责管理流程名称到 {@link FlowScript} 的映射，供多图链接器按名称构建被引用的流程。
 *
 * @author ruifeng.wen
 */
public interface FlowRegistry {

    /**
     * 注册一个流程。
     *
     * @param name   流程名称 (在此注册表内唯一, 不能为空)
     * @param script 描述该流程的脚本 (不能为空)
     * @throws IllegalArgumentException 如果名称已被注册
     */
    void register(String name, FlowScript script);

    /**
     * 根据名称获取流程脚本。
     *
     * @return 脚本的 Optional，未注册时为空
     */
    Optional<FlowScript> getScript(String name);

    /**
     * 已注册的全部流程名称，按注册顺序。
     */
    Set<String> getFlowNames();

    /**
     * 被标记为主流程的名称；没有标记时为空。
     */
    Optional<String> getMainFlowName();

    default boolean contains(String name) {
        return getScript(name).isPresent();
    }
}
