package xyz.vvrf.flowgraph.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.flowgraph.assembly.FlowScript;

import java.util.*;

/**
 * FlowRegistry 的简单内存实现。
 * 线程安全，保持注册顺序。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleFlowRegistry implements FlowRegistry {

    private final Map<String, FlowScript> scripts = Collections.synchronizedMap(new LinkedHashMap<>());
    private volatile String mainFlowName;

    @Override
    public void register(String name, FlowScript script) {
        Objects.requireNonNull(name, "流程名称不能为空");
        Objects.requireNonNull(script, "流程脚本不能为空");
        if (scripts.putIfAbsent(name, script) != null) {
            throw new IllegalArgumentException(String.format("流程 '%s' 在注册表中已存在。", name));
        }
        log.info("已注册流程 '{}' (实现: {})", name, script.getClass().getName());
    }

    /**
     * 注册一个流程并将其标记为主流程。
     */
    public void registerMain(String name, FlowScript script) {
        register(name, script);
        if (mainFlowName != null && !mainFlowName.equals(name)) {
            log.warn("主流程由 '{}' 替换为 '{}'", mainFlowName, name);
        }
        mainFlowName = name;
    }

    @Override
    public Optional<FlowScript> getScript(String name) {
        return Optional.ofNullable(scripts.get(name));
    }

    @Override
    public Set<String> getFlowNames() {
        synchronized (scripts) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(scripts.keySet()));
        }
    }

    @Override
    public Optional<String> getMainFlowName() {
        return Optional.ofNullable(mainFlowName);
    }
}
