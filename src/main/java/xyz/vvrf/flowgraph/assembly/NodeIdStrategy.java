package xyz.vvrf.flowgraph.assembly;

import xyz.vvrf.flowgraph.core.NodeKind;

import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * 节点 ID 的生成策略。每次组装都会通过 {@link #newGenerator()} 得到一个独立的生成器。
 */
public enum NodeIdStrategy {
    /**
     * 随机 UUID。
     */
    UUID {
        @Override
        public Function<NodeKind, String> newGenerator() {
            return kind -> java.util.UUID.randomUUID().toString();
        }
    },
    /**
     * 按类型加前缀的递增序号，例如 {@code process_3}。同一次组装内唯一，便于阅读和测试。
     */
    SEQUENTIAL {
        @Override
        public Function<NodeKind, String> newGenerator() {
            AtomicLong counter = new AtomicLong();
            return kind -> kind.name().toLowerCase(Locale.ROOT) + "_" + counter.incrementAndGet();
        }
    };

    public abstract Function<NodeKind, String> newGenerator();
}
