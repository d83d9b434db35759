package xyz.vvrf.bimflow.registry;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeHandler;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * NodeHandlerRegistry 的简单内存实现。
 * 线程安全。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SimpleNodeHandlerRegistry implements NodeHandlerRegistry {

    private final Map<String, NodeHandler> handlerMap = new ConcurrentHashMap<>();
    // 缓存处理器元数据
    private final Map<String, HandlerMetadata> metadataMap = new ConcurrentHashMap<>();

    @Override
    public void register(String kind, NodeHandler handler) {
        Objects.requireNonNull(kind, "节点类型不能为空");
        Objects.requireNonNull(handler, "节点处理器不能为空");
        if (kind.trim().isEmpty()) {
            throw new IllegalArgumentException("节点类型不能为空字符串");
        }

        // 尝试原子性地放入，如果已存在则抛异常
        if (handlerMap.putIfAbsent(kind, handler) != null) {
            throw new IllegalArgumentException(String.format("节点类型 '%s' 在注册表中已存在。", kind));
        }

        try {
            metadataMap.put(kind, extractMetadata(kind, handler));
        } catch (RuntimeException e) {
            // 如果提取元数据失败，也应该移除注册
            handlerMap.remove(kind);
            log.error("提取节点类型 '{}' (实现: {}) 的元数据时出错。", kind, handler.getClass().getName(), e);
            throw new IllegalArgumentException("提取元数据失败: " + kind, e);
        }

        log.info("已注册节点类型 '{}' (模式: {}, 实现: {})",
                kind, handler.getExecutionMode(), handler.getClass().getName());
    }

    @Override
    public Optional<NodeHandler> getHandler(String kind) {
        Objects.requireNonNull(kind, "节点类型不能为空");
        return Optional.ofNullable(handlerMap.get(kind));
    }

    @Override
    public Optional<HandlerMetadata> getMetadata(String kind) {
        Objects.requireNonNull(kind, "节点类型不能为空");
        return Optional.ofNullable(metadataMap.get(kind));
    }

    @Override
    public Set<String> getRegisteredKinds() {
        return Collections.unmodifiableSet(new TreeSet<>(handlerMap.keySet()));
    }

    private HandlerMetadata extractMetadata(String kind, NodeHandler handler) {
        final Set<String> inputPorts = Objects.requireNonNull(handler.getInputPorts(),
                "getInputPorts() 不能为节点类型 '" + kind + "' 返回 null");
        final ExecutionMode mode = Objects.requireNonNull(handler.getExecutionMode(),
                "getExecutionMode() 不能为节点类型 '" + kind + "' 返回 null");
        final String outputShape = handler.getOutputShape();
        final Set<String> finalInputPorts = Collections.unmodifiableSet(new LinkedHashSet<>(inputPorts));
        final Class<?> implementation = handler.getClass();

        return new HandlerMetadata() {
            @Override public String getKind() { return kind; }
            @Override public Set<String> getInputPorts() { return finalInputPorts; }
            @Override public ExecutionMode getExecutionMode() { return mode; }
            @Override public String getOutputShape() { return outputShape; }
            @Override public Class<?> getImplementationClass() { return implementation; }

            @Override
            public String toString() {
                return String.format("Metadata[kind=%s, mode=%s, inputs=%s, output=%s]",
                        kind, mode, finalInputPorts, outputShape);
            }
        };
    }
}
