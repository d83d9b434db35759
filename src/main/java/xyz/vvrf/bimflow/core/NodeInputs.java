package xyz.vvrf.bimflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 节点已解析的输入：端口名到上游结果值的映射（不可变）。
 * <p>
 * 上游结果为空时该端口仍被记为"已连接"，但没有值。
 *
 * @author ruifeng.wen
 */
public final class NodeInputs {

    private static final NodeInputs NONE = new NodeInputs(Collections.emptyMap(), Collections.emptySet());

    private final Map<String, Object> values;
    private final Set<String> connectedPorts;

    private NodeInputs(Map<String, Object> values, Set<String> connectedPorts) {
        this.values = values;
        this.connectedPorts = connectedPorts;
    }

    public static NodeInputs none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 便于测试和直接调用处理器的工厂方法。
     */
    public static NodeInputs of(Map<String, Object> values) {
        Builder builder = builder();
        values.forEach(builder::put);
        return builder.build();
    }

    /**
     * @return 端口上的值，没有值时为空
     */
    public Optional<Object> get(String port) {
        return Optional.ofNullable(values.get(port));
    }

    public <T> Optional<T> get(String port, Class<T> type) {
        return get(port).filter(type::isInstance).map(type::cast);
    }

    /**
     * @return 端口上的值，可能为 null
     */
    public Object getRaw(String port) {
        return values.get(port);
    }

    public boolean has(String port) {
        return values.get(port) != null;
    }

    public boolean isConnected(String port) {
        return connectedPorts.contains(port);
    }

    public Set<String> getConnectedPorts() {
        return connectedPorts;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "NodeInputs{ports=" + connectedPorts + ", withValue=" + values.keySet() + "}";
    }

    /**
     * 输入构建器。同一端口多次写入时后写入者覆盖先写入者。
     */
    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final Set<String> connectedPorts = new LinkedHashSet<>();

        private Builder() {
        }

        /**
         * 写入端口值。
         *
         * @return 如果该端口此前已被写入，返回 true
         */
        public boolean put(String port, Object value) {
            Objects.requireNonNull(port, "Port cannot be null");
            boolean overwritten = !connectedPorts.add(port);
            if (value == null) {
                values.remove(port);
            } else {
                values.put(port, value);
            }
            return overwritten;
        }

        public NodeInputs build() {
            if (connectedPorts.isEmpty()) {
                return NONE;
            }
            return new NodeInputs(Collections.unmodifiableMap(new LinkedHashMap<>(values)),
                    Collections.unmodifiableSet(new LinkedHashSet<>(connectedPorts)));
        }
    }
}
