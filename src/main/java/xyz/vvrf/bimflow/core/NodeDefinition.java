package xyz.vvrf.bimflow.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 工作流中的一个节点（不可变数据类）。
 * 包含节点 ID、节点类型 (kind) 以及由对应处理器解释的配置属性。
 * <p>
 * 编辑器通常把数字和布尔值以字符串形式保存，因此类型化的读取方法会尝试解析字符串。
 *
 * @author ruifeng.wen
 */
public final class NodeDefinition {

    private final String id;
    private final String kind;
    private final Map<String, Object> properties;

    /**
     * 创建节点定义。
     *
     * @param id         节点 ID (非空，图内唯一)
     * @param kind       节点类型，用于选择处理器 (非空)
     * @param properties 配置属性 (可为 null，将被复制为不可变 Map)
     */
    public NodeDefinition(String id, String kind, Map<String, Object> properties) {
        this.id = Objects.requireNonNull(id, "Node id cannot be null");
        this.kind = Objects.requireNonNull(kind, "Node kind cannot be null");
        this.properties = (properties == null || properties.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static NodeDefinition of(String id, String kind) {
        return new NodeDefinition(id, kind, null);
    }

    public static NodeDefinition of(String id, String kind, Map<String, Object> properties) {
        return new NodeDefinition(id, kind, properties);
    }

    public String getId() {
        return id;
    }

    public String getKind() {
        return kind;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    /**
     * 安全获取特定类型属性值。
     *
     * @return 键不存在、值为 null 或类型不匹配时为空
     */
    public <T> Optional<T> getProperty(String key, Class<T> expectedType) {
        return Optional.ofNullable(properties.get(key))
                .filter(expectedType::isInstance)
                .map(expectedType::cast);
    }

    /**
     * 读取字符串属性。值缺失或为空字符串时返回默认值。
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        String text = String.valueOf(value);
        return text.isEmpty() ? defaultValue : text;
    }

    /**
     * 读取数值属性。值缺失或无法解析时返回默认值。
     */
    public double getDouble(String key, double defaultValue) {
        Object value = properties.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String && !((String) value).trim().isEmpty()) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * 读取布尔属性。接受 Boolean 或 "true"/"false" 字符串，其他情况返回默认值。
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = properties.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            String text = ((String) value).trim();
            if ("true".equalsIgnoreCase(text)) {
                return true;
            }
            if ("false".equalsIgnoreCase(text)) {
                return false;
            }
        }
        return defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDefinition that = (NodeDefinition) o;
        return id.equals(that.id) && kind.equals(that.kind) && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, properties);
    }

    @Override
    public String toString() {
        return String.format("Node[id=%s, kind=%s, properties=%s]", id, kind, properties.keySet());
    }
}
