package xyz.vvrf.bimflow.core;

import java.util.Objects;
import java.util.Optional;

/**
 * 单个节点执行后缓存的结果（不可变数据类）。
 * 值可能不存在，例如未知类型的节点或没有输入的观察节点，此时即为"空结果"。
 * 值可以是任意领域对象、{@link TaggedValue} 或 {@link SoftError}。
 *
 * @author ruifeng.wen
 */
public final class NodeResult {

    private static final NodeResult EMPTY = new NodeResult(null);

    private final Object value;

    private NodeResult(Object value) {
        this.value = value;
    }

    /**
     * 创建包含值的结果。值为 null 时返回空结果。
     */
    public static NodeResult of(Object value) {
        return value == null ? EMPTY : new NodeResult(value);
    }

    public static NodeResult empty() {
        return EMPTY;
    }

    public static NodeResult softError(String message) {
        return new NodeResult(SoftError.of(message));
    }

    public static NodeResult tagged(String type, Object value) {
        return new NodeResult(TaggedValue.of(type, value));
    }

    public Optional<Object> getValue() {
        return Optional.ofNullable(value);
    }

    /**
     * 按类型读取值。
     *
     * @return 值不存在或类型不匹配时为空
     */
    public <T> Optional<T> getValueAs(Class<T> type) {
        return getValue().filter(type::isInstance).map(type::cast);
    }

    /**
     * @return 值本身，可能为 null
     */
    public Object getRawValue() {
        return value;
    }

    public boolean isEmpty() {
        return value == null;
    }

    public boolean isSoftError() {
        return value instanceof SoftError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(value, ((NodeResult) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        if (value == null) {
            return "NodeResult{empty}";
        }
        return "NodeResult{value=" + value.getClass().getSimpleName() + "}";
    }
}
