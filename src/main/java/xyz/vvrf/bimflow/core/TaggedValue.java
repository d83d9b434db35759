package xyz.vvrf.bimflow.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 带类型标签的结果值，供需要区分负载形状的消费者使用（如 "elements" 与 "clashResults"）。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TaggedValue {

    public static final String ELEMENTS = "elements";
    public static final String CLASH_RESULTS = "clashResults";
    public static final String QUANTITY_RESULTS = "quantityResults";

    private final String type;
    private final Object value;

    private TaggedValue(String type, Object value) {
        this.type = Objects.requireNonNull(type, "Tag type cannot be null");
        this.value = value;
    }

    public static TaggedValue of(String type, Object value) {
        return new TaggedValue(type, value);
    }

    public boolean isType(String expected) {
        return type.equals(expected);
    }
}
