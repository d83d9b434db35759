package xyz.vvrf.bimflow.core;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * 以数据形式返回的非致命错误。它会像普通值一样被缓存并流向下游，
 * 由消费它的处理器自行识别和处理。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class SoftError {

    private final String error;

    private SoftError(String error) {
        this.error = Objects.requireNonNull(error, "Error message cannot be null");
    }

    public static SoftError of(String error) {
        return new SoftError(error);
    }
}
