package xyz.vvrf.bimflow.spring.boot;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 工作流引擎的配置属性，绑定 'bimflow' 前缀。
 *
 * @author ruifeng.wen
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "bimflow")
@Validated
public class WorkflowEngineProperties {

    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final StatusStore statusStore = new StatusStore();
    @Valid
    private final Monitor monitor = new Monitor();
    @Valid
    private final BuiltinHandlers builtinHandlers = new BuiltinHandlers();

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 异步节点处理器使用的调度器类型。
         */
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "bimflow-exec";
    }

    public enum SchedulerType {
        IMMEDIATE, BOUNDED_ELASTIC, SINGLE
    }

    @Getter
    @Setter
    public static class StatusStore {
        /**
         * 节点状态存储保留的最大节点数。
         */
        @Min(1)
        private long maximumSize = 10_000;

        /**
         * 状态写入后的过期时间；为空表示不过期。
         */
        private Duration expireAfterWrite;
    }

    @Getter
    @Setter
    public static class Monitor {
        /**
         * 是否注册日志监控监听器。
         */
        private boolean loggingEnabled = true;
    }

    @Getter
    @Setter
    public static class BuiltinHandlers {
        /**
         * 是否注册内置节点处理器。
         */
        private boolean enabled = true;
    }

    @Override
    public String toString() {
        return "WorkflowEngineProperties{" +
                "scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                "}, statusStore={maximumSize=" + statusStore.maximumSize +
                ", expireAfterWrite=" + statusStore.expireAfterWrite +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}, builtinHandlers={enabled=" + builtinHandlers.enabled +
                "}}";
    }
}
