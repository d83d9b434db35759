package xyz.vvrf.bimflow.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.bimflow.annotation.WorkflowNodeKind;
import xyz.vvrf.bimflow.builder.WorkflowGraphBuilder;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeHandler;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.execution.NodeDispatcher;
import xyz.vvrf.bimflow.execution.WorkflowExecutorFactory;
import xyz.vvrf.bimflow.execution.WorkflowRunResult;
import xyz.vvrf.bimflow.handler.BuiltinNodeHandlers;
import xyz.vvrf.bimflow.handler.NodeKinds;
import xyz.vvrf.bimflow.monitor.LoggingWorkflowMonitorListener;
import xyz.vvrf.bimflow.monitor.MicrometerWorkflowMonitorListener;
import xyz.vvrf.bimflow.registry.NodeHandlerRegistry;
import xyz.vvrf.bimflow.sink.NodeStatusStore;

import java.time.Duration;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowEngineAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WorkflowEngineAutoConfiguration.class));

    @WorkflowNodeKind("stampNode")
    static class StampHandler implements NodeHandler {
        @Override
        public ExecutionMode getExecutionMode() {
            return ExecutionMode.SYNC;
        }

        @Override
        public Mono<NodeResult> execute(NodeInvocation invocation) {
            return Mono.just(NodeResult.of("stamped:" + invocation.getNodeId()));
        }
    }

    @Test
    void shouldCreateDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(NodeHandlerRegistry.class);
            assertThat(context).hasSingleBean(NodeDispatcher.class);
            assertThat(context).hasSingleBean(NodeStatusStore.class);
            assertThat(context).hasSingleBean(WorkflowExecutorFactory.class);
            assertThat(context).hasSingleBean(BuiltinNodeHandlers.class);
            assertThat(context).hasSingleBean(LoggingWorkflowMonitorListener.class);
            assertThat(context).doesNotHaveBean(MicrometerWorkflowMonitorListener.class);
            assertThat(context).hasBean(WorkflowEngineAutoConfiguration.SCHEDULER_BEAN_NAME);

            NodeHandlerRegistry registry = context.getBean(NodeHandlerRegistry.class);
            assertThat(registry.getRegisteredKinds()).hasSize(14).contains(NodeKinds.IFC, NodeKinds.WATCH);
        });
    }

    @Test
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "bimflow.scheduler.type=immediate",
                        "bimflow.status-store.maximum-size=50",
                        "bimflow.status-store.expire-after-write=10m")
                .run(context -> {
                    WorkflowEngineProperties properties = context.getBean(WorkflowEngineProperties.class);
                    assertThat(properties.getScheduler().getType())
                            .isEqualTo(WorkflowEngineProperties.SchedulerType.IMMEDIATE);
                    assertThat(properties.getStatusStore().getMaximumSize()).isEqualTo(50);
                    assertThat(properties.getStatusStore().getExpireAfterWrite()).isEqualTo(Duration.ofMinutes(10));
                    assertThat(context.getBean(WorkflowEngineAutoConfiguration.SCHEDULER_BEAN_NAME, Scheduler.class))
                            .isSameAs(Schedulers.immediate());
                });
    }

    @Test
    void shouldFailOnInvalidStatusStoreSize() {
        contextRunner
                .withPropertyValues("bimflow.status-store.maximum-size=0")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldSkipBuiltinsWhenDisabled() {
        contextRunner
                .withPropertyValues("bimflow.builtin-handlers.enabled=false")
                .withBean(StampHandler.class)
                .run(context -> {
                    NodeHandlerRegistry registry = context.getBean(NodeHandlerRegistry.class);
                    assertThat(registry.getRegisteredKinds()).containsExactly("stampNode");
                });
    }

    @Test
    void shouldDisableLoggingListener() {
        contextRunner
                .withPropertyValues("bimflow.monitor.logging-enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(LoggingWorkflowMonitorListener.class));
    }

    @Test
    void shouldAddMicrometerListenerWhenMeterRegistryPresent() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> assertThat(context).hasSingleBean(MicrometerWorkflowMonitorListener.class));
    }

    @Test
    void shouldRunGraphWithUserHandler() {
        contextRunner
                .withBean(StampHandler.class)
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    WorkflowExecutorFactory factory = context.getBean(WorkflowExecutorFactory.class);
                    WorkflowRunResult result = factory.create(new WorkflowGraphBuilder("stamp")
                                    .addNode("p", NodeKinds.PARAMETER, Collections.singletonMap("value", "x"))
                                    .addNode("s", "stampNode")
                                    .addEdge("p", "s")
                                    .build())
                            .execute()
                            .block(Duration.ofSeconds(5));

                    assertThat(result).isNotNull();
                    assertThat(result.isCompleted()).isTrue();
                    assertThat(result.getValue("s")).contains("stamped:s");
                    assertThat(context.getBean(NodeStatusStore.class).snapshot()).isEmpty();

                    MeterRegistry meterRegistry = context.getBean(MeterRegistry.class);
                    assertThat(meterRegistry.getMeters()).isNotEmpty();
                });
    }
}
