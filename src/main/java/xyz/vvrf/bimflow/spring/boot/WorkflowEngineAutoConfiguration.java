package xyz.vvrf.bimflow.spring.boot;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.bimflow.collaborator.GeometryCapability;
import xyz.vvrf.bimflow.collaborator.ModelLoader;
import xyz.vvrf.bimflow.collaborator.QuantityWorker;
import xyz.vvrf.bimflow.execution.NodeDispatcher;
import xyz.vvrf.bimflow.execution.StandardNodeDispatcher;
import xyz.vvrf.bimflow.execution.WorkflowExecutorFactory;
import xyz.vvrf.bimflow.handler.BuiltinNodeHandlers;
import xyz.vvrf.bimflow.monitor.LoggingWorkflowMonitorListener;
import xyz.vvrf.bimflow.monitor.MicrometerWorkflowMonitorListener;
import xyz.vvrf.bimflow.monitor.WorkflowMonitorListener;
import xyz.vvrf.bimflow.registry.NodeHandlerRegistry;
import xyz.vvrf.bimflow.registry.SpringScanningNodeHandlerRegistry;
import xyz.vvrf.bimflow.sink.NodeStatusStore;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 工作流引擎的 Spring Boot 自动配置。
 * <p>
 * 提供节点执行调度器、处理器注册表 (扫描 {@link xyz.vvrf.bimflow.annotation.WorkflowNodeKind} Bean 并补充内置处理器)、
 * 节点状态存储、监控监听器、节点调度器和 {@link WorkflowExecutorFactory}。
 * 所有 Bean 都可以由用户定义的同类型 Bean 覆盖。
 * <p>
 * 外部协作者 ({@link ModelLoader}、{@link GeometryCapability}、{@link QuantityWorker}) 如果存在于上下文中，
 * 会被传给内置处理器。
 *
 * @author ruifeng.wen
 */
@Configuration
@EnableConfigurationProperties(WorkflowEngineProperties.class)
@AutoConfigureAfter(name = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration"})
@Slf4j
public class WorkflowEngineAutoConfiguration {

    public static final String SCHEDULER_BEAN_NAME = "workflowNodeExecutionScheduler";
    public static final String LISTENERS_BEAN_NAME = "workflowMonitorListeners";

    public WorkflowEngineAutoConfiguration() {
        log.info("工作流引擎自动配置 (WorkflowEngineAutoConfiguration) 已加载。");
    }

    /**
     * 异步节点处理器使用的调度器。
     */
    @Bean(name = SCHEDULER_BEAN_NAME, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = SCHEDULER_BEAN_NAME)
    public Scheduler workflowNodeExecutionScheduler(WorkflowEngineProperties properties) {
        WorkflowEngineProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case IMMEDIATE:
                log.info("正在创建 '{}' (Immediate)", SCHEDULER_BEAN_NAME);
                return Schedulers.immediate();
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case BOUNDED_ELASTIC:
            default:
                log.info("正在创建 '{}' (BoundedElastic): prefix={}", SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newBoundedElastic(Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                        Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, namePrefix, 60, true);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public BuiltinNodeHandlers builtinNodeHandlers(ObjectProvider<ModelLoader> modelLoader,
                                                   ObjectProvider<GeometryCapability> geometryCapability,
                                                   ObjectProvider<QuantityWorker> quantityWorker,
                                                   ObjectProvider<ObjectMapper> objectMapper) {
        return BuiltinNodeHandlers.builder()
                .modelLoader(modelLoader.getIfUnique())
                .geometryCapability(geometryCapability.getIfUnique())
                .quantityWorker(quantityWorker.getIfUnique())
                .objectMapper(objectMapper.getIfUnique(ObjectMapper::new))
                .build();
    }

    /**
     * 处理器注册表。内置处理器在扫描之后注册，只补充尚未注册的类型。
     */
    @Bean
    @ConditionalOnMissingBean(NodeHandlerRegistry.class)
    public SpringScanningNodeHandlerRegistry nodeHandlerRegistry(WorkflowEngineProperties properties,
                                                                 BuiltinNodeHandlers builtinNodeHandlers) {
        if (!properties.getBuiltinHandlers().isEnabled()) {
            log.info("内置节点处理器已禁用 (bimflow.builtin-handlers.enabled=false)。");
            return new SpringScanningNodeHandlerRegistry();
        }
        return new SpringScanningNodeHandlerRegistry(builtinNodeHandlers::registerAll);
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeStatusStore nodeStatusStore(WorkflowEngineProperties properties) {
        WorkflowEngineProperties.StatusStore props = properties.getStatusStore();
        return new NodeStatusStore(props.getMaximumSize(), props.getExpireAfterWrite());
    }

    @Bean
    @ConditionalOnProperty(prefix = "bimflow.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnMissingBean(LoggingWorkflowMonitorListener.class)
    public LoggingWorkflowMonitorListener loggingWorkflowMonitorListener() {
        return new LoggingWorkflowMonitorListener();
    }

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean(MicrometerWorkflowMonitorListener.class)
    public MicrometerWorkflowMonitorListener micrometerWorkflowMonitorListener(MeterRegistry meterRegistry) {
        return new MicrometerWorkflowMonitorListener(meterRegistry);
    }

    /**
     * 收集上下文中所有的 {@link WorkflowMonitorListener} Bean。
     */
    @Bean(name = LISTENERS_BEAN_NAME)
    @ConditionalOnMissingBean(name = LISTENERS_BEAN_NAME)
    public List<WorkflowMonitorListener> workflowMonitorListeners(ObjectProvider<WorkflowMonitorListener> listenersProvider) {
        List<WorkflowMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        log.info("找到 {} 个 WorkflowMonitorListener: {}", listeners.size(),
                listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.toList()));
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean(NodeDispatcher.class)
    public StandardNodeDispatcher nodeDispatcher(NodeHandlerRegistry nodeHandlerRegistry,
                                                 @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler,
                                                 @Qualifier(LISTENERS_BEAN_NAME) List<WorkflowMonitorListener> workflowMonitorListeners) {
        return new StandardNodeDispatcher(nodeHandlerRegistry, scheduler, workflowMonitorListeners);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowExecutorFactory workflowExecutorFactory(NodeDispatcher nodeDispatcher,
                                                           NodeStatusStore nodeStatusStore,
                                                           @Qualifier(LISTENERS_BEAN_NAME) List<WorkflowMonitorListener> workflowMonitorListeners) {
        log.info("正在创建 WorkflowExecutorFactory Bean...");
        return new WorkflowExecutorFactory(nodeDispatcher, nodeStatusStore, workflowMonitorListeners);
    }
}
