package xyz.vvrf.bimflow.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.lang.NonNull;
import xyz.vvrf.bimflow.annotation.WorkflowNodeKind;
import xyz.vvrf.bimflow.core.NodeHandler;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 一个 {@link NodeHandlerRegistry} 实现，它会在初始化后扫描 ApplicationContext，
 * 自动注册使用 {@link WorkflowNodeKind} 注解的处理器 Bean。
 * 扫描完成后调用可选的默认注册器（例如内置处理器），它只应补充尚未注册的类型。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpringScanningNodeHandlerRegistry implements NodeHandlerRegistry, ApplicationContextAware, InitializingBean {

    private ApplicationContext applicationContext;
    // 内部使用 SimpleNodeHandlerRegistry 来存储注册信息和元数据
    private final SimpleNodeHandlerRegistry delegateRegistry = new SimpleNodeHandlerRegistry();
    private final Consumer<NodeHandlerRegistry> defaultsRegistrar;

    public SpringScanningNodeHandlerRegistry() {
        this(null);
    }

    /**
     * @param defaultsRegistrar 扫描之后执行的默认注册逻辑，可为 null
     */
    public SpringScanningNodeHandlerRegistry(Consumer<NodeHandlerRegistry> defaultsRegistrar) {
        this.defaultsRegistrar = defaultsRegistrar;
    }

    @Override
    public void setApplicationContext(@NonNull ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Override
    public void afterPropertiesSet() {
        if (applicationContext == null) {
            throw new BeanCreationException("SpringScanningNodeHandlerRegistry 中 ApplicationContext 未设置");
        }
        log.info("开始扫描 @WorkflowNodeKind Bean...");
        scanAndRegisterHandlers();
        if (defaultsRegistrar != null) {
            defaultsRegistrar.accept(delegateRegistry);
        }
    }

    private void scanAndRegisterHandlers() {
        Map<String, Object> beansWithAnnotation = applicationContext.getBeansWithAnnotation(WorkflowNodeKind.class);
        int registeredCount = 0;

        for (Map.Entry<String, Object> entry : beansWithAnnotation.entrySet()) {
            String beanName = entry.getKey();
            Object beanInstance = entry.getValue();
            WorkflowNodeKind annotation = applicationContext.findAnnotationOnBean(beanName, WorkflowNodeKind.class);

            if (annotation == null) {
                log.warn("在 Bean '{}' 上找不到 @WorkflowNodeKind 注解，尽管 getBeansWithAnnotation 返回了它。", beanName);
                continue;
            }
            if (!(beanInstance instanceof NodeHandler)) {
                log.error("Bean '{}' 使用了 @WorkflowNodeKind 注解，但未实现 NodeHandler 接口。跳过注册。", beanName);
                continue;
            }

            String kind = determineKind(annotation, beanName);
            try {
                delegateRegistry.register(kind, (NodeHandler) beanInstance);
                registeredCount++;
            } catch (IllegalArgumentException e) {
                // 记录注册错误（例如重复类型），但继续扫描
                log.error("注册处理器 Bean '{}' (类型: '{}') 失败: {}", beanName, kind, e.getMessage());
            }
        }
        log.info("扫描完成。共注册了 {} 个处理器。", registeredCount);
    }

    private String determineKind(WorkflowNodeKind annotation, String beanName) {
        String kind = annotation.kind();
        if (kind.isEmpty()) {
            kind = annotation.value();
        }
        if (kind.isEmpty()) {
            log.warn("Bean '{}' 的 @WorkflowNodeKind 注解未提供节点类型，将使用 Bean 名称。", beanName);
            return beanName;
        }
        return kind;
    }

    @Override
    public void register(String kind, NodeHandler handler) {
        delegateRegistry.register(kind, handler);
    }

    @Override
    public Optional<NodeHandler> getHandler(String kind) {
        return delegateRegistry.getHandler(kind);
    }

    @Override
    public Optional<HandlerMetadata> getMetadata(String kind) {
        return delegateRegistry.getMetadata(kind);
    }

    @Override
    public Set<String> getRegisteredKinds() {
        return delegateRegistry.getRegisteredKinds();
    }
}
