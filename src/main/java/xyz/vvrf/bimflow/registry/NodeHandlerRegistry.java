package xyz.vvrf.bimflow.registry;

import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeHandler;

import java.util.Optional;
import java.util.Set;

/**
 * 节点处理器注册表接口。
 * 负责管理节点类型 (kind) 到处理器实现的映射，并提供处理器元数据。
 *
 * @author ruifeng.wen
 */
public interface NodeHandlerRegistry {

    /**
     * 注册一个处理器。
     *
     * @param kind    节点类型 (在此注册表内唯一, 不能为空)
     * @param handler 处理器实例，应是无状态且线程安全的 (不能为空)
     * @throws IllegalArgumentException 如果该类型已被注册
     */
    void register(String kind, NodeHandler handler);

    /**
     * 根据节点类型获取处理器。
     *
     * @return 处理器的 Optional，未注册时为空
     */
    Optional<NodeHandler> getHandler(String kind);

    /**
     * 获取处理器元数据。
     */
    Optional<HandlerMetadata> getMetadata(String kind);

    /**
     * @return 所有已注册的节点类型
     */
    Set<String> getRegisteredKinds();

    default boolean isRegistered(String kind) {
        return getHandler(kind).isPresent();
    }

    /**
     * 处理器元数据：声明的输入端口、执行模式和输出形状。
     */
    interface HandlerMetadata {
        String getKind();

        Set<String> getInputPorts();

        ExecutionMode getExecutionMode();

        String getOutputShape();

        Class<?> getImplementationClass();
    }
}
