package xyz.vvrf.bimflow.annotation;

import org.springframework.core.annotation.AliasFor;
import org.springframework.stereotype.Component;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 标记一个类为可被发现的节点处理器实现。
 * 使用此注解且实现了 {@link xyz.vvrf.bimflow.core.NodeHandler} 的 Bean 会被
 * {@link xyz.vvrf.bimflow.registry.SpringScanningNodeHandlerRegistry} 自动注册。
 * 与内置处理器类型相同时，扫描到的 Bean 优先。
 *
 * @author ruifeng.wen
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
@Component
public @interface WorkflowNodeKind {

    /**
     * 节点类型 (kind)，{@link #kind()} 的别名。
     */
    @AliasFor("kind")
    String value() default "";

    /**
     * 节点类型 (kind)，{@link #value()} 的别名。
     */
    @AliasFor("value")
    String kind() default "";
}
