package xyz.vvrf.bimflow.handler;

import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;

import java.util.Collections;
import java.util.Set;

/**
 * 参数节点：输出属性 {@code value}，缺失或为空串时输出 ""。
 */
public class ParameterNodeHandler extends SynchronousNodeHandler {

    @Override
    public Set<String> getInputPorts() {
        return Collections.emptySet();
    }

    @Override
    protected Object apply(NodeInvocation invocation) {
        return invocation.getNode().getProperty("value", Object.class).orElse("");
    }
}
