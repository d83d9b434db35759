package xyz.vvrf.bimflow.handler;

import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;

public class ViewerNodeHandler extends SynchronousNodeHandler {

    @Override
    protected Object apply(NodeInvocation invocation) {
        return invocation.getInputs().getRaw(Ports.INPUT);
    }
}
