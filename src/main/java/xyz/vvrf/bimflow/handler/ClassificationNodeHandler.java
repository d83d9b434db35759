package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;
import xyz.vvrf.bimflow.transform.ClassificationManager;
import xyz.vvrf.bimflow.transform.Elements;

import java.util.Collections;

@Slf4j
public class ClassificationNodeHandler extends SynchronousNodeHandler {

    @Override
    public String getOutputShape() {
        return "elements";
    }

    @Override
    protected Object apply(NodeInvocation invocation) {
        Object input = invocation.getInputs().getRaw(Ports.INPUT);
        if (input == null) {
            log.warn("No input provided to classification node '{}'", invocation.getNodeId());
            return Collections.emptyList();
        }
        NodeDefinition node = invocation.getNode();
        return ClassificationManager.manage(Elements.asElements(input),
                node.getString("system", "uniclass"),
                node.getString("action", "get"),
                node.getString("code", ""));
    }
}
