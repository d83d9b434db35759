package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;
import xyz.vvrf.bimflow.model.ElementTransform;
import xyz.vvrf.bimflow.model.Vector3;
import xyz.vvrf.bimflow.transform.ElementTransforms;
import xyz.vvrf.bimflow.transform.Elements;

import java.util.Collections;

@Slf4j
public class TransformNodeHandler extends SynchronousNodeHandler {

    @Override
    public String getOutputShape() {
        return "elements";
    }

    @Override
    protected Object apply(NodeInvocation invocation) {
        Object input = invocation.getInputs().getRaw(Ports.INPUT);
        if (input == null) {
            log.warn("No input provided to transform node '{}'", invocation.getNodeId());
            return Collections.emptyList();
        }
        NodeDefinition node = invocation.getNode();
        ElementTransform transform = new ElementTransform(
                vector(node, "translate", 0),
                vector(node, "rotate", 0),
                vector(node, "scale", 1));
        return ElementTransforms.transform(Elements.asElements(input), transform);
    }

    private static Vector3 vector(NodeDefinition node, String prefix, double defaultValue) {
        return new Vector3(
                node.getDouble(prefix + "X", defaultValue),
                node.getDouble(prefix + "Y", defaultValue),
                node.getDouble(prefix + "Z", defaultValue));
    }
}
