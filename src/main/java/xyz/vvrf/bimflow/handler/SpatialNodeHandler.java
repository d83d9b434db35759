package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;
import xyz.vvrf.bimflow.transform.Elements;
import xyz.vvrf.bimflow.transform.SpatialQueries;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

@Slf4j
public class SpatialNodeHandler extends SynchronousNodeHandler {

    @Override
    public Set<String> getInputPorts() {
        return new HashSet<>(Arrays.asList(Ports.INPUT, Ports.REFERENCE));
    }

    @Override
    public String getOutputShape() {
        return "elements";
    }

    @Override
    protected Object apply(NodeInvocation invocation) {
        Object input = invocation.getInputs().getRaw(Ports.INPUT);
        if (input == null) {
            log.warn("No input provided to spatial node '{}'", invocation.getNodeId());
            return Collections.emptyList();
        }
        NodeDefinition node = invocation.getNode();
        return SpatialQueries.query(Elements.asElements(input),
                Elements.asElements(invocation.getInputs().getRaw(Ports.REFERENCE)),
                node.getString("queryType", "contained"),
                node.getDouble("distance", 1.0));
    }
}
