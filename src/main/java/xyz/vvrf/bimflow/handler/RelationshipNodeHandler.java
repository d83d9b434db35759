package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;
import xyz.vvrf.bimflow.transform.Elements;
import xyz.vvrf.bimflow.transform.RelationshipQueries;

import java.util.Collections;

@Slf4j
public class RelationshipNodeHandler extends SynchronousNodeHandler {

    @Override
    public String getOutputShape() {
        return "elements";
    }

    @Override
    protected Object apply(NodeInvocation invocation) {
        Object input = invocation.getInputs().getRaw(Ports.INPUT);
        if (input == null) {
            log.warn("No input provided to relationship node '{}'", invocation.getNodeId());
            return Collections.emptyList();
        }
        NodeDefinition node = invocation.getNode();
        return RelationshipQueries.query(Elements.asElements(input),
                node.getString("relationType", RelationshipQueries.CONTAINMENT),
                node.getString("direction", "outgoing"));
    }
}
