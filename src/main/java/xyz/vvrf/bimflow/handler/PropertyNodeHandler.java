package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeInputs;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.PropertyInfo;
import xyz.vvrf.bimflow.model.PropertyNodeResult;
import xyz.vvrf.bimflow.transform.Elements;
import xyz.vvrf.bimflow.transform.PropertyManager;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 属性节点：get / set / add / remove。
 * <p>
 * {@code useValueInput} 为 true 且 {@code valueInput} 端口有值时，写入的值取自该端口：
 * 上游是属性节点结果时，取唯一的属性值或第一个元素的属性值。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class PropertyNodeHandler extends SynchronousNodeHandler {

    @Override
    public Set<String> getInputPorts() {
        return new HashSet<>(Arrays.asList(Ports.INPUT, Ports.VALUE_INPUT));
    }

    @Override
    public String getOutputShape() {
        return "propertyResults";
    }

    @Override
    protected Object apply(NodeInvocation invocation) {
        NodeDefinition node = invocation.getNode();
        NodeInputs inputs = invocation.getInputs();
        List<BimElement> elements = Elements.asElements(inputs.getRaw(Ports.INPUT));
        if (elements.isEmpty()) {
            log.warn("No elements provided to property node '{}'", node.getId());
            return new PropertyNodeResult(new ArrayList<>(), new ArrayList<>());
        }

        Object value = node.getProperty("propertyValue", Object.class).orElse("");
        if (node.getBoolean("useValueInput", false) && inputs.has(Ports.VALUE_INPUT)) {
            value = valueFromInput(inputs.getRaw(Ports.VALUE_INPUT));
            log.debug("Node '{}' uses value from input: {}", node.getId(), value);
        }

        List<BimElement> updated = PropertyManager.manage(elements,
                node.getString("action", "get"),
                node.getString("propertyName", ""),
                value,
                node.getString("targetPset", PropertyManager.ANY_PSET));
        return new PropertyNodeResult(updated, PropertyManager.uniqueValues(updated));
    }

    static Object valueFromInput(Object input) {
        if (input instanceof PropertyNodeResult) {
            PropertyNodeResult result = (PropertyNodeResult) input;
            List<BimElement> elements = result.getElements();
            if (elements != null && !elements.isEmpty() && elements.get(0).getPropertyInfo() != null) {
                if (result.getUniqueValues() != null && result.getUniqueValues().size() == 1) {
                    return result.getUniqueValues().get(0);
                }
                PropertyInfo first = elements.get(0).getPropertyInfo();
                if (first.isExists()) {
                    return first.getValue();
                }
            }
        }
        return input;
    }
}
