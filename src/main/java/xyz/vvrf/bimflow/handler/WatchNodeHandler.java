package xyz.vvrf.bimflow.handler;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.NodeStatusPatch;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.BimModel;
import xyz.vvrf.bimflow.model.PropertyNodeResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 观察节点：原样传递输入，并通过进度通道报告输入的类型和数量 ({@code inputData})。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WatchNodeHandler extends SynchronousNodeHandler {

    @Override
    protected Object apply(NodeInvocation invocation) {
        Object input = invocation.getInputs().getRaw(Ports.INPUT);
        if (input == null) {
            log.debug("No input provided to watch node '{}'", invocation.getNodeId());
            return null;
        }
        Map<String, Object> summary = summarize(input);
        invocation.report(NodeStatusPatch.builder().inputData(summary).build());
        return input;
    }

    static Map<String, Object> summarize(Object input) {
        String type;
        int count = 0;
        if (input instanceof List) {
            List<?> list = (List<?>) input;
            type = isGeometryResult(list) ? "geometryResult" : "array";
            count = list.size();
        } else if (input instanceof PropertyNodeResult) {
            type = "propertyResults";
            count = (int) ((PropertyNodeResult) input).getElements().stream()
                    .filter(e -> e.getPropertyInfo() != null && e.getPropertyInfo().isExists())
                    .count();
        } else if (input instanceof BimModel) {
            type = "model";
            count = ((BimModel) input).getElements().size();
        } else if (input instanceof Map) {
            type = "object";
            count = ((Map<?, ?>) input).size();
        } else {
            type = input.getClass().getSimpleName().toLowerCase(Locale.ROOT);
        }
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("type", type);
        summary.put("count", count);
        return summary;
    }

    private static boolean isGeometryResult(List<?> list) {
        if (list.isEmpty() || !(list.get(0) instanceof BimElement)) {
            return false;
        }
        BimElement first = (BimElement) list.get(0);
        boolean ifcType = first.getType() != null && first.getType().toUpperCase(Locale.ROOT).startsWith("IFC");
        boolean hasGeometry = first.getBoundingBox() != null
                || Boolean.TRUE.equals(first.getProperties().get("hasSimplifiedGeometry"));
        return ifcType && hasGeometry;
    }
}
