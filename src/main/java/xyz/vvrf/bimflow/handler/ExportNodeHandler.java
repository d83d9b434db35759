package xyz.vvrf.bimflow.handler;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.NodeInvocation;
import xyz.vvrf.bimflow.core.Ports;
import xyz.vvrf.bimflow.core.SoftError;
import xyz.vvrf.bimflow.core.SynchronousNodeHandler;
import xyz.vvrf.bimflow.transform.ElementExporter;
import xyz.vvrf.bimflow.transform.Elements;

import java.util.Locale;

/**
 * 导出节点。输出导出的文本；IFC 格式需要文件写回，不在引擎内支持，返回 {@link SoftError}。
 */
@Slf4j
public class ExportNodeHandler extends SynchronousNodeHandler {

    private final ElementExporter exporter;

    public ExportNodeHandler(ObjectMapper objectMapper) {
        this.exporter = new ElementExporter(objectMapper);
    }

    @Override
    public String getOutputShape() {
        return "text";
    }

    @Override
    protected Object apply(NodeInvocation invocation) {
        Object input = invocation.getInputs().getRaw(Ports.INPUT);
        if (input == null) {
            log.warn("No input provided to export node '{}'", invocation.getNodeId());
            return "";
        }
        NodeDefinition node = invocation.getNode();
        String format = node.getString("format", ElementExporter.FORMAT_CSV).toLowerCase(Locale.ROOT);
        if (!ElementExporter.FORMAT_CSV.equals(format) && !ElementExporter.FORMAT_JSON.equals(format)) {
            log.warn("Export node '{}': format '{}' is not supported", node.getId(), format);
            return SoftError.of("Export format '" + format + "' is not supported");
        }
        return exporter.export(Elements.asElements(input), format,
                node.getString("properties", ElementExporter.DEFAULT_COLUMNS));
    }
}
