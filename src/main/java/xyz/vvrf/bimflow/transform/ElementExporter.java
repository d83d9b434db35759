package xyz.vvrf.bimflow.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.model.BimElement;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 把元素的选定属性导出为 CSV 或 JSON 文本。
 * 列名语法同 {@link Elements#readPath(BimElement, String)}。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ElementExporter {

    public static final String DEFAULT_COLUMNS = "Name,Type,Material";
    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_CSV = "csv";

    private final ObjectMapper objectMapper;

    public ElementExporter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    /**
     * @param columns 逗号分隔的列；为空时使用第一个元素的直接属性名
     * @throws IllegalArgumentException 如果格式不受支持
     */
    public String export(List<BimElement> elements, String format, String columns) {
        if (!FORMAT_JSON.equals(format) && !FORMAT_CSV.equals(format)) {
            throw new IllegalArgumentException("Unsupported export format: " + format);
        }
        if (elements == null || elements.isEmpty()) {
            log.debug("No elements to export as {}", format);
            return FORMAT_JSON.equals(format) ? "[]" : "";
        }
        List<String> headers = columns != null && !columns.trim().isEmpty()
                ? Arrays.stream(columns.split(",")).map(String::trim).collect(Collectors.toList())
                : defaultHeaders(elements.get(0));

        return FORMAT_JSON.equals(format) ? toJson(elements, headers) : toCsv(elements, headers);
    }

    private static List<String> defaultHeaders(BimElement first) {
        Map<String, Object> properties = first.getProperties();
        return properties != null ? new ArrayList<>(properties.keySet()) : new ArrayList<>();
    }

    private String toJson(List<BimElement> elements, List<String> headers) {
        List<Map<String, Object>> rows = new ArrayList<>(elements.size());
        for (BimElement element : elements) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (String header : headers) {
                if (Elements.hasPath(element, header)) {
                    row.put(header, Elements.readPath(element, header));
                }
            }
            rows.add(row);
        }
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize export rows: " + e.getOriginalMessage(), e);
        }
    }

    private String toCsv(List<BimElement> elements, List<String> headers) {
        StringBuilder csv = new StringBuilder(String.join(",", headers)).append('\n');
        for (BimElement element : elements) {
            csv.append(headers.stream()
                            .map(header -> escapeCsv(Elements.asText(Elements.readPath(element, header))))
                            .collect(Collectors.joining(",")))
                    .append('\n');
        }
        return csv.toString();
    }

    static String escapeCsv(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
