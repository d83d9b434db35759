package xyz.vvrf.bimflow.transform;

import xyz.vvrf.bimflow.core.TaggedValue;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.BimModel;
import xyz.vvrf.bimflow.model.PropertyNodeResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 从上游结果中取出元素列表。接受元素列表、模型、属性节点结果和 "elements" 标签值。
 *
 * @author ruifeng.wen
 */
public final class Elements {

    private Elements() {}

    /**
     * @return 元素列表；无法识别的值返回空列表
     */
    public static List<BimElement> asElements(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof BimModel) {
            List<BimElement> elements = ((BimModel) value).getElements();
            return elements != null ? elements : Collections.emptyList();
        }
        if (value instanceof PropertyNodeResult) {
            List<BimElement> elements = ((PropertyNodeResult) value).getElements();
            return elements != null ? elements : Collections.emptyList();
        }
        if (value instanceof TaggedValue && ((TaggedValue) value).isType(TaggedValue.ELEMENTS)) {
            return asElements(((TaggedValue) value).getValue());
        }
        if (value instanceof List) {
            List<BimElement> elements = new ArrayList<>();
            for (Object item : (List<?>) value) {
                if (item instanceof BimElement) {
                    elements.add((BimElement) item);
                }
            }
            return elements;
        }
        return Collections.emptyList();
    }

    /**
     * 读取点分路径的值：一段读取直接属性，两段读取 {@code 属性集.属性}。
     *
     * @return 值；路径不存在时为 null
     */
    public static Object readPath(BimElement element, String path) {
        if (path == null) {
            return null;
        }
        String[] parts = path.split("\\.", -1);
        if (parts.length == 1) {
            return element.getProperties() != null ? element.getProperties().get(path) : null;
        }
        if (parts.length == 2 && element.getPsets() != null) {
            Map<String, Object> pset = element.getPsets().get(parts[0]);
            return pset != null ? pset.get(parts[1]) : null;
        }
        return null;
    }

    /**
     * 路径是否存在 (值可以为 null)。
     */
    public static boolean hasPath(BimElement element, String path) {
        if (path == null) {
            return false;
        }
        String[] parts = path.split("\\.", -1);
        if (parts.length == 1) {
            return element.getProperties() != null && element.getProperties().containsKey(path);
        }
        if (parts.length == 2 && element.getPsets() != null) {
            Map<String, Object> pset = element.getPsets().get(parts[0]);
            return pset != null && pset.containsKey(parts[1]);
        }
        return false;
    }

    static String asText(Object value) {
        return Objects.toString(value, "");
    }

    /**
     * 把数字或数字字符串转换为 double；0、非数字或缺失返回 null。
     */
    static Double positiveNumber(Object value) {
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else if (value instanceof String && !((String) value).trim().isEmpty()) {
            try {
                number = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return number != 0 && !Double.isNaN(number) ? number : null;
    }

    static double round(double value, int scale) {
        double factor = Math.pow(10, scale);
        return Math.round(value * factor) / factor;
    }
}
