package xyz.vvrf.bimflow.transform;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.model.BimElement;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.BiPredicate;
import java.util.stream.Collectors;

/**
 * 按属性值过滤元素。属性路径语法见 {@link Elements#readPath(BimElement, String)}，
 * 比较时值统一转换为字符串 ({@code greaterThan}/{@code lessThan} 按数值比较)。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class ElementFilters {

    public static final String EQUALS = "equals";

    private ElementFilters() {}

    public static List<BimElement> filter(List<BimElement> elements, String property, String operator, String value) {
        if (elements == null || elements.isEmpty()) {
            log.debug("No elements to filter");
            return Collections.emptyList();
        }
        String op = operator != null ? operator : EQUALS;
        String expected = value != null ? value : "";

        if ("exists".equals(op)) {
            return elements.stream()
                    .filter(element -> Elements.readPath(element, property) != null)
                    .collect(Collectors.toList());
        }

        BiPredicate<String, String> predicate = predicateFor(op);
        if (predicate == null) {
            log.warn("Unknown filter operator '{}', no element matches.", op);
            return Collections.emptyList();
        }
        List<BimElement> result = elements.stream()
                .filter(element -> {
                    Object actual = Elements.readPath(element, property);
                    return actual != null && predicate.test(String.valueOf(actual), expected);
                })
                .collect(Collectors.toList());
        log.debug("Filter {} {} '{}': {} of {} elements matched", property, op, expected, result.size(), elements.size());
        return result;
    }

    private static BiPredicate<String, String> predicateFor(String operator) {
        switch (operator) {
            case EQUALS:
                return String::equals;
            case "notEquals":
                return (actual, expected) -> !actual.equals(expected);
            case "contains":
                return String::contains;
            case "startsWith":
                return String::startsWith;
            case "endsWith":
                return String::endsWith;
            case "equalsIgnoreCase":
                return (actual, expected) -> actual.toLowerCase(Locale.ROOT).equals(expected.toLowerCase(Locale.ROOT));
            case "greaterThan":
                return (actual, expected) -> compareNumbers(actual, expected) > 0;
            case "lessThan":
                return (actual, expected) -> compareNumbers(actual, expected) < 0;
            default:
                return null;
        }
    }

    /**
     * 任一侧不是数字时返回 0 (视为不满足大小比较)。
     */
    private static int compareNumbers(String actual, String expected) {
        try {
            return Double.compare(Double.parseDouble(actual.trim()), Double.parseDouble(expected.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
