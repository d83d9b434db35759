package xyz.vvrf.bimflow.transform;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.PropertyInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 读取、设置、添加和删除元素属性。
 * <p>
 * 属性名可写为 {@code 属性集:属性}，显式属性集优先于 {@code targetPset}。
 * {@code targetPset} 为 {@code any} 时在所有属性集和数量集中查找。
 * 输入元素不会被修改，返回的是带 {@link PropertyInfo} 的副本。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class PropertyManager {

    public static final String ANY_PSET = "any";

    private static final List<String> IS_EXTERNAL_VARIANTS =
            Arrays.asList("IsExternal", "isExternal", "ISEXTERNAL", "isexternal");

    private PropertyManager() {}

    public static List<BimElement> manage(List<BimElement> elements, String action, String propertyName,
                                          Object propertyValue, String targetPset) {
        if (elements == null || elements.isEmpty()) {
            log.debug("No elements provided to property manager");
            return Collections.emptyList();
        }
        if (propertyName == null || propertyName.isEmpty()) {
            log.warn("No property name provided, elements returned unchanged");
            return elements;
        }

        String actualName = propertyName;
        String explicitPset = "";
        int separator = propertyName.indexOf(':');
        if (separator >= 0) {
            explicitPset = propertyName.substring(0, separator);
            actualName = propertyName.substring(separator + 1);
        }
        String effectivePset = !explicitPset.isEmpty() ? explicitPset
                : (targetPset != null && !targetPset.isEmpty() ? targetPset : ANY_PSET);
        String op = action != null ? action.toLowerCase(Locale.ROOT) : "get";

        List<BimElement> result = new ArrayList<>(elements.size());
        for (BimElement element : elements) {
            BimElement copy = element.deepCopy();
            Lookup found = find(copy, actualName, effectivePset);
            switch (op) {
                case "get":
                    copy.setPropertyInfo(new PropertyInfo(actualName, found.exists, found.value, found.psetName));
                    break;
                case "set":
                case "add":
                    copy.getProperties().put(actualName, propertyValue);
                    if (!ANY_PSET.equals(effectivePset)) {
                        copy.getPsets().computeIfAbsent(effectivePset, k -> new LinkedHashMap<>())
                                .put(actualName, propertyValue);
                    }
                    copy.setPropertyInfo(new PropertyInfo(actualName, true, propertyValue,
                            ANY_PSET.equals(effectivePset) ? "properties" : effectivePset));
                    break;
                case "remove":
                    remove(copy, actualName, effectivePset);
                    copy.setPropertyInfo(new PropertyInfo(actualName, false, null, found.psetName));
                    break;
                default:
                    log.warn("Unknown property action: {}", action);
            }
            result.add(copy);
        }
        return result;
    }

    /**
     * 收集存在该属性的元素中不同的属性值，保持首次出现的顺序。
     */
    public static List<Object> uniqueValues(List<BimElement> elements) {
        Set<Object> values = new LinkedHashSet<>();
        for (BimElement element : elements) {
            PropertyInfo info = element.getPropertyInfo();
            if (info != null && info.isExists()) {
                values.add(info.getValue());
            }
        }
        return new ArrayList<>(values);
    }

    private static Lookup find(BimElement element, String name, String psetName) {
        boolean isExternal = IS_EXTERNAL_VARIANTS.contains(name);
        String initialPset = ANY_PSET.equals(psetName) ? "" : psetName;

        if (!ANY_PSET.equals(psetName)) {
            Map<String, Object> pset = element.getPsets().get(psetName);
            Lookup hit = lookupIn(pset, name, isExternal, psetName);
            if (hit != null) {
                return hit;
            }
        }

        Lookup direct = lookupIn(element.getProperties(), name, isExternal, initialPset);
        if (direct != null) {
            return direct;
        }

        if (ANY_PSET.equals(psetName)) {
            for (Map.Entry<String, Map<String, Object>> entry : element.getPsets().entrySet()) {
                Lookup hit = lookupIn(entry.getValue(), name, isExternal, entry.getKey());
                if (hit != null) {
                    return hit;
                }
            }
            for (Map.Entry<String, Map<String, Object>> entry : element.getQtos().entrySet()) {
                Lookup hit = lookupIn(entry.getValue(), name, false, entry.getKey());
                if (hit != null) {
                    return hit;
                }
            }
        }
        return new Lookup(false, null, initialPset);
    }

    private static Lookup lookupIn(Map<String, Object> container, String name, boolean isExternal, String psetName) {
        if (container == null) {
            return null;
        }
        if (container.containsKey(name)) {
            return new Lookup(true, container.get(name), psetName);
        }
        if (isExternal) {
            for (String variant : IS_EXTERNAL_VARIANTS) {
                if (container.containsKey(variant)) {
                    return new Lookup(true, container.get(variant), psetName);
                }
            }
        }
        return null;
    }

    private static void remove(BimElement element, String name, String psetName) {
        element.getProperties().remove(name);
        if (!ANY_PSET.equals(psetName)) {
            Map<String, Object> pset = element.getPsets().get(psetName);
            if (pset != null) {
                pset.remove(name);
            }
            return;
        }
        element.getPsets().values().forEach(pset -> pset.remove(name));
        element.getQtos().values().forEach(qto -> qto.remove(name));
    }

    private static final class Lookup {
        private final boolean exists;
        private final Object value;
        private final String psetName;

        private Lookup(boolean exists, Object value, String psetName) {
            this.exists = exists;
            this.value = value;
            this.psetName = psetName;
        }
    }
}
