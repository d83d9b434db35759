package xyz.vvrf.bimflow.transform;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.Classification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 读取或设置元素分类。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class ClassificationManager {

    public static final String CLASSIFICATION_PSET = "Pset_ClassificationReference";
    public static final String CLASSIFICATION_PROPERTY = "Classification";

    private static final Map<String, String> SYSTEM_NAMES = new HashMap<>();

    static {
        SYSTEM_NAMES.put("uniclass", "Uniclass 2015");
        SYSTEM_NAMES.put("uniformat", "Uniformat II");
        SYSTEM_NAMES.put("masterformat", "MasterFormat 2016");
        SYSTEM_NAMES.put("omniclass", "OmniClass");
        SYSTEM_NAMES.put("cobie", "COBie");
        SYSTEM_NAMES.put("custom", "Custom Classification");
    }

    private ClassificationManager() {}

    public static String systemName(String system) {
        return SYSTEM_NAMES.getOrDefault(system, system);
    }

    /**
     * @param action get 时收集已有分类到 {@code classifications}；其他值按 set 处理
     */
    public static List<BimElement> manage(List<BimElement> elements, String system, String action, String code) {
        if (elements == null || elements.isEmpty()) {
            log.debug("No elements for classification management");
            return Collections.emptyList();
        }
        List<BimElement> result = new ArrayList<>(elements.size());
        if ("get".equals(action)) {
            for (BimElement element : elements) {
                BimElement copy = element.deepCopy();
                copy.setClassifications(collect(copy));
                result.add(copy);
            }
            return result;
        }

        String systemName = systemName(system);
        String safeCode = code != null ? code : "";
        for (BimElement element : elements) {
            BimElement copy = element.deepCopy();
            Map<String, Object> pset = copy.getPsets().computeIfAbsent(CLASSIFICATION_PSET, k -> new LinkedHashMap<>());
            pset.put("System", systemName);
            pset.put("Code", safeCode);
            pset.put("Name", systemName);
            pset.put("ItemReference", safeCode);
            pset.put("Description", systemName + " classification " + safeCode);

            Map<String, Object> direct = new LinkedHashMap<>();
            direct.put("System", systemName);
            direct.put("Code", safeCode);
            copy.getProperties().put(CLASSIFICATION_PROPERTY, direct);
            result.add(copy);
        }
        log.debug("Classified {} elements as {} {}", result.size(), systemName, safeCode);
        return result;
    }

    private static List<Classification> collect(BimElement element) {
        List<Classification> found = new ArrayList<>();
        Object direct = element.getProperties().get(CLASSIFICATION_PROPERTY);
        if (direct instanceof Classification) {
            found.add((Classification) direct);
        } else if (direct instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) direct;
            found.add(new Classification(
                    Elements.asText(firstNonNull(map.get("System"), "Unknown")),
                    Elements.asText(map.get("Code")),
                    Elements.asText(map.get("Description"))));
        }
        element.getPsets().forEach((psetName, pset) -> {
            if (psetName.contains("Classification")) {
                found.add(new Classification(
                        Elements.asText(firstNonNull(pset.get("System"), pset.get("Name"), "Unknown")),
                        Elements.asText(firstNonNull(pset.get("Code"), pset.get("ItemReference"), "")),
                        Elements.asText(pset.get("Description"))));
            }
        });
        return found;
    }

    private static Object firstNonNull(Object... values) {
        for (Object value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
