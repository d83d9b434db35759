package xyz.vvrf.bimflow.handler;

import org.junit.jupiter.api.Test;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.PropertyInfo;
import xyz.vvrf.bimflow.model.PropertyNodeResult;
import xyz.vvrf.bimflow.test.util.BimFixtures;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static xyz.vvrf.bimflow.test.util.Invocations.invocation;
import static xyz.vvrf.bimflow.test.util.Invocations.props;
import static xyz.vvrf.bimflow.test.util.Invocations.withInput;

class PropertyNodeHandlerTest {

    private final PropertyNodeHandler handler = new PropertyNodeHandler();
    private final List<BimElement> walls = BimFixtures.building().subList(0, 3);

    private PropertyNodeResult run(Map<String, Object> properties, Map<String, Object> inputs) {
        return (PropertyNodeResult) handler.execute(invocation("propertyNode", properties, inputs))
                .block().getRawValue();
    }

    @Test
    void shouldReturnEmptyResultWithoutElements() {
        PropertyNodeResult result = run(props("propertyName", "FireRating"), Collections.emptyMap());

        assertThat(result.getElements()).isEmpty();
        assertThat(result.getUniqueValues()).isEmpty();
    }

    @Test
    void shouldGetPropertyAndCollectUniqueValues() {
        PropertyNodeResult result = (PropertyNodeResult) handler.execute(withInput("propertyNode",
                props("action", "get", "propertyName", "IsExternal"), walls)).block().getRawValue();

        assertThat(result.getElements()).extracting(e -> e.getPropertyInfo().getValue())
                .containsExactly(true, true, false);
        assertThat(result.getUniqueValues()).containsExactlyInAnyOrder(true, false);
    }

    @Test
    void shouldSetValueFromProperty() {
        PropertyNodeResult result = (PropertyNodeResult) handler.execute(withInput("propertyNode",
                props("action", "set", "propertyName", "Status", "propertyValue", "Approved"), walls))
                .block().getRawValue();

        assertThat(result.getElements()).allSatisfy(e -> assertThat(e.getProperties()).containsEntry("Status", "Approved"));
        assertThat(walls).allSatisfy(e -> assertThat(e.getProperties()).doesNotContainKey("Status"));
    }

    @Test
    void shouldTakeValueFromConnectedInput() {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("input", walls);
        inputs.put("valueInput", "Revised");

        PropertyNodeResult result = run(props("action", "set", "propertyName", "Status",
                "propertyValue", "ignored", "useValueInput", true), inputs);

        assertThat(result.getUniqueValues()).containsExactly("Revised");
    }

    @Test
    void shouldIgnoreValueInputUnlessEnabled() {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("input", walls);
        inputs.put("valueInput", "Revised");

        PropertyNodeResult result = run(props("action", "set", "propertyName", "Status",
                "propertyValue", "Draft"), inputs);

        assertThat(result.getUniqueValues()).containsExactly("Draft");
    }

    @Test
    void shouldUnwrapUpstreamPropertyResult() {
        BimElement first = BimFixtures.wall("a", 1, "A", "L1");
        first.setPropertyInfo(new PropertyInfo("FireRating", true, "REI90", "Pset_WallCommon"));
        BimElement second = BimFixtures.wall("b", 2, "B", "L1");
        second.setPropertyInfo(new PropertyInfo("FireRating", true, "REI30", "Pset_WallCommon"));

        PropertyNodeResult single = new PropertyNodeResult(Arrays.asList(first, second), Collections.singletonList("REI120"));
        PropertyNodeResult mixed = new PropertyNodeResult(Arrays.asList(first, second), Arrays.asList("REI90", "REI30"));

        assertThat(PropertyNodeHandler.valueFromInput(single)).isEqualTo("REI120");
        assertThat(PropertyNodeHandler.valueFromInput(mixed)).isEqualTo("REI90");
        assertThat(PropertyNodeHandler.valueFromInput(42)).isEqualTo(42);
    }
}
