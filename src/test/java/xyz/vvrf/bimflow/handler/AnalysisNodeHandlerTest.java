package xyz.vvrf.bimflow.handler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import xyz.vvrf.bimflow.collaborator.GeometryCapability;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.SoftError;
import xyz.vvrf.bimflow.core.TaggedValue;
import xyz.vvrf.bimflow.model.BimElement;
import xyz.vvrf.bimflow.model.ClashDetection;
import xyz.vvrf.bimflow.model.ClashReport;
import xyz.vvrf.bimflow.test.util.BimFixtures;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static xyz.vvrf.bimflow.test.util.Invocations.invocation;
import static xyz.vvrf.bimflow.test.util.Invocations.props;
import static xyz.vvrf.bimflow.test.util.Invocations.withInput;

class AnalysisNodeHandlerTest {

    private final List<BimElement> building = BimFixtures.building();

    private static String softError(NodeResult result) {
        assertThat(result.isSoftError()).isTrue();
        return ((SoftError) result.getRawValue()).getError();
    }

    private static NodeResult run(AnalysisNodeHandler handler, Map<String, Object> properties,
                                  Object input, Object reference) {
        Map<String, Object> inputs = new HashMap<>();
        inputs.put("input", input);
        inputs.put("reference", reference);
        return handler.execute(invocation("analysisNode", properties, inputs)).block();
    }

    @Test
    void shouldReturnSoftErrorWithoutElements() {
        AnalysisNodeHandler handler = new AnalysisNodeHandler(null);

        NodeResult result = handler.execute(invocation("analysisNode", props(), Collections.emptyMap())).block();

        assertThat(softError(result)).isEqualTo("No elements to analyze");
    }

    @Test
    void shouldReturnSoftErrorForUnknownType() {
        NodeResult result = new AnalysisNodeHandler(null)
                .execute(withInput("analysisNode", props("analysisType", "thermal"), building)).block();

        assertThat(softError(result)).isEqualTo("Unknown analysis type");
    }

    @Test
    void shouldComputeSpatialMetrics() {
        AnalysisNodeHandler handler = new AnalysisNodeHandler(null);

        NodeResult volume = handler.execute(withInput("analysisNode",
                props("analysisType", "spatial", "metric", "volume"), building)).block();
        NodeResult unknown = handler.execute(withInput("analysisNode",
                props("analysisType", "space", "metric", "daylight"), building)).block();

        assertThat(volume.getRawValue()).isInstanceOf(Map.class);
        @SuppressWarnings("unchecked")
        Map<String, Object> metrics = (Map<String, Object>) volume.getRawValue();
        assertThat(metrics).containsOnlyKeys("totalVolume", "volumePerElement");
        assertThat(softError(unknown)).isEqualTo("Unknown spatial metric");
    }

    @Test
    void shouldComputeAdjacency() {
        NodeResult result = new AnalysisNodeHandler(null)
                .execute(withInput("analysisNode", props("analysisType", "adjacency"), building)).block();

        assertThat(result.getRawValue()).isInstanceOf(Map.class);
        assertThat(result.isSoftError()).isFalse();
    }

    @Nested
    class ClashDetectionTests {

        private GeometryCapability capability;
        private AnalysisNodeHandler handler;
        private List<BimElement> walls;
        private List<BimElement> doors;

        @BeforeEach
        void setUp() {
            capability = mock(GeometryCapability.class);
            handler = new AnalysisNodeHandler(capability);
            walls = building.subList(0, 3);
            doors = Collections.singletonList(building.get(4));
        }

        @Test
        void shouldRequireReferenceElements() {
            assertThat(softError(run(handler, props(), walls, null)))
                    .isEqualTo("No reference elements for clash detection");
        }

        @Test
        void shouldRequireGeometryCapability() {
            assertThat(softError(run(new AnalysisNodeHandler(null), props(), walls, doors)))
                    .isEqualTo("Active 3D Viewer not found for clash detection");
        }

        @Test
        void shouldWaitForGeometry() {
            when(capability.isReady()).thenReturn(false);

            assertThat(softError(run(handler, props(), walls, doors)))
                    .isEqualTo("Viewer is initializing or loading geometry.");
            verify(capability, never()).detectClashes(anyList(), anyList(), anyDouble());
        }

        @Test
        void shouldRequireExpressIds() {
            when(capability.isReady()).thenReturn(true);
            BimElement anonymous = BimElement.builder().id("x").type("IFCBEAM").build();

            assertThat(softError(run(handler, props(), walls, Collections.singletonList(anonymous))))
                    .isEqualTo("Could not extract valid element IDs for clash detection");
        }

        @Test
        void shouldDegradeWhenDetectionThrows() {
            when(capability.isReady()).thenReturn(true);
            when(capability.detectClashes(anyList(), anyList(), anyDouble()))
                    .thenThrow(new IllegalStateException("BVH not built"));

            assertThat(softError(run(handler, props(), walls, doors)))
                    .isEqualTo("Failed to perform geometric clash detection");
        }

        @Test
        void shouldReportClashesWithElementSummaries() {
            when(capability.isReady()).thenReturn(true);
            ClashDetection detection = new ClashDetection(1,
                    Collections.singletonList(new ClashDetection.Pair("clash-1", 101, 301, 0.1)));
            when(capability.detectClashes(eq(Arrays.asList(101, 102, 103)), eq(Collections.singletonList(301)), eq(25.0)))
                    .thenReturn(detection);

            NodeResult result = run(handler, props("tolerance", 25.0), walls, doors);

            TaggedValue tagged = result.getValueAs(TaggedValue.class).orElseThrow(AssertionError::new);
            assertThat(tagged.isType(TaggedValue.CLASH_RESULTS)).isTrue();
            ClashReport report = (ClashReport) tagged.getValue();
            assertThat(report.getClashes()).isEqualTo(1);
            assertThat(report.isCompleted()).isTrue();
            ClashReport.Detail detail = report.getDetails().get(0);
            assertThat(detail.getElement1().getName()).isEqualTo("Wall-01");
            assertThat(detail.getElement2().getType()).isEqualTo("IFCDOOR");
            assertThat(detail.getDistance()).isEqualTo(0.1);
        }
    }
}
