package xyz.vvrf.bimflow.handler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import xyz.vvrf.bimflow.collaborator.ModelLoader;
import xyz.vvrf.bimflow.core.ExecutionMode;
import xyz.vvrf.bimflow.core.NodeResult;
import xyz.vvrf.bimflow.core.ProgressCallback;
import xyz.vvrf.bimflow.model.BimModel;
import xyz.vvrf.bimflow.model.ModelSource;
import xyz.vvrf.bimflow.test.util.BimFixtures;
import xyz.vvrf.bimflow.test.util.RecordingProgressSink;

import java.io.IOException;
import java.util.Collections;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static xyz.vvrf.bimflow.test.util.Invocations.invocation;
import static xyz.vvrf.bimflow.test.util.Invocations.props;

class IfcNodeHandlerTest {

    private ModelLoader modelLoader;
    private RecordingProgressSink sink;

    @BeforeEach
    void setUp() {
        modelLoader = mock(ModelLoader.class);
        sink = new RecordingProgressSink();
    }

    @Test
    void shouldRunAsyncWithoutInputPorts() {
        IfcNodeHandler handler = new IfcNodeHandler(modelLoader);
        assertThat(handler.getExecutionMode()).isEqualTo(ExecutionMode.ASYNC);
        assertThat(handler.getInputPorts()).isEmpty();
    }

    @Test
    void shouldPreferModelInfoProperty() {
        BimModel model = BimFixtures.model(BimFixtures.building());
        IfcNodeHandler handler = new IfcNodeHandler(modelLoader);

        StepVerifier.create(handler.execute(invocation("ifcNode", props("modelInfo", model, "file", "other.ifc"),
                        Collections.emptyMap(), sink)))
                .assertNext(result -> assertThat(result.getRawValue()).isSameAs(model))
                .verifyComplete();

        verify(modelLoader, never()).load(any(), any());
    }

    @Test
    void shouldNormalizeModelWithoutElements() {
        BimModel model = BimModel.builder().id("m").name("bare").elements(null).build();
        IfcNodeHandler handler = new IfcNodeHandler(null);

        NodeResult result = handler.execute(invocation("ifcNode", props("modelInfo", model), Collections.emptyMap()))
                .block();

        BimModel output = result.getValueAs(BimModel.class).orElseThrow(AssertionError::new);
        assertThat(output.getElements()).isNotNull().isEmpty();
        assertThat(output.getName()).isEqualTo("bare");
    }

    @Test
    void shouldLoadFileAndReportProgress() {
        BimModel loaded = BimFixtures.model(BimFixtures.building());
        when(modelLoader.load(any(ModelSource.class), any(ProgressCallback.class))).thenAnswer(inv -> {
            ProgressCallback callback = inv.getArgument(1);
            callback.onProgress(50, "Parsing geometry");
            return Mono.just(loaded);
        });
        IfcNodeHandler handler = new IfcNodeHandler(modelLoader);

        StepVerifier.create(handler.execute(invocation("ifcNode", props("file", "tower.ifc"), Collections.emptyMap(), sink)))
                .assertNext(result -> assertThat(result.getRawValue()).isSameAs(loaded))
                .verifyComplete();

        verify(modelLoader).load(any(ModelSource.class), any(ProgressCallback.class));
        assertThat(sink.getMessages()).containsExactly("Loading tower.ifc...", "Parsing geometry");
        assertThat(sink.last().getLoading()).isFalse();
        assertThat(sink.last().isClearProgress()).isTrue();
    }

    @Test
    void shouldWrapLoadFailure() {
        when(modelLoader.load(any(ModelSource.class), any(ProgressCallback.class)))
                .thenReturn(Mono.error(new IOException("corrupt header")));
        IfcNodeHandler handler = new IfcNodeHandler(modelLoader);

        StepVerifier.create(handler.execute(invocation("ifcNode", props("file", "broken.ifc"), Collections.emptyMap(), sink)))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(IllegalStateException.class)
                            .hasMessage("Failed to load IFC file: corrupt header");
                    assertThat(e.getCause()).isInstanceOf(IOException.class);
                })
                .verify();

        assertThat(sink.last().getError()).isEqualTo("corrupt header");
    }

    @Test
    void shouldFallBackToLastLoadedModel() {
        BimModel last = BimFixtures.model(BimFixtures.building());
        when(modelLoader.getLastLoadedModel()).thenReturn(Optional.of(last));
        IfcNodeHandler handler = new IfcNodeHandler(modelLoader);

        NodeResult result = handler.execute(invocation("ifcNode", props(), Collections.emptyMap())).block();

        assertThat(result.getRawValue()).isSameAs(last);
    }

    @Test
    void shouldProduceEmptyModelWhenNothingIsAvailable() {
        when(modelLoader.getLastLoadedModel()).thenReturn(Optional.empty());
        IfcNodeHandler handler = new IfcNodeHandler(modelLoader);

        NodeResult result = handler.execute(invocation("ifcNode", props(), Collections.emptyMap())).block();

        BimModel model = result.getValueAs(BimModel.class).orElseThrow(AssertionError::new);
        assertThat(model.hasError()).isTrue();
        assertThat(model.getErrorMessage()).isEqualTo(IfcNodeHandler.NO_MODEL_MESSAGE);
        assertThat(model.getElements()).isEmpty();
    }
}
