package xyz.vvrf.bimflow.sink;

import org.junit.jupiter.api.Test;
import xyz.vvrf.bimflow.core.NodeStatusPatch;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class NodeStatusStoreTest {

    private final NodeStatusStore store = new NodeStatusStore(100, null);

    @Test
    void shouldMergePatchesIntoNodeStatus() {
        store.report("ifc", NodeStatusPatch.progress(30, "Loading model.ifc..."));
        store.report("ifc", NodeStatusPatch.progress(60, null).toBuilder().correlationId("ifc-1234").build());

        NodeStatus status = store.getStatus("ifc").orElseThrow(IllegalStateException::new);
        assertThat(status.isLoading()).isTrue();
        assertThat(status.getProgressPercentage()).isEqualTo(60);
        assertThat(status.getProgressMessage()).isEqualTo("Processing...");
        assertThat(status.getCorrelationId()).isEqualTo("ifc-1234");
    }

    @Test
    void shouldClearProgressWhenFinished() {
        store.report("geo", NodeStatusPatch.progress(50, "Extracting"));
        store.report("geo", NodeStatusPatch.finished());

        NodeStatus status = store.getStatus("geo").orElseThrow(IllegalStateException::new);
        assertThat(status.isLoading()).isFalse();
        assertThat(status.getProgressPercentage()).isNull();
        assertThat(status.getProgressMessage()).isNull();
    }

    @Test
    void shouldKeepErrorUntilNextLoad() {
        store.report("q", NodeStatusPatch.failed("Worker crashed"));
        assertThat(store.getStatus("q")).get().extracting(NodeStatus::getError).isEqualTo("Worker crashed");

        store.report("q", NodeStatusPatch.progress(0, "Extracting quantities..."));
        assertThat(store.getStatus("q")).get().extracting(NodeStatus::getError).isNull();
    }

    @Test
    void shouldClampPercentage() {
        store.report("n", NodeStatusPatch.progress(150, "over"));
        assertThat(store.getStatus("n")).get().extracting(NodeStatus::getProgressPercentage).isEqualTo(100);
    }

    @Test
    void shouldStoreWatchInputDataAndSupportClear() {
        store.report("watch", NodeStatusPatch.builder().inputData(Collections.singletonMap("count", 3)).build());
        assertThat(store.snapshot()).containsOnlyKeys("watch");

        store.clear("watch");
        assertThat(store.getStatus("watch")).isEmpty();

        store.report("a", NodeStatusPatch.finished());
        store.clearAll();
        assertThat(store.snapshot()).isEmpty();
    }
}
