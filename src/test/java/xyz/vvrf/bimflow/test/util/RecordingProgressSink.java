package xyz.vvrf.bimflow.test.util;

import xyz.vvrf.bimflow.core.NodeStatusPatch;
import xyz.vvrf.bimflow.core.ProgressSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 记录所有补丁的进度通道。
 */
public class RecordingProgressSink implements ProgressSink {

    private final List<NodeStatusPatch> patches = new CopyOnWriteArrayList<>();

    @Override
    public void report(String nodeId, NodeStatusPatch patch) {
        patches.add(patch);
    }

    public List<NodeStatusPatch> getPatches() {
        return patches;
    }

    public List<String> getMessages() {
        return patches.stream()
                .map(NodeStatusPatch::getProgressMessage)
                .filter(m -> m != null)
                .collect(Collectors.toList());
    }

    public NodeStatusPatch last() {
        return patches.get(patches.size() - 1);
    }
}
