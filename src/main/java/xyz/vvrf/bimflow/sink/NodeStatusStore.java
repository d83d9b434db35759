package xyz.vvrf.bimflow.sink;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.NodeStatusPatch;
import xyz.vvrf.bimflow.core.ProgressSink;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 基于 Caffeine 的节点元数据存储，作为 {@link ProgressSink} 接收处理器报告的补丁。
 * 只供外部观察者（UI）读取，引擎从不读取。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class NodeStatusStore implements ProgressSink {

    private final Cache<String, NodeStatus> statuses;

    public NodeStatusStore(long maximumSize, Duration expireAfterWrite) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder().maximumSize(maximumSize);
        if (expireAfterWrite != null && !expireAfterWrite.isZero() && !expireAfterWrite.isNegative()) {
            builder.expireAfterWrite(expireAfterWrite);
        }
        this.statuses = builder.build();
        log.info("NodeStatusStore 已创建 (maximumSize={}, expireAfterWrite={})", maximumSize, expireAfterWrite);
    }

    @Override
    public void report(String nodeId, NodeStatusPatch patch) {
        Objects.requireNonNull(nodeId, "Node id cannot be null");
        Objects.requireNonNull(patch, "Patch cannot be null");
        statuses.asMap().compute(nodeId, (id, current) ->
                (current != null ? current : NodeStatus.initial(id)).apply(patch));
        log.trace("节点 '{}' 状态已更新: {}", nodeId, patch);
    }

    public Optional<NodeStatus> getStatus(String nodeId) {
        return Optional.ofNullable(statuses.getIfPresent(nodeId));
    }

    public Map<String, NodeStatus> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(statuses.asMap()));
    }

    public void clear(String nodeId) {
        statuses.invalidate(nodeId);
    }

    public void clearAll() {
        statuses.invalidateAll();
    }
}
