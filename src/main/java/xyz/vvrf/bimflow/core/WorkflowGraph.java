package xyz.vvrf.bimflow.core;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.util.GraphUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 工作流图的不可变快照：有序的节点集合加边集合。
 * <p>
 * 构建时校验每条边引用的节点都存在（否则抛出
 * {@link xyz.vvrf.bimflow.exception.UnknownNodeReferenceException}）。
 * 无环性不在此校验，它是执行的前置条件，由拓扑排序检查。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class WorkflowGraph {

    private final String name;
    private final Map<String, NodeDefinition> nodes;
    private final List<EdgeDefinition> edges;
    private final Map<String, List<EdgeDefinition>> incomingEdges;

    public WorkflowGraph(String name, List<NodeDefinition> nodes, List<EdgeDefinition> edges) {
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        Objects.requireNonNull(nodes, "Node list cannot be null");

        Map<String, NodeDefinition> nodeMap = new LinkedHashMap<>();
        for (NodeDefinition node : nodes) {
            Objects.requireNonNull(node, "Node definition cannot be null");
            if (nodeMap.putIfAbsent(node.getId(), node) != null) {
                throw new IllegalArgumentException(String.format(
                        "Workflow '%s': duplicate node id '%s'.", name, node.getId()));
            }
        }
        this.nodes = Collections.unmodifiableMap(nodeMap);
        this.edges = (edges == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(edges));

        GraphUtils.validateEdgeReferences(this.nodes.keySet(), this.edges, name);

        this.incomingEdges = Collections.unmodifiableMap(this.edges.stream()
                .collect(Collectors.groupingBy(EdgeDefinition::getTargetNodeId, LinkedHashMap::new,
                        Collectors.collectingAndThen(Collectors.toList(), Collections::unmodifiableList))));

        log.debug("Workflow '{}': graph created with {} nodes and {} edges.", name, this.nodes.size(), this.edges.size());
    }

    public String getName() {
        return name;
    }

    /**
     * 按插入顺序返回所有节点。
     */
    public List<NodeDefinition> getNodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    /**
     * 按插入顺序返回所有节点 ID。
     */
    public List<String> getNodeIds() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.keySet()));
    }

    public List<EdgeDefinition> getEdges() {
        return edges;
    }

    public Optional<NodeDefinition> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public boolean containsNode(String nodeId) {
        return nodes.containsKey(nodeId);
    }

    /**
     * 返回指向指定节点的所有边，保持图中边的顺序。
     */
    public List<EdgeDefinition> getIncomingEdges(String nodeId) {
        return incomingEdges.getOrDefault(nodeId, Collections.emptyList());
    }

    public int size() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return String.format("WorkflowGraph[name=%s, nodes=%d, edges=%d]", name, nodes.size(), edges.size());
    }
}
