package xyz.vvrf.bimflow.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.EdgeDefinition;
import xyz.vvrf.bimflow.core.NodeDefinition;
import xyz.vvrf.bimflow.core.WorkflowGraph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 用于以编程方式构建不可变的 {@link WorkflowGraph}。
 * 节点顺序即添加顺序，它决定了拓扑排序的遍历顺序。
 * 边引用的节点在 {@link #build()} 时统一校验。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class WorkflowGraphBuilder {

    private String name;
    private final Map<String, NodeDefinition> nodes = new LinkedHashMap<>();
    private final List<EdgeDefinition> edges = new ArrayList<>();

    public WorkflowGraphBuilder(String name) {
        this.name = Objects.requireNonNull(name, "工作流名称不能为空");
    }

    public WorkflowGraphBuilder name(String name) {
        this.name = Objects.requireNonNull(name, "工作流名称不能为空");
        return this;
    }

    public WorkflowGraphBuilder addNode(String id, String kind) {
        return addNode(id, kind, null);
    }

    public WorkflowGraphBuilder addNode(String id, String kind, Map<String, Object> properties) {
        return addNode(new NodeDefinition(id, kind, properties));
    }

    public WorkflowGraphBuilder addNode(NodeDefinition node) {
        Objects.requireNonNull(node, "节点定义不能为空");
        if (nodes.putIfAbsent(node.getId(), node) != null) {
            throw new IllegalArgumentException(String.format("节点 ID '%s' 在工作流 '%s' 中已存在。", node.getId(), name));
        }
        log.debug("Workflow '{}': 添加了节点 '{}' (类型: {})", name, node.getId(), node.getKind());
        return this;
    }

    /**
     * 添加一条连接到目标节点默认端口 {@code input} 的边。
     */
    public WorkflowGraphBuilder addEdge(String sourceNodeId, String targetNodeId) {
        return addEdge(sourceNodeId, null, targetNodeId, null);
    }

    public WorkflowGraphBuilder addEdge(String sourceNodeId, String targetNodeId, String targetPort) {
        return addEdge(sourceNodeId, null, targetNodeId, targetPort);
    }

    public WorkflowGraphBuilder addEdge(String sourceNodeId, String sourcePort, String targetNodeId, String targetPort) {
        EdgeDefinition edge = new EdgeDefinition(sourceNodeId, sourcePort, targetNodeId, targetPort);
        if (edges.contains(edge)) {
            log.warn("Workflow '{}': 检测到重复边 {}，忽略添加。", name, edge);
            return this;
        }
        edges.add(edge);
        log.debug("Workflow '{}': 添加了边 {}", name, edge);
        return this;
    }

    /**
     * 构建图快照。
     *
     * @throws xyz.vvrf.bimflow.exception.UnknownNodeReferenceException 如果边引用了未添加的节点
     */
    public WorkflowGraph build() {
        WorkflowGraph graph = new WorkflowGraph(name, new ArrayList<>(nodes.values()), edges);
        log.info("Workflow '{}' 构建完成: {} 个节点, {} 条边", name, graph.size(), edges.size());
        return graph;
    }
}
