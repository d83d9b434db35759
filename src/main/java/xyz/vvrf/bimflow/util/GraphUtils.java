package xyz.vvrf.bimflow.util;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.bimflow.core.EdgeDefinition;
import xyz.vvrf.bimflow.core.WorkflowGraph;
import xyz.vvrf.bimflow.exception.CyclicGraphException;
import xyz.vvrf.bimflow.exception.UnknownNodeReferenceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 提供工作流图的结构验证、环检测和拓扑排序的工具方法。
 *
 * @author ruifeng.wen
 */
@Slf4j
public final class GraphUtils {

    private GraphUtils() {}

    /**
     * 验证每条边引用的源节点和目标节点都存在。
     *
     * @param nodeIds      图中所有节点 ID
     * @param edges        边定义列表
     * @param workflowName 工作流名称
     * @throws UnknownNodeReferenceException 如果边引用了不存在的节点
     */
    public static void validateEdgeReferences(
            Collection<String> nodeIds,
            List<EdgeDefinition> edges,
            String workflowName) {

        for (EdgeDefinition edge : edges) {
            if (!nodeIds.contains(edge.getSourceNodeId())) {
                throw new UnknownNodeReferenceException(workflowName, edge.getSourceNodeId(), edge.toString());
            }
            if (!nodeIds.contains(edge.getTargetNodeId())) {
                throw new UnknownNodeReferenceException(workflowName, edge.getTargetNodeId(), edge.toString());
            }
        }
    }

    /**
     * 使用深度优先搜索 (DFS) 计算拓扑排序，同时检测环。
     * <p>
     * 按图中节点的自然顺序依次从未访问节点出发，沿出边遍历；
     * 一个节点的所有下游都访问完毕后，将其插入结果列表的<b>头部</b>。
     * 对同一张图，结果总是相同的。
     *
     * @param graph 工作流图
     * @return 按拓扑顺序排列的节点 ID 列表：对每条边 (u -> v)，u 都在 v 之前
     * @throws CyclicGraphException 如果检测到环（包括自环）
     */
    public static List<String> topologicalSort(WorkflowGraph graph) {
        String workflowName = graph.getName();
        log.debug("Workflow '{}': Starting topological sort...", workflowName);

        Map<String, List<String>> adj = buildAdjacencyList(graph.getNodeIds(), graph.getEdges());
        Set<String> visited = new HashSet<>();  // 已完全访问的节点
        Set<String> visiting = new HashSet<>(); // 当前递归路径上的节点
        LinkedList<String> sortedOrder = new LinkedList<>();

        for (String nodeId : graph.getNodeIds()) {
            if (!visited.contains(nodeId)) {
                visit(nodeId, adj, visited, visiting, sortedOrder, workflowName);
            }
        }

        log.debug("Workflow '{}': Topological sort successful: {}", workflowName, sortedOrder);
        return Collections.unmodifiableList(new ArrayList<>(sortedOrder));
    }

    private static void visit(
            String nodeId,
            Map<String, List<String>> adj,
            Set<String> visited,
            Set<String> visiting,
            LinkedList<String> sortedOrder,
            String workflowName) {

        visiting.add(nodeId);

        for (String neighbor : adj.getOrDefault(nodeId, Collections.emptyList())) {
            if (visiting.contains(neighbor)) {
                throw new CyclicGraphException(workflowName, nodeId, neighbor);
            }
            if (!visited.contains(neighbor)) {
                visit(neighbor, adj, visited, visiting, sortedOrder, workflowName);
            }
        }

        visiting.remove(nodeId); // 回溯
        visited.add(nodeId);
        sortedOrder.addFirst(nodeId);
    }

    /**
     * 仅检测环，不关心顺序。
     *
     * @throws CyclicGraphException 如果检测到环
     */
    public static void detectCycles(WorkflowGraph graph) {
        topologicalSort(graph);
    }

    /**
     * 构建邻接表 (源节点 -> 目标节点列表)。每个节点都有一项，后继按边的顺序排列。
     */
    static Map<String, List<String>> buildAdjacencyList(List<String> nodeIds, List<EdgeDefinition> edges) {
        Map<String, List<String>> adj = new LinkedHashMap<>();
        for (String nodeId : nodeIds) {
            adj.put(nodeId, new ArrayList<>());
        }
        for (EdgeDefinition edge : edges) {
            adj.computeIfAbsent(edge.getSourceNodeId(), k -> new ArrayList<>())
                    .add(edge.getTargetNodeId());
        }
        return adj;
    }
}
