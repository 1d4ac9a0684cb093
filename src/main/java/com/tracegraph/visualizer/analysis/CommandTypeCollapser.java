package com.tracegraph.visualizer.analysis;

import com.tracegraph.visualizer.model.GraphNode;
import com.tracegraph.visualizer.model.TraceGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * 按命令类型折叠后求强连通分量，再把结果以 "/SCC<n>" 后缀写回原图节点。
 *
 * 投影图：每个出现过的 commandTypeId 一个节点（节点 id 就是类型 id），
 * 原图中每条边 a -> b 对应投影图中 type(a) -> type(b)，重复边自动去重。
 * 回答的是“这个节点的类型属于哪一组互相依赖的类型”，不是节点级别的环。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CommandTypeCollapser {

    static final String SCC_PREFIX = "SCC";

    private final StronglyConnectedComponents sccAnalyzer;

    /**
     * @return commandTypeId -> 投影图中的分量 id
     */
    public Map<Integer, Integer> collapseByCommandType(TraceGraph graph) {
        TraceGraph projection = buildTypeProjection(graph);
        Map<Integer, Integer> typeToComponent = sccAnalyzer.getIdInStronglyConnectedComponents(projection);

        for (GraphNode node : graph.getSortedNodes()) {
            Integer componentId = typeToComponent.get(node.getCommandTypeId());
            node.getDecoratedLabel().addSuffix("/" + SCC_PREFIX + componentId);
        }
        log.debug("Command type projection: types={}, typeEdges={}, components={}",
                projection.getNumberOfNodes(), projection.getNumberOfEdges(),
                StronglyConnectedComponents.countComponents(typeToComponent));
        return typeToComponent;
    }

    TraceGraph buildTypeProjection(TraceGraph graph) {
        TraceGraph projection = new TraceGraph();
        List<GraphNode> nodes = graph.getSortedNodes();
        for (GraphNode node : nodes) {
            if (!projection.containsNode(node.getCommandTypeId())) {
                projection.addNode(new GraphNode(node.getCommandTypeId()));
            }
        }
        for (GraphNode node : nodes) {
            for (GraphNode neighbour : graph.getSortedOutNeighbours(node)) {
                projection.addEdgeById(node.getCommandTypeId(), neighbour.getCommandTypeId());
            }
        }
        return projection;
    }
}
