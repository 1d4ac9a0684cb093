package com.tracegraph.visualizer.assemble;

import com.tracegraph.visualizer.exception.MissingNodeException;
import com.tracegraph.visualizer.model.EdgeDescriptor;
import com.tracegraph.visualizer.model.GraphEdge;
import com.tracegraph.visualizer.model.GraphNode;
import com.tracegraph.visualizer.model.NodeDescriptor;
import com.tracegraph.visualizer.model.TraceGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把外部给出的节点 / 边描述组装成 {@link TraceGraph}。
 *
 * 顺序：
 * 1. 按列表顺序建节点（id 为空的自动分配 maxNodeId + 1）
 * 2. 所有节点就位后再解析子命令引用
 * 3. 最后加边，重复的 (source, sink) 自动吸收
 *
 * 这里不理解任何命令语义，只检查图结构约束。
 */
@Component
@Slf4j
public class GraphAssembler {

    /**
     * @throws com.tracegraph.visualizer.exception.DuplicateIdException 节点 id 重复
     * @throws MissingNodeException 边或子命令引用了不存在的节点
     */
    public TraceGraph assemble(List<NodeDescriptor> nodes, List<EdgeDescriptor> edges) {
        TraceGraph graph = new TraceGraph();
        if (nodes == null || nodes.isEmpty()) {
            return graph;
        }

        List<GraphNode> created = new ArrayList<>(nodes.size());
        for (NodeDescriptor d : nodes) {
            GraphNode node;
            if (d.getId() == null) {
                node = graph.newNode(d.getLabel());
            } else {
                node = new GraphNode(d.getId(), d.getLabel());
                graph.addNode(node);
            }
            node.setName(d.getName());
            node.setAttributes(d.getAttributes());
            node.setCommandTypeId(d.getCommandTypeId());
            node.setEndOfFrame(d.isEndOfFrame());
            created.add(node);
        }

        // 子命令可以引用列表后面的节点，所以单独一轮
        for (int i = 0; i < created.size(); i++) {
            GraphNode node = created.get(i);
            List<Integer> subCommandIds = nodes.get(i).getSubCommandIds();
            if (subCommandIds == null) {
                continue;
            }
            for (Integer subCommandId : subCommandIds) {
                if (subCommandId == null || !graph.containsNode(subCommandId)) {
                    throw new MissingNodeException(String.format(
                            "Node %d references non-existent sub-command node with id %d",
                            node.getId(), subCommandId), subCommandId == null ? -1 : subCommandId);
                }
                node.addSubCommandNodeId(subCommandId);
            }
        }

        if (edges != null) {
            for (EdgeDescriptor d : edges) {
                GraphEdge edge = graph.addEdgeById(d.getSourceId(), d.getSinkId());
                if (d.getLabel() != null) {
                    edge.setLabel(d.getLabel());
                }
            }
        }

        log.debug("Assembled graph: nodes={}, edges={} (edge descriptors={})",
                graph.getNumberOfNodes(), graph.getNumberOfEdges(), edges == null ? 0 : edges.size());
        return graph;
    }
}
