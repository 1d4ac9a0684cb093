package com.tracegraph.visualizer.analysis;

import com.tracegraph.visualizer.model.GraphNode;
import com.tracegraph.visualizer.model.TraceGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 按帧分组：从每个 endOfFrame 节点出发做 BFS，同时沿出边和子命令关系扩展，
 * 到达的节点标签加上 "FRAME<n>/" 前缀。
 *
 * 起点按 id 升序，帧号从 1 开始。一个节点只属于第一个到达它的帧；
 * 任何帧都到不了的节点保持原标签。
 */
@Component
@Slf4j
public class FrameGrouper {

    static final String FRAME = "FRAME";

    /**
     * @return 节点 id -> 帧号，只包含被某一帧覆盖到的节点
     */
    public Map<Integer, Integer> joinNodesByFrame(TraceGraph graph) {
        Set<Integer> visited = new HashSet<>();
        Map<Integer, Integer> frameOf = new LinkedHashMap<>();
        int frameNumber = 1;

        for (GraphNode node : graph.getSortedNodes()) {
            if (visited.contains(node.getId()) || !node.isEndOfFrame()) {
                continue;
            }
            List<GraphNode> frameNodes = bfs(graph, node, visited);
            for (GraphNode frameNode : frameNodes) {
                frameNode.getDecoratedLabel().addPrefix(FRAME + frameNumber + "/");
                frameOf.put(frameNode.getId(), frameNumber);
            }
            frameNumber++;
        }
        log.debug("Frame grouping: frames={}, coveredNodes={}, totalNodes={}",
                frameNumber - 1, frameOf.size(), graph.getNumberOfNodes());
        return frameOf;
    }

    private List<GraphNode> bfs(TraceGraph graph, GraphNode source, Set<Integer> visited) {
        List<GraphNode> queue = new ArrayList<>();
        visited.add(source.getId());
        queue.add(source);

        int head = 0;
        while (head < queue.size()) {
            GraphNode current = queue.get(head++);
            for (GraphNode neighbour : graph.getSortedOutNeighbours(current)) {
                if (visited.add(neighbour.getId())) {
                    queue.add(neighbour);
                }
            }
            for (Integer subCommandId : current.getSubCommandNodeIds()) {
                if (visited.contains(subCommandId)) {
                    continue;
                }
                Optional<GraphNode> subCommand = graph.getNode(subCommandId);
                if (subCommand.isEmpty()) {
                    log.warn("Skip sub-command {} of node {}: not in graph", subCommandId, current.getId());
                    continue;
                }
                visited.add(subCommandId);
                queue.add(subCommand.get());
            }
        }
        return queue;
    }
}
