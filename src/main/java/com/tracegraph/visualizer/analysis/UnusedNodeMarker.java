package com.tracegraph.visualizer.analysis;

import com.tracegraph.visualizer.model.GraphNode;
import com.tracegraph.visualizer.model.TraceGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 给入度 + 出度为 0 的节点加 "UNUSED/" 前缀。只改标签，不删节点。
 */
@Component
@Slf4j
public class UnusedNodeMarker {

    static final String UNUSED = "UNUSED";

    /**
     * @return 被标记的节点数
     */
    public int joinNodesWithZeroDegree(TraceGraph graph) {
        int marked = 0;
        for (GraphNode node : graph.getSortedNodes()) {
            if (node.getDegree() == 0) {
                node.getDecoratedLabel().addPrefix(UNUSED + "/");
                marked++;
            }
        }
        log.debug("Marked {} unused node(s)", marked);
        return marked;
    }
}
