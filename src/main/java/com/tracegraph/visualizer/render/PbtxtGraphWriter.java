package com.tracegraph.visualizer.render;

import com.tracegraph.visualizer.model.GraphFormat;
import com.tracegraph.visualizer.model.GraphNode;
import com.tracegraph.visualizer.model.TraceGraph;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 每个节点一个 node { ... } 记录的 pbtxt 格式。
 *
 * 注意：name 和 op 都取节点的 label（不是 name 字段），input 也是入邻居的 label，
 * 所以分析阶段加上的前缀 / 后缀会出现在这些标识里。
 */
@Component
public class PbtxtGraphWriter implements GraphWriter {

    @Override
    public GraphFormat format() {
        return GraphFormat.PBTXT;
    }

    @Override
    public byte[] write(TraceGraph graph) {
        StringBuilder sb = new StringBuilder();
        for (GraphNode node : graph.getSortedNodes()) {
            String label = node.getLabel();
            sb.append("node {\n");
            sb.append("name: \"").append(label).append("\"\n");
            sb.append("op: \"").append(label).append("\"\n");
            for (GraphNode neighbour : graph.getSortedInNeighbours(node)) {
                sb.append("input: \"").append(neighbour.getLabel()).append("\"\n");
            }
            sb.append("attr {\n");
            sb.append("key: \"").append(node.getAttributes() == null ? "" : node.getAttributes()).append("\"\n");
            sb.append("}\n");
            sb.append("}\n");
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }
}
