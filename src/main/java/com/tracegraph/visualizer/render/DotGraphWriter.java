package com.tracegraph.visualizer.render;

import com.tracegraph.visualizer.model.GraphFormat;
import com.tracegraph.visualizer.model.GraphNode;
import com.tracegraph.visualizer.model.TraceGraph;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Graphviz digraph 格式。
 *
 * 标签原样输出、不做转义，调用方需保证标签里没有需要转义的字符。
 * 边按“每个节点的入边”输出：外层 sink id 升序，内层 source id 升序。
 */
@Component
public class DotGraphWriter implements GraphWriter {

    @Override
    public GraphFormat format() {
        return GraphFormat.DOT;
    }

    @Override
    public byte[] write(TraceGraph graph) {
        List<GraphNode> nodes = graph.getSortedNodes();
        StringBuilder sb = new StringBuilder();
        sb.append("digraph g {\n");
        for (GraphNode node : nodes) {
            sb.append(node.getId()).append("[label=").append(node.getLabel()).append("];\n");
        }
        for (GraphNode node : nodes) {
            for (GraphNode neighbour : graph.getSortedInNeighbours(node)) {
                sb.append(neighbour.getId()).append(" -> ").append(node.getId()).append(";\n");
            }
        }
        sb.append("}\n");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }
}
