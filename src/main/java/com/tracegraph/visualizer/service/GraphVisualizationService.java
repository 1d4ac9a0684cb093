package com.tracegraph.visualizer.service;

import com.tracegraph.visualizer.analysis.CommandTypeCollapser;
import com.tracegraph.visualizer.analysis.FrameGrouper;
import com.tracegraph.visualizer.analysis.UnusedNodeMarker;
import com.tracegraph.visualizer.model.GraphFormat;
import com.tracegraph.visualizer.model.TraceGraph;
import com.tracegraph.visualizer.render.GraphWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 可视化流水线：裁剪 -> 类型 SCC -> 帧分组 -> UNUSED 标记 -> 输出。
 *
 * 各阶段会直接修改传入图的节点标签（以及裁剪时的结构），同一张图不要重复跑。
 */
@Component
@Slf4j
public class GraphVisualizationService {

    private final VisualizationProperties properties;
    private final CommandTypeCollapser commandTypeCollapser;
    private final FrameGrouper frameGrouper;
    private final UnusedNodeMarker unusedNodeMarker;
    private final Map<GraphFormat, GraphWriter> writers = new EnumMap<>(GraphFormat.class);

    public GraphVisualizationService(VisualizationProperties properties,
                                     CommandTypeCollapser commandTypeCollapser,
                                     FrameGrouper frameGrouper,
                                     UnusedNodeMarker unusedNodeMarker,
                                     List<GraphWriter> graphWriters) {
        this.properties = properties;
        this.commandTypeCollapser = commandTypeCollapser;
        this.frameGrouper = frameGrouper;
        this.unusedNodeMarker = unusedNodeMarker;
        for (GraphWriter writer : graphWriters) {
            GraphWriter previous = writers.put(writer.format(), writer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate GraphWriter for format " + writer.format()
                        + ": " + previous.getClass().getName() + ", " + writer.getClass().getName());
            }
        }
    }

    public byte[] visualize(TraceGraph graph) {
        return visualize(graph, properties.getDefaultFormat());
    }

    public byte[] visualize(TraceGraph graph, GraphFormat format) {
        return visualize(graph, format, List.of());
    }

    /**
     * @param elideIds 先按 id 升序省略这些节点（保留经过它们的连通性），不存在的 id 忽略
     */
    public byte[] visualize(TraceGraph graph, GraphFormat format, Collection<Integer> elideIds) {
        GraphWriter writer = writers.get(format);
        if (writer == null) {
            throw new IllegalArgumentException("No GraphWriter registered for format " + format);
        }

        for (Integer id : new TreeSet<>(elideIds)) {
            graph.elideNodePreservingEdges(id);
        }
        if (properties.isElideZeroDegree()) {
            int removed = graph.removeNodesWithZeroDegree();
            log.debug("Removed {} zero-degree node(s)", removed);
        }
        if (properties.isCollapseByCommandType()) {
            commandTypeCollapser.collapseByCommandType(graph);
        }
        if (properties.isGroupByFrame()) {
            frameGrouper.joinNodesByFrame(graph);
        }
        if (properties.isMarkUnused()) {
            unusedNodeMarker.joinNodesWithZeroDegree(graph);
        }

        byte[] output = writer.write(graph);
        log.info("Graph rendered: format={}, nodes={}, edges={}, bytes={}",
                format, graph.getNumberOfNodes(), graph.getNumberOfEdges(), output.length);
        return output;
    }
}
