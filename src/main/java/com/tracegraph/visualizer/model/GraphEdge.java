package com.tracegraph.visualizer.model;

import lombok.Getter;
import lombok.Setter;

/**
 * 有向边，source / sink 只记节点 id。
 */
@Getter
public class GraphEdge {
    private final int id;
    private final int sourceId;
    private final int sinkId;
    @Setter
    private String label;     // 可选

    public GraphEdge(int id, int sourceId, int sinkId) {
        this.id = id;
        this.sourceId = sourceId;
        this.sinkId = sinkId;
    }

    @Override
    public String toString() {
        return "GraphEdge{id=" + id + ", " + sourceId + " -> " + sinkId + "}";
    }
}
