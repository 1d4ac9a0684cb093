package com.tracegraph.visualizer.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 图中的一个命令节点。
 *
 * 邻接关系只存 id：邻居节点 id -> 连接它们的边 id，入边 / 出边各一份。
 * 这两张表只由 {@link TraceGraph} 维护，外部只读。
 */
@Getter
public class GraphNode {

    private final int id;

    /** 命令类型，只在按类型折叠 SCC 时使用 */
    @Setter
    private int commandTypeId;

    private final NodeLabel decoratedLabel;

    @Setter
    private String name;

    /** 原样输出为 pbtxt 中 attr 的 key */
    @Setter
    private String attributes;

    /** 帧分组的起点标记 */
    @Setter
    private boolean endOfFrame;

    // 子命令：独立于边的组合关系，只引用不拥有
    private final List<Integer> subCommandNodeIds = new ArrayList<>();

    private final Map<Integer, Integer> inNeighbourIdToEdgeId = new HashMap<>();
    private final Map<Integer, Integer> outNeighbourIdToEdgeId = new HashMap<>();

    public GraphNode(int id) {
        this(id, "");
    }

    public GraphNode(int id, String label) {
        this.id = id;
        this.decoratedLabel = new NodeLabel(label);
    }

    /** 当前完整标签（含各分析阶段叠加的前缀 / 后缀） */
    public String getLabel() {
        return decoratedLabel.render();
    }

    public void setLabel(String label) {
        decoratedLabel.reset(label);
    }

    public void addSubCommandNode(GraphNode subCommandNode) {
        subCommandNodeIds.add(subCommandNode.getId());
    }

    public void addSubCommandNodeId(int subCommandNodeId) {
        subCommandNodeIds.add(subCommandNodeId);
    }

    public List<Integer> getSubCommandNodeIds() {
        return Collections.unmodifiableList(subCommandNodeIds);
    }

    public Map<Integer, Integer> getInNeighbourIdToEdgeId() {
        return Collections.unmodifiableMap(inNeighbourIdToEdgeId);
    }

    public Map<Integer, Integer> getOutNeighbourIdToEdgeId() {
        return Collections.unmodifiableMap(outNeighbourIdToEdgeId);
    }

    public int getInDegree() {
        return inNeighbourIdToEdgeId.size();
    }

    public int getOutDegree() {
        return outNeighbourIdToEdgeId.size();
    }

    public int getDegree() {
        return getInDegree() + getOutDegree();
    }

    void putInNeighbour(int neighbourId, int edgeId) {
        inNeighbourIdToEdgeId.put(neighbourId, edgeId);
    }

    void putOutNeighbour(int neighbourId, int edgeId) {
        outNeighbourIdToEdgeId.put(neighbourId, edgeId);
    }

    void removeInNeighbour(int neighbourId) {
        inNeighbourIdToEdgeId.remove(neighbourId);
    }

    void removeOutNeighbour(int neighbourId) {
        outNeighbourIdToEdgeId.remove(neighbourId);
    }

    @Override
    public String toString() {
        return "GraphNode{id=" + id + ", label=" + getLabel() + "}";
    }
}
