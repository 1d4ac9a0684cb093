package com.tracegraph.visualizer.model;

import com.tracegraph.visualizer.exception.DuplicateIdException;
import com.tracegraph.visualizer.exception.MissingNodeException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 命令依赖图：独占持有所有节点和边，节点 / 边之间只通过 id 互相引用。
 *
 * 约束：
 * - 节点 id、边 id 在图内各自唯一
 * - 任意有序对 (source, sink) 之间至多一条边，重复添加直接忽略
 * - 节点的入边 / 出边表始终与当前边集合一致
 *
 * 非线程安全，调用方自行保证独占访问。
 */
public class TraceGraph {

    private static final Comparator<GraphNode> BY_ID = Comparator.comparingInt(GraphNode::getId);

    private final Map<Integer, GraphNode> nodeIdToNode = new HashMap<>();
    private final Map<Integer, GraphEdge> edgeIdToEdge = new HashMap<>();
    private int maxNodeId;
    private int maxEdgeId;

    /**
     * 创建一个带 n 个空节点的图，节点 id 为 1..n。
     */
    public static TraceGraph create(int numberOfNodes) {
        TraceGraph graph = new TraceGraph();
        for (int i = 0; i < numberOfNodes; i++) {
            graph.newNode("");
        }
        return graph;
    }

    public int getNumberOfNodes() {
        return nodeIdToNode.size();
    }

    public int getNumberOfEdges() {
        return edgeIdToEdge.size();
    }

    public int getMaxNodeId() {
        return maxNodeId;
    }

    public int getMaxEdgeId() {
        return maxEdgeId;
    }

    public Optional<GraphNode> getNode(int id) {
        return Optional.ofNullable(nodeIdToNode.get(id));
    }

    public Optional<GraphEdge> getEdge(int id) {
        return Optional.ofNullable(edgeIdToEdge.get(id));
    }

    public boolean containsNode(int id) {
        return nodeIdToNode.containsKey(id);
    }

    // ========= 节点 =========

    /**
     * 用下一个可用 id 新建节点并加入图中。
     */
    public GraphNode newNode(String label) {
        GraphNode node = new GraphNode(maxNodeId + 1, label);
        addNode(node);
        return node;
    }

    /**
     * @throws DuplicateIdException id 已存在
     */
    public void addNode(GraphNode node) {
        if (nodeIdToNode.containsKey(node.getId())) {
            throw DuplicateIdException.node(node.getId());
        }
        nodeIdToNode.put(node.getId(), node);
        if (node.getId() > maxNodeId) {
            maxNodeId = node.getId();
        }
    }

    /**
     * 删除节点及所有与之相连的边；节点不存在时什么也不做。
     */
    public void removeNodeById(int id) {
        GraphNode node = nodeIdToNode.get(id);
        if (node == null) {
            return;
        }
        // 先拷贝一份，removeEdgeById 会修改这两张表
        List<Integer> edgeIds = new ArrayList<>(node.getInNeighbourIdToEdgeId().values());
        edgeIds.addAll(node.getOutNeighbourIdToEdgeId().values());
        for (Integer edgeId : edgeIds) {
            removeEdgeById(edgeId);
        }
        nodeIdToNode.remove(id);
    }

    /**
     * 删除所有入度 + 出度为 0 的节点。
     *
     * @return 删除的节点数
     */
    public int removeNodesWithZeroDegree() {
        List<Integer> isolated = new ArrayList<>();
        for (GraphNode node : nodeIdToNode.values()) {
            if (node.getDegree() == 0) {
                isolated.add(node.getId());
            }
        }
        for (Integer id : isolated) {
            removeNodeById(id);
        }
        return isolated.size();
    }

    /**
     * 删除节点但保留经过它的连通性：每个入邻居连一条边到每个出邻居，再删掉节点本身。
     */
    public void elideNodePreservingEdges(int id) {
        GraphNode node = nodeIdToNode.get(id);
        if (node == null) {
            return;
        }
        List<Integer> sources = new ArrayList<>(node.getInNeighbourIdToEdgeId().keySet());
        List<Integer> sinks = new ArrayList<>(node.getOutNeighbourIdToEdgeId().keySet());
        for (Integer sourceId : sources) {
            for (Integer sinkId : sinks) {
                addEdgeById(sourceId, sinkId);
            }
        }
        removeNodeById(id);
    }

    // ========= 边 =========

    /**
     * 添加 source -> sink 边，已存在时直接返回原有的边。
     *
     * @throws MissingNodeException source 或 sink 不属于本图
     */
    public GraphEdge addEdge(GraphNode source, GraphNode sink) {
        return addEdge(source, sink, maxEdgeId + 1);
    }

    /**
     * 以指定 id 添加边。
     *
     * @throws DuplicateIdException 该边 id 已被其他边占用
     * @throws MissingNodeException source 或 sink 不属于本图
     */
    public GraphEdge addEdge(GraphNode source, GraphNode sink, int edgeId) {
        if (nodeIdToNode.get(source.getId()) != source) {
            throw MissingNodeException.edgeSource(source.getId());
        }
        if (nodeIdToNode.get(sink.getId()) != sink) {
            throw MissingNodeException.edgeSink(sink.getId());
        }
        Integer existing = source.getOutNeighbourIdToEdgeId().get(sink.getId());
        if (existing != null) {
            return edgeIdToEdge.get(existing);
        }
        if (edgeIdToEdge.containsKey(edgeId)) {
            throw DuplicateIdException.edge(edgeId);
        }

        GraphEdge edge = new GraphEdge(edgeId, source.getId(), sink.getId());
        edgeIdToEdge.put(edgeId, edge);
        source.putOutNeighbour(sink.getId(), edgeId);
        sink.putInNeighbour(source.getId(), edgeId);
        if (edgeId > maxEdgeId) {
            maxEdgeId = edgeId;
        }
        return edge;
    }

    /**
     * 按节点 id 添加边。
     *
     * @throws MissingNodeException 任一端点 id 不存在
     */
    public GraphEdge addEdgeById(int sourceId, int sinkId) {
        GraphNode source = nodeIdToNode.get(sourceId);
        if (source == null) {
            throw MissingNodeException.edgeSource(sourceId);
        }
        GraphNode sink = nodeIdToNode.get(sinkId);
        if (sink == null) {
            throw MissingNodeException.edgeSink(sinkId);
        }
        return addEdge(source, sink);
    }

    public void removeEdgeById(int id) {
        GraphEdge edge = edgeIdToEdge.remove(id);
        if (edge == null) {
            return;
        }
        GraphNode source = nodeIdToNode.get(edge.getSourceId());
        GraphNode sink = nodeIdToNode.get(edge.getSinkId());
        if (source != null) {
            source.removeOutNeighbour(edge.getSinkId());
        }
        if (sink != null) {
            sink.removeInNeighbour(edge.getSourceId());
        }
    }

    // ========= 有序遍历 =========

    public List<GraphNode> getSortedNodes() {
        List<GraphNode> nodes = new ArrayList<>(nodeIdToNode.values());
        nodes.sort(BY_ID);
        return nodes;
    }

    public List<GraphEdge> getSortedEdges() {
        List<GraphEdge> edges = new ArrayList<>(edgeIdToEdge.values());
        edges.sort(Comparator.comparingInt(GraphEdge::getId));
        return edges;
    }

    public List<GraphNode> getSortedInNeighbours(GraphNode node) {
        return getSortedNeighbours(node.getInNeighbourIdToEdgeId());
    }

    public List<GraphNode> getSortedOutNeighbours(GraphNode node) {
        return getSortedNeighbours(node.getOutNeighbourIdToEdgeId());
    }

    private List<GraphNode> getSortedNeighbours(Map<Integer, Integer> neighbourIdToEdgeId) {
        List<GraphNode> neighbours = new ArrayList<>(neighbourIdToEdgeId.size());
        for (Integer neighbourId : neighbourIdToEdgeId.keySet()) {
            neighbours.add(nodeIdToNode.get(neighbourId));
        }
        neighbours.sort(BY_ID);
        return neighbours;
    }
}
