package com.tracegraph.visualizer.model;

import com.tracegraph.visualizer.exception.DuplicateIdException;
import com.tracegraph.visualizer.exception.MissingNodeException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TraceGraphTest {

    private static TraceGraph cycleWithIsolatedNode() {
        TraceGraph g = TraceGraph.create(4);
        g.addEdgeById(1, 2);
        g.addEdgeById(2, 3);
        g.addEdgeById(3, 1);
        return g;
    }

    @Test
    void createAllocatesSequentialIds() {
        TraceGraph g = TraceGraph.create(3);

        assertThat(g.getNumberOfNodes()).isEqualTo(3);
        assertThat(g.getSortedNodes()).extracting(GraphNode::getId).containsExactly(1, 2, 3);
        assertThat(g.getMaxNodeId()).isEqualTo(3);
        assertThat(g.newNode("x").getId()).isEqualTo(4);
    }

    @Test
    void addNodeRejectsDuplicateId() {
        TraceGraph g = TraceGraph.create(2);

        assertThatThrownBy(() -> g.addNode(new GraphNode(2)))
                .isInstanceOf(DuplicateIdException.class)
                .hasMessage("Trying to add an existing node with id 2")
                .extracting("id").isEqualTo(2);
    }

    @Test
    void addNodeAdvancesMaxId() {
        TraceGraph g = new TraceGraph();
        g.addNode(new GraphNode(10));
        g.addNode(new GraphNode(3));

        assertThat(g.getMaxNodeId()).isEqualTo(10);
        assertThat(g.newNode("next").getId()).isEqualTo(11);
    }

    @Test
    void addEdgeIsIdempotent() {
        TraceGraph g = TraceGraph.create(2);
        GraphEdge first = g.addEdgeById(1, 2);
        GraphEdge second = g.addEdgeById(1, 2);

        assertThat(g.getNumberOfEdges()).isEqualTo(1);
        assertThat(second).isSameAs(first);
        assertThat(g.getMaxEdgeId()).isEqualTo(1);
    }

    @Test
    void oppositeDirectionIsADistinctEdge() {
        TraceGraph g = TraceGraph.create(2);
        g.addEdgeById(1, 2);
        g.addEdgeById(2, 1);

        assertThat(g.getNumberOfEdges()).isEqualTo(2);
    }

    @Test
    void addEdgeUpdatesBothAdjacencyMaps() {
        TraceGraph g = TraceGraph.create(2);
        GraphEdge edge = g.addEdgeById(1, 2);

        GraphNode source = g.getNode(1).orElseThrow();
        GraphNode sink = g.getNode(2).orElseThrow();
        assertThat(source.getOutNeighbourIdToEdgeId()).containsEntry(2, edge.getId());
        assertThat(sink.getInNeighbourIdToEdgeId()).containsEntry(1, edge.getId());
        assertThat(source.getInDegree()).isZero();
        assertThat(sink.getOutDegree()).isZero();
    }

    @Test
    void addEdgeByIdRejectsMissingEndpoints() {
        TraceGraph g = TraceGraph.create(2);

        assertThatThrownBy(() -> g.addEdgeById(7, 1))
                .isInstanceOf(MissingNodeException.class)
                .hasMessage("Adding edge from non-existent node with id 7");
        assertThatThrownBy(() -> g.addEdgeById(1, 9))
                .isInstanceOf(MissingNodeException.class)
                .hasMessage("Adding edge to non-existent node with id 9")
                .extracting("id").isEqualTo(9);
        assertThat(g.getNumberOfEdges()).isZero();
    }

    @Test
    void addEdgeRejectsNodesOwnedByAnotherGraph() {
        TraceGraph g = TraceGraph.create(1);
        GraphNode stranger = new GraphNode(1);

        assertThatThrownBy(() -> g.addEdge(stranger, g.getNode(1).orElseThrow()))
                .isInstanceOf(MissingNodeException.class);
    }

    @Test
    void explicitEdgeIdIsHonouredAndMustBeUnique() {
        TraceGraph g = TraceGraph.create(3);
        GraphNode n1 = g.getNode(1).orElseThrow();
        GraphNode n2 = g.getNode(2).orElseThrow();
        GraphNode n3 = g.getNode(3).orElseThrow();

        assertThat(g.addEdge(n1, n2, 40).getId()).isEqualTo(40);
        assertThat(g.getMaxEdgeId()).isEqualTo(40);
        assertThat(g.addEdge(n2, n3).getId()).isEqualTo(41);
        assertThatThrownBy(() -> g.addEdge(n1, n3, 40))
                .isInstanceOf(DuplicateIdException.class)
                .hasMessage("Trying to add an existing edge with id 40");
    }

    @Test
    void removeEdgeClearsBothDirections() {
        TraceGraph g = TraceGraph.create(2);
        GraphEdge edge = g.addEdgeById(1, 2);

        g.removeEdgeById(edge.getId());
        g.removeEdgeById(edge.getId());

        assertThat(g.getNumberOfEdges()).isZero();
        assertThat(g.getNode(1).orElseThrow().getDegree()).isZero();
        assertThat(g.getNode(2).orElseThrow().getDegree()).isZero();
    }

    @Test
    void removeNodeLeavesNoDanglingReferences() {
        TraceGraph g = TraceGraph.create(4);
        g.addEdgeById(1, 2);
        g.addEdgeById(2, 3);
        g.addEdgeById(3, 2);
        g.addEdgeById(2, 2);
        g.addEdgeById(4, 2);

        g.removeNodeById(2);

        assertThat(g.containsNode(2)).isFalse();
        assertThat(g.getNumberOfEdges()).isZero();
        for (GraphEdge edge : g.getSortedEdges()) {
            assertThat(edge.getSourceId()).isNotEqualTo(2);
            assertThat(edge.getSinkId()).isNotEqualTo(2);
        }
        for (GraphNode node : g.getSortedNodes()) {
            assertThat(node.getInNeighbourIdToEdgeId()).doesNotContainKey(2);
            assertThat(node.getOutNeighbourIdToEdgeId()).doesNotContainKey(2);
        }
    }

    @Test
    void removeAbsentNodeIsNoOp() {
        TraceGraph g = cycleWithIsolatedNode();

        g.removeNodeById(99);

        assertThat(g.getNumberOfNodes()).isEqualTo(4);
        assertThat(g.getNumberOfEdges()).isEqualTo(3);
    }

    @Test
    void removeNodesWithZeroDegreeDropsOnlyIsolatedNodes() {
        TraceGraph g = cycleWithIsolatedNode();

        int removed = g.removeNodesWithZeroDegree();

        assertThat(removed).isEqualTo(1);
        assertThat(g.getSortedNodes()).extracting(GraphNode::getId).containsExactly(1, 2, 3);
        assertThat(g.getNumberOfEdges()).isEqualTo(3);
    }

    @Test
    void removeNodesWithZeroDegreeHandlesManyIsolatedNodes() {
        TraceGraph g = TraceGraph.create(500);
        g.addEdgeById(1, 500);

        g.removeNodesWithZeroDegree();

        assertThat(g.getSortedNodes()).extracting(GraphNode::getId).containsExactly(1, 500);
    }

    @Test
    void elisionConnectsEveryInNeighbourToEveryOutNeighbour() {
        TraceGraph g = TraceGraph.create(5);
        g.addEdgeById(1, 3);
        g.addEdgeById(2, 3);
        g.addEdgeById(3, 4);
        g.addEdgeById(3, 5);
        g.addEdgeById(1, 4);

        g.elideNodePreservingEdges(3);

        assertThat(g.containsNode(3)).isFalse();
        assertThat(outNeighbours(g, 1)).containsExactly(4, 5);
        assertThat(outNeighbours(g, 2)).containsExactly(4, 5);
        assertThat(g.getNumberOfEdges()).isEqualTo(4);
    }

    @Test
    void elisionOfTwoCycleMemberCreatesSelfLoop() {
        TraceGraph g = TraceGraph.create(2);
        g.addEdgeById(1, 2);
        g.addEdgeById(2, 1);

        g.elideNodePreservingEdges(2);

        assertThat(outNeighbours(g, 1)).containsExactly(1);
        assertThat(g.getNumberOfEdges()).isEqualTo(1);
    }

    @Test
    void elisionOfAbsentNodeIsNoOp() {
        TraceGraph g = cycleWithIsolatedNode();

        g.elideNodePreservingEdges(42);

        assertThat(g.getNumberOfNodes()).isEqualTo(4);
    }

    @Test
    void sortedNeighboursAreAscending() {
        TraceGraph g = TraceGraph.create(6);
        g.addEdgeById(6, 1);
        g.addEdgeById(6, 4);
        g.addEdgeById(6, 2);
        g.addEdgeById(5, 2);
        g.addEdgeById(3, 2);

        assertThat(outNeighbours(g, 6)).containsExactly(1, 2, 4);
        assertThat(g.getSortedInNeighbours(g.getNode(2).orElseThrow()))
                .extracting(GraphNode::getId).containsExactly(3, 5, 6);
    }

    private static List<Integer> outNeighbours(TraceGraph g, int id) {
        return g.getSortedOutNeighbours(g.getNode(id).orElseThrow()).stream().map(GraphNode::getId).toList();
    }
}
