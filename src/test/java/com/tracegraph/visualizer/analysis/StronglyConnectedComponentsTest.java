package com.tracegraph.visualizer.analysis;

import com.tracegraph.visualizer.model.GraphNode;
import com.tracegraph.visualizer.model.TraceGraph;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StronglyConnectedComponentsTest {

    private final StronglyConnectedComponents scc = new StronglyConnectedComponents();

    @Test
    void threeCycleSharesOneComponentAndIsolatedNodeGetsAnother() {
        TraceGraph g = TraceGraph.create(4);
        g.addEdgeById(1, 2);
        g.addEdgeById(2, 3);
        g.addEdgeById(3, 1);

        Map<Integer, Integer> ids = scc.getIdInStronglyConnectedComponents(g);

        assertThat(ids).hasSize(4);
        assertThat(ids.get(1)).isEqualTo(ids.get(2)).isEqualTo(ids.get(3));
        assertThat(ids.get(4)).isNotEqualTo(ids.get(1));
        assertThat(ids).containsEntry(1, 0).containsEntry(4, 1);
    }

    @Test
    void acyclicGraphYieldsOneSingletonPerNode() {
        TraceGraph g = TraceGraph.create(5);
        g.addEdgeById(1, 2);
        g.addEdgeById(1, 3);
        g.addEdgeById(2, 4);
        g.addEdgeById(3, 4);
        g.addEdgeById(4, 5);

        Map<Integer, Integer> ids = scc.getIdInStronglyConnectedComponents(g);

        assertThat(StronglyConnectedComponents.countComponents(ids)).isEqualTo(5);
        // 先闭合的是最深的节点
        assertThat(ids).containsEntry(5, 0).containsEntry(4, 1).containsEntry(1, 4);
    }

    @Test
    void selfLoopIsItsOwnComponent() {
        TraceGraph g = TraceGraph.create(2);
        g.addEdgeById(1, 1);
        g.addEdgeById(1, 2);

        Map<Integer, Integer> ids = scc.getIdInStronglyConnectedComponents(g);

        assertThat(StronglyConnectedComponents.countComponents(ids)).isEqualTo(2);
    }

    @Test
    void emptyGraphYieldsEmptyMapping() {
        assertThat(scc.getIdInStronglyConnectedComponents(new TraceGraph())).isEmpty();
    }

    @Test
    void repeatedRunsAreIdentical() {
        TraceGraph g = randomGraph(40, 90, 7L);

        assertThat(scc.getIdInStronglyConnectedComponents(g))
                .isEqualTo(scc.getIdInStronglyConnectedComponents(g));
    }

    @Test
    void deepChainDoesNotOverflowTheStack() {
        int n = 100_000;
        TraceGraph g = TraceGraph.create(n);
        for (int i = 1; i < n; i++) {
            g.addEdgeById(i, i + 1);
        }
        g.addEdgeById(n, 1);

        Map<Integer, Integer> ids = scc.getIdInStronglyConnectedComponents(g);

        assertThat(StronglyConnectedComponents.countComponents(ids)).isEqualTo(1);
    }

    @Test
    void componentsMatchMutualReachability() {
        for (long seed = 1; seed <= 5; seed++) {
            TraceGraph g = randomGraph(25, 45, seed);
            Map<Integer, Integer> ids = scc.getIdInStronglyConnectedComponents(g);

            Map<Integer, Set<Integer>> reach = new HashMap<>();
            for (GraphNode node : g.getSortedNodes()) {
                reach.put(node.getId(), reachable(g, node));
            }
            for (GraphNode a : g.getSortedNodes()) {
                for (GraphNode b : g.getSortedNodes()) {
                    boolean mutual = reach.get(a.getId()).contains(b.getId())
                            && reach.get(b.getId()).contains(a.getId());
                    assertThat(ids.get(a.getId()).equals(ids.get(b.getId())))
                            .as("seed=%d, %d vs %d", seed, a.getId(), b.getId())
                            .isEqualTo(mutual);
                }
            }
        }
    }

    private static Set<Integer> reachable(TraceGraph g, GraphNode from) {
        Set<Integer> seen = new HashSet<>();
        Deque<GraphNode> queue = new ArrayDeque<>();
        seen.add(from.getId());
        queue.add(from);
        while (!queue.isEmpty()) {
            for (GraphNode next : g.getSortedOutNeighbours(queue.poll())) {
                if (seen.add(next.getId())) {
                    queue.add(next);
                }
            }
        }
        return seen;
    }

    static TraceGraph randomGraph(int nodes, int edges, long seed) {
        Random random = new Random(seed);
        TraceGraph g = TraceGraph.create(nodes);
        for (int i = 0; i < edges; i++) {
            g.addEdgeById(1 + random.nextInt(nodes), 1 + random.nextInt(nodes));
        }
        return g;
    }
}
