package com.tracegraph.visualizer.analysis;

import com.tracegraph.visualizer.model.GraphNode;
import com.tracegraph.visualizer.model.TraceGraph;
import com.tracegraph.visualizer.model.VisitState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 强连通分量（Tarjan low-link），沿出边遍历。
 *
 * 用显式工作栈代替递归，深图不会栈溢出；根节点和后继都按 id 升序取，
 * 所以同一张图每次算出的分量编号一致。分量编号从 0 开始，按分量闭合的先后分配，
 * 单个节点也算一个分量。
 */
@Component
@Slf4j
public class StronglyConnectedComponents {

    /**
     * @return 节点 id -> 分量 id，覆盖图中所有节点
     */
    public Map<Integer, Integer> getIdInStronglyConnectedComponents(TraceGraph graph) {
        TarjanRun run = new TarjanRun(graph);
        for (GraphNode node : graph.getSortedNodes()) {
            if (run.stateOf(node.getId()) == VisitState.UNVISITED) {
                run.strongConnect(node.getId());
            }
        }
        log.debug("SCC: nodes={}, components={}", graph.getNumberOfNodes(), run.currentComponentId);
        return run.componentOf;
    }

    /** 分量个数 */
    public static int countComponents(Map<Integer, Integer> idInComponents) {
        return (int) idInComponents.values().stream().distinct().count();
    }

    /** 工作栈上的一帧：节点 + 下一个要看的后继下标 */
    private static final class Frame {
        final int nodeId;
        final List<Integer> successors;
        int cursor;

        Frame(int nodeId, List<Integer> successors) {
            this.nodeId = nodeId;
            this.successors = successors;
        }
    }

    private static final class TarjanRun {
        private final TraceGraph graph;
        private final Map<Integer, VisitState> state = new HashMap<>();
        private final Map<Integer, Integer> visitTime = new HashMap<>();
        private final Map<Integer, Integer> minVisitTime = new HashMap<>();
        private final Map<Integer, Integer> componentOf = new LinkedHashMap<>();
        // 已访问但还没归入分量的节点
        private final Deque<Integer> activeStack = new ArrayDeque<>();
        private int currentTime = 1;
        private int currentComponentId = 0;

        TarjanRun(TraceGraph graph) {
            this.graph = graph;
        }

        VisitState stateOf(int nodeId) {
            return state.getOrDefault(nodeId, VisitState.UNVISITED);
        }

        void strongConnect(int rootId) {
            Deque<Frame> work = new ArrayDeque<>();
            work.push(enter(rootId));

            while (!work.isEmpty()) {
                Frame frame = work.peek();
                if (frame.cursor < frame.successors.size()) {
                    int next = frame.successors.get(frame.cursor++);
                    VisitState nextState = stateOf(next);
                    if (nextState == VisitState.UNVISITED) {
                        work.push(enter(next));
                    } else if (nextState == VisitState.ON_STACK) {
                        lowerTo(frame.nodeId, minVisitTime.get(next));
                    }
                    continue;
                }

                work.pop();
                int nodeId = frame.nodeId;
                if (minVisitTime.get(nodeId).equals(visitTime.get(nodeId))) {
                    closeComponent(nodeId);
                }
                // 回到父节点：子节点仍在栈上时把它的 low-link 传上去
                if (!work.isEmpty() && stateOf(nodeId) == VisitState.ON_STACK) {
                    lowerTo(work.peek().nodeId, minVisitTime.get(nodeId));
                }
            }
        }

        private Frame enter(int nodeId) {
            state.put(nodeId, VisitState.ON_STACK);
            visitTime.put(nodeId, currentTime);
            minVisitTime.put(nodeId, currentTime);
            currentTime++;
            activeStack.push(nodeId);

            GraphNode node = graph.getNode(nodeId).orElseThrow();
            List<Integer> successors = new ArrayList<>(node.getOutNeighbourIdToEdgeId().keySet());
            Collections.sort(successors);
            return new Frame(nodeId, successors);
        }

        private void lowerTo(int nodeId, int candidate) {
            if (candidate < minVisitTime.get(nodeId)) {
                minVisitTime.put(nodeId, candidate);
            }
        }

        private void closeComponent(int headId) {
            int popped;
            do {
                popped = activeStack.pop();
                state.put(popped, VisitState.ASSIGNED);
                componentOf.put(popped, currentComponentId);
            } while (popped != headId);
            currentComponentId++;
        }
    }
}
