package com.tracegraph.visualizer.model;

/**
 * SCC 遍历中每个节点的访问状态。
 */
public enum VisitState {
    UNVISITED,
    /** 已访问，仍在活动栈上，尚未归入任何分量 */
    ON_STACK,
    /** 已弹栈并分配了分量 id */
    ASSIGNED
}
