package com.tracegraph.visualizer.render;

import com.tracegraph.visualizer.model.GraphFormat;
import com.tracegraph.visualizer.model.TraceGraph;

/**
 * 把图的当前状态输出成某种文本图描述格式。
 * 实现必须按 id 升序输出节点 / 边，同一状态两次输出逐字节相同。
 */
public interface GraphWriter {

    GraphFormat format();

    /**
     * @return UTF-8 编码的输出
     */
    byte[] write(TraceGraph graph);
}
