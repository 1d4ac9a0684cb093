package com.tracegraph.visualizer.exception;

/**
 * 引用了图中不存在的节点。
 */
public class MissingNodeException extends GraphStructureException {

    public MissingNodeException(String message, int id) {
        super(message, id);
    }

    public static MissingNodeException edgeSource(int id) {
        return new MissingNodeException(String.format("Adding edge from non-existent node with id %d", id), id);
    }

    public static MissingNodeException edgeSink(int id) {
        return new MissingNodeException(String.format("Adding edge to non-existent node with id %d", id), id);
    }
}
