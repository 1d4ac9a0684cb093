package com.tracegraph.visualizer.exception;

/**
 * 添加的节点（或显式指定 id 的边）与已有 id 冲突。
 */
public class DuplicateIdException extends GraphStructureException {

    public DuplicateIdException(String message, int id) {
        super(message, id);
    }

    public static DuplicateIdException node(int id) {
        return new DuplicateIdException(String.format("Trying to add an existing node with id %d", id), id);
    }

    public static DuplicateIdException edge(int id) {
        return new DuplicateIdException(String.format("Trying to add an existing edge with id %d", id), id);
    }
}
