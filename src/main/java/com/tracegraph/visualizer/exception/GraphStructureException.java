package com.tracegraph.visualizer.exception;

import lombok.Getter;

/**
 * 图结构约束被破坏时抛出，携带出问题的 id。
 */
@Getter
public class GraphStructureException extends RuntimeException {

    private final int id;

    public GraphStructureException(String message, int id) {
        super(message);
        this.id = id;
    }
}
