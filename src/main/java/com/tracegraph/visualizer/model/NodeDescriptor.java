package com.tracegraph.visualizer.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 外部构图方给出的节点描述。
 */
@Data
public class NodeDescriptor {

    /** 为 null 时按 maxNodeId + 1 自动分配 */
    private Integer id;

    private String label;
    private String name;
    private String attributes;
    private int commandTypeId;
    private boolean endOfFrame;

    /** 子命令节点 id，按顺序；必须指向同一批描述里的节点 */
    private List<Integer> subCommandIds = new ArrayList<>();
}
