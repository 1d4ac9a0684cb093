package com.tracegraph.visualizer.service;

import com.tracegraph.visualizer.model.GraphFormat;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * tracegraph.visualization.* 配置：控制可视化流水线里跑哪些阶段。
 */
@Data
@ConfigurationProperties(prefix = "tracegraph.visualization")
public class VisualizationProperties {

    /** 标注之前先删除孤立节点（删除后 markUnused 不会再看到任何节点） */
    private boolean elideZeroDegree = false;

    /** 按命令类型折叠求 SCC，加 /SCC<n> 后缀 */
    private boolean collapseByCommandType = true;

    /** 按帧分组，加 FRAME<n>/ 前缀 */
    private boolean groupByFrame = true;

    /** 孤立节点加 UNUSED/ 前缀 */
    private boolean markUnused = true;

    private GraphFormat defaultFormat = GraphFormat.DOT;
}
