package com.tracegraph.visualizer.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EdgeDescriptor {
    private int sourceId;
    private int sinkId;
    private String label;     // 可选

    public EdgeDescriptor(int sourceId, int sinkId) {
        this(sourceId, sinkId, null);
    }
}
