package com.tracegraph.visualizer.model;

public enum GraphFormat {
    DOT,
    PBTXT
}
