package com.tracegraph.visualizer.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 节点的展示标签：基础文本 + 分析阶段逐步叠加的前缀 / 后缀。
 *
 * 各分析阶段（类型 SCC、帧分组、UNUSED 标记）只追加标记，不覆盖；
 * 真正的字符串只在读取时拼出来。
 * - 前缀：后加的在最外层，例如先 FRAME1/ 再 UNUSED/ 得到 "UNUSED/FRAME1/base"
 * - 后缀：按追加顺序拼在 base 后面，例如 "/SCC3"
 */
public class NodeLabel {

    private String base;
    private final Deque<String> prefixes = new ArrayDeque<>();
    private final List<String> suffixes = new ArrayList<>();

    public NodeLabel(String base) {
        this.base = base == null ? "" : base;
    }

    public String getBase() {
        return base;
    }

    /** 替换基础文本，同时清空已有的前缀 / 后缀 */
    public void reset(String newBase) {
        this.base = newBase == null ? "" : newBase;
        prefixes.clear();
        suffixes.clear();
    }

    public void addPrefix(String prefix) {
        prefixes.addFirst(prefix);
    }

    public void addSuffix(String suffix) {
        suffixes.add(suffix);
    }

    /** 从外到内的前缀 */
    public List<String> getPrefixes() {
        return List.copyOf(prefixes);
    }

    public List<String> getSuffixes() {
        return List.copyOf(suffixes);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (String p : prefixes) {
            sb.append(p);
        }
        sb.append(base);
        for (String s : suffixes) {
            sb.append(s);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
