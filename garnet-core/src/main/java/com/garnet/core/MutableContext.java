package com.garnet.core;

import com.garnet.core.metrics.TreeMetrics;

/**
 * pass 执行上下文：可追加的符号表、当前所有者符号、注入的计数接收器。
 */
public class MutableContext {
    private final GlobalState state;
    private final SymbolRef owner;
    private final TreeMetrics metrics;

    public MutableContext(GlobalState state) {
        this(state, Symbols.ROOT, TreeMetrics.NONE);
    }

    public MutableContext(GlobalState state, SymbolRef owner, TreeMetrics metrics) {
        this.state = state;
        this.owner = owner;
        this.metrics = metrics != null ? metrics : TreeMetrics.NONE;
    }

    public GlobalState getState() {
        return state;
    }

    public SymbolRef getOwner() {
        return owner;
    }

    public TreeMetrics getMetrics() {
        return metrics;
    }

    public MutableContext withOwner(SymbolRef newOwner) {
        return new MutableContext(state, newOwner, metrics);
    }
}
