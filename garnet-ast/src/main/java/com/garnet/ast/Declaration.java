package com.garnet.ast;

import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.SymbolRef;

/**
 * 声明节点基类。除整体区间外还记录声明头部位置，并持有解析后（或占位）的符号。
 */
public abstract class Declaration extends Expression {
    protected final Loc declLoc;
    protected SymbolRef symbol;

    protected Declaration(Loc loc, Loc declLoc, SymbolRef symbol) {
        super(loc);
        this.declLoc = Enforce.notNull(declLoc, "declLoc", loc);
        this.symbol = Enforce.notNull(symbol, "symbol", loc);
    }

    public Loc getDeclLoc() {
        return declLoc;
    }

    public SymbolRef getSymbol() {
        return symbol;
    }

    /**
     * 由名称解析阶段回填符号。不属于结构变更。
     */
    public void setSymbol(SymbolRef symbol) {
        this.symbol = Enforce.notNull(symbol, "symbol", loc);
    }
}
