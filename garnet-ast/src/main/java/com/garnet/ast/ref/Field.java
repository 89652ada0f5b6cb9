package com.garnet.ast.ref;

import com.garnet.ast.Reference;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.SymbolRef;

/**
 * 已解析的字段引用
 */
public final class Field extends Reference {

    private final SymbolRef symbol;

    public Field(Loc loc, SymbolRef symbol) {
        super(loc);
        this.symbol = symbol;
        sanityCheck();
    }

    public SymbolRef getSymbol() {
        return symbol;
    }

    @Override
    public String nodeName() {
        return "Field";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(symbol, "symbol", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitField(this, context);
    }
}
