package com.garnet.core.types;

import com.garnet.core.GlobalState;
import com.garnet.core.SymbolRef;
import com.garnet.core.Symbols;

/**
 * 类实例类型。nil/true/false 字面量以 NilClass/TrueClass/FalseClass 的实例类型表示。
 */
public final class ClassType extends Type {
    private final SymbolRef symbol;

    public ClassType(SymbolRef symbol) {
        this.symbol = symbol;
    }

    public static ClassType nil() {
        return new ClassType(Symbols.NIL_CLASS);
    }

    public static ClassType trueClass() {
        return new ClassType(Symbols.TRUE_CLASS);
    }

    public static ClassType falseClass() {
        return new ClassType(Symbols.FALSE_CLASS);
    }

    public SymbolRef getSymbol() {
        return symbol;
    }

    @Override
    public String toString(GlobalState gs) {
        return symbol.data(gs).fullName(gs);
    }

    @Override
    public boolean derivesFrom(GlobalState gs, SymbolRef klass) {
        return symbol.equals(klass) || klass.equals(Symbols.OBJECT);
    }
}
