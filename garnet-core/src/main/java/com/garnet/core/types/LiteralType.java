package com.garnet.core.types;

import com.garnet.core.GlobalState;
import com.garnet.core.NameRef;
import com.garnet.core.SymbolRef;
import com.garnet.core.Symbols;

/**
 * 单值字面量类型：符号、字符串、整数、浮点数。
 * 符号与字符串的值保存为驻留名称 id，数值直接保存。
 */
public final class LiteralType extends Type {
    private final LiteralKind kind;
    private final long value;
    private final double floatValue;

    private LiteralType(LiteralKind kind, long value, double floatValue) {
        this.kind = kind;
        this.value = value;
        this.floatValue = floatValue;
    }

    public static LiteralType symbol(NameRef name) {
        return new LiteralType(LiteralKind.SYMBOL, name.getId(), 0);
    }

    public static LiteralType string(NameRef name) {
        return new LiteralType(LiteralKind.STRING, name.getId(), 0);
    }

    public static LiteralType integer(long value) {
        return new LiteralType(LiteralKind.INTEGER, value, 0);
    }

    public static LiteralType floating(double value) {
        return new LiteralType(LiteralKind.FLOAT, 0, value);
    }

    public LiteralKind getKind() {
        return kind;
    }

    /** 符号/字符串字面量对应的名称 */
    public NameRef asName() {
        return new NameRef((int) value);
    }

    public long getValue() {
        return value;
    }

    public double getFloatValue() {
        return floatValue;
    }

    public SymbolRef underlying() {
        switch (kind) {
            case SYMBOL:  return Symbols.SYMBOL;
            case STRING:  return Symbols.STRING;
            case INTEGER: return Symbols.INTEGER;
            case FLOAT:   return Symbols.FLOAT;
            default:      throw new IllegalStateException("unknown literal kind " + kind);
        }
    }

    /**
     * 源码形式的值：{@code :foo}、{@code "foo"}、{@code 42}、{@code 1.5}
     */
    public String showValue(GlobalState gs) {
        switch (kind) {
            case SYMBOL:  return ":" + asName().show(gs);
            case STRING:  return "\"" + asName().show(gs) + "\"";
            case INTEGER: return Long.toString(value);
            case FLOAT:   return Double.toString(floatValue);
            default:      throw new IllegalStateException("unknown literal kind " + kind);
        }
    }

    @Override
    public String toString(GlobalState gs) {
        return underlying().data(gs).fullName(gs) + "(" + showValue(gs) + ")";
    }

    @Override
    public boolean derivesFrom(GlobalState gs, SymbolRef klass) {
        return underlying().equals(klass) || klass.equals(Symbols.OBJECT);
    }

    public enum LiteralKind {
        SYMBOL,
        STRING,
        INTEGER,
        FLOAT
    }
}
