package com.garnet.core;

/**
 * 内建符号。{@link GlobalState} 构造时按此顺序登记。
 */
public final class Symbols {

    public static final SymbolRef NO_SYMBOL = new SymbolRef(0);
    public static final SymbolRef ROOT = new SymbolRef(1);
    /** 解析前的占位符号 */
    public static final SymbolRef TODO = new SymbolRef(2);
    public static final SymbolRef OBJECT = new SymbolRef(3);
    public static final SymbolRef NIL_CLASS = new SymbolRef(4);
    public static final SymbolRef TRUE_CLASS = new SymbolRef(5);
    public static final SymbolRef FALSE_CLASS = new SymbolRef(6);
    public static final SymbolRef SYMBOL = new SymbolRef(7);
    public static final SymbolRef STRING = new SymbolRef(8);
    public static final SymbolRef INTEGER = new SymbolRef(9);
    public static final SymbolRef FLOAT = new SymbolRef(10);
    public static final SymbolRef ARRAY = new SymbolRef(11);
    public static final SymbolRef HASH = new SymbolRef(12);
    public static final SymbolRef T = new SymbolRef(13);

    static final int BUILTIN_COUNT = 14;

    private Symbols() {
    }
}
