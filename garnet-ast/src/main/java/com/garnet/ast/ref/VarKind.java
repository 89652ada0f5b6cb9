package com.garnet.ast.ref;

/**
 * 未解析标识符的种类：foo / @foo / @@foo / $foo
 */
public enum VarKind {
    LOCAL,
    INSTANCE,
    CLASS,
    GLOBAL
}
