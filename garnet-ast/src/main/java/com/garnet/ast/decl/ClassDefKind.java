package com.garnet.ast.decl;

/**
 * 类定义的种类
 */
public enum ClassDefKind {
    MODULE,
    CLASS
}
