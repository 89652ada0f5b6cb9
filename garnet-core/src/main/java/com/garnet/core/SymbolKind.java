package com.garnet.core;

/**
 * 符号种类
 */
public enum SymbolKind {
    CLASS,
    MODULE,
    METHOD,
    ARGUMENT,
    FIELD,
    STATIC_FIELD
}
