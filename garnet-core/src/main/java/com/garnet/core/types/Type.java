package com.garnet.core.types;

import com.garnet.core.GlobalState;
import com.garnet.core.SymbolRef;

/**
 * 字面量节点携带的类型值。推断阶段的完整类型系统不在本模块内。
 */
public abstract class Type {

    public abstract String toString(GlobalState gs);

    public abstract boolean derivesFrom(GlobalState gs, SymbolRef klass);
}
