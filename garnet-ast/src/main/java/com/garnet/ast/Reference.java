package com.garnet.ast;

import com.garnet.core.Loc;

/**
 * 可赋值/可引用的位置：局部变量、字段、未解析标识符，以及包装它们的各类形参形态。
 */
public abstract class Reference extends Expression {

    protected Reference(Loc loc) {
        super(loc);
    }
}
