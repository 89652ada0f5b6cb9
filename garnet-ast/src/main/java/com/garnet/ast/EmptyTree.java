package com.garnet.ast;

import com.garnet.core.Loc;

/**
 * “无表达式”占位符。可选槽位从不为 null，缺省时放一个 EmptyTree。
 * 每次使用都是新实例，判断时用 {@link #isEmptyTree()}。
 */
public final class EmptyTree extends Expression {

    public EmptyTree() {
        super(Loc.none());
        sanityCheck();
    }

    @Override
    public boolean isEmptyTree() {
        return true;
    }

    @Override
    public String nodeName() {
        return "EmptyTree";
    }

    @Override
    public void sanityCheck() {
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitEmptyTree(this, context);
    }
}
