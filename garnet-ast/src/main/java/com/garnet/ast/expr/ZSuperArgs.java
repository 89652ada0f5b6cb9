package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Loc;

/**
 * 无括号 super 隐式转发的参数
 */
public final class ZSuperArgs extends Expression {

    public ZSuperArgs(Loc loc) {
        super(loc);
        sanityCheck();
    }

    @Override
    public String nodeName() {
        return "ZSuperArgs";
    }

    @Override
    public void sanityCheck() {
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitZSuperArgs(this, context);
    }
}
