package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

/**
 * 赋值 lhs = rhs
 */
public final class Assign extends Expression {

    private final Expression lhs;
    private final Expression rhs;

    public Assign(Loc loc, Expression lhs, Expression rhs) {
        super(loc);
        this.lhs = lhs;
        this.rhs = rhs;
        sanityCheck();
    }

    public Expression getLhs() {
        return lhs;
    }

    public Expression getRhs() {
        return rhs;
    }

    @Override
    public String nodeName() {
        return "Assign";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(lhs, "lhs", loc);
        Enforce.notNull(rhs, "rhs", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitAssign(this, context);
    }
}
