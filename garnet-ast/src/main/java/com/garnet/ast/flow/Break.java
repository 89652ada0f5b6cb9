package com.garnet.ast.flow;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

/**
 * 
 */
public final class Break extends Expression {

    private final Expression expr;

    public Break(Loc loc, Expression expr) {
        super(loc);
        this.expr = expr;
        sanityCheck();
    }

    public Expression getExpr() {
        return expr;
    }

    @Override
    public String nodeName() {
        return "Break";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(expr, "expr", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitBreak(this, context);
    }
}
