package com.garnet.ast.flow;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Loc;

/**
 * rescue 子句中的 retry
 */
public final class Retry extends Expression {

    public Retry(Loc loc) {
        super(loc);
        sanityCheck();
    }

    @Override
    public String nodeName() {
        return "Retry";
    }

    @Override
    public void sanityCheck() {
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitRetry(this, context);
    }
}
