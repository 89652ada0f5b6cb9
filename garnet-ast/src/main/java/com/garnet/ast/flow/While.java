package com.garnet.ast.flow;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

/**
 * while 循环
 */
public final class While extends Expression {

    private final Expression cond;
    private final Expression body;

    public While(Loc loc, Expression cond, Expression body) {
        super(loc);
        this.cond = cond;
        this.body = body;
        sanityCheck();
    }

    public Expression getCond() {
        return cond;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public String nodeName() {
        return "While";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(cond, "cond", loc);
        Enforce.notNull(body, "body", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitWhile(this, context);
    }
}
