package com.garnet.ast.flow;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

/**
 * 条件表达式。缺省分支用 EmptyTree 表示，三个槽位都不为 null。
 */
public final class If extends Expression {

    private final Expression cond;
    private final Expression thenp;
    private final Expression elsep;

    public If(Loc loc, Expression cond, Expression thenp, Expression elsep) {
        super(loc);
        this.cond = cond;
        this.thenp = thenp;
        this.elsep = elsep;
        sanityCheck();
    }

    public Expression getCond() {
        return cond;
    }

    public Expression getThenp() {
        return thenp;
    }

    public Expression getElsep() {
        return elsep;
    }

    @Override
    public String nodeName() {
        return "If";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(cond, "cond", loc);
        Enforce.notNull(thenp, "thenp", loc);
        Enforce.notNull(elsep, "elsep", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
