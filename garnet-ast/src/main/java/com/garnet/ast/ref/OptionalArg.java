package com.garnet.ast.ref;

import com.garnet.ast.Expression;
import com.garnet.ast.Reference;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

/**
 * 带默认值的参数 name = default
 */
public final class OptionalArg extends Reference {

    private final Reference expr;
    private final Expression defaultValue;

    public OptionalArg(Loc loc, Reference expr, Expression defaultValue) {
        super(loc);
        this.expr = expr;
        this.defaultValue = defaultValue;
        sanityCheck();
    }

    public Reference getExpr() {
        return expr;
    }

    public Expression getDefault() {
        return defaultValue;
    }

    @Override
    public String nodeName() {
        return "OptionalArg";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(expr, "expr", loc);
        Enforce.notNull(defaultValue, "default", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitOptionalArg(this, context);
    }
}
