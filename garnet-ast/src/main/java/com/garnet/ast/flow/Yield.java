package com.garnet.ast.flow;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Loc;

import java.util.List;

/**
 * yield 调用
 */
public final class Yield extends Expression {

    private final List<Expression> args;

    public Yield(Loc loc, List<Expression> args) {
        super(loc);
        this.args = freeze(args, "args", loc);
        sanityCheck();
    }

    public List<Expression> getArgs() {
        return args;
    }

    @Override
    public String nodeName() {
        return "Yield";
    }

    @Override
    public void sanityCheck() {
        checkElements(args, "args", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitYield(this, context);
    }
}
