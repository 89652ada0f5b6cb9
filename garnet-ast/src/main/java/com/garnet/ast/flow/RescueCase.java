package com.garnet.ast.flow;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

import java.util.List;

/**
 * 单个 rescue 子句：捕获的异常类型列表、绑定变量、子句体。
 */
public final class RescueCase extends Expression {

    private final List<Expression> exceptions;
    private final Expression var;
    private final Expression body;

    public RescueCase(Loc loc, List<Expression> exceptions, Expression var, Expression body) {
        super(loc);
        this.exceptions = freeze(exceptions, "exceptions", loc);
        this.var = var;
        this.body = body;
        sanityCheck();
    }

    public List<Expression> getExceptions() {
        return exceptions;
    }

    public Expression getVar() {
        return var;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public String nodeName() {
        return "RescueCase";
    }

    @Override
    public void sanityCheck() {
        checkElements(exceptions, "exceptions", loc);
        Enforce.notNull(var, "var", loc);
        Enforce.notNull(body, "body", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitRescueCase(this, context);
    }
}
