package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.NameRef;

/**
 * 解析前的常量引用 scope::Name。顶层常量的 scope 为 EmptyTree。
 */
public final class UnresolvedConstantLit extends Expression {

    private final Expression scope;
    private final NameRef cnst;

    public UnresolvedConstantLit(Loc loc, Expression scope, NameRef cnst) {
        super(loc);
        this.scope = scope;
        this.cnst = cnst;
        sanityCheck();
    }

    public Expression getScope() {
        return scope;
    }

    public NameRef getCnst() {
        return cnst;
    }

    @Override
    public String nodeName() {
        return "UnresolvedConstantLit";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(scope, "scope", loc);
        Enforce.notNull(cnst, "cnst", loc);
        Enforce.check(cnst.exists(), "cnst.exists()", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitUnresolvedConstantLit(this, context);
    }
}
