package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.SymbolRef;

/**
 * self。claz 在解析前可能不存在。
 */
public final class Self extends Expression {

    private final SymbolRef claz;

    public Self(Loc loc, SymbolRef claz) {
        super(loc);
        this.claz = claz;
        sanityCheck();
    }

    public SymbolRef getClaz() {
        return claz;
    }

    @Override
    public String nodeName() {
        return "Self";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(claz, "claz", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitSelf(this, context);
    }
}
