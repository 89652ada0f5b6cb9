package com.garnet.ast.ref;

import com.garnet.ast.Reference;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

/**
 * 关键字参数 name:
 */
public final class KeywordArg extends Reference {

    private final Reference expr;

    public KeywordArg(Loc loc, Reference expr) {
        super(loc);
        this.expr = expr;
        sanityCheck();
    }

    public Reference getExpr() {
        return expr;
    }

    @Override
    public String nodeName() {
        return "KeywordArg";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(expr, "expr", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitKeywordArg(this, context);
    }
}
