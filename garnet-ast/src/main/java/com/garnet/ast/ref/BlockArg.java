package com.garnet.ast.ref;

import com.garnet.ast.Reference;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

/**
 * 块参数 &blk
 */
public final class BlockArg extends Reference {

    private final Reference expr;

    public BlockArg(Loc loc, Reference expr) {
        super(loc);
        this.expr = expr;
        sanityCheck();
    }

    public Reference getExpr() {
        return expr;
    }

    @Override
    public String nodeName() {
        return "BlockArg";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(expr, "expr", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitBlockArg(this, context);
    }
}
