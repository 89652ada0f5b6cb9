package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

import java.util.List;

/**
 * 语句序列，值为最后的 expr。
 */
public final class InsSeq extends Expression {

    private final List<Expression> stats;
    private final Expression expr;

    public InsSeq(Loc loc, List<Expression> stats, Expression expr) {
        super(loc);
        this.stats = freeze(stats, "stats", loc);
        this.expr = expr;
        sanityCheck();
    }

    public List<Expression> getStats() {
        return stats;
    }

    public Expression getExpr() {
        return expr;
    }

    @Override
    public String nodeName() {
        return "InsSeq";
    }

    @Override
    public void sanityCheck() {
        checkElements(stats, "stats", loc);
        Enforce.notNull(expr, "expr", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitInsSeq(this, context);
    }
}
