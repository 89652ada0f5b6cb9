package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Loc;

import java.util.List;

/**
 * 数组字面量
 */
public final class Array extends Expression {

    private final List<Expression> elems;

    public Array(Loc loc, List<Expression> elems) {
        super(loc);
        this.elems = freeze(elems, "elems", loc);
        sanityCheck();
    }

    public List<Expression> getElems() {
        return elems;
    }

    @Override
    public String nodeName() {
        return "Array";
    }

    @Override
    public void sanityCheck() {
        checkElements(elems, "elems", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitArray(this, context);
    }
}
