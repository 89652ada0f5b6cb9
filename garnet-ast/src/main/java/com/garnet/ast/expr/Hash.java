package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

import java.util.List;

/**
 * 哈希字面量，键与值分列存放，长度必须一致。
 */
public final class Hash extends Expression {

    private final List<Expression> keys;
    private final List<Expression> values;

    public Hash(Loc loc, List<Expression> keys, List<Expression> values) {
        super(loc);
        this.keys = freeze(keys, "keys", loc);
        this.values = freeze(values, "values", loc);
        sanityCheck();
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }

    @Override
    public String nodeName() {
        return "Hash";
    }

    @Override
    public void sanityCheck() {
        checkElements(keys, "keys", loc);
        checkElements(values, "values", loc);
        Enforce.check(keys.size() == values.size(), "keys.size() == values.size()", loc,
                "keys=", keys.size(), " values=", values.size());
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitHash(this, context);
    }
}
