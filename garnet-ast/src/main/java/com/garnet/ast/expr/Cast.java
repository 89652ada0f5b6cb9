package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.NameRef;
import com.garnet.core.types.Type;

/**
 * 已解析的 T.let / T.cast 等类型断言
 */
public final class Cast extends Expression {

    private final NameRef cast;
    private final Type type;
    private final Expression arg;

    public Cast(Loc loc, Type type, Expression arg, NameRef cast) {
        super(loc);
        this.cast = cast;
        this.type = type;
        this.arg = arg;
        sanityCheck();
    }

    public NameRef getCast() {
        return cast;
    }

    public Type getType() {
        return type;
    }

    public Expression getArg() {
        return arg;
    }

    @Override
    public String nodeName() {
        return "Cast";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(cast, "cast", loc);
        Enforce.notNull(type, "type", loc);
        Enforce.notNull(arg, "arg", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitCast(this, context);
    }
}
