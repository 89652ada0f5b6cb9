package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.GlobalState;
import com.garnet.core.Loc;
import com.garnet.core.NameRef;
import com.garnet.core.Symbols;
import com.garnet.core.types.LiteralType;
import com.garnet.core.types.Type;

/**
 * 字面量。值是一个类型：符号/字符串/数值为 {@link LiteralType}，nil/true/false 为对应类的实例类型。
 */
public final class Literal extends Expression {

    private final Type value;

    public Literal(Loc loc, Type value) {
        super(loc);
        this.value = value;
        sanityCheck();
    }

    public Type getValue() {
        return value;
    }

    public boolean isSymbol(GlobalState gs) {
        return value instanceof LiteralType && value.derivesFrom(gs, Symbols.SYMBOL);
    }

    public boolean isString(GlobalState gs) {
        return value instanceof LiteralType && value.derivesFrom(gs, Symbols.STRING);
    }

    public boolean isNil(GlobalState gs) {
        return value.derivesFrom(gs, Symbols.NIL_CLASS);
    }

    public boolean isTrue(GlobalState gs) {
        return value.derivesFrom(gs, Symbols.TRUE_CLASS);
    }

    public boolean isFalse(GlobalState gs) {
        return value.derivesFrom(gs, Symbols.FALSE_CLASS);
    }

    public NameRef asSymbol(GlobalState gs) {
        Enforce.check(isSymbol(gs), "isSymbol(gs)", loc);
        return ((LiteralType) value).asName();
    }

    public NameRef asString(GlobalState gs) {
        Enforce.check(isString(gs), "isString(gs)", loc);
        return ((LiteralType) value).asName();
    }

    @Override
    public String nodeName() {
        return "Literal";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(value, "value", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }
}
