package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.SymbolRef;

/**
 * 已解析的常量。只由名称解析阶段产生，解析器从不构造它。
 * original 保留解析前的形式，typeAlias 在常量是类型别名时指向别名目标；二者均可为 null。
 */
public final class ConstantLit extends Expression {

    private final SymbolRef symbol;
    private final UnresolvedConstantLit original;  // nullable
    private final Expression typeAlias;            // nullable

    public ConstantLit(Loc loc, SymbolRef symbol, UnresolvedConstantLit original, Expression typeAlias) {
        super(loc);
        this.symbol = symbol;
        this.original = original;
        this.typeAlias = typeAlias;
        sanityCheck();
    }

    public SymbolRef getSymbol() {
        return symbol;
    }

    public UnresolvedConstantLit getOriginal() {
        return original;
    }

    public Expression getTypeAlias() {
        return typeAlias;
    }

    @Override
    public String nodeName() {
        return "ConstantLit";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(symbol, "symbol", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitConstantLit(this, context);
    }
}
