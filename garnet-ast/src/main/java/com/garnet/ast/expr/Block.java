package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.SymbolRef;
import com.garnet.core.Symbols;

import java.util.List;

/**
 * 附着在 Send 上的块 do |args| body end。符号由命名阶段回填，之前为 NO_SYMBOL。
 */
public final class Block extends Expression {

    private final List<Expression> args;
    private final Expression body;
    private SymbolRef symbol;

    public Block(Loc loc, List<Expression> args, Expression body) {
        this(loc, args, body, Symbols.NO_SYMBOL);
    }

    public Block(Loc loc, List<Expression> args, Expression body, SymbolRef symbol) {
        super(loc);
        this.args = freeze(args, "args", loc);
        this.body = body;
        this.symbol = symbol;
        sanityCheck();
    }

    public List<Expression> getArgs() {
        return args;
    }

    public Expression getBody() {
        return body;
    }

    public SymbolRef getSymbol() {
        return symbol;
    }

    public void setSymbol(SymbolRef symbol) {
        this.symbol = Enforce.notNull(symbol, "symbol", loc);
    }

    @Override
    public String nodeName() {
        return "Block";
    }

    @Override
    public void sanityCheck() {
        checkArgs(args, loc);
        Enforce.notNull(body, "body", loc);
        Enforce.notNull(symbol, "symbol", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitBlock(this, context);
    }
}
