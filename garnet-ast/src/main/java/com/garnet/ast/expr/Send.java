package com.garnet.ast.expr;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.NameRef;

import java.util.List;

/**
 * 方法调用 recv.fun(args) { block }。block 可为 null。
 */
public final class Send extends Expression {

    private final Expression recv;
    private final NameRef fun;
    private final List<Expression> args;
    private final Block block;  // nullable

    public Send(Loc loc, Expression recv, NameRef fun, List<Expression> args) {
        this(loc, recv, fun, args, null);
    }

    public Send(Loc loc, Expression recv, NameRef fun, List<Expression> args, Block block) {
        super(loc);
        this.recv = recv;
        this.fun = fun;
        this.args = freeze(args, "args", loc);
        this.block = block;
        sanityCheck();
    }

    public Expression getRecv() {
        return recv;
    }

    public NameRef getFun() {
        return fun;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public Block getBlock() {
        return block;
    }

    public boolean hasBlock() {
        return block != null;
    }

    @Override
    public String nodeName() {
        return "Send";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(recv, "recv", loc);
        Enforce.notNull(fun, "fun", loc);
        Enforce.check(fun.exists(), "fun.exists()", loc);
        checkElements(args, "args", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitSend(this, context);
    }
}
