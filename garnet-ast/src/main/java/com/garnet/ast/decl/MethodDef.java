package com.garnet.ast.decl;

import com.garnet.ast.Declaration;
import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.NameRef;
import com.garnet.core.SymbolRef;

import java.util.List;

/**
 * 方法定义。args 只包含引用形态的节点，rhs 是单个方法体表达式。
 */
public final class MethodDef extends Declaration {

    /** def self.foo */
    public static final int SELF_METHOD = 1;
    /** 由 DSL pass 合成 */
    public static final int DSL_SYNTHESIZED = 1 << 1;

    private final NameRef name;
    private final List<Expression> args;
    private final Expression rhs;
    private final int flags;

    public MethodDef(Loc loc, Loc declLoc, SymbolRef symbol, NameRef name,
                     List<Expression> args, Expression rhs, int flags) {
        super(loc, declLoc, symbol);
        this.name = name;
        this.args = freeze(args, "args", loc);
        this.rhs = rhs;
        this.flags = flags;
        sanityCheck();
    }

    public NameRef getName() {
        return name;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public Expression getRhs() {
        return rhs;
    }

    public int getFlags() {
        return flags;
    }

    public boolean isSelf() {
        return (flags & SELF_METHOD) != 0;
    }

    public boolean isDslSynthesized() {
        return (flags & DSL_SYNTHESIZED) != 0;
    }

    @Override
    public String nodeName() {
        return "MethodDef";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(name, "name", loc);
        Enforce.check(name.exists(), "name.exists()", loc);
        Enforce.notNull(rhs, "rhs", loc);
        checkArgs(args, loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitMethodDef(this, context);
    }
}
