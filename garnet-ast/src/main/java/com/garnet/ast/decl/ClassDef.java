package com.garnet.ast.decl;

import com.garnet.ast.Declaration;
import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.SymbolRef;

import java.util.List;

/**
 * 类或模块定义。rhs 是有序的类体语句列表，DSL 拼接驱动以它为单位工作。
 */
public final class ClassDef extends Declaration {

    private final ClassDefKind kind;
    private final Expression name;
    private final List<Expression> ancestors;
    private final List<Expression> rhs;

    public ClassDef(Loc loc, Loc declLoc, SymbolRef symbol, Expression name,
                    List<Expression> ancestors, List<Expression> rhs, ClassDefKind kind) {
        super(loc, declLoc, symbol);
        this.kind = kind;
        this.name = name;
        this.ancestors = freeze(ancestors, "ancestors", loc);
        this.rhs = freeze(rhs, "rhs", loc);
        sanityCheck();
    }

    public ClassDefKind getKind() {
        return kind;
    }

    public Expression getName() {
        return name;
    }

    public List<Expression> getAncestors() {
        return ancestors;
    }

    public List<Expression> getRhs() {
        return rhs;
    }

    /**
     * 以新的类体构造同一个类定义（位置、符号、名称、祖先不变）。
     */
    public ClassDef withRhs(List<Expression> newRhs) {
        return new ClassDef(loc, declLoc, symbol, name, ancestors, newRhs, kind);
    }

    @Override
    public String nodeName() {
        return "ClassDef";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(name, "name", loc);
        Enforce.notNull(kind, "kind", loc);
        checkElements(ancestors, "ancestors", loc);
        checkElements(rhs, "rhs", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitClassDef(this, context);
    }
}
