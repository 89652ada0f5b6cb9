package com.garnet.ast.ref;

import com.garnet.ast.Reference;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.NameRef;

/**
 * 名称解析之前的标识符。解析完成后不再出现。
 */
public final class UnresolvedIdent extends Reference {

    private final VarKind kind;
    private final NameRef name;

    public UnresolvedIdent(Loc loc, VarKind kind, NameRef name) {
        super(loc);
        this.kind = kind;
        this.name = name;
        sanityCheck();
    }

    public VarKind getKind() {
        return kind;
    }

    public NameRef getName() {
        return name;
    }

    @Override
    public String nodeName() {
        return "UnresolvedIdent";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(kind, "kind", loc);
        Enforce.notNull(name, "name", loc);
        Enforce.check(name.exists(), "name.exists()", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitUnresolvedIdent(this, context);
    }
}
