package com.garnet.ast.ref;

import com.garnet.ast.Reference;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.LocalVariable;
import com.garnet.core.Loc;

/**
 * 已绑定的局部变量引用
 */
public final class Local extends Reference {

    private final LocalVariable localVariable;

    public Local(Loc loc, LocalVariable localVariable) {
        super(loc);
        this.localVariable = localVariable;
        sanityCheck();
    }

    public LocalVariable getLocalVariable() {
        return localVariable;
    }

    @Override
    public String nodeName() {
        return "Local";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(localVariable, "localVariable", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitLocal(this, context);
    }
}
