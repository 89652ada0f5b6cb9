package com.garnet.ast.flow;

import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;

import java.util.List;

/**
 * begin/rescue/else/ensure。else 与 ensure 缺省为 EmptyTree，可读输出据此省略对应子句。
 */
public final class Rescue extends Expression {

    private final Expression body;
    private final List<RescueCase> rescueCases;
    private final Expression elseBranch;
    private final Expression ensure;

    public Rescue(Loc loc, Expression body, List<RescueCase> rescueCases,
                  Expression elseBranch, Expression ensure) {
        super(loc);
        this.body = body;
        this.rescueCases = freeze(rescueCases, "rescueCases", loc);
        this.elseBranch = elseBranch;
        this.ensure = ensure;
        sanityCheck();
    }

    public Expression getBody() {
        return body;
    }

    public List<RescueCase> getRescueCases() {
        return rescueCases;
    }

    public Expression getElse() {
        return elseBranch;
    }

    public Expression getEnsure() {
        return ensure;
    }

    @Override
    public String nodeName() {
        return "Rescue";
    }

    @Override
    public void sanityCheck() {
        Enforce.notNull(body, "body", loc);
        checkElements(rescueCases, "rescueCases", loc);
        Enforce.notNull(elseBranch, "else", loc);
        Enforce.notNull(ensure, "ensure", loc);
    }

    @Override
    public <R, C> R accept(TreeVisitor<R, C> visitor, C context) {
        return visitor.visitRescue(this, context);
    }
}
