package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.expr.Send;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.MutableContext;
import com.garnet.core.Names;
import com.garnet.dsl.DslRule;

import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import static com.garnet.dsl.rules.RuleSupport.*;

/**
 * {@code Mod.wrap_instance(x)} 改写为 {@code T.let(x, Mod)}。作用于树中任意位置的调用。
 */
public class InterfaceWrapperRule implements DslRule<Send> {

    private static final Logger LOG = Logger.getLogger(InterfaceWrapperRule.class.getName());

    @Override
    public String getName() {
        return "InterfaceWrapper";
    }

    @Override
    public Class<Send> nodeType() {
        return Send.class;
    }

    @Override
    public List<Expression> replaceDsl(MutableContext ctx, Send send, Expression prevStat) {
        if (!send.getFun().equals(Names.WRAP_INSTANCE) || !isConstant(send.getRecv())) {
            return Collections.emptyList();
        }
        if (send.getArgs().size() != 1 || send.hasBlock()) {
            return decline(LOG, getName(), send, "wrap_instance takes exactly one argument");
        }
        TreeBuilder b = new TreeBuilder(ctx);
        return Collections.<Expression>singletonList(b.let(send.getLoc(), send.getArgs().get(0), send.getRecv()));
    }
}
