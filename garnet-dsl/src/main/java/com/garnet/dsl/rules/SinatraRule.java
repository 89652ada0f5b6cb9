package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.Loc;
import com.garnet.core.MutableContext;
import com.garnet.core.NameRef;
import com.garnet.core.Names;
import com.garnet.dsl.DslRule;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import static com.garnet.dsl.rules.RuleSupport.*;

/**
 * Sinatra 扩展的注册钩子 {@code def self.registered(app)} 前补一条
 * {@code sig {params(app: T.untyped).void}}。
 */
public class SinatraRule implements DslRule<MethodDef> {

    private static final Logger LOG = Logger.getLogger(SinatraRule.class.getName());

    @Override
    public String getName() {
        return "Sinatra";
    }

    @Override
    public Class<MethodDef> nodeType() {
        return MethodDef.class;
    }

    @Override
    public List<Expression> replaceDsl(MutableContext ctx, MethodDef mdef, Expression prevStat) {
        if (!mdef.getName().equals(Names.REGISTERED) || !mdef.isSelf()) {
            return Collections.emptyList();
        }
        if (prevStat != null && isSig(prevStat)) {
            return Collections.emptyList();
        }
        if (mdef.getArgs().size() != 1) {
            return decline(LOG, getName(), mdef, "expected exactly one argument");
        }
        NameRef app = argName(mdef.getArgs().get(0));
        if (app == null) {
            return decline(LOG, getName(), mdef, "argument has no name");
        }

        TreeBuilder b = new TreeBuilder(ctx);
        Loc loc = mdef.getLoc();
        Expression sig = b.sigVoid(loc, b.hash1(loc, b.symbol(loc, app), b.untyped(loc)));
        return Arrays.<Expression>asList(sig, mdef);
    }
}
