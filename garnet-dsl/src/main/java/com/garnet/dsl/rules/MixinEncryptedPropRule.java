package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.expr.Hash;
import com.garnet.ast.expr.Send;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.GlobalState;
import com.garnet.core.Loc;
import com.garnet.core.MutableContext;
import com.garnet.core.NameRef;
import com.garnet.core.Names;
import com.garnet.dsl.DslRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import static com.garnet.dsl.rules.RuleSupport.*;

/**
 * {@code encrypted_prop :foo}：明文属性 foo 与密文属性 encrypted_foo 各一对读写方法，
 * 类型都是 {@code T.nilable(String)}。
 */
public class MixinEncryptedPropRule implements DslRule<Send> {

    private static final Logger LOG = Logger.getLogger(MixinEncryptedPropRule.class.getName());

    @Override
    public String getName() {
        return "MixinEncryptedProp";
    }

    @Override
    public Class<Send> nodeType() {
        return Send.class;
    }

    @Override
    public List<Expression> replaceDsl(MutableContext ctx, Send send, Expression prevStat) {
        if (!send.getFun().equals(Names.ENCRYPTED_PROP) || !isSelfReference(send.getRecv()) || send.hasBlock()) {
            return Collections.emptyList();
        }
        List<Expression> args = send.getArgs();
        if (args.isEmpty() || args.size() > 2) {
            return decline(LOG, getName(), send, "expected 1 or 2 arguments, got " + args.size());
        }
        if (args.size() == 2 && !(args.get(1) instanceof Hash)) {
            return decline(LOG, getName(), send, "second argument is not an options hash");
        }
        GlobalState gs = ctx.getState();
        NameRef name = symbolName(gs, args.get(0));
        if (name == null) {
            return decline(LOG, getName(), send, "property name is not a symbol literal");
        }
        NameRef encrypted = prefixed(gs, "encrypted_", name);

        TreeBuilder b = new TreeBuilder(ctx);
        Loc loc = send.getLoc();
        List<Expression> stats = new ArrayList<>();
        for (NameRef attr : new NameRef[]{name, encrypted}) {
            Expression type = b.nilable(loc, b.constant(loc, Names.STRING));
            stats.add(reader(b, loc, attr, b.let(loc, b.instanceVar(loc, attr), type)));
            stats.add(writer(b, loc, attr, type));
        }
        return stats;
    }
}
