package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.expr.Hash;
import com.garnet.ast.expr.Send;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.ast.util.TreeCopier;
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
 * 属性声明：
 * <ul>
 *   <li>{@code prop :foo, Type} / {@code prop :foo, type: Type}：读方法 + 写方法</li>
 *   <li>{@code const :foo, Type}：只有读方法</li>
 * </ul>
 * 没有给出类型时按 {@code T.untyped} 处理。
 */
public class ChalkOdmPropRule implements DslRule<Send> {

    private static final Logger LOG = Logger.getLogger(ChalkOdmPropRule.class.getName());

    @Override
    public String getName() {
        return "ChalkODMProp";
    }

    @Override
    public Class<Send> nodeType() {
        return Send.class;
    }

    @Override
    public List<Expression> replaceDsl(MutableContext ctx, Send send, Expression prevStat) {
        boolean isConst = send.getFun().equals(Names.CONST);
        if (!send.getFun().equals(Names.PROP) && !isConst) {
            return Collections.emptyList();
        }
        if (!isSelfReference(send.getRecv()) || send.hasBlock()) {
            return Collections.emptyList();
        }
        List<Expression> args = send.getArgs();
        if (args.isEmpty() || args.size() > 3) {
            return decline(LOG, getName(), send, "expected 1 to 3 arguments, got " + args.size());
        }

        GlobalState gs = ctx.getState();
        NameRef name = symbolName(gs, args.get(0));
        if (name == null) {
            return decline(LOG, getName(), send, "property name is not a symbol literal");
        }

        Expression type = null;
        Hash rules = null;
        if (args.size() >= 2) {
            if (args.get(1) instanceof Hash) {
                if (args.size() == 3) {
                    return decline(LOG, getName(), send, "options hash must be the last argument");
                }
                rules = (Hash) args.get(1);
            } else {
                type = args.get(1);
                if (args.size() == 3) {
                    if (!(args.get(2) instanceof Hash)) {
                        return decline(LOG, getName(), send, "third argument is not an options hash");
                    }
                    rules = (Hash) args.get(2);
                }
            }
        }
        if (type == null && rules != null) {
            type = hashValue(gs, rules, Names.TYPE);
        }

        TreeBuilder b = new TreeBuilder(ctx);
        Loc loc = send.getLoc();
        Expression readType = type != null ? TreeCopier.deepCopy(type) : b.untyped(loc);

        List<Expression> stats = new ArrayList<>();
        stats.add(reader(b, loc, name, b.let(loc, b.instanceVar(loc, name), readType)));
        if (!isConst) {
            stats.add(writer(b, loc, name, type != null ? type : b.untyped(loc)));
        }
        return stats;
    }
}
