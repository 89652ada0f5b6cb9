package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.expr.Hash;
import com.garnet.ast.expr.Literal;
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
 * {@code dsl_optional :foo, Type} / {@code dsl_required :foo, Type}：
 *
 * <pre>
 * def self.foo(foo); T.let(foo, Type); end
 * def foo; T.let(@foo, T.nilable(Type)); end   # dsl_required 时为 Type
 * </pre>
 *
 * 选项 {@code skip_getter: true} 时不生成实例读方法。
 */
public class DslBuilderRule implements DslRule<Send> {

    private static final Logger LOG = Logger.getLogger(DslBuilderRule.class.getName());

    @Override
    public String getName() {
        return "DSLBuilder";
    }

    @Override
    public Class<Send> nodeType() {
        return Send.class;
    }

    @Override
    public List<Expression> replaceDsl(MutableContext ctx, Send send, Expression prevStat) {
        boolean optional = send.getFun().equals(Names.DSL_OPTIONAL);
        if (!optional && !send.getFun().equals(Names.DSL_REQUIRED)) {
            return Collections.emptyList();
        }
        if (!isSelfReference(send.getRecv()) || send.hasBlock()) {
            return Collections.emptyList();
        }
        List<Expression> args = send.getArgs();
        if (args.size() < 2 || args.size() > 3) {
            return decline(LOG, getName(), send, "expected 2 or 3 arguments, got " + args.size());
        }
        GlobalState gs = ctx.getState();
        NameRef name = symbolName(gs, args.get(0));
        if (name == null) {
            return decline(LOG, getName(), send, "name is not a symbol literal");
        }
        Expression type = args.get(1);
        if (type instanceof Hash) {
            return decline(LOG, getName(), send, "missing type");
        }
        boolean skipGetter = false;
        if (args.size() == 3) {
            if (!(args.get(2) instanceof Hash)) {
                return decline(LOG, getName(), send, "third argument is not an options hash");
            }
            Expression skip = hashValue(gs, (Hash) args.get(2), Names.SKIP_GETTER);
            skipGetter = skip instanceof Literal && ((Literal) skip).isTrue(gs);
        }

        TreeBuilder b = new TreeBuilder(ctx);
        Loc loc = send.getLoc();
        List<Expression> stats = new ArrayList<>();
        stats.add(b.selfMethodDef(loc, name, Collections.<Expression>singletonList(b.local(loc, name)),
                b.let(loc, b.local(loc, name), TreeCopier.deepCopy(type))));
        if (!skipGetter) {
            Expression getterType = TreeCopier.deepCopy(type);
            if (optional) {
                getterType = b.nilable(loc, getterType);
            }
            stats.add(reader(b, loc, name, b.let(loc, b.instanceVar(loc, name), getterType)));
        }
        return stats;
    }
}
