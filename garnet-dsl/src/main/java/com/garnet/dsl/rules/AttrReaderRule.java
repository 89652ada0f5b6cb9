package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
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
 * {@code attr_reader / attr_writer / attr_accessor :a, :b}。
 *
 * <p>前一条语句是 {@code sig {returns(X)}} 时，读方法体写成 {@code T.let(@a, X)}，
 * 把签名里的类型带到实例变量上。sig 本身保留在类体中，类型只做拷贝。</p>
 */
public class AttrReaderRule implements DslRule<Send> {

    private static final Logger LOG = Logger.getLogger(AttrReaderRule.class.getName());

    @Override
    public String getName() {
        return "AttrReader";
    }

    @Override
    public Class<Send> nodeType() {
        return Send.class;
    }

    @Override
    public List<Expression> replaceDsl(MutableContext ctx, Send send, Expression prevStat) {
        boolean makeReader = send.getFun().equals(Names.ATTR_READER) || send.getFun().equals(Names.ATTR_ACCESSOR);
        boolean makeWriter = send.getFun().equals(Names.ATTR_WRITER) || send.getFun().equals(Names.ATTR_ACCESSOR);
        if (!makeReader && !makeWriter) {
            return Collections.emptyList();
        }
        if (!isSelfReference(send.getRecv()) || send.hasBlock()) {
            return Collections.emptyList();
        }
        if (send.getArgs().isEmpty()) {
            return decline(LOG, getName(), send, "no attribute names");
        }
        GlobalState gs = ctx.getState();
        List<NameRef> names = new ArrayList<>();
        for (Expression arg : send.getArgs()) {
            NameRef name = symbolOrStringName(gs, arg);
            if (name == null) {
                return decline(LOG, getName(), send, "attribute name is not a literal");
            }
            names.add(name);
        }

        Expression sigType = prevStat != null ? sigReturnType(prevStat) : null;
        TreeBuilder b = new TreeBuilder(ctx);
        Loc loc = send.getLoc();
        List<Expression> stats = new ArrayList<>();
        if (makeReader) {
            for (NameRef name : names) {
                Expression body = b.instanceVar(loc, name);
                if (sigType != null) {
                    body = b.let(loc, body, TreeCopier.deepCopy(sigType));
                }
                stats.add(reader(b, loc, name, body));
            }
        }
        if (makeWriter) {
            for (NameRef name : names) {
                stats.add(writer(b, loc, name, null));
            }
        }
        return stats;
    }
}
