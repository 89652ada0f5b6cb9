package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.ClassDefKind;
import com.garnet.ast.expr.Assign;
import com.garnet.ast.expr.Send;
import com.garnet.ast.expr.UnresolvedConstantLit;
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
 * {@code A = Struct.new(:a, :b)} 展开为
 *
 * <pre>
 * class A &lt; Struct
 *   def a; @a; end
 *   def a=(a); @a = a; end
 *   ...
 *   def initialize(a = nil, b = nil); end
 * end
 * </pre>
 */
public class StructRule implements DslRule<Assign> {

    private static final Logger LOG = Logger.getLogger(StructRule.class.getName());

    @Override
    public String getName() {
        return "Struct";
    }

    @Override
    public Class<Assign> nodeType() {
        return Assign.class;
    }

    @Override
    public List<Expression> replaceDsl(MutableContext ctx, Assign asgn, Expression prevStat) {
        if (!(asgn.getLhs() instanceof UnresolvedConstantLit) || !(asgn.getRhs() instanceof Send)) {
            return Collections.emptyList();
        }
        Send send = (Send) asgn.getRhs();
        if (!send.getFun().equals(Names.NEW) || !isStructConstant(send.getRecv())) {
            return Collections.emptyList();
        }
        if (send.hasBlock()) {
            return decline(LOG, getName(), asgn, "Struct.new with a block");
        }
        if (send.getArgs().isEmpty()) {
            return decline(LOG, getName(), asgn, "no members");
        }

        GlobalState gs = ctx.getState();
        List<NameRef> members = new ArrayList<>();
        for (Expression arg : send.getArgs()) {
            NameRef name = symbolName(gs, arg);
            if (name == null) {
                return decline(LOG, getName(), asgn, "member is not a symbol literal");
            }
            members.add(name);
        }

        TreeBuilder b = new TreeBuilder(ctx);
        Loc loc = asgn.getLoc();
        List<Expression> body = new ArrayList<>();
        List<Expression> initArgs = new ArrayList<>();
        for (NameRef member : members) {
            body.add(reader(b, loc, member, b.instanceVar(loc, member)));
            body.add(writer(b, loc, member, null));
            initArgs.add(b.optionalArg(loc, b.local(loc, member), b.nil(loc)));
        }
        body.add(b.syntheticMethod(loc, Names.INITIALIZE, initArgs, b.emptyTree()));

        // 赋值语句被整体替换，常量节点直接移入新类
        return Collections.<Expression>singletonList(b.classDef(loc, asgn.getLhs(),
                Collections.<Expression>singletonList(send.getRecv()), body, ClassDefKind.CLASS));
    }

    private static boolean isStructConstant(Expression recv) {
        if (!(recv instanceof UnresolvedConstantLit)) {
            return false;
        }
        UnresolvedConstantLit cnst = (UnresolvedConstantLit) recv;
        return cnst.getCnst().equals(Names.STRUCT) && cnst.getScope().isEmptyTree();
    }
}
