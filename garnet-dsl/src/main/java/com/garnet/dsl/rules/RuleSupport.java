package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.*;
import com.garnet.ast.ref.*;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.ast.util.TreeCopier;
import com.garnet.core.GlobalState;
import com.garnet.core.Loc;
import com.garnet.core.NameRef;
import com.garnet.core.Names;

import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 规则共用的匹配与构造辅助。
 */
final class RuleSupport {

    private RuleSupport() {
    }

    /**
     * 识别出了调用形态但参数不合法：记录后放弃改写。
     */
    static List<Expression> decline(Logger log, String rule, Expression stat, String reason) {
        if (log.isLoggable(Level.FINE)) {
            log.fine(rule + " 放弃 " + stat.getLoc() + ": " + reason);
        }
        return Collections.emptyList();
    }

    /**
     * 隐式接收者：self 或省略。
     */
    static boolean isSelfReference(Expression recv) {
        return recv instanceof Self || recv.isEmptyTree();
    }

    /**
     * 符号字面量的名字，不是符号时返回 null。
     */
    static NameRef symbolName(GlobalState gs, Expression e) {
        if (e instanceof Literal && ((Literal) e).isSymbol(gs)) {
            return ((Literal) e).asSymbol(gs);
        }
        return null;
    }

    /**
     * 符号或字符串字面量的名字。
     */
    static NameRef symbolOrStringName(GlobalState gs, Expression e) {
        if (e instanceof Literal && ((Literal) e).isString(gs)) {
            return ((Literal) e).asString(gs);
        }
        return symbolName(gs, e);
    }

    /**
     * 形参的变量名，剥掉参数包装。
     */
    static NameRef argName(Expression arg) {
        Expression e = arg;
        if (e instanceof RestArg) {
            e = ((RestArg) e).getExpr();
        } else if (e instanceof KeywordArg) {
            e = ((KeywordArg) e).getExpr();
        } else if (e instanceof OptionalArg) {
            e = ((OptionalArg) e).getExpr();
        } else if (e instanceof BlockArg) {
            e = ((BlockArg) e).getExpr();
        } else if (e instanceof ShadowArg) {
            e = ((ShadowArg) e).getExpr();
        }
        if (e instanceof UnresolvedIdent) {
            return ((UnresolvedIdent) e).getName();
        }
        if (e instanceof Local) {
            return ((Local) e).getLocalVariable().getName();
        }
        return null;
    }

    /**
     * 以符号为键查找哈希值，找不到返回 null。
     */
    static Expression hashValue(GlobalState gs, Hash hash, NameRef key) {
        for (int i = 0; i < hash.getKeys().size(); i++) {
            if (key.equals(symbolName(gs, hash.getKeys().get(i)))) {
                return hash.getValues().get(i);
            }
        }
        return null;
    }

    static boolean isConstant(Expression e) {
        return e instanceof UnresolvedConstantLit || e instanceof ConstantLit;
    }

    /**
     * {@code sig {returns(X)}} 或 {@code sig {params(...).returns(X)}} 中的返回类型，其他形态返回 null。
     */
    static Expression sigReturnType(Expression stat) {
        if (!(stat instanceof Send)) {
            return null;
        }
        Send sig = (Send) stat;
        if (!sig.getFun().equals(Names.SIG) || !sig.hasBlock()) {
            return null;
        }
        Expression body = sig.getBlock().getBody();
        if (body instanceof Send) {
            Send returns = (Send) body;
            if (returns.getFun().equals(Names.RETURNS) && returns.getArgs().size() == 1) {
                return returns.getArgs().get(0);
            }
        }
        return null;
    }

    static boolean isSig(Expression stat) {
        return stat instanceof Send && ((Send) stat).getFun().equals(Names.SIG) && ((Send) stat).hasBlock();
    }

    /**
     * 属性名追加后缀后驻留，例如 foo + "=" -> foo=
     */
    static NameRef suffixed(GlobalState gs, NameRef name, String suffix) {
        return gs.enterNameUtf8(name.show(gs) + suffix);
    }

    static NameRef prefixed(GlobalState gs, String prefix, NameRef name) {
        return gs.enterNameUtf8(prefix + name.show(gs));
    }

    /**
     * def name; body; end
     */
    static MethodDef reader(TreeBuilder b, Loc loc, NameRef name, Expression body) {
        return b.syntheticMethod(loc, name, Collections.<Expression>emptyList(), body);
    }

    /**
     * def name=(name); @name = value; end，value 为 null 时直接赋形参。
     */
    static MethodDef writer(TreeBuilder b, Loc loc, NameRef name, Expression type) {
        GlobalState gs = b.getContext().getState();
        Expression value = b.local(loc, name);
        if (type != null) {
            value = b.let(loc, value, TreeCopier.deepCopy(type));
        }
        Assign assign = b.assign(loc, b.instanceVar(loc, name), value);
        return b.syntheticMethod(loc, suffixed(gs, name, "="),
                Collections.<Expression>singletonList(b.local(loc, name)), assign);
    }
}
