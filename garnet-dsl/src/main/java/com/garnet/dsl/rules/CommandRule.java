package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.ClassDef;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.UnresolvedConstantLit;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.ast.util.TreeCopier;
import com.garnet.core.MutableContext;
import com.garnet.core.Names;
import com.garnet.dsl.DslRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.garnet.dsl.rules.RuleSupport.*;

/**
 * 继承 {@code Opus::Command} 并定义了实例方法 {@code call} 的类，
 * 追加同签名的 {@code def self.call(...)}；call 前面有 sig 时一并拷贝。
 *
 * <p>类级补丁：返回的是要追加到类体末尾的语句。已经有 self.call 时不再追加。</p>
 */
public class CommandRule implements DslRule<ClassDef> {

    @Override
    public String getName() {
        return "Command";
    }

    @Override
    public Class<ClassDef> nodeType() {
        return ClassDef.class;
    }

    @Override
    public List<Expression> replaceDsl(MutableContext ctx, ClassDef classDef, Expression prevStat) {
        if (!isCommand(classDef)) {
            return Collections.emptyList();
        }
        List<Expression> rhs = classDef.getRhs();
        int callIndex = -1;
        for (int i = 0; i < rhs.size(); i++) {
            Expression stat = rhs.get(i);
            if (stat instanceof MethodDef && ((MethodDef) stat).getName().equals(Names.CALL)) {
                if (((MethodDef) stat).isSelf()) {
                    return Collections.emptyList();
                }
                if (callIndex < 0) {
                    callIndex = i;
                }
            }
        }
        if (callIndex < 0) {
            return Collections.emptyList();
        }

        MethodDef call = (MethodDef) rhs.get(callIndex);
        TreeBuilder b = new TreeBuilder(ctx);
        List<Expression> extra = new ArrayList<>();
        if (callIndex > 0 && isSig(rhs.get(callIndex - 1))) {
            extra.add(TreeCopier.deepCopy(rhs.get(callIndex - 1)));
        }
        List<Expression> args = new ArrayList<>();
        for (Expression arg : call.getArgs()) {
            args.add(TreeCopier.deepCopy(arg));
        }
        extra.add(b.selfMethodDef(call.getLoc(), Names.CALL, args, b.emptyTree()));
        return extra;
    }

    private static boolean isCommand(ClassDef classDef) {
        for (Expression ancestor : classDef.getAncestors()) {
            if (!(ancestor instanceof UnresolvedConstantLit)) {
                continue;
            }
            UnresolvedConstantLit cnst = (UnresolvedConstantLit) ancestor;
            if (cnst.getCnst().equals(Names.COMMAND) && cnst.getScope() instanceof UnresolvedConstantLit) {
                UnresolvedConstantLit scope = (UnresolvedConstantLit) cnst.getScope();
                if (scope.getCnst().equals(Names.OPUS) && scope.getScope().isEmptyTree()) {
                    return true;
                }
            }
        }
        return false;
    }
}
