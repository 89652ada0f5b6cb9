package com.garnet.dsl;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.ClassDef;
import com.garnet.ast.expr.Send;
import com.garnet.ast.treemap.TreeMapper;
import com.garnet.core.Enforce;
import com.garnet.core.MutableContext;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 类体语句拼接驱动。
 *
 * <p>对每个类：先应用类级补丁，再把类体中的每条语句连同它前面那条原始语句交给对应的规则族，
 * 第一个返回非空结果的规则胜出，其结果平铺替换该语句；都不匹配时保留原语句。
 * 没有任何语句被替换时返回原 ClassDef 实例。</p>
 *
 * <p>嵌套类由 TreeMap 的后序遍历先行处理。方法体和块体照常遍历，但不做语句拼接。</p>
 */
public class DslReplacer implements TreeMapper {

    private static final Logger LOG = Logger.getLogger(DslReplacer.class.getName());

    private final RuleRegistry rules;
    private final boolean logRewrites;
    private int rewriteCount;

    public DslReplacer(RuleRegistry rules, boolean logRewrites) {
        this.rules = rules;
        this.logRewrites = logRewrites;
    }

    /**
     * 本实例累计完成的改写次数
     */
    public int getRewriteCount() {
        return rewriteCount;
    }

    @Override
    public Expression postTransformClassDef(MutableContext ctx, ClassDef classDef) {
        ClassDef cd = patchClass(ctx, classDef);

        List<Expression> newRhs = null;
        Expression prevStat = null;
        List<Expression> rhs = cd.getRhs();
        for (int i = 0; i < rhs.size(); i++) {
            Expression stat = rhs.get(i);
            List<Expression> replacement = replaceStatement(ctx, stat, prevStat);
            if (replacement != null && newRhs == null) {
                newRhs = new ArrayList<>(rhs.size() + replacement.size());
                newRhs.addAll(rhs.subList(0, i));
            }
            if (newRhs != null) {
                if (replacement != null) {
                    newRhs.addAll(replacement);
                } else {
                    newRhs.add(stat);
                }
            }
            prevStat = stat;
        }
        return newRhs == null ? cd : cd.withRhs(newRhs);
    }

    @Override
    public Expression postTransformSend(MutableContext ctx, Send send) {
        for (DslRule<Send> rule : rules.getCallRules()) {
            List<Expression> result = offer(rule, ctx, send, null);
            if (!result.isEmpty()) {
                Enforce.check(result.size() == 1, "result.size() == 1", send.getLoc(),
                        rule.getName(), " must rewrite a call into exactly one expression");
                trace(rule, send, result.size());
                return result.get(0);
            }
        }
        return send;
    }

    private ClassDef patchClass(MutableContext ctx, ClassDef classDef) {
        ClassDef cd = classDef;
        for (DslRule<ClassDef> rule : rules.getClassRules()) {
            List<Expression> extra = offer(rule, ctx, cd, null);
            if (!extra.isEmpty()) {
                List<Expression> rhs = new ArrayList<>(cd.getRhs());
                rhs.addAll(extra);
                trace(rule, cd, extra.size());
                cd = cd.withRhs(rhs);
            }
        }
        return cd;
    }

    /**
     * @return 替换序列；没有规则匹配时为 null
     */
    private List<Expression> replaceStatement(MutableContext ctx, Expression stat, Expression prevStat) {
        for (DslRule<? extends Expression> rule : rules.familyOf(stat)) {
            List<Expression> result = offer(rule, ctx, stat, prevStat);
            if (!result.isEmpty()) {
                trace(rule, stat, result.size());
                return result;
            }
        }
        return null;
    }

    private static <T extends Expression> List<Expression> offer(DslRule<T> rule, MutableContext ctx,
                                                                 Expression stat, Expression prevStat) {
        List<Expression> result = rule.replaceDsl(ctx, rule.nodeType().cast(stat), prevStat);
        Enforce.check(result != null, "result != null", stat.getLoc(), rule.getName(), " returned null");
        return result;
    }

    private void trace(DslRule<?> rule, Expression stat, int produced) {
        rewriteCount++;
        if (logRewrites && LOG.isLoggable(Level.FINE)) {
            LOG.fine(rule.getName() + " 改写 " + stat.nodeName() + " @ " + stat.getLoc() + " -> " + produced + " 条语句");
        }
    }
}
