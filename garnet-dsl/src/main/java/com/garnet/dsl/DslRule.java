package com.garnet.dsl;

import com.garnet.ast.Expression;
import com.garnet.core.MutableContext;

import java.util.List;

/**
 * 单条 DSL 脱糖规则。
 *
 * <p>规则只读候选语句和前一条语句，不修改它们。返回空列表表示不匹配；
 * 非空列表按顺序替换候选语句。被替换的语句交回规则处置，其子树可以直接移入结果，
 * 同一子树要出现两次时第二份必须深拷贝；前一条语句仍留在类体中，只能拷贝不能移动。</p>
 *
 * @param <T> 规则关心的语句种类
 */
public interface DslRule<T extends Expression> {

    /**
     * 规则名称（用于配置与日志）。
     */
    String getName();

    /**
     * 候选语句的节点种类，驱动器据此选择规则族。
     */
    Class<T> nodeType();

    /**
     * @param stat     候选语句
     * @param prevStat 类体中紧邻的前一条原始语句，没有时为 null
     * @return 替换语句序列，空列表表示不匹配
     */
    List<Expression> replaceDsl(MutableContext ctx, T stat, Expression prevStat);
}
