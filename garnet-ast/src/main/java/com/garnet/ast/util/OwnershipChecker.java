package com.garnet.ast.util;

import com.garnet.ast.Expression;
import com.garnet.ast.treemap.TreeMap;
import com.garnet.ast.treemap.TreeMapper;
import com.garnet.core.Enforce;
import com.garnet.core.MutableContext;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 校验一棵树确实是树：任何节点实例都不能从根出发被访问到两次。
 *
 * <p>按实例身份比较，不看结构是否相等。违反即致命。</p>
 */
public final class OwnershipChecker implements TreeMapper {

    private final Set<Expression> seen = Collections.newSetFromMap(new IdentityHashMap<Expression, Boolean>());

    private OwnershipChecker() {
    }

    /**
     * @return 树中节点实例的个数
     */
    public static int check(MutableContext ctx, Expression tree) {
        OwnershipChecker checker = new OwnershipChecker();
        TreeMap.apply(ctx, checker, tree);
        return checker.seen.size();
    }

    @Override
    public Expression postTransformDefault(MutableContext ctx, Expression tree) {
        Enforce.check(seen.add(tree), "seen.add(tree)", tree.getLoc(),
                tree.nodeName(), " instance is shared between two parents");
        return tree;
    }
}
