package com.garnet.dsl;

import com.garnet.ast.Expression;
import com.garnet.ast.treemap.TreeMap;
import com.garnet.ast.util.OwnershipChecker;
import com.garnet.core.MutableContext;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * DSL 脱糖 pass 入口。单线程、同步；输入树的所有权转移给本 pass，返回改写后的树。
 */
public final class Dsl {

    private static final Logger LOG = Logger.getLogger(Dsl.class.getName());

    private Dsl() {
    }

    /**
     * 使用 classpath 上的 {@code garnet-dsl.json} 配置运行。
     */
    public static Expression run(MutableContext ctx, Expression tree) {
        return run(ctx, tree, DslConfig.load());
    }

    public static Expression run(MutableContext ctx, Expression tree, DslConfig config) {
        return run(ctx, tree, config, RuleRegistry.defaults());
    }

    public static Expression run(MutableContext ctx, Expression tree, DslConfig config, RuleRegistry registry) {
        DslReplacer replacer = new DslReplacer(registry.without(config.getDisabledRules()), config.isLogRewrites());
        Expression result = TreeMap.apply(ctx, replacer, tree);
        if (config.isVerifyOwnership()) {
            int nodes = OwnershipChecker.check(ctx, result);
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("所有权校验通过: " + nodes + " 个节点");
            }
        }
        if (config.isLogRewrites() && LOG.isLoggable(Level.FINE)) {
            LOG.fine("DSL pass 完成: " + replacer.getRewriteCount() + " 处改写");
        }
        return result;
    }
}
