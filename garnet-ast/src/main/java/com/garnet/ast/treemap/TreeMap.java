package com.garnet.ast.treemap;

import com.garnet.ast.EmptyTree;
import com.garnet.ast.Expression;
import com.garnet.ast.Reference;
import com.garnet.ast.TreeVisitor;
import com.garnet.ast.decl.*;
import com.garnet.ast.expr.*;
import com.garnet.ast.flow.*;
import com.garnet.ast.ref.*;
import com.garnet.core.Enforce;
import com.garnet.core.Loc;
import com.garnet.core.MutableContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 语法树改写引擎（copy-on-change）。
 *
 * <p>后序、深度优先遍历：子节点按字段顺序处理，全部未变时保留原节点，
 * 否则用新的子节点重建（重建会重新执行构造期校验），然后把节点交给对应的
 * {@link TreeMapper} 钩子。每个节点实例只会被交给 mapper 一次。</p>
 *
 * <p>带类型约束的槽位（Send.block、Rescue.rescueCases、参数包装、形参列表）
 * 放回钩子结果时校验种类，不符合即致命。</p>
 */
public final class TreeMap implements TreeVisitor<Expression, MutableContext> {

    private final TreeMapper mapper;

    private TreeMap(TreeMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 对整棵树运行 mapper，返回改写后的树。输入树的所有权转移给本方法。
     */
    public static Expression apply(MutableContext ctx, TreeMapper mapper, Expression tree) {
        Enforce.notNull(tree, "tree", Loc.none());
        return new TreeMap(mapper).map(tree, ctx);
    }

    // ==================== 辅助方法 ====================

    private Expression map(Expression tree, MutableContext ctx) {
        Expression result = tree.accept(this, ctx);
        Enforce.check(result != null, "result != null", tree.getLoc(),
                "mapper returned null for ", tree.nodeName());
        return result;
    }

    private static <T extends Expression> T slot(Expression result, Class<T> type, String slot, Loc loc) {
        Enforce.check(type.isInstance(result), "result instanceof " + type.getSimpleName(), loc,
                slot, " expects ", type.getSimpleName(), " but got ", result.nodeName());
        return type.cast(result);
    }

    /**
     * 逐个映射列表元素；没有任何元素变化时返回原列表实例。
     */
    private <T extends Expression> List<T> mapList(List<T> list, Class<T> type, String slotName,
                                                  MutableContext ctx, Loc loc) {
        List<T> result = null;
        for (int i = 0; i < list.size(); i++) {
            T original = list.get(i);
            T mapped = slot(map(original, ctx), type, slotName, loc);
            if (result == null && mapped != original) {
                result = new ArrayList<>(list.subList(0, i));
            }
            if (result != null) {
                result.add(mapped);
            }
        }
        return result == null ? list : result;
    }

    private List<Expression> mapArgs(List<Expression> args, MutableContext ctx, Loc loc) {
        List<Expression> result = mapList(args, Expression.class, "args", ctx, loc);
        if (result != args) {
            for (Expression arg : result) {
                slot(arg, Reference.class, "args", loc);
            }
        }
        return result;
    }

    // ==================== 定义 ====================

    @Override
    public Expression visitClassDef(ClassDef node, MutableContext ctx) {
        MutableContext inner = ctx.withOwner(node.getSymbol());
        ClassDef cd = mapper.preTransformClassDef(inner, node);
        Enforce.notNull(cd, "preTransformClassDef result", node.getLoc());

        Expression name = map(cd.getName(), inner);
        List<Expression> ancestors = mapList(cd.getAncestors(), Expression.class, "ancestors", inner, cd.getLoc());
        List<Expression> rhs = mapList(cd.getRhs(), Expression.class, "rhs", inner, cd.getLoc());
        if (name != cd.getName() || ancestors != cd.getAncestors() || rhs != cd.getRhs()) {
            cd = new ClassDef(cd.getLoc(), cd.getDeclLoc(), cd.getSymbol(), name, ancestors, rhs, cd.getKind());
        }
        return mapper.postTransformClassDef(inner, cd);
    }

    @Override
    public Expression visitMethodDef(MethodDef node, MutableContext ctx) {
        MutableContext inner = ctx.withOwner(node.getSymbol());
        MethodDef md = mapper.preTransformMethodDef(inner, node);
        Enforce.notNull(md, "preTransformMethodDef result", node.getLoc());

        List<Expression> args = mapArgs(md.getArgs(), inner, md.getLoc());
        Expression rhs = map(md.getRhs(), inner);
        if (args != md.getArgs() || rhs != md.getRhs()) {
            md = new MethodDef(md.getLoc(), md.getDeclLoc(), md.getSymbol(), md.getName(), args, rhs, md.getFlags());
        }
        return mapper.postTransformMethodDef(inner, md);
    }

    // ==================== 控制流 ====================

    @Override
    public Expression visitIf(If node, MutableContext ctx) {
        Expression cond = map(node.getCond(), ctx);
        Expression thenp = map(node.getThenp(), ctx);
        Expression elsep = map(node.getElsep(), ctx);
        If result = node;
        if (cond != node.getCond() || thenp != node.getThenp() || elsep != node.getElsep()) {
            result = new If(node.getLoc(), cond, thenp, elsep);
        }
        return mapper.postTransformIf(ctx, result);
    }

    @Override
    public Expression visitWhile(While node, MutableContext ctx) {
        Expression cond = map(node.getCond(), ctx);
        Expression body = map(node.getBody(), ctx);
        While result = node;
        if (cond != node.getCond() || body != node.getBody()) {
            result = new While(node.getLoc(), cond, body);
        }
        return mapper.postTransformWhile(ctx, result);
    }

    @Override
    public Expression visitBreak(Break node, MutableContext ctx) {
        Expression expr = map(node.getExpr(), ctx);
        Break result = expr == node.getExpr() ? node : new Break(node.getLoc(), expr);
        return mapper.postTransformBreak(ctx, result);
    }

    @Override
    public Expression visitRetry(Retry node, MutableContext ctx) {
        return mapper.postTransformRetry(ctx, node);
    }

    @Override
    public Expression visitNext(Next node, MutableContext ctx) {
        Expression expr = map(node.getExpr(), ctx);
        Next result = expr == node.getExpr() ? node : new Next(node.getLoc(), expr);
        return mapper.postTransformNext(ctx, result);
    }

    @Override
    public Expression visitReturn(Return node, MutableContext ctx) {
        Expression expr = map(node.getExpr(), ctx);
        Return result = expr == node.getExpr() ? node : new Return(node.getLoc(), expr);
        return mapper.postTransformReturn(ctx, result);
    }

    @Override
    public Expression visitYield(Yield node, MutableContext ctx) {
        List<Expression> args = mapList(node.getArgs(), Expression.class, "args", ctx, node.getLoc());
        Yield result = args == node.getArgs() ? node : new Yield(node.getLoc(), args);
        return mapper.postTransformYield(ctx, result);
    }

    @Override
    public Expression visitRescueCase(RescueCase node, MutableContext ctx) {
        List<Expression> exceptions = mapList(node.getExceptions(), Expression.class, "exceptions", ctx, node.getLoc());
        Expression var = map(node.getVar(), ctx);
        Expression body = map(node.getBody(), ctx);
        RescueCase result = node;
        if (exceptions != node.getExceptions() || var != node.getVar() || body != node.getBody()) {
            result = new RescueCase(node.getLoc(), exceptions, var, body);
        }
        return mapper.postTransformRescueCase(ctx, result);
    }

    @Override
    public Expression visitRescue(Rescue node, MutableContext ctx) {
        Expression body = map(node.getBody(), ctx);
        List<RescueCase> cases = mapList(node.getRescueCases(), RescueCase.class, "rescueCases", ctx, node.getLoc());
        Expression elseBranch = map(node.getElse(), ctx);
        Expression ensure = map(node.getEnsure(), ctx);
        Rescue result = node;
        if (body != node.getBody() || cases != node.getRescueCases()
                || elseBranch != node.getElse() || ensure != node.getEnsure()) {
            result = new Rescue(node.getLoc(), body, cases, elseBranch, ensure);
        }
        return mapper.postTransformRescue(ctx, result);
    }

    // ==================== 引用与形参 ====================

    @Override
    public Expression visitField(Field node, MutableContext ctx) {
        return mapper.postTransformField(ctx, node);
    }

    @Override
    public Expression visitLocal(Local node, MutableContext ctx) {
        return mapper.postTransformLocal(ctx, node);
    }

    @Override
    public Expression visitUnresolvedIdent(UnresolvedIdent node, MutableContext ctx) {
        return mapper.postTransformUnresolvedIdent(ctx, node);
    }

    @Override
    public Expression visitRestArg(RestArg node, MutableContext ctx) {
        Reference expr = slot(map(node.getExpr(), ctx), Reference.class, "RestArg.expr", node.getLoc());
        RestArg result = expr == node.getExpr() ? node : new RestArg(node.getLoc(), expr);
        return mapper.postTransformRestArg(ctx, result);
    }

    @Override
    public Expression visitKeywordArg(KeywordArg node, MutableContext ctx) {
        Reference expr = slot(map(node.getExpr(), ctx), Reference.class, "KeywordArg.expr", node.getLoc());
        KeywordArg result = expr == node.getExpr() ? node : new KeywordArg(node.getLoc(), expr);
        return mapper.postTransformKeywordArg(ctx, result);
    }

    @Override
    public Expression visitOptionalArg(OptionalArg node, MutableContext ctx) {
        Reference expr = slot(map(node.getExpr(), ctx), Reference.class, "OptionalArg.expr", node.getLoc());
        Expression defaultValue = map(node.getDefault(), ctx);
        OptionalArg result = node;
        if (expr != node.getExpr() || defaultValue != node.getDefault()) {
            result = new OptionalArg(node.getLoc(), expr, defaultValue);
        }
        return mapper.postTransformOptionalArg(ctx, result);
    }

    @Override
    public Expression visitShadowArg(ShadowArg node, MutableContext ctx) {
        Reference expr = slot(map(node.getExpr(), ctx), Reference.class, "ShadowArg.expr", node.getLoc());
        ShadowArg result = expr == node.getExpr() ? node : new ShadowArg(node.getLoc(), expr);
        return mapper.postTransformShadowArg(ctx, result);
    }

    @Override
    public Expression visitBlockArg(BlockArg node, MutableContext ctx) {
        Reference expr = slot(map(node.getExpr(), ctx), Reference.class, "BlockArg.expr", node.getLoc());
        BlockArg result = expr == node.getExpr() ? node : new BlockArg(node.getLoc(), expr);
        return mapper.postTransformBlockArg(ctx, result);
    }

    // ==================== 指令 ====================

    @Override
    public Expression visitAssign(Assign node, MutableContext ctx) {
        Expression lhs = map(node.getLhs(), ctx);
        Expression rhs = map(node.getRhs(), ctx);
        Assign result = node;
        if (lhs != node.getLhs() || rhs != node.getRhs()) {
            result = new Assign(node.getLoc(), lhs, rhs);
        }
        return mapper.postTransformAssign(ctx, result);
    }

    @Override
    public Expression visitSend(Send node, MutableContext ctx) {
        Expression recv = map(node.getRecv(), ctx);
        List<Expression> args = mapList(node.getArgs(), Expression.class, "args", ctx, node.getLoc());
        Block block = node.getBlock();
        if (block != null) {
            block = slot(map(block, ctx), Block.class, "Send.block", node.getLoc());
        }
        Send result = node;
        if (recv != node.getRecv() || args != node.getArgs() || block != node.getBlock()) {
            result = new Send(node.getLoc(), recv, node.getFun(), args, block);
        }
        return mapper.postTransformSend(ctx, result);
    }

    @Override
    public Expression visitCast(Cast node, MutableContext ctx) {
        Expression arg = map(node.getArg(), ctx);
        Cast result = arg == node.getArg() ? node : new Cast(node.getLoc(), node.getType(), arg, node.getCast());
        return mapper.postTransformCast(ctx, result);
    }

    @Override
    public Expression visitZSuperArgs(ZSuperArgs node, MutableContext ctx) {
        return mapper.postTransformZSuperArgs(ctx, node);
    }

    @Override
    public Expression visitHash(Hash node, MutableContext ctx) {
        // 按 key/value 交替的源码顺序处理
        List<Expression> keys = new ArrayList<>(node.getKeys().size());
        List<Expression> values = new ArrayList<>(node.getValues().size());
        boolean changed = false;
        for (int i = 0; i < node.getKeys().size(); i++) {
            Expression key = map(node.getKeys().get(i), ctx);
            Expression value = map(node.getValues().get(i), ctx);
            changed |= key != node.getKeys().get(i) || value != node.getValues().get(i);
            keys.add(key);
            values.add(value);
        }
        Hash result = changed ? new Hash(node.getLoc(), keys, values) : node;
        return mapper.postTransformHash(ctx, result);
    }

    @Override
    public Expression visitArray(Array node, MutableContext ctx) {
        List<Expression> elems = mapList(node.getElems(), Expression.class, "elems", ctx, node.getLoc());
        Array result = elems == node.getElems() ? node : new Array(node.getLoc(), elems);
        return mapper.postTransformArray(ctx, result);
    }

    @Override
    public Expression visitLiteral(Literal node, MutableContext ctx) {
        return mapper.postTransformLiteral(ctx, node);
    }

    @Override
    public Expression visitUnresolvedConstantLit(UnresolvedConstantLit node, MutableContext ctx) {
        Expression scope = map(node.getScope(), ctx);
        UnresolvedConstantLit result = scope == node.getScope()
                ? node : new UnresolvedConstantLit(node.getLoc(), scope, node.getCnst());
        return mapper.postTransformUnresolvedConstantLit(ctx, result);
    }

    @Override
    public Expression visitConstantLit(ConstantLit node, MutableContext ctx) {
        // original 只是解析前语法的记录，不参与遍历
        ConstantLit result = node;
        if (node.getTypeAlias() != null) {
            Expression typeAlias = map(node.getTypeAlias(), ctx);
            if (typeAlias != node.getTypeAlias()) {
                result = new ConstantLit(node.getLoc(), node.getSymbol(), node.getOriginal(), typeAlias);
            }
        }
        return mapper.postTransformConstantLit(ctx, result);
    }

    @Override
    public Expression visitSelf(Self node, MutableContext ctx) {
        return mapper.postTransformSelf(ctx, node);
    }

    @Override
    public Expression visitBlock(Block node, MutableContext ctx) {
        Block block = mapper.preTransformBlock(ctx, node);
        Enforce.notNull(block, "preTransformBlock result", node.getLoc());

        List<Expression> args = mapArgs(block.getArgs(), ctx, block.getLoc());
        Expression body = map(block.getBody(), ctx);
        if (args != block.getArgs() || body != block.getBody()) {
            block = new Block(block.getLoc(), args, body, block.getSymbol());
        }
        return mapper.postTransformBlock(ctx, block);
    }

    @Override
    public Expression visitInsSeq(InsSeq node, MutableContext ctx) {
        List<Expression> stats = mapList(node.getStats(), Expression.class, "stats", ctx, node.getLoc());
        Expression expr = map(node.getExpr(), ctx);
        InsSeq result = node;
        if (stats != node.getStats() || expr != node.getExpr()) {
            result = new InsSeq(node.getLoc(), stats, expr);
        }
        return mapper.postTransformInsSeq(ctx, result);
    }

    @Override
    public Expression visitEmptyTree(EmptyTree node, MutableContext ctx) {
        return mapper.postTransformEmptyTree(ctx, node);
    }
}
