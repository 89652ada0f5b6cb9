package com.garnet.ast.treemap;

import com.garnet.ast.EmptyTree;
import com.garnet.ast.Expression;
import com.garnet.ast.decl.*;
import com.garnet.ast.expr.*;
import com.garnet.ast.flow.*;
import com.garnet.ast.ref.*;
import com.garnet.core.MutableContext;

/**
 * {@link TreeMap} 的改写回调。
 *
 * <p>每种节点一个后序钩子 {@code postTransformX}，在子节点处理完之后调用，返回值替换该节点；
 * 默认全部转发到 {@link #postTransformDefault}，即原样返回。
 * 另有三个前序钩子，在进入定义、方法和块的子节点之前调用。</p>
 *
 * <p>钩子收到的节点归 TreeMap 所有，返回值的所有权交回 TreeMap。
 * 不要把同一个节点实例放进结果两次。</p>
 */
public interface TreeMapper {

    default Expression postTransformDefault(MutableContext ctx, Expression tree) {
        return tree;
    }

    // ===== 前序 =====

    default ClassDef preTransformClassDef(MutableContext ctx, ClassDef tree) {
        return tree;
    }

    default MethodDef preTransformMethodDef(MutableContext ctx, MethodDef tree) {
        return tree;
    }

    default Block preTransformBlock(MutableContext ctx, Block tree) {
        return tree;
    }

    // ===== 后序 =====

    default Expression postTransformClassDef(MutableContext ctx, ClassDef tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformMethodDef(MutableContext ctx, MethodDef tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformIf(MutableContext ctx, If tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformWhile(MutableContext ctx, While tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformBreak(MutableContext ctx, Break tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformRetry(MutableContext ctx, Retry tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformNext(MutableContext ctx, Next tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformReturn(MutableContext ctx, Return tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformYield(MutableContext ctx, Yield tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformRescueCase(MutableContext ctx, RescueCase tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformRescue(MutableContext ctx, Rescue tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformField(MutableContext ctx, Field tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformLocal(MutableContext ctx, Local tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformUnresolvedIdent(MutableContext ctx, UnresolvedIdent tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformRestArg(MutableContext ctx, RestArg tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformKeywordArg(MutableContext ctx, KeywordArg tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformOptionalArg(MutableContext ctx, OptionalArg tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformShadowArg(MutableContext ctx, ShadowArg tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformBlockArg(MutableContext ctx, BlockArg tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformAssign(MutableContext ctx, Assign tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformSend(MutableContext ctx, Send tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformCast(MutableContext ctx, Cast tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformZSuperArgs(MutableContext ctx, ZSuperArgs tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformHash(MutableContext ctx, Hash tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformArray(MutableContext ctx, Array tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformLiteral(MutableContext ctx, Literal tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformUnresolvedConstantLit(MutableContext ctx, UnresolvedConstantLit tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformConstantLit(MutableContext ctx, ConstantLit tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformSelf(MutableContext ctx, Self tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformBlock(MutableContext ctx, Block tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformInsSeq(MutableContext ctx, InsSeq tree) {
        return postTransformDefault(ctx, tree);
    }

    default Expression postTransformEmptyTree(MutableContext ctx, EmptyTree tree) {
        return postTransformDefault(ctx, tree);
    }
}
