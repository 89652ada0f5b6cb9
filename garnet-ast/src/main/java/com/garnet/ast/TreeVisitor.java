package com.garnet.ast;

import com.garnet.ast.decl.*;
import com.garnet.ast.expr.*;
import com.garnet.ast.flow.*;
import com.garnet.ast.ref.*;

/**
 * 语法树访问者接口，每种节点一个 visit 方法。
 *
 * <p>刻意不提供默认实现：新增节点种类时，所有访问者都必须在编译期补上对应分支。</p>
 *
 * @param <R> 返回类型
 * @param <C> 上下文类型
 */
public interface TreeVisitor<R, C> {

    // ===== 定义 (2) =====
    R visitClassDef(ClassDef node, C context);
    R visitMethodDef(MethodDef node, C context);

    // ===== 控制流 (9) =====
    R visitIf(If node, C context);
    R visitWhile(While node, C context);
    R visitBreak(Break node, C context);
    R visitRetry(Retry node, C context);
    R visitNext(Next node, C context);
    R visitReturn(Return node, C context);
    R visitYield(Yield node, C context);
    R visitRescueCase(RescueCase node, C context);
    R visitRescue(Rescue node, C context);

    // ===== 引用与形参 (8) =====
    R visitField(Field node, C context);
    R visitLocal(Local node, C context);
    R visitUnresolvedIdent(UnresolvedIdent node, C context);
    R visitRestArg(RestArg node, C context);
    R visitKeywordArg(KeywordArg node, C context);
    R visitOptionalArg(OptionalArg node, C context);
    R visitShadowArg(ShadowArg node, C context);
    R visitBlockArg(BlockArg node, C context);

    // ===== 指令 (13) =====
    R visitAssign(Assign node, C context);
    R visitSend(Send node, C context);
    R visitCast(Cast node, C context);
    R visitZSuperArgs(ZSuperArgs node, C context);
    R visitHash(Hash node, C context);
    R visitArray(Array node, C context);
    R visitLiteral(Literal node, C context);
    R visitUnresolvedConstantLit(UnresolvedConstantLit node, C context);
    R visitConstantLit(ConstantLit node, C context);
    R visitSelf(Self node, C context);
    R visitBlock(Block node, C context);
    R visitInsSeq(InsSeq node, C context);
    R visitEmptyTree(EmptyTree node, C context);
}
