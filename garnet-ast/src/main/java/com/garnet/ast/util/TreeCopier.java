package com.garnet.ast.util;

import com.garnet.ast.EmptyTree;
import com.garnet.ast.Expression;
import com.garnet.ast.TreeVisitor;
import com.garnet.ast.decl.*;
import com.garnet.ast.expr.*;
import com.garnet.ast.flow.*;
import com.garnet.ast.ref.*;

import java.util.ArrayList;
import java.util.List;

/**
 * 结构深拷贝：每个节点都是新实例，Loc、名字、符号和类型原样共享（它们是不可变值）。
 *
 * <p>rule 需要把同一棵子树放进结果两次时，第二份必须来自这里。</p>
 */
public final class TreeCopier implements TreeVisitor<Expression, Void> {

    private static final TreeCopier INSTANCE = new TreeCopier();

    private TreeCopier() {
    }

    @SuppressWarnings("unchecked")
    public static <T extends Expression> T deepCopy(T tree) {
        return (T) tree.accept(INSTANCE, null);
    }

    private static <T extends Expression> List<T> copyList(List<T> list) {
        List<T> result = new ArrayList<>(list.size());
        for (T e : list) {
            result.add(deepCopy(e));
        }
        return result;
    }

    @Override
    public Expression visitClassDef(ClassDef node, Void ctx) {
        return new ClassDef(node.getLoc(), node.getDeclLoc(), node.getSymbol(), deepCopy(node.getName()),
                copyList(node.getAncestors()), copyList(node.getRhs()), node.getKind());
    }

    @Override
    public Expression visitMethodDef(MethodDef node, Void ctx) {
        return new MethodDef(node.getLoc(), node.getDeclLoc(), node.getSymbol(), node.getName(),
                copyList(node.getArgs()), deepCopy(node.getRhs()), node.getFlags());
    }

    @Override
    public Expression visitIf(If node, Void ctx) {
        return new If(node.getLoc(), deepCopy(node.getCond()), deepCopy(node.getThenp()), deepCopy(node.getElsep()));
    }

    @Override
    public Expression visitWhile(While node, Void ctx) {
        return new While(node.getLoc(), deepCopy(node.getCond()), deepCopy(node.getBody()));
    }

    @Override
    public Expression visitBreak(Break node, Void ctx) {
        return new Break(node.getLoc(), deepCopy(node.getExpr()));
    }

    @Override
    public Expression visitRetry(Retry node, Void ctx) {
        return new Retry(node.getLoc());
    }

    @Override
    public Expression visitNext(Next node, Void ctx) {
        return new Next(node.getLoc(), deepCopy(node.getExpr()));
    }

    @Override
    public Expression visitReturn(Return node, Void ctx) {
        return new Return(node.getLoc(), deepCopy(node.getExpr()));
    }

    @Override
    public Expression visitYield(Yield node, Void ctx) {
        return new Yield(node.getLoc(), copyList(node.getArgs()));
    }

    @Override
    public Expression visitRescueCase(RescueCase node, Void ctx) {
        return new RescueCase(node.getLoc(), copyList(node.getExceptions()), deepCopy(node.getVar()),
                deepCopy(node.getBody()));
    }

    @Override
    public Expression visitRescue(Rescue node, Void ctx) {
        return new Rescue(node.getLoc(), deepCopy(node.getBody()), copyList(node.getRescueCases()),
                deepCopy(node.getElse()), deepCopy(node.getEnsure()));
    }

    @Override
    public Expression visitField(Field node, Void ctx) {
        return new Field(node.getLoc(), node.getSymbol());
    }

    @Override
    public Expression visitLocal(Local node, Void ctx) {
        return new Local(node.getLoc(), node.getLocalVariable());
    }

    @Override
    public Expression visitUnresolvedIdent(UnresolvedIdent node, Void ctx) {
        return new UnresolvedIdent(node.getLoc(), node.getKind(), node.getName());
    }

    @Override
    public Expression visitRestArg(RestArg node, Void ctx) {
        return new RestArg(node.getLoc(), deepCopy(node.getExpr()));
    }

    @Override
    public Expression visitKeywordArg(KeywordArg node, Void ctx) {
        return new KeywordArg(node.getLoc(), deepCopy(node.getExpr()));
    }

    @Override
    public Expression visitOptionalArg(OptionalArg node, Void ctx) {
        return new OptionalArg(node.getLoc(), deepCopy(node.getExpr()), deepCopy(node.getDefault()));
    }

    @Override
    public Expression visitShadowArg(ShadowArg node, Void ctx) {
        return new ShadowArg(node.getLoc(), deepCopy(node.getExpr()));
    }

    @Override
    public Expression visitBlockArg(BlockArg node, Void ctx) {
        return new BlockArg(node.getLoc(), deepCopy(node.getExpr()));
    }

    @Override
    public Expression visitAssign(Assign node, Void ctx) {
        return new Assign(node.getLoc(), deepCopy(node.getLhs()), deepCopy(node.getRhs()));
    }

    @Override
    public Expression visitSend(Send node, Void ctx) {
        Block block = node.hasBlock() ? deepCopy(node.getBlock()) : null;
        return new Send(node.getLoc(), deepCopy(node.getRecv()), node.getFun(), copyList(node.getArgs()), block);
    }

    @Override
    public Expression visitCast(Cast node, Void ctx) {
        return new Cast(node.getLoc(), node.getType(), deepCopy(node.getArg()), node.getCast());
    }

    @Override
    public Expression visitZSuperArgs(ZSuperArgs node, Void ctx) {
        return new ZSuperArgs(node.getLoc());
    }

    @Override
    public Expression visitHash(Hash node, Void ctx) {
        return new Hash(node.getLoc(), copyList(node.getKeys()), copyList(node.getValues()));
    }

    @Override
    public Expression visitArray(Array node, Void ctx) {
        return new Array(node.getLoc(), copyList(node.getElems()));
    }

    @Override
    public Expression visitLiteral(Literal node, Void ctx) {
        return new Literal(node.getLoc(), node.getValue());
    }

    @Override
    public Expression visitUnresolvedConstantLit(UnresolvedConstantLit node, Void ctx) {
        return new UnresolvedConstantLit(node.getLoc(), deepCopy(node.getScope()), node.getCnst());
    }

    @Override
    public Expression visitConstantLit(ConstantLit node, Void ctx) {
        UnresolvedConstantLit original = node.getOriginal() != null ? deepCopy(node.getOriginal()) : null;
        Expression typeAlias = node.getTypeAlias() != null ? deepCopy(node.getTypeAlias()) : null;
        return new ConstantLit(node.getLoc(), node.getSymbol(), original, typeAlias);
    }

    @Override
    public Expression visitSelf(Self node, Void ctx) {
        return new Self(node.getLoc(), node.getClaz());
    }

    @Override
    public Expression visitBlock(Block node, Void ctx) {
        return new Block(node.getLoc(), copyList(node.getArgs()), deepCopy(node.getBody()), node.getSymbol());
    }

    @Override
    public Expression visitInsSeq(InsSeq node, Void ctx) {
        return new InsSeq(node.getLoc(), copyList(node.getStats()), deepCopy(node.getExpr()));
    }

    @Override
    public Expression visitEmptyTree(EmptyTree node, Void ctx) {
        return new EmptyTree();
    }
}
