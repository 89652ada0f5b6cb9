package com.garnet.ast.util;

import com.garnet.ast.EmptyTree;
import com.garnet.ast.Expression;
import com.garnet.ast.Reference;
import com.garnet.ast.decl.ClassDef;
import com.garnet.ast.decl.ClassDefKind;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.*;
import com.garnet.ast.flow.RescueCase;
import com.garnet.ast.flow.Rescue;
import com.garnet.ast.flow.Return;
import com.garnet.ast.ref.OptionalArg;
import com.garnet.ast.ref.UnresolvedIdent;
import com.garnet.ast.ref.VarKind;
import com.garnet.core.Loc;
import com.garnet.core.MutableContext;
import com.garnet.core.NameRef;
import com.garnet.core.Names;
import com.garnet.core.Symbols;
import com.garnet.core.metrics.TreeMetrics;
import com.garnet.core.types.ClassType;
import com.garnet.core.types.LiteralType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 节点工厂。pass 和测试通过它建树，构造计数上报给上下文持有的 {@link TreeMetrics}。
 *
 * <p>名称全部在构造前解析，新名字只能经由 {@link com.garnet.core.GlobalState#enterNameUtf8} 进入名字表。</p>
 */
public class TreeBuilder {

    private static final String CATEGORY = "trees";

    private final MutableContext ctx;
    private final TreeMetrics metrics;

    public TreeBuilder(MutableContext ctx) {
        this.ctx = ctx;
        this.metrics = ctx.getMetrics();
    }

    public MutableContext getContext() {
        return ctx;
    }

    private <T extends Expression> T count(T node, String counter) {
        metrics.categoryCounterInc(CATEGORY, counter);
        return node;
    }

    // ===== 引用 =====

    /** 未解析的局部变量 foo */
    public UnresolvedIdent local(Loc loc, NameRef name) {
        return count(new UnresolvedIdent(loc, VarKind.LOCAL, name), "unresolvedident");
    }

    /**
     * 未解析的实例变量。传入属性名 foo，节点名字是驻留后的 {@code @foo}。
     */
    public UnresolvedIdent instanceVar(Loc loc, NameRef attr) {
        NameRef name = ctx.getState().enterNameUtf8("@" + attr.show(ctx.getState()));
        return count(new UnresolvedIdent(loc, VarKind.INSTANCE, name), "unresolvedident");
    }

    public OptionalArg optionalArg(Loc loc, Reference expr, Expression defaultValue) {
        return count(new OptionalArg(loc, expr, defaultValue), "optionalarg");
    }

    // ===== 常量与字面量 =====

    public UnresolvedConstantLit constant(Loc loc, Expression scope, NameRef cnst) {
        return count(new UnresolvedConstantLit(loc, scope, cnst), "constantlit");
    }

    public UnresolvedConstantLit constant(Loc loc, NameRef cnst) {
        return constant(loc, emptyTree(), cnst);
    }

    /** 类型运行时模块 T */
    public UnresolvedConstantLit tModule(Loc loc) {
        return constant(loc, Names.T);
    }

    public Literal symbol(Loc loc, NameRef name) {
        return count(new Literal(loc, LiteralType.symbol(name)), "literal");
    }

    public Literal string(Loc loc, NameRef value) {
        return count(new Literal(loc, LiteralType.string(value)), "literal");
    }

    public Literal integer(Loc loc, long value) {
        return count(new Literal(loc, LiteralType.integer(value)), "literal");
    }

    public Literal nil(Loc loc) {
        return count(new Literal(loc, ClassType.nil()), "literal");
    }

    public Literal trueLit(Loc loc) {
        return count(new Literal(loc, ClassType.trueClass()), "literal");
    }

    public Literal falseLit(Loc loc) {
        return count(new Literal(loc, ClassType.falseClass()), "literal");
    }

    public Self self(Loc loc) {
        return count(new Self(loc, Symbols.TODO), "self");
    }

    public EmptyTree emptyTree() {
        return count(new EmptyTree(), "emptytree");
    }

    // ===== 指令 =====

    public Send send(Loc loc, Expression recv, NameRef fun, List<Expression> args, Block block) {
        Send send = new Send(loc, recv, fun, args, block);
        metrics.categoryCounterInc(CATEGORY, "send");
        if (block != null) {
            metrics.counterInc("trees.send.with_block");
        }
        metrics.histogramInc("trees.send.args", args.size());
        return send;
    }

    public Send send(Loc loc, Expression recv, NameRef fun, List<Expression> args) {
        return send(loc, recv, fun, args, null);
    }

    public Send send0(Loc loc, Expression recv, NameRef fun) {
        return send(loc, recv, fun, Collections.<Expression>emptyList());
    }

    public Send send1(Loc loc, Expression recv, NameRef fun, Expression arg) {
        return send(loc, recv, fun, Collections.singletonList(arg));
    }

    public Send send2(Loc loc, Expression recv, NameRef fun, Expression arg1, Expression arg2) {
        return send(loc, recv, fun, Arrays.asList(arg1, arg2));
    }

    public Assign assign(Loc loc, Expression lhs, Expression rhs) {
        return count(new Assign(loc, lhs, rhs), "assign");
    }

    public Hash hash(Loc loc, List<Expression> keys, List<Expression> values) {
        Hash hash = count(new Hash(loc, keys, values), "hash");
        metrics.histogramInc("trees.hash.entries", keys.size());
        return hash;
    }

    public Hash hash1(Loc loc, Expression key, Expression value) {
        return hash(loc, Collections.singletonList(key), Collections.singletonList(value));
    }

    public Array array(Loc loc, List<Expression> elems) {
        Array array = count(new Array(loc, elems), "array");
        metrics.histogramInc("trees.array.elems", elems.size());
        return array;
    }

    public Block block(Loc loc, List<Expression> args, Expression body) {
        return count(new Block(loc, args, body), "block");
    }

    public Block block0(Loc loc, Expression body) {
        return block(loc, Collections.<Expression>emptyList(), body);
    }

    public InsSeq insSeq(Loc loc, List<Expression> stats, Expression expr) {
        InsSeq insSeq = count(new InsSeq(loc, stats, expr), "insseq");
        metrics.histogramInc("trees.insseq.stats", stats.size());
        return insSeq;
    }

    public Return returnExpr(Loc loc, Expression expr) {
        return count(new Return(loc, expr), "return");
    }

    public RescueCase rescueCase(Loc loc, List<Expression> exceptions, Expression var, Expression body) {
        RescueCase rescueCase = count(new RescueCase(loc, exceptions, var, body), "rescuecase");
        metrics.histogramInc("trees.rescueCase.exceptions", exceptions.size());
        return rescueCase;
    }

    public Rescue rescue(Loc loc, Expression body, List<RescueCase> cases, Expression elseBranch, Expression ensure) {
        Rescue rescue = count(new Rescue(loc, body, cases, elseBranch, ensure), "rescue");
        metrics.histogramInc("trees.rescue.rescuecases", cases.size());
        return rescue;
    }

    // ===== 定义 =====

    public MethodDef methodDef(Loc loc, NameRef name, List<Expression> args, Expression rhs, int flags) {
        MethodDef methodDef = count(new MethodDef(loc, loc, Symbols.TODO, name, args, rhs, flags), "methoddef");
        metrics.histogramInc("trees.methodDef.args", args.size());
        return methodDef;
    }

    /** DSL 合成的实例方法 */
    public MethodDef syntheticMethod(Loc loc, NameRef name, List<Expression> args, Expression rhs) {
        return methodDef(loc, name, args, rhs, MethodDef.DSL_SYNTHESIZED);
    }

    /** DSL 合成的单例方法 def self.x */
    public MethodDef selfMethodDef(Loc loc, NameRef name, List<Expression> args, Expression rhs) {
        return methodDef(loc, name, args, rhs, MethodDef.SELF_METHOD | MethodDef.DSL_SYNTHESIZED);
    }

    public ClassDef classDef(Loc loc, Expression name, List<Expression> ancestors, List<Expression> rhs,
                             ClassDefKind kind) {
        ClassDef classDef = count(new ClassDef(loc, loc, Symbols.TODO, name, ancestors, rhs, kind), "classdef");
        metrics.histogramInc("trees.classdef.kind", kind.ordinal());
        metrics.histogramInc("trees.classdef.ancestors", ancestors.size());
        return classDef;
    }

    // ===== T 运行时 =====

    /** T.let(value, type) */
    public Send let(Loc loc, Expression value, Expression type) {
        return send2(loc, tModule(loc), Names.LET, value, type);
    }

    /** T.unsafe(inner) */
    public Send unsafe(Loc loc, Expression inner) {
        return send1(loc, tModule(loc), Names.UNSAFE, inner);
    }

    /** T.untyped */
    public Send untyped(Loc loc) {
        return send0(loc, tModule(loc), Names.UNTYPED);
    }

    /** T.nilable(type) */
    public Send nilable(Loc loc, Expression type) {
        return send1(loc, tModule(loc), Names.NILABLE, type);
    }

    /** sig {returns(ret)} */
    public Send sig0(Loc loc, Expression ret) {
        Send returns = send1(loc, self(loc), Names.RETURNS, ret);
        return send(loc, self(loc), Names.SIG, Collections.<Expression>emptyList(), block0(loc, returns));
    }

    /** sig {params(k: v, ...).returns(ret)} */
    public Send sig(Loc loc, Hash params, Expression ret) {
        Send withParams = send1(loc, self(loc), Names.PARAMS, params);
        Send returns = send1(loc, withParams, Names.RETURNS, ret);
        return send(loc, self(loc), Names.SIG, Collections.<Expression>emptyList(), block0(loc, returns));
    }

    /** sig {params(k: v, ...).void} */
    public Send sigVoid(Loc loc, Hash params) {
        Send withParams = send1(loc, self(loc), Names.PARAMS, params);
        Send voidSend = send0(loc, withParams, Names.VOID);
        return send(loc, self(loc), Names.SIG, Collections.<Expression>emptyList(), block0(loc, voidSend));
    }

    /**
     * 可变列表，便于 rule 继续追加
     */
    public static List<Expression> list(Expression... elems) {
        return new ArrayList<>(Arrays.asList(elems));
    }
}
