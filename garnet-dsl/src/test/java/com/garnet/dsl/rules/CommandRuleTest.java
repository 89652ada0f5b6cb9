package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.ClassDef;
import com.garnet.ast.decl.ClassDefKind;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.Send;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.*;
import com.garnet.dsl.Dsl;
import com.garnet.dsl.DslConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Opus::Command 规则测试")
class CommandRuleTest {

    private GlobalState gs;
    private MutableContext ctx;
    private TreeBuilder b;
    private Loc loc;
    private final CommandRule rule = new CommandRule();

    @BeforeEach
    void setUp() {
        gs = new GlobalState();
        ctx = new MutableContext(gs);
        b = new TreeBuilder(ctx);
        loc = new Loc(gs.enterFile("cmd.rb"), 0, 60);
    }

    private Expression opusCommand() {
        return b.constant(loc, b.constant(loc, Names.OPUS), Names.COMMAND);
    }

    private MethodDef call() {
        return b.methodDef(loc, Names.CALL, TreeBuilder.list(b.local(loc, gs.enterNameUtf8("x"))),
                b.local(loc, gs.enterNameUtf8("x")), 0);
    }

    private ClassDef command(Expression ancestor, Expression... stats) {
        return b.classDef(loc, b.constant(loc, gs.enterNameUtf8("MyCommand")), TreeBuilder.list(ancestor),
                TreeBuilder.list(stats), ClassDefKind.CLASS);
    }

    @Test
    @DisplayName("追加 sig 拷贝和 self.call")
    void testAppend() {
        Send sig = b.sig0(loc, b.constant(loc, Names.INTEGER));
        ClassDef cd = command(opusCommand(), sig, call());
        List<Expression> extra = rule.replaceDsl(ctx, cd, null);

        assertThat(extra).hasSize(2);
        assertThat(extra.get(0)).isNotSameAs(sig);
        assertThat(extra.get(0).toString(gs)).isEqualTo(sig.toString(gs));
        MethodDef selfCall = (MethodDef) extra.get(1);
        assertThat(selfCall.isSelf()).isTrue();
        assertThat(selfCall.getName()).isEqualTo(Names.CALL);
        assertThat(selfCall.getArgs()).hasSize(1);
        assertThat(selfCall.getRhs().isEmptyTree()).isTrue();
    }

    @Test
    @DisplayName("没有 sig 时只追加 self.call")
    void testWithoutSig() {
        assertThat(rule.replaceDsl(ctx, command(opusCommand(), call()), null)).hasSize(1);
    }

    @Test
    @DisplayName("不是 Opus::Command 子类、没有 call、已有 self.call 时不追加")
    void testNoMatch() {
        assertThat(rule.replaceDsl(ctx, command(b.constant(loc, Names.COMMAND), call()), null)).isEmpty();
        assertThat(rule.replaceDsl(ctx, command(opusCommand()), null)).isEmpty();

        MethodDef existing = b.selfMethodDef(loc, Names.CALL, TreeBuilder.list(), b.emptyTree());
        assertThat(rule.replaceDsl(ctx, command(opusCommand(), call(), existing), null)).isEmpty();
    }

    @Test
    @DisplayName("经由 pass 运行时追加到类体末尾")
    void testThroughPass() {
        ClassDef result = (ClassDef) Dsl.run(ctx, command(opusCommand(), call()), new DslConfig());
        assertThat(result.getRhs()).hasSize(2);
        assertThat(((MethodDef) result.getRhs().get(1)).isSelf()).isTrue();
    }
}
