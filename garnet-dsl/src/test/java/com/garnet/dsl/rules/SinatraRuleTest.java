package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Sinatra 规则测试")
class SinatraRuleTest {

    private GlobalState gs;
    private MutableContext ctx;
    private TreeBuilder b;
    private Loc loc;
    private final SinatraRule rule = new SinatraRule();

    @BeforeEach
    void setUp() {
        gs = new GlobalState();
        ctx = new MutableContext(gs);
        b = new TreeBuilder(ctx);
        loc = new Loc(gs.enterFile("ext.rb"), 0, 40);
    }

    private MethodDef registered(Expression... args) {
        return b.selfMethodDef(loc, Names.REGISTERED, TreeBuilder.list(args), b.emptyTree());
    }

    @Test
    @DisplayName("registered(app) 前补 sig")
    void testAddSig() {
        MethodDef mdef = registered(b.local(loc, gs.enterNameUtf8("app")));
        List<Expression> out = rule.replaceDsl(ctx, mdef, null);
        assertThat(out).hasSize(2);
        assertThat(out.get(0).toString(gs)).isEqualTo(
                "self(<todo sym>).sig() do ||\n"
                        + "  self(<todo sym>).params({:app => <emptyTree>::T.untyped()}).void()\n"
                        + "end");
        assertThat(out.get(1)).isSameAs(mdef);
    }

    @Test
    @DisplayName("已有 sig、参数个数不对、实例方法时不改写")
    void testNoRewrite() {
        MethodDef mdef = registered(b.local(loc, gs.enterNameUtf8("app")));
        assertThat(rule.replaceDsl(ctx, mdef, b.sig0(loc, b.nil(loc)))).isEmpty();

        assertThat(rule.replaceDsl(ctx, registered(), null)).isEmpty();

        MethodDef instance = b.methodDef(loc, Names.REGISTERED,
                TreeBuilder.list(b.local(loc, gs.enterNameUtf8("app"))), b.emptyTree(), 0);
        assertThat(rule.replaceDsl(ctx, instance, null)).isEmpty();
    }
}
