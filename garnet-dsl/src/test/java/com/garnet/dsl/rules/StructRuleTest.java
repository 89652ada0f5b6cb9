package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.ClassDef;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.Assign;
import com.garnet.ast.expr.Block;
import com.garnet.ast.expr.Send;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Struct 规则测试")
class StructRuleTest {

    private GlobalState gs;
    private MutableContext ctx;
    private TreeBuilder b;
    private Loc loc;
    private final StructRule rule = new StructRule();

    @BeforeEach
    void setUp() {
        gs = new GlobalState();
        ctx = new MutableContext(gs);
        b = new TreeBuilder(ctx);
        loc = new Loc(gs.enterFile("s.rb"), 0, 25);
    }

    private Assign struct(List<Expression> members, Block block) {
        Send send = b.send(loc, b.constant(loc, Names.STRUCT), Names.NEW, members, block);
        return b.assign(loc, b.constant(loc, gs.enterNameUtf8("Point")), send);
    }

    @Test
    @DisplayName("A = Struct.new(:x, :y) 展开为类定义")
    void testExpand() {
        Assign asgn = struct(TreeBuilder.list(b.symbol(loc, gs.enterNameUtf8("x")),
                b.symbol(loc, gs.enterNameUtf8("y"))), null);
        List<Expression> out = rule.replaceDsl(ctx, asgn, null);

        assertThat(out).hasSize(1);
        ClassDef cd = (ClassDef) out.get(0);
        assertThat(cd.getName()).isSameAs(asgn.getLhs());
        assertThat(cd.getAncestors()).hasSize(1);
        assertThat(cd.getAncestors().get(0).toString(gs)).isEqualTo("<emptyTree>::Struct");
        assertThat(cd.getRhs()).hasSize(5);

        MethodDef readerX = (MethodDef) cd.getRhs().get(0);
        assertThat(readerX.getName().show(gs)).isEqualTo("x");
        assertThat(readerX.getRhs().toString(gs)).isEqualTo("@x");
        MethodDef writerY = (MethodDef) cd.getRhs().get(3);
        assertThat(writerY.getName().show(gs)).isEqualTo("y=");
        assertThat(writerY.getRhs().toString(gs)).isEqualTo("@y = y");

        MethodDef init = (MethodDef) cd.getRhs().get(4);
        assertThat(init.getName()).isEqualTo(Names.INITIALIZE);
        assertThat(init.getArgs()).hasSize(2);
        assertThat(init.getArgs().get(0).toString(gs)).isEqualTo("x = nil");
        assertThat(init.getRhs().isEmptyTree()).isTrue();
    }

    @Test
    @DisplayName("非符号成员、空成员、带块时放弃")
    void testDecline() {
        assertThat(rule.replaceDsl(ctx, struct(TreeBuilder.list(b.integer(loc, 1)), null), null)).isEmpty();
        assertThat(rule.replaceDsl(ctx, struct(TreeBuilder.list(), null), null)).isEmpty();
        assertThat(rule.replaceDsl(ctx, struct(TreeBuilder.list(b.symbol(loc, gs.enterNameUtf8("x"))),
                b.block0(loc, b.nil(loc))), null)).isEmpty();
    }

    @Test
    @DisplayName("左侧不是常量或右侧不是 Struct.new 时不匹配")
    void testNoMatch() {
        Send send = b.send1(loc, b.constant(loc, Names.STRUCT), Names.NEW, b.symbol(loc, gs.enterNameUtf8("x")));
        Assign toLocal = b.assign(loc, b.local(loc, gs.enterNameUtf8("p")), send);
        assertThat(rule.replaceDsl(ctx, toLocal, null)).isEmpty();

        Send other = b.send1(loc, b.constant(loc, Names.OBJECT), Names.NEW, b.symbol(loc, gs.enterNameUtf8("x")));
        Assign notStruct = b.assign(loc, b.constant(loc, gs.enterNameUtf8("P")), other);
        assertThat(rule.replaceDsl(ctx, notStruct, null)).isEmpty();
    }
}
