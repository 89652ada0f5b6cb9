package com.garnet.dsl.rules;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.Send;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("encrypted_prop 规则测试")
class MixinEncryptedPropRuleTest {

    private GlobalState gs;
    private MutableContext ctx;
    private TreeBuilder b;
    private Loc loc;
    private final MixinEncryptedPropRule rule = new MixinEncryptedPropRule();

    @BeforeEach
    void setUp() {
        gs = new GlobalState();
        ctx = new MutableContext(gs);
        b = new TreeBuilder(ctx);
        loc = new Loc(gs.enterFile("e.rb"), 0, 22);
    }

    @Test
    @DisplayName("明文与密文属性各一对读写方法")
    void testExpand() {
        Send send = b.send1(loc, b.self(loc), Names.ENCRYPTED_PROP, b.symbol(loc, gs.enterNameUtf8("secret")));
        List<Expression> out = rule.replaceDsl(ctx, send, null);

        List<String> names = new ArrayList<>();
        for (Expression e : out) {
            names.add(((MethodDef) e).getName().show(gs));
        }
        assertThat(names).containsExactly("secret", "secret=", "encrypted_secret", "encrypted_secret=");
        assertThat(((MethodDef) out.get(2)).getRhs().toString(gs))
                .isEqualTo("<emptyTree>::T.let(@encrypted_secret, <emptyTree>::T.nilable(<emptyTree>::String))");
    }

    @Test
    @DisplayName("第二个参数不是选项哈希时放弃")
    void testDecline() {
        Send send = b.send2(loc, b.self(loc), Names.ENCRYPTED_PROP, b.symbol(loc, gs.enterNameUtf8("secret")),
                b.constant(loc, Names.STRING));
        assertThat(rule.replaceDsl(ctx, send, null)).isEmpty();
    }

    @Test
    @DisplayName("带选项哈希时照常展开")
    void testWithOptions() {
        Send send = b.send2(loc, b.self(loc), Names.ENCRYPTED_PROP, b.symbol(loc, gs.enterNameUtf8("secret")),
                b.hash1(loc, b.symbol(loc, gs.enterNameUtf8("migrating")), b.trueLit(loc)));
        assertThat(rule.replaceDsl(ctx, send, null)).hasSize(4);
    }
}
