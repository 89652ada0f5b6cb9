package com.garnet.ast.util;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.Send;
import com.garnet.ast.ref.OptionalArg;
import com.garnet.core.GlobalState;
import com.garnet.core.Loc;
import com.garnet.core.MutableContext;
import com.garnet.core.Names;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("深拷贝测试")
class TreeCopierTest {

    private final GlobalState gs = new GlobalState();
    private final MutableContext ctx = new MutableContext(gs);
    private final TreeBuilder b = new TreeBuilder(ctx);
    private final Loc loc = new Loc(gs.enterFile("a.rb"), 4, 7);

    @Test
    @DisplayName("拷贝结构相同、实例全新")
    void testDeepCopy() {
        OptionalArg opt = b.optionalArg(loc, b.local(loc, gs.enterNameUtf8("o")), b.nil(loc));
        Send body = b.let(loc, b.instanceVar(loc, gs.enterNameUtf8("o")), b.constant(loc, Names.STRING));
        MethodDef m = b.syntheticMethod(loc, gs.enterNameUtf8("m"), Arrays.<Expression>asList(opt), body);

        MethodDef copy = TreeCopier.deepCopy(m);

        assertThat(copy).isNotSameAs(m);
        assertThat(copy.showRaw(gs)).isEqualTo(m.showRaw(gs));
        assertThat(copy.getArgs().get(0)).isNotSameAs(opt);
        assertThat(copy.getRhs()).isNotSameAs(body);
        assertThat(copy.getLoc()).isEqualTo(loc);
        assertThat(copy.getFlags()).isEqualTo(m.getFlags());
    }

    @Test
    @DisplayName("原树与拷贝可以同时挂在一棵树上")
    void testCopyKeepsTreeShape() {
        Expression type = b.constant(loc, Names.STRING);
        Expression tree = b.array(loc, Arrays.asList(type, TreeCopier.deepCopy(type)));
        assertThatCode(() -> OwnershipChecker.check(ctx, tree)).doesNotThrowAnyException();
    }
}
