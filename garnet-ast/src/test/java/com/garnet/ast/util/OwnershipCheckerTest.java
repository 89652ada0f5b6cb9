package com.garnet.ast.util;

import com.garnet.ast.Expression;
import com.garnet.ast.expr.Literal;
import com.garnet.core.GlobalState;
import com.garnet.core.Loc;
import com.garnet.core.MutableContext;
import com.garnet.core.TreeCorruptionError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("所有权校验测试")
class OwnershipCheckerTest {

    private final GlobalState gs = new GlobalState();
    private final MutableContext ctx = new MutableContext(gs);
    private final TreeBuilder b = new TreeBuilder(ctx);
    private final Loc loc = new Loc(gs.enterFile("a.rb"), 0, 1);

    @Test
    @DisplayName("合法的树返回节点个数")
    void testTree() {
        Expression tree = b.assign(loc, b.local(loc, gs.enterNameUtf8("x")),
                b.array(loc, Arrays.<Expression>asList(b.nil(loc), b.integer(loc, 1))));
        assertThat(OwnershipChecker.check(ctx, tree)).isEqualTo(5);
    }

    @Test
    @DisplayName("同一实例出现两次致命")
    void testSharedNode() {
        Literal shared = b.nil(loc);
        Expression graph = b.array(loc, Arrays.<Expression>asList(shared, shared));
        assertThatThrownBy(() -> OwnershipChecker.check(ctx, graph))
                .isInstanceOf(TreeCorruptionError.class)
                .hasMessageContaining("shared between two parents");
    }
}
