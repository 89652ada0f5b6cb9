package com.garnet.ast.print;

import com.garnet.ast.EmptyTree;
import com.garnet.ast.Expression;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.Send;
import com.garnet.ast.flow.Rescue;
import com.garnet.ast.flow.RescueCase;
import com.garnet.ast.flow.Retry;
import com.garnet.ast.flow.Return;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.GlobalState;
import com.garnet.core.Loc;
import com.garnet.core.MutableContext;
import com.garnet.core.Names;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.*;

@DisplayName("结构化输出测试")
class RawTreePrinterTest {

    private GlobalState gs;
    private TreeBuilder b;
    private Loc loc;

    @BeforeEach
    void setUp() {
        gs = new GlobalState();
        b = new TreeBuilder(new MutableContext(gs));
        loc = new Loc(gs.enterFile("a.rb"), 0, 10);
    }

    @Test
    @DisplayName("单字段节点使用单行形式")
    void testShortForms() {
        assertThat(new Return(loc, b.integer(loc, 1)).showRaw(gs)).isEqualTo("Return{ expr = Literal{ value = 1 } }");
        assertThat(new Retry(loc).showRaw(gs)).isEqualTo("Retry{}");
        assertThat(new EmptyTree().showRaw(gs)).isEqualTo("EmptyTree");
        assertThat(b.self(loc).showRaw(gs)).isEqualTo("Self{ claz = <todo sym> }");
    }

    @Test
    @DisplayName("多字段节点逐行缩进")
    void testAssign() {
        Expression assign = b.assign(loc, b.local(loc, gs.enterNameUtf8("x")), b.integer(loc, 1));
        assertThat(assign.showRaw(gs)).isEqualTo(
                "Assign{\n"
                        + "  lhs = UnresolvedIdent{\n"
                        + "    kind = Local\n"
                        + "    name = x\n"
                        + "  }\n"
                        + "  rhs = Literal{ value = 1 }\n"
                        + "}");
    }

    @Test
    @DisplayName("send 列出 recv、fun、block 与参数")
    void testSend() {
        Send send = b.send1(loc, b.self(loc), gs.enterNameUtf8("foo"), b.symbol(loc, gs.enterNameUtf8("a")));
        assertThat(send.showRaw(gs)).isEqualTo(
                "Send{\n"
                        + "  recv = Self{ claz = <todo sym> }\n"
                        + "  fun = foo\n"
                        + "  block = null\n"
                        + "  args = [\n"
                        + "    Literal{ value = :a }\n"
                        + "  ]\n"
                        + "}");
    }

    @Test
    @DisplayName("方法标志位")
    void testMethodFlags() {
        MethodDef plain = b.methodDef(loc, Names.CALL, Collections.<Expression>emptyList(), new EmptyTree(), 0);
        MethodDef synthetic = b.selfMethodDef(loc, Names.CALL, Collections.<Expression>emptyList(), new EmptyTree());
        assertThat(plain.showRaw(gs)).contains("flags = 0").contains("name = call<<todo sym>>");
        assertThat(synthetic.showRaw(gs)).contains("flags = self dsl");
    }

    @Test
    @DisplayName("rescue 的空 else/ensure 在结构化输出中仍然可见")
    void testRescueShowsEmptyTree() {
        RescueCase rc = new RescueCase(loc, Collections.<Expression>emptyList(),
                b.local(loc, gs.enterNameUtf8("e")), new EmptyTree());
        Rescue rescue = new Rescue(loc, b.nil(loc), Collections.singletonList(rc), new EmptyTree(), new EmptyTree());
        assertThat(rescue.showRaw(gs))
                .startsWith("Rescue{\n")
                .contains("  else = EmptyTree\n")
                .contains("  ensure = EmptyTree\n")
                .contains("RescueCase{");
    }
}
