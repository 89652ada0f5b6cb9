package com.garnet.ast.treemap;

import com.garnet.ast.EmptyTree;
import com.garnet.ast.Expression;
import com.garnet.ast.decl.ClassDef;
import com.garnet.ast.decl.ClassDefKind;
import com.garnet.ast.decl.MethodDef;
import com.garnet.ast.expr.*;
import com.garnet.ast.flow.If;
import com.garnet.ast.flow.Rescue;
import com.garnet.ast.flow.RescueCase;
import com.garnet.ast.ref.UnresolvedIdent;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.*;
import com.garnet.core.types.LiteralType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TreeMap 改写引擎测试")
class TreeMapTest {

    private GlobalState gs;
    private MutableContext ctx;
    private TreeBuilder b;
    private Loc loc;

    @BeforeEach
    void setUp() {
        gs = new GlobalState();
        ctx = new MutableContext(gs);
        b = new TreeBuilder(ctx);
        loc = new Loc(gs.enterFile("a.rb"), 0, 40);
    }

    private UnresolvedIdent local(String name) {
        return b.local(loc, gs.enterNameUtf8(name));
    }

    /**
     * class Foo
     *   def bar(x)
     *     if x then 1 else [2, :sym] end
     *   end
     *   baz.each do |y| y end
     * end
     */
    private ClassDef sampleClass() {
        Expression body = new If(loc, local("x"), b.integer(loc, 1),
                b.array(loc, Arrays.<Expression>asList(b.integer(loc, 2), b.symbol(loc, gs.enterNameUtf8("sym")))));
        MethodDef bar = b.methodDef(loc, gs.enterNameUtf8("bar"),
                Collections.<Expression>singletonList(local("x")), body, 0);
        Send each = b.send(loc, local("baz"), gs.enterNameUtf8("each"), Collections.<Expression>emptyList(),
                b.block(loc, Collections.<Expression>singletonList(local("y")), local("y")));
        return b.classDef(loc, b.constant(loc, gs.enterNameUtf8("Foo")), Collections.<Expression>emptyList(),
                Arrays.<Expression>asList(bar, each), ClassDefKind.CLASS);
    }

    /** 把所有整数字面量加一 */
    private static class Increment implements TreeMapper {
        @Override
        public Expression postTransformLiteral(MutableContext ctx, Literal tree) {
            if (tree.getValue() instanceof LiteralType
                    && ((LiteralType) tree.getValue()).getKind() == LiteralType.LiteralKind.INTEGER) {
                return new Literal(tree.getLoc(), LiteralType.integer(((LiteralType) tree.getValue()).getValue() + 1));
            }
            return tree;
        }
    }

    @Nested
    @DisplayName("copy-on-change")
    class CopyOnChange {

        @Test
        @DisplayName("恒等 mapper 返回原实例，输出不变")
        void testIdentity() {
            ClassDef tree = sampleClass();
            String before = tree.showRaw(gs);

            Expression result = TreeMap.apply(ctx, new TreeMapper() {
            }, tree);

            assertThat(result).isSameAs(tree);
            assertThat(result.showRaw(gs)).isEqualTo(before);
        }

        @Test
        @DisplayName("钩子替换节点，只重建变化路径上的祖先")
        void testHookReplacement() {
            ClassDef tree = sampleClass();
            Expression untouchedSend = tree.getRhs().get(1);

            ClassDef result = (ClassDef) TreeMap.apply(ctx, new Increment(), tree);

            assertThat(result).isNotSameAs(tree);
            assertThat(result.getRhs().get(1)).isSameAs(untouchedSend);
            assertThat(result.toString(gs)).contains("    2\n").contains("[3, :sym]");
            // 输入树保持原样
            assertThat(tree.toString(gs)).contains("    1\n").contains("[2, :sym]");
        }

        @Test
        @DisplayName("空树槽位原样保留")
        void testEmptyTreePreserved() {
            RescueCase rc = new RescueCase(loc, Collections.<Expression>emptyList(), local("e"), b.integer(loc, 1));
            Rescue rescue = new Rescue(loc, b.integer(loc, 5), Collections.singletonList(rc),
                    new EmptyTree(), new EmptyTree());

            Rescue result = (Rescue) TreeMap.apply(ctx, new Increment(), rescue);

            assertThat(result).isNotSameAs(rescue);
            assertThat(result.getElse().isEmptyTree()).isTrue();
            assertThat(result.getEnsure().isEmptyTree()).isTrue();
            assertThat(result.toString(gs)).isEqualTo("6\nrescue => e\n2");
        }
    }

    @Nested
    @DisplayName("遍历顺序")
    class Order {

        @Test
        @DisplayName("后序、按字段顺序，前序钩子先于子节点")
        void testOrder() {
            final List<String> events = new ArrayList<>();
            TreeMapper recorder = new TreeMapper() {
                @Override
                public ClassDef preTransformClassDef(MutableContext ctx, ClassDef tree) {
                    events.add("pre:ClassDef");
                    return tree;
                }

                @Override
                public MethodDef preTransformMethodDef(MutableContext ctx, MethodDef tree) {
                    events.add("pre:MethodDef");
                    return tree;
                }

                @Override
                public Block preTransformBlock(MutableContext ctx, Block tree) {
                    events.add("pre:Block");
                    return tree;
                }

                @Override
                public Expression postTransformDefault(MutableContext ctx, Expression tree) {
                    events.add(tree.nodeName());
                    return tree;
                }
            };

            TreeMap.apply(ctx, recorder, sampleClass());

            assertThat(events).containsExactly(
                    "pre:ClassDef",
                    "EmptyTree", "UnresolvedConstantLit",
                    "pre:MethodDef",
                    "UnresolvedIdent",
                    "UnresolvedIdent", "Literal", "Literal", "Literal", "Array", "If",
                    "MethodDef",
                    "UnresolvedIdent",
                    "pre:Block", "UnresolvedIdent", "UnresolvedIdent", "Block",
                    "Send",
                    "ClassDef");
        }

        @Test
        @DisplayName("进入定义时切换上下文所有者")
        void testOwner() {
            ClassDef tree = sampleClass();
            SymbolRef fooSym = gs.enterSymbol(Symbols.ROOT, gs.enterNameUtf8("Foo"), SymbolKind.CLASS);
            tree.setSymbol(fooSym);
            final List<SymbolRef> owners = new ArrayList<>();

            TreeMap.apply(ctx, new TreeMapper() {
                @Override
                public Expression postTransformSend(MutableContext ctx, Send tree) {
                    owners.add(ctx.getOwner());
                    return tree;
                }
            }, tree);

            assertThat(owners).containsExactly(fooSym);
        }

        @Test
        @DisplayName("每个节点实例只交给 mapper 一次")
        void testEachNodeOnce() {
            final List<Expression> seen = new ArrayList<>();
            ClassDef tree = sampleClass();
            TreeMap.apply(ctx, new TreeMapper() {
                @Override
                public Expression postTransformDefault(MutableContext ctx, Expression tree) {
                    for (Expression e : seen) {
                        assertThat(e).isNotSameAs(tree);
                    }
                    seen.add(tree);
                    return tree;
                }
            }, tree);
            assertThat(seen).hasSize(16);
        }
    }

    @Nested
    @DisplayName("类型槽位")
    class TypedSlots {

        @Test
        @DisplayName("send 的 block 槽位只接受 Block")
        void testBlockSlot() {
            TreeMapper bad = new TreeMapper() {
                @Override
                public Expression postTransformBlock(MutableContext ctx, Block tree) {
                    return new EmptyTree();
                }
            };
            assertThatThrownBy(() -> TreeMap.apply(ctx, bad, sampleClass()))
                    .isInstanceOf(TreeCorruptionError.class)
                    .hasMessageContaining("Send.block expects Block");
        }

        @Test
        @DisplayName("形参槽位只接受引用")
        void testArgsSlot() {
            TreeMapper bad = new TreeMapper() {
                @Override
                public Expression postTransformUnresolvedIdent(MutableContext ctx, UnresolvedIdent tree) {
                    return new Literal(tree.getLoc(), LiteralType.integer(0));
                }
            };
            assertThatThrownBy(() -> TreeMap.apply(ctx, bad, sampleClass()))
                    .isInstanceOf(TreeCorruptionError.class)
                    .hasMessageContaining("args expects Reference");
        }

        @Test
        @DisplayName("rescueCases 槽位只接受 RescueCase")
        void testRescueCaseSlot() {
            RescueCase rc = new RescueCase(loc, Collections.<Expression>emptyList(), local("e"), b.nil(loc));
            Rescue rescue = new Rescue(loc, b.nil(loc), Collections.singletonList(rc), new EmptyTree(), new EmptyTree());
            TreeMapper bad = new TreeMapper() {
                @Override
                public Expression postTransformRescueCase(MutableContext ctx, RescueCase tree) {
                    return tree.getBody();
                }
            };
            assertThatThrownBy(() -> TreeMap.apply(ctx, bad, rescue))
                    .isInstanceOf(TreeCorruptionError.class)
                    .hasMessageContaining("rescueCases expects RescueCase");
        }

        @Test
        @DisplayName("钩子返回 null 致命")
        void testNullResult() {
            TreeMapper bad = new TreeMapper() {
                @Override
                public Expression postTransformLiteral(MutableContext ctx, Literal tree) {
                    return null;
                }
            };
            assertThatThrownBy(() -> TreeMap.apply(ctx, bad, b.integer(loc, 1)))
                    .isInstanceOf(TreeCorruptionError.class);
        }
    }

    @Test
    @DisplayName("ConstantLit 的 original 不参与遍历")
    void testConstantLitOriginalSkipped() {
        UnresolvedConstantLit original = b.constant(loc, gs.enterNameUtf8("Foo"));
        ConstantLit lit = new ConstantLit(loc, Symbols.STRING, original, null);
        final List<String> events = new ArrayList<>();
        TreeMap.apply(ctx, new TreeMapper() {
            @Override
            public Expression postTransformDefault(MutableContext ctx, Expression tree) {
                events.add(tree.nodeName());
                return tree;
            }
        }, lit);
        assertThat(events).containsExactly("ConstantLit");
    }
}
