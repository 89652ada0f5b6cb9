package com.garnet.core.types;

import com.garnet.core.GlobalState;
import com.garnet.core.Names;
import com.garnet.core.Symbols;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("字面量类型测试")
class LiteralTypeTest {

    private final GlobalState gs = new GlobalState();

    @Test
    @DisplayName("源码形式的值")
    void testShowValue() {
        assertThat(LiteralType.symbol(Names.PROP).showValue(gs)).isEqualTo(":prop");
        assertThat(LiteralType.string(gs.enterNameUtf8("hi")).showValue(gs)).isEqualTo("\"hi\"");
        assertThat(LiteralType.integer(42).showValue(gs)).isEqualTo("42");
        assertThat(LiteralType.floating(1.5).showValue(gs)).isEqualTo("1.5");
        assertThat(LiteralType.integer(7).toString(gs)).isEqualTo("Integer(7)");
    }

    @Test
    @DisplayName("派生关系")
    void testDerivesFrom() {
        assertThat(LiteralType.symbol(Names.PROP).derivesFrom(gs, Symbols.SYMBOL)).isTrue();
        assertThat(LiteralType.symbol(Names.PROP).derivesFrom(gs, Symbols.STRING)).isFalse();
        assertThat(ClassType.nil().derivesFrom(gs, Symbols.NIL_CLASS)).isTrue();
        assertThat(ClassType.trueClass().toString(gs)).isEqualTo("TrueClass");
    }
}
