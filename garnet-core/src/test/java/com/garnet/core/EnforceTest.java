package com.garnet.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Enforce 测试")
class EnforceTest {

    private final Loc loc = new Loc(new FileRef(1, "x.rb"), 5, 8);

    @Test
    @DisplayName("条件成立时无副作用")
    void testPass() {
        assertThatCode(() -> Enforce.check(true, "true", loc)).doesNotThrowAnyException();
        assertThat(Enforce.notNull("v", "value", loc)).isEqualTo("v");
    }

    @Test
    @DisplayName("失败时携带条件文本、位置与调用点")
    void testFailure() {
        TreeCorruptionError error = catchThrowableOfType(
                () -> Enforce.check(1 > 2, "1 > 2", loc, "keys=", 2, " values=", 1),
                TreeCorruptionError.class);
        assertThat(error.getCondition()).isEqualTo("1 > 2");
        assertThat(error.getLoc()).isEqualTo(loc);
        assertThat(error.getMessage())
                .contains("EnforceTest.java")
                .contains("enforced condition 1 > 2 has failed: keys=2 values=1")
                .contains("x.rb:5-8");
    }

    @Test
    @DisplayName("notNull 失败")
    void testNotNull() {
        assertThatThrownBy(() -> Enforce.notNull(null, "body", loc))
                .isInstanceOf(TreeCorruptionError.class)
                .hasMessageContaining("body != null");
    }

    @Test
    @DisplayName("raise 总是失败")
    void testRaise() {
        assertThatThrownBy(() -> {
            throw Enforce.raise(loc, "bad state");
        }).isInstanceOf(TreeCorruptionError.class).hasMessageContaining("unreachable");
    }
}
