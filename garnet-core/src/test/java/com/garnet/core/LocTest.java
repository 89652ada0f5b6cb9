package com.garnet.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Loc 测试")
class LocTest {

    private final FileRef file = new FileRef(1, "a.rb");

    @Test
    @DisplayName("值相等")
    void testEquality() {
        assertThat(new Loc(file, 3, 9)).isEqualTo(new Loc(new FileRef(1, "a.rb"), 3, 9));
        assertThat(new Loc(file, 3, 9)).isNotEqualTo(new Loc(file, 3, 10));
        assertThat(new Loc(file, 3, 9).toString()).isEqualTo("a.rb:3-9");
    }

    @Test
    @DisplayName("none 不存在")
    void testNone() {
        assertThat(Loc.none().exists()).isFalse();
        assertThat(new Loc(file, 0, 1).exists()).isTrue();
    }

    @Test
    @DisplayName("join 覆盖两个区间")
    void testJoin() {
        Loc joined = new Loc(file, 10, 20).join(new Loc(file, 4, 12));
        assertThat(joined).isEqualTo(new Loc(file, 4, 20));
        assertThat(Loc.none().join(joined)).isSameAs(joined);
    }

    @Test
    @DisplayName("跨文件 join 是致命错误")
    void testJoinAcrossFiles() {
        Loc other = new Loc(new FileRef(2, "b.rb"), 0, 1);
        assertThatThrownBy(() -> new Loc(file, 0, 1).join(other))
                .isInstanceOf(TreeCorruptionError.class)
                .hasMessageContaining("file == other.file");
    }
}
