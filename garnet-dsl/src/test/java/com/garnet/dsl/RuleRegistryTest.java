package com.garnet.dsl;

import com.garnet.ast.Expression;
import com.garnet.ast.util.TreeBuilder;
import com.garnet.core.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("规则注册表测试")
class RuleRegistryTest {

    private static List<String> names(List<? extends DslRule<?>> rules) {
        List<String> names = new ArrayList<>();
        for (DslRule<?> rule : rules) {
            names.add(rule.getName());
        }
        return names;
    }

    @Test
    @DisplayName("默认规则按优先级注册")
    void testDefaults() {
        RuleRegistry registry = RuleRegistry.defaults();
        assertThat(registry.getRuleNames()).containsExactly(
                "Command", "Struct", "ChalkODMProp", "MixinEncryptedProp", "DSLBuilder", "AttrReader",
                "Sinatra", "InterfaceWrapper");
        assertThat(names(registry.getClassRules())).containsExactly("Command");
        assertThat(names(registry.getCallRules())).containsExactly("InterfaceWrapper");
    }

    @Test
    @DisplayName("按语句种类选出规则族")
    void testFamilyOf() {
        GlobalState gs = new GlobalState();
        TreeBuilder b = new TreeBuilder(new MutableContext(gs));
        Loc loc = Loc.none();
        RuleRegistry registry = RuleRegistry.defaults();

        Expression send = b.send0(loc, b.self(loc), Names.PROP);
        Expression assign = b.assign(loc, b.constant(loc, Names.STRUCT), b.nil(loc));
        Expression method = b.methodDef(loc, Names.CALL, Collections.<Expression>emptyList(), b.nil(loc), 0);

        assertThat(names(registry.familyOf(send)))
                .containsExactly("ChalkODMProp", "MixinEncryptedProp", "DSLBuilder", "AttrReader");
        assertThat(names(registry.familyOf(assign))).containsExactly("Struct");
        assertThat(names(registry.familyOf(method))).containsExactly("Sinatra");
        assertThat(registry.familyOf(b.nil(loc))).isEmpty();
    }

    @Test
    @DisplayName("禁用规则，未知名称忽略")
    void testWithout() {
        RuleRegistry registry = RuleRegistry.defaults()
                .without(Arrays.asList("AttrReader", "Command", "NoSuchRule"));
        assertThat(registry.getRuleNames()).doesNotContain("AttrReader", "Command").contains("Struct");
        assertThat(registry.getClassRules()).isEmpty();
    }

    @Test
    @DisplayName("空禁用列表返回原注册表")
    void testWithoutNothing() {
        RuleRegistry registry = RuleRegistry.defaults();
        assertThat(registry.without(Collections.<String>emptyList())).isSameAs(registry);
    }
}
