package com.garnet.dsl;

import com.garnet.ast.Expression;
import com.garnet.ast.decl.ClassDef;
import com.garnet.ast.expr.Send;
import com.garnet.dsl.rules.*;

import java.util.*;
import java.util.logging.Logger;

/**
 * 规则注册表。三类规则各自保持注册顺序：
 * <ul>
 *   <li>类级补丁：在处理类体之前对整个类追加语句</li>
 *   <li>语句规则：按语句种类分族，族内先匹配者胜出</li>
 *   <li>调用改写：作用于树中任意位置的 send，一换一</li>
 * </ul>
 */
public final class RuleRegistry {

    private static final Logger LOG = Logger.getLogger(RuleRegistry.class.getName());

    private final List<DslRule<ClassDef>> classRules;
    private final List<DslRule<? extends Expression>> statementRules;
    private final List<DslRule<Send>> callRules;

    private RuleRegistry(Builder builder) {
        this.classRules = Collections.unmodifiableList(new ArrayList<>(builder.classRules));
        this.statementRules = Collections.unmodifiableList(new ArrayList<>(builder.statementRules));
        this.callRules = Collections.unmodifiableList(new ArrayList<>(builder.callRules));
    }

    /**
     * 默认规则集合，顺序即匹配优先级。
     */
    public static RuleRegistry defaults() {
        return builder()
                .classRule(new CommandRule())
                // Assign
                .statementRule(new StructRule())
                // Send
                .statementRule(new ChalkOdmPropRule())
                .statementRule(new MixinEncryptedPropRule())
                .statementRule(new DslBuilderRule())
                .statementRule(new AttrReaderRule())
                // MethodDef
                .statementRule(new SinatraRule())
                .callRule(new InterfaceWrapperRule())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<DslRule<ClassDef>> getClassRules() {
        return classRules;
    }

    public List<DslRule<Send>> getCallRules() {
        return callRules;
    }

    /**
     * 语句所属的规则族（按注册顺序）。
     */
    public List<DslRule<? extends Expression>> familyOf(Expression stat) {
        List<DslRule<? extends Expression>> family = new ArrayList<>();
        for (DslRule<? extends Expression> rule : statementRules) {
            if (rule.nodeType().isInstance(stat)) {
                family.add(rule);
            }
        }
        return family;
    }

    public Set<String> getRuleNames() {
        Set<String> names = new LinkedHashSet<>();
        for (DslRule<?> rule : classRules) {
            names.add(rule.getName());
        }
        for (DslRule<?> rule : statementRules) {
            names.add(rule.getName());
        }
        for (DslRule<?> rule : callRules) {
            names.add(rule.getName());
        }
        return names;
    }

    /**
     * 去掉指定名称的规则。未知名称记录警告后忽略。
     */
    public RuleRegistry without(Collection<String> disabled) {
        if (disabled.isEmpty()) {
            return this;
        }
        Set<String> known = getRuleNames();
        for (String name : disabled) {
            if (!known.contains(name)) {
                LOG.warning("未知的 DSL 规则，已忽略: " + name);
            }
        }
        Builder builder = builder();
        for (DslRule<ClassDef> rule : classRules) {
            if (!disabled.contains(rule.getName())) {
                builder.classRule(rule);
            }
        }
        for (DslRule<? extends Expression> rule : statementRules) {
            if (!disabled.contains(rule.getName())) {
                builder.statementRule(rule);
            }
        }
        for (DslRule<Send> rule : callRules) {
            if (!disabled.contains(rule.getName())) {
                builder.callRule(rule);
            }
        }
        return builder.build();
    }

    public static final class Builder {
        private final List<DslRule<ClassDef>> classRules = new ArrayList<>();
        private final List<DslRule<? extends Expression>> statementRules = new ArrayList<>();
        private final List<DslRule<Send>> callRules = new ArrayList<>();

        private Builder() {
        }

        public Builder classRule(DslRule<ClassDef> rule) {
            classRules.add(rule);
            return this;
        }

        public Builder statementRule(DslRule<? extends Expression> rule) {
            statementRules.add(rule);
            return this;
        }

        public Builder callRule(DslRule<Send> rule) {
            callRules.add(rule);
            return this;
        }

        public RuleRegistry build() {
            return new RuleRegistry(this);
        }
    }
}
