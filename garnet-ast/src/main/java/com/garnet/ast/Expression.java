package com.garnet.ast;

import com.garnet.ast.print.RawTreePrinter;
import com.garnet.ast.print.TreePrinter;
import com.garnet.core.Enforce;
import com.garnet.core.GlobalState;
import com.garnet.core.Loc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 语法树节点基类。
 *
 * <p>节点种类是封闭集合，所有具体节点都是 final 类，并由 {@link TreeVisitor} 穷举。
 * 每个节点独占自己的子节点（树而不是图）；构造完成后结构不再变化，
 * 改写只能通过整棵子树替换完成。</p>
 *
 * <p>构造器末尾调用 {@link #sanityCheck()}，不变量失败视为上游 bug，直接致命。</p>
 */
public abstract class Expression {
    protected final Loc loc;

    protected Expression(Loc loc) {
        this.loc = Enforce.notNull(loc, "loc", Loc.none());
    }

    public Loc getLoc() {
        return loc;
    }

    public abstract <R, C> R accept(TreeVisitor<R, C> visitor, C context);

    /**
     * 结构化输出中使用的节点种类名
     */
    public abstract String nodeName();

    /**
     * 重新断言本节点的结构不变量。
     */
    public abstract void sanityCheck();

    /**
     * 是否为空树占位符。按种类判断，不比较实例。
     */
    public boolean isEmptyTree() {
        return false;
    }

    /**
     * 近似源码的可读输出
     */
    public String toString(GlobalState gs) {
        return new TreePrinter(gs).print(this);
    }

    /**
     * 列出全部字段的结构化输出
     */
    public String showRaw(GlobalState gs) {
        return new RawTreePrinter(gs).print(this);
    }

    @Override
    public String toString() {
        return nodeName() + "@" + loc;
    }

    /**
     * 校验子节点列表（非空且不含 null 元素）并返回只读副本。
     */
    protected static <T extends Expression> List<T> freeze(List<T> list, String what, Loc loc) {
        Enforce.notNull(list, what, loc);
        checkElements(list, what, loc);
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    protected static void checkElements(List<? extends Expression> list, String what, Loc loc) {
        Enforce.notNull(list, what, loc);
        for (int i = 0; i < list.size(); i++) {
            Enforce.check(list.get(i) != null, what + "[i] != null", loc, "null element at index ", i);
        }
    }

    /**
     * 形参列表只允许引用形态（局部变量、未解析标识符及各类参数包装）。
     */
    protected static void checkArgs(List<? extends Expression> args, Loc loc) {
        checkElements(args, "args", loc);
        for (Expression arg : args) {
            Enforce.check(arg instanceof Reference, "arg instanceof Reference", loc,
                    "argument is ", arg.nodeName());
        }
    }
}
