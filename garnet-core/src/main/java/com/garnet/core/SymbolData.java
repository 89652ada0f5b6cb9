package com.garnet.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 符号表条目
 */
public final class SymbolData {
    public static final int ARG_BLOCK = 1;
    public static final int ARG_REPEATED = 1 << 1;
    public static final int ARG_KEYWORD = 1 << 2;

    private final NameRef name;
    private final SymbolRef owner;
    private final SymbolKind kind;
    private final List<SymbolRef> arguments = new ArrayList<>();
    private int argumentFlags;

    SymbolData(NameRef name, SymbolRef owner, SymbolKind kind, int argumentFlags) {
        this.name = name;
        this.owner = owner;
        this.kind = kind;
        this.argumentFlags = argumentFlags;
    }

    public NameRef getName() {
        return name;
    }

    public SymbolRef getOwner() {
        return owner;
    }

    public SymbolKind getKind() {
        return kind;
    }

    /** 方法或块的形参符号，按声明顺序 */
    public List<SymbolRef> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    void addArgument(SymbolRef argument) {
        arguments.add(argument);
    }

    public boolean isBlockArgument() {
        return (argumentFlags & ARG_BLOCK) != 0;
    }

    public boolean isRepeated() {
        return (argumentFlags & ARG_REPEATED) != 0;
    }

    public boolean isKeyword() {
        return (argumentFlags & ARG_KEYWORD) != 0;
    }

    /**
     * 以 {@code ::} 连接所有者链（不含根）得到的完整名称。
     */
    public String fullName(GlobalState gs) {
        String own = name.show(gs);
        if (!owner.exists() || owner.equals(Symbols.ROOT)) {
            return own;
        }
        String prefix = owner.data(gs).fullName(gs);
        if (kind == SymbolKind.METHOD || kind == SymbolKind.FIELD) {
            return prefix + "#" + own;
        }
        return prefix + "::" + own;
    }
}
