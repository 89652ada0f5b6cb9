package com.garnet.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 名称表 + 符号表。
 *
 * <p>只追加：打印和模式匹配只读，pass 合成新标识符时通过 {@link #enterNameUtf8(String)} 驻留。
 * 非线程安全，每个文件处理单元持有自己的实例。</p>
 */
public class GlobalState {
    private final List<String> names = new ArrayList<>();
    private final Map<String, NameRef> nameIndex = new HashMap<>();
    private final List<SymbolData> symbols = new ArrayList<>();
    private final Map<String, SymbolRef> symbolIndex = new HashMap<>();
    private final Map<Integer, FileRef> files = new HashMap<>();

    public GlobalState() {
        names.add("");
        for (String text : Names.wellKnown()) {
            enterNameUtf8(text);
        }
        initBuiltinSymbols();
    }

    private void initBuiltinSymbols() {
        symbols.add(new SymbolData(Names.NO_SYMBOL, Symbols.NO_SYMBOL, SymbolKind.CLASS, 0));
        symbols.add(new SymbolData(Names.ROOT, Symbols.NO_SYMBOL, SymbolKind.CLASS, 0));
        symbols.add(new SymbolData(Names.TODO, Symbols.ROOT, SymbolKind.CLASS, 0));
        enterBuiltin(Symbols.OBJECT, Names.OBJECT, SymbolKind.CLASS);
        enterBuiltin(Symbols.NIL_CLASS, Names.NIL_CLASS, SymbolKind.CLASS);
        enterBuiltin(Symbols.TRUE_CLASS, Names.TRUE_CLASS, SymbolKind.CLASS);
        enterBuiltin(Symbols.FALSE_CLASS, Names.FALSE_CLASS, SymbolKind.CLASS);
        enterBuiltin(Symbols.SYMBOL, Names.SYMBOL, SymbolKind.CLASS);
        enterBuiltin(Symbols.STRING, Names.STRING, SymbolKind.CLASS);
        enterBuiltin(Symbols.INTEGER, Names.INTEGER, SymbolKind.CLASS);
        enterBuiltin(Symbols.FLOAT, Names.FLOAT, SymbolKind.CLASS);
        enterBuiltin(Symbols.ARRAY, Names.ARRAY, SymbolKind.CLASS);
        enterBuiltin(Symbols.HASH, Names.HASH, SymbolKind.CLASS);
        enterBuiltin(Symbols.T, Names.T, SymbolKind.MODULE);
        Enforce.check(symbols.size() == Symbols.BUILTIN_COUNT, "symbols.size() == BUILTIN_COUNT",
                Loc.none(), "builtin symbol table out of sync");
    }

    private void enterBuiltin(SymbolRef expected, NameRef name, SymbolKind kind) {
        SymbolRef actual = enterSymbol(Symbols.ROOT, name, kind);
        Enforce.check(actual.equals(expected), "actual == expected", Loc.none(),
                "builtin symbol ", name.show(this), " entered at wrong id");
    }

    // ============ 名称 ============

    /**
     * 驻留名称；同一文本总是返回同一个句柄。
     */
    public NameRef enterNameUtf8(String text) {
        Enforce.notNull(text, "text", Loc.none());
        NameRef existing = nameIndex.get(text);
        if (existing != null) {
            return existing;
        }
        names.add(text);
        NameRef ref = new NameRef(names.size() - 1);
        nameIndex.put(text, ref);
        return ref;
    }

    /**
     * 查找已驻留的名称，不存在时返回 {@link NameRef#NO_NAME}。
     */
    public NameRef lookupName(String text) {
        NameRef ref = nameIndex.get(text);
        return ref != null ? ref : NameRef.NO_NAME;
    }

    public String nameText(NameRef name) {
        Enforce.check(name.getId() >= 0 && name.getId() < names.size(),
                "name id in range", Loc.none(), "name id ", name.getId());
        return names.get(name.getId());
    }

    public int nameCount() {
        return names.size();
    }

    // ============ 符号 ============

    public SymbolRef enterSymbol(SymbolRef owner, NameRef name, SymbolKind kind) {
        return enterSymbol(owner, name, kind, 0);
    }

    private SymbolRef enterSymbol(SymbolRef owner, NameRef name, SymbolKind kind, int flags) {
        String key = owner.getId() + "/" + kind + "/" + name.getId();
        SymbolRef existing = symbolIndex.get(key);
        if (existing != null) {
            return existing;
        }
        symbols.add(new SymbolData(name, owner, kind, flags));
        SymbolRef ref = new SymbolRef(symbols.size() - 1);
        symbolIndex.put(key, ref);
        return ref;
    }

    /**
     * 为方法或块登记一个形参符号，并追加到所有者的参数列表。
     */
    public SymbolRef enterArgument(SymbolRef method, NameRef name, int argumentFlags) {
        SymbolRef arg = enterSymbol(method, name, SymbolKind.ARGUMENT, argumentFlags);
        SymbolData owner = symbolData(method);
        if (!owner.getArguments().contains(arg)) {
            owner.addArgument(arg);
        }
        return arg;
    }

    public SymbolData symbolData(SymbolRef symbol) {
        Enforce.check(symbol.getId() >= 0 && symbol.getId() < symbols.size(),
                "symbol id in range", Loc.none(), "symbol id ", symbol.getId());
        return symbols.get(symbol.getId());
    }

    public int symbolCount() {
        return symbols.size();
    }

    // ============ 文件 ============

    public FileRef enterFile(String path) {
        FileRef file = new FileRef(files.size() + 1, path);
        files.put(file.getId(), file);
        return file;
    }
}
