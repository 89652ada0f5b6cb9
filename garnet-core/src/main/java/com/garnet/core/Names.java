package com.garnet.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 预驻留的常用名称。每个 {@link GlobalState} 按相同顺序登记，因此 id 在所有实例间一致。
 */
public final class Names {
    private static final List<String> TEXTS = new ArrayList<>();

    // 符号名
    public static final NameRef NO_SYMBOL = register("<none>");
    public static final NameRef ROOT = register("<root>");
    public static final NameRef TODO = register("<todo sym>");

    // 方法名
    public static final NameRef INITIALIZE = register("initialize");
    public static final NameRef CALL = register("call");
    public static final NameRef NEW = register("new");
    public static final NameRef PROP = register("prop");
    public static final NameRef CONST = register("const");
    public static final NameRef ENCRYPTED_PROP = register("encrypted_prop");
    public static final NameRef DSL_OPTIONAL = register("dsl_optional");
    public static final NameRef DSL_REQUIRED = register("dsl_required");
    public static final NameRef ATTR_READER = register("attr_reader");
    public static final NameRef ATTR_WRITER = register("attr_writer");
    public static final NameRef ATTR_ACCESSOR = register("attr_accessor");
    public static final NameRef SIG = register("sig");
    public static final NameRef RETURNS = register("returns");
    public static final NameRef PARAMS = register("params");
    public static final NameRef VOID = register("void");
    public static final NameRef LET = register("let");
    public static final NameRef CAST = register("cast");
    public static final NameRef UNSAFE = register("unsafe");
    public static final NameRef NILABLE = register("nilable");
    public static final NameRef UNTYPED = register("untyped");
    public static final NameRef WRAP_INSTANCE = register("wrap_instance");
    public static final NameRef REGISTERED = register("registered");

    // 关键字参数名
    public static final NameRef TYPE = register("type");
    public static final NameRef DEFAULT = register("default");
    public static final NameRef SKIP_GETTER = register("skip_getter");

    // 常量名
    public static final NameRef T = register("T");
    public static final NameRef STRUCT = register("Struct");
    public static final NameRef COMMAND = register("Command");
    public static final NameRef OPUS = register("Opus");
    public static final NameRef OBJECT = register("Object");
    public static final NameRef NIL_CLASS = register("NilClass");
    public static final NameRef TRUE_CLASS = register("TrueClass");
    public static final NameRef FALSE_CLASS = register("FalseClass");
    public static final NameRef SYMBOL = register("Symbol");
    public static final NameRef STRING = register("String");
    public static final NameRef INTEGER = register("Integer");
    public static final NameRef FLOAT = register("Float");
    public static final NameRef ARRAY = register("Array");
    public static final NameRef HASH = register("Hash");

    public static final NameRef SELF = register("self");
    public static final NameRef BLOCK_CALL = register("<block-call>");

    private Names() {
    }

    private static NameRef register(String text) {
        TEXTS.add(text);
        return new NameRef(TEXTS.size());
    }

    static List<String> wellKnown() {
        return Collections.unmodifiableList(TEXTS);
    }
}
