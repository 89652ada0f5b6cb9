package com.garnet.core;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 不变量断言。失败时先向 fatal 日志输出诊断（调用位置、条件文本、源码位置），
 * 再抛出 {@link TreeCorruptionError}。
 */
public final class Enforce {
    private static final Logger FATAL = Logger.getLogger("com.garnet.fatal");

    private Enforce() {
    }

    public static void check(boolean condition, String conditionText, Loc loc, Object... details) {
        if (!condition) {
            fail(conditionText, loc, details);
        }
    }

    /**
     * 断言引用非空，返回原值便于在构造器中直接赋值。
     */
    public static <T> T notNull(T value, String what, Loc loc) {
        if (value == null) {
            fail(what + " != null", loc);
        }
        return value;
    }

    /**
     * 不可达状态。
     */
    public static TreeCorruptionError raise(Loc loc, Object... details) {
        throw fail("unreachable", loc, details);
    }

    private static TreeCorruptionError fail(String conditionText, Loc loc, Object... details) {
        StringBuilder sb = new StringBuilder();
        StackTraceElement caller = callerFrame();
        if (caller != null) {
            sb.append(caller.getFileName()).append(':').append(caller.getLineNumber()).append(' ');
        }
        sb.append("enforced condition ").append(conditionText).append(" has failed");
        if (details.length > 0) {
            sb.append(": ");
            for (Object d : details) {
                sb.append(d);
            }
        }
        if (loc != null) {
            sb.append(" (at ").append(loc).append(')');
        }
        String message = sb.toString();
        FATAL.log(Level.SEVERE, message);
        throw new TreeCorruptionError(message, conditionText, loc);
    }

    private static StackTraceElement callerFrame() {
        for (StackTraceElement frame : new Throwable().getStackTrace()) {
            if (!frame.getClassName().equals(Enforce.class.getName())) {
                return frame;
            }
        }
        return null;
    }
}
