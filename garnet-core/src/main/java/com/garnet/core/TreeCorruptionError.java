package com.garnet.core;

/**
 * 不变量断言失败。只可能由解析器或某个 pass 的 bug 引起，调用方不应捕获，
 * 宿主驱动程序收到后直接终止当前进程。
 */
public class TreeCorruptionError extends Error {
    private final String condition;
    private final Loc loc;

    public TreeCorruptionError(String message, String condition, Loc loc) {
        super(message);
        this.condition = condition;
        this.loc = loc;
    }

    public String getCondition() {
        return condition;
    }

    public Loc getLoc() {
        return loc;
    }
}
