package com.garnet.core;

/**
 * 源码区间：文件 + [beginPos, endPos) 字节偏移。不可变值类型。
 */
public final class Loc {
    private final FileRef file;
    private final int beginPos;
    private final int endPos;

    private static final Loc NONE = new Loc(FileRef.NONE, 0, 0);

    public Loc(FileRef file, int beginPos, int endPos) {
        this.file = file != null ? file : FileRef.NONE;
        this.beginPos = beginPos;
        this.endPos = endPos;
    }

    /**
     * 不对应任何源码的位置（EmptyTree、纯合成节点使用）
     */
    public static Loc none() {
        return NONE;
    }

    public FileRef getFile() {
        return file;
    }

    public int getBeginPos() {
        return beginPos;
    }

    public int getEndPos() {
        return endPos;
    }

    public boolean exists() {
        return file.exists();
    }

    /**
     * 合并两个位置，得到覆盖二者的区间。任一方不存在时返回另一方。
     */
    public Loc join(Loc other) {
        if (!exists()) return other;
        if (other == null || !other.exists()) return this;
        Enforce.check(file.equals(other.file), "file == other.file", this,
                "cannot join locations from different files");
        return new Loc(file, Math.min(beginPos, other.beginPos), Math.max(endPos, other.endPos));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Loc)) return false;
        Loc loc = (Loc) o;
        return beginPos == loc.beginPos && endPos == loc.endPos && file.equals(loc.file);
    }

    @Override
    public int hashCode() {
        return (file.hashCode() * 31 + beginPos) * 31 + endPos;
    }

    @Override
    public String toString() {
        return file + ":" + beginPos + "-" + endPos;
    }
}
