package com.garnet.core;

/**
 * 已解析的局部变量：名称 + 区分同名变量的序号（0 表示未重命名）。
 */
public final class LocalVariable {
    private final NameRef name;
    private final int unique;

    public LocalVariable(NameRef name, int unique) {
        this.name = name;
        this.unique = unique;
    }

    public NameRef getName() {
        return name;
    }

    public int getUnique() {
        return unique;
    }

    public String toString(GlobalState gs) {
        if (unique == 0) {
            return name.show(gs);
        }
        return name.show(gs) + "$" + unique;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocalVariable)) return false;
        LocalVariable that = (LocalVariable) o;
        return unique == that.unique && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + unique;
    }
}
