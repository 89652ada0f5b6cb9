package com.garnet.core;

/**
 * 驻留名称句柄。只是 {@link GlobalState} 名称表中的下标，不持有字符串。
 */
public final class NameRef {
    private final int id;

    public static final NameRef NO_NAME = new NameRef(0);

    public NameRef(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public boolean exists() {
        return id != 0;
    }

    public String show(GlobalState gs) {
        return gs.nameText(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NameRef)) return false;
        return id == ((NameRef) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "NameRef(" + id + ")";
    }
}
