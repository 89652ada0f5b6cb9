package com.garnet.core;

/**
 * 符号句柄（{@link GlobalState} 符号表下标）。非拥有引用。
 */
public final class SymbolRef {
    private final int id;

    public SymbolRef(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public boolean exists() {
        return id != 0;
    }

    public SymbolData data(GlobalState gs) {
        return gs.symbolData(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolRef)) return false;
        return id == ((SymbolRef) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "SymbolRef(" + id + ")";
    }
}
