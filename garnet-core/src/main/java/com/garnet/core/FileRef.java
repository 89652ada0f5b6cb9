package com.garnet.core;

/**
 * 源文件标识（不透明句柄），树中的位置信息只通过它引用源文件。
 */
public final class FileRef {
    private final int id;
    private final String path;

    public static final FileRef NONE = new FileRef(0, "<none>");

    public FileRef(int id, String path) {
        this.id = id;
        this.path = path != null ? path.intern() : null;
    }

    public int getId() {
        return id;
    }

    public String getPath() {
        return path;
    }

    public boolean exists() {
        return id != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileRef)) return false;
        return id == ((FileRef) o).id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return path;
    }
}
