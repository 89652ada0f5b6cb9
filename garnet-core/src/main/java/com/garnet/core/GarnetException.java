package com.garnet.core;

/**
 * 面向调用方的可恢复错误（例如配置无法读取）。
 * 树结构不变量被破坏不属于此类，见 {@link TreeCorruptionError}。
 */
public class GarnetException extends RuntimeException {

    public GarnetException(String message) {
        super(message);
    }

    public GarnetException(String message, Throwable cause) {
        super(message, cause);
    }
}
