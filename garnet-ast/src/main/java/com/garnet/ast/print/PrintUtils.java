package com.garnet.ast.print;

/**
 * 打印辅助
 */
final class PrintUtils {

    /** 单层缩进 */
    static final String INDENT = "  ";

    private PrintUtils() {
    }

    static void printTabs(StringBuilder sb, int count) {
        for (int i = 0; i < count; i++) {
            sb.append(INDENT);
        }
    }
}
