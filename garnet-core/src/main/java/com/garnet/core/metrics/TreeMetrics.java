package com.garnet.core.metrics;

/**
 * 节点构造计数接收器。与正确性无关，通过上下文注入而不是全局状态，
 * 这样测试之间不会互相泄漏计数。
 */
public interface TreeMetrics {

    /** 丢弃所有计数 */
    TreeMetrics NONE = new TreeMetrics() {
        @Override
        public void categoryCounterInc(String category, String counter) {
        }

        @Override
        public void counterInc(String counter) {
        }

        @Override
        public void histogramInc(String histogram, int key) {
        }
    };

    void categoryCounterInc(String category, String counter);

    void counterInc(String counter);

    void histogramInc(String histogram, int key);
}
