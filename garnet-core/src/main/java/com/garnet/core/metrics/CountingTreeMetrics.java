package com.garnet.core.metrics;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 内存计数实现，供宿主系统汇总或测试断言。
 */
public class CountingTreeMetrics implements TreeMetrics {
    private final Map<String, Long> counters = new TreeMap<>();
    private final Map<String, Map<Integer, Long>> histograms = new TreeMap<>();

    @Override
    public void categoryCounterInc(String category, String counter) {
        counters.merge(category + "." + counter, 1L, Long::sum);
    }

    @Override
    public void counterInc(String counter) {
        counters.merge(counter, 1L, Long::sum);
    }

    @Override
    public void histogramInc(String histogram, int key) {
        histograms.computeIfAbsent(histogram, k -> new TreeMap<>()).merge(key, 1L, Long::sum);
    }

    public long getCounter(String name) {
        Long value = counters.get(name);
        return value != null ? value : 0L;
    }

    public Map<Integer, Long> getHistogram(String name) {
        Map<Integer, Long> h = histograms.get(name);
        return h != null ? Collections.unmodifiableMap(h) : Collections.emptyMap();
    }

    public Map<String, Long> getCounters() {
        return Collections.unmodifiableMap(counters);
    }

    public void reset() {
        counters.clear();
        histograms.clear();
    }
}
