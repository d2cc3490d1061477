package com.fastextract.core.eta;

import com.fastextract.exception.InvalidConfigurationException;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 滚动窗口 ETA 估算
 * 保留最近 windowSize 个任务耗时, 均值 * 剩余数量即为剩余时间
 * 线程安全; 每个批次使用独立实例或开始前 reset()
 */
public class EtaEstimator {

    public static final int DEFAULT_WINDOW_SIZE = 10;
    public static final int DEFAULT_MIN_SAMPLES = 3;

    private static final long SECOND = 1000L;
    private static final long MINUTE = 60 * SECOND;
    private static final long HOUR = 60 * MINUTE;
    private static final long DAY = 24 * HOUR;

    private final int windowSize;

    private final int minSamples;

    private final Deque<Long> window = new ArrayDeque<>();

    private long windowSum;

    public EtaEstimator() {
        this(DEFAULT_WINDOW_SIZE, DEFAULT_MIN_SAMPLES);
    }

    public EtaEstimator(int windowSize, int minSamples) {
        if (windowSize <= 0) {
            throw new InvalidConfigurationException("windowSize must be > 0, got " + windowSize);
        }
        if (minSamples <= 0) {
            throw new InvalidConfigurationException("minSamples must be > 0, got " + minSamples);
        }
        this.windowSize = windowSize;
        this.minSamples = minSamples;
    }

    /**
     * 非正耗时（end <= start）不计入样本
     */
    public synchronized void recordCompletion(long startMs, long endMs) {
        long duration = endMs - startMs;
        if (duration <= 0) {
            return;
        }
        window.addLast(duration);
        windowSum += duration;
        if (window.size() > windowSize) {
            windowSum -= window.removeFirst();
        }
    }

    public synchronized EtaEstimate getEstimate(int completed, int total) {
        int samples = window.size();
        if (completed >= total) {
            long avg = samples == 0 ? 0 : windowSum / samples;
            return new EtaEstimate(0, "Complete", avg, samples, true);
        }
        if (samples == 0) {
            return new EtaEstimate(0, "Calculating...", 0, 0, false);
        }
        long avg = Math.round((double) windowSum / samples);
        long remaining = avg * (long) (total - Math.max(0, completed));
        return new EtaEstimate(remaining, format(remaining), avg, samples, samples >= minSamples);
    }

    public synchronized void reset() {
        window.clear();
        windowSum = 0;
    }

    public synchronized int sampleCount() {
        return window.size();
    }

    /**
     * 剩余时间的人读格式
     */
    public static String format(long ms) {
        if (ms < SECOND) {
            return "< 1s";
        }
        if (ms < MINUTE) {
            return (ms / SECOND) + "s";
        }
        if (ms < HOUR) {
            long m = ms / MINUTE;
            long s = (ms % MINUTE) / SECOND;
            return s == 0 ? m + "m" : m + "m " + s + "s";
        }
        if (ms < DAY) {
            long h = ms / HOUR;
            long m = (ms % HOUR) / MINUTE;
            return m == 0 ? h + "h" : h + "h " + m + "m";
        }
        return "> 24h";
    }
}
