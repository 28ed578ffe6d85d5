package com.vibescout.core.sandbox;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.Locale;

/**
 * 内存观测器
 * 记录创建时的内存快照，之后可查询与起点的差值。只观测整个 JVM，不区分具体插件。
 */
public class MemoryTracker {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private final MemoryMXBean memoryBean;
    private final Snapshot initial;

    public MemoryTracker() {
        this(ManagementFactory.getMemoryMXBean());
    }

    MemoryTracker(MemoryMXBean memoryBean) {
        this.memoryBean = memoryBean;
        this.initial = getCurrentUsage();
    }

    public Snapshot getCurrentUsage() {
        Runtime runtime = Runtime.getRuntime();
        return new Snapshot(
                memoryBean.getHeapMemoryUsage().getUsed(),
                memoryBean.getHeapMemoryUsage().getCommitted(),
                memoryBean.getNonHeapMemoryUsage().getUsed(),
                runtime.totalMemory());
    }

    /**
     * 与创建时相比的变化量，可能为负
     */
    public Snapshot getDelta() {
        Snapshot current = getCurrentUsage();
        return new Snapshot(
                current.heapUsed() - initial.heapUsed(),
                current.heapCommitted() - initial.heapCommitted(),
                current.nonHeapUsed() - initial.nonHeapUsed(),
                current.runtimeTotal() - initial.runtimeTotal());
    }

    /**
     * 格式化为可读字符串，例如 {@code 1536 -> "1.50 KB"}
     */
    public static String formatBytes(long bytes) {
        double size = bytes;
        int unitIndex = 0;
        while (size >= 1024 && unitIndex < UNITS.length - 1) {
            size /= 1024;
            unitIndex++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, UNITS[unitIndex]);
    }

    /**
     * 内存快照（字节）
     */
    public record Snapshot(long heapUsed, long heapCommitted, long nonHeapUsed, long runtimeTotal) {
    }
}
