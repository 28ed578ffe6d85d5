package com.vibescout.core.sandbox;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 一次内存观测会话
 * 超限只作为观测结果返回，不会中止插件执行
 */
@RequiredArgsConstructor
public class SandboxSession {

    @Getter
    private final MemoryTracker tracker;

    public MemoryTracker.Snapshot getDelta() {
        return tracker.getDelta();
    }

    /**
     * 会话期间堆内存增量是否在限制之内
     *
     * @param limit 例如 "512MB"
     * @throws IllegalArgumentException 限制格式不合法
     */
    public boolean checkLimit(String limit) {
        return tracker.getDelta().heapUsed() <= MemoryLimits.parse(limit);
    }
}
