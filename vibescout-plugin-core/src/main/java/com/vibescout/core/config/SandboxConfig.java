package com.vibescout.core.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 沙箱配置 (Immutable)
 */
@Value
@Builder(toBuilder = true)
public class SandboxConfig {

    public static final long DEFAULT_TIMEOUT_MS = 30_000L;
    public static final String DEFAULT_MAX_MEMORY = "512MB";
    public static final List<String> DEFAULT_ALLOWED_MODULES =
            List.of("java.base", "java.logging", "java.net.http", "java.xml");

    /**
     * 是否启用沙箱包装
     */
    @Builder.Default
    boolean enabled = true;

    /**
     * 单次调用的超时时间 (ms)
     */
    @Builder.Default
    long timeoutMs = DEFAULT_TIMEOUT_MS;

    /**
     * 内存上限 (仅观测，不强制)，例如 "512MB"、"1GB"
     */
    @Builder.Default
    String maxMemory = DEFAULT_MAX_MEMORY;

    /**
     * 模块白名单 (仅告警，不强制)
     */
    @Singular
    Set<String> allowedModules;

    public static SandboxConfig defaults() {
        return SandboxConfig.builder()
                .allowedModules(DEFAULT_ALLOWED_MODULES)
                .build();
    }
}
