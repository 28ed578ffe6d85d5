package com.vibescout.core.plugin;

import com.vibescout.core.config.PluginHostConfig;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Set;

/**
 * 单次 loadAll 的参数
 */
@Value
@Builder
public class LoadOptions {

    /**
     * false 时不做任何事
     */
    @Builder.Default
    boolean enabled = true;

    /**
     * 按名称跳过的插件
     */
    @Builder.Default
    Set<String> disabledNames = Collections.emptySet();

    @Builder.Default
    boolean sandboxed = true;

    public static LoadOptions from(PluginHostConfig config) {
        return LoadOptions.builder()
                .enabled(config.isEnabled())
                .disabledNames(config.getDisabledPlugins())
                .sandboxed(config.isSandboxed())
                .build();
    }
}
