package com.vibescout.core.plugin;

/**
 * 插件对外展示状态
 */
public enum PluginStatus {
    /**
     * 已发现，尚未尝试加载
     */
    DISCOVERED,
    LOADED,
    /**
     * 被用户禁用
     */
    DISABLED,
    /**
     * 宿主版本不满足清单约束
     */
    INCOMPATIBLE,
    /**
     * 加载或初始化失败
     */
    ERRORED
}
