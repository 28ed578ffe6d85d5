package com.vibescout.api;

/**
 * 插件 API 契约常量
 *
 * @author VibeScout
 */
public final class PluginApi {

    /**
     * 插件 API 版本号
     * <p>
     * 契约不保证跨版本兼容，插件声明的 apiVersion 必须与此值完全相等（不是范围匹配）。
     * 发生破坏性变更时递增。
     */
    public static final String VERSION = "1.0.0";

    private PluginApi() {
    }
}
