package com.vibescout.core.config;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 插件宿主全局配置对象 (Immutable)
 * <p>
 * 职责：作为 Core 层的唯一配置入口，包含：
 * 1. 插件开关与禁用列表
 * 2. 三类插件来源的目录
 * 3. 沙箱模板
 * 4. 下发给插件的配置快照
 */
@Value
@Builder(toBuilder = true)
public class PluginHostConfig {

    public static final String DEFAULT_PACKAGE_PREFIX = "vibescout-plugin-";

    // ================= 开关 =================

    /**
     * 全局插件开关，false 时 loadAll 直接返回
     */
    @Builder.Default
    boolean enabled = true;

    /**
     * 是否对插件启用沙箱包装
     */
    @Builder.Default
    boolean sandboxed = true;

    /**
     * 按名称禁用的插件
     */
    @Builder.Default
    Set<String> disabledPlugins = Collections.emptySet();

    /**
     * 宿主版本，用于兼容性校验。默认取 core jar 的 Implementation-Version
     */
    @Builder.Default
    String hostVersion = HostVersion.detect();

    // ================= 插件来源 =================

    /**
     * 内置插件根目录：&lt;root&gt;/&lt;name&gt;/&lt;version&gt;/plugin.yml
     */
    @Builder.Default
    Path builtinRoot = Paths.get("plugins");

    /**
     * 用户本地插件目录，不存在时自动创建
     */
    @Builder.Default
    Path localRoot = defaultLocalRoot();

    /**
     * 外部安装包根目录 (按优先级排列，只扫描第一个存在的)
     */
    @Builder.Default
    List<Path> packageRoots = defaultPackageRoots();

    /**
     * 外部安装包目录名前缀
     */
    @Builder.Default
    String packagePrefix = DEFAULT_PACKAGE_PREFIX;

    // ================= 运行时模板 =================

    @Builder.Default
    SandboxConfig sandbox = SandboxConfig.defaults();

    /**
     * 下发给插件的配置快照
     */
    @Builder.Default
    Map<String, Object> properties = Collections.emptyMap();

    public static PluginHostConfig defaults() {
        return PluginHostConfig.builder().build();
    }

    public static Path vibescoutHome() {
        return Paths.get(System.getProperty("user.home"), ".vibescout");
    }

    private static Path defaultLocalRoot() {
        return vibescoutHome().resolve("plugins");
    }

    private static List<Path> defaultPackageRoots() {
        String home = System.getProperty("user.home");
        return List.of(
                Paths.get(System.getProperty("user.dir"), "lib", "plugins"),
                Paths.get(home, ".vibescout", "packages"),
                Paths.get(home, ".local", "share", "vibescout", "packages"));
    }
}
