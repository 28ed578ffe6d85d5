package com.vibescout.core.manifest;

import com.vibescout.api.PluginApi;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * 插件清单 (plugin.yml 解析后的不可变视图)
 * 从磁盘读取后不再修改
 */
@Value
@Builder(toBuilder = true)
public class PluginManifest {

    public static final String DEFAULT_MAIN = "plugin.jar";

    // === 基础元数据 ===
    String name;
    String version;
    String description;
    String author;
    String homepage;

    // === 入口 ===
    /**
     * 入口相对路径 (jar 文件或 classes 目录)
     */
    @Builder.Default
    String main = DEFAULT_MAIN;

    /**
     * 入口类全限定名，为空时通过 ServiceLoader 查找
     */
    String mainClass;

    // === 宿主契约 ===
    @Builder.Default
    String apiVersion = PluginApi.VERSION;

    @Singular
    Set<Capability> capabilities;

    @Builder.Default
    Compatibility compatibility = Compatibility.UNBOUNDED;

    boolean builtin;

    @Builder.Default
    SandboxRequirements sandbox = SandboxRequirements.NONE;

    public boolean hasCapability(Capability capability) {
        return capabilities.contains(capability);
    }

    @Override
    public String toString() {
        return String.format("PluginManifest{name='%s', version='%s'}", name, version);
    }

    /**
     * 宿主版本约束 (闭区间，三段式版本号)
     */
    @Value
    public static class Compatibility {

        public static final Compatibility UNBOUNDED = new Compatibility(null, null);

        String minHostVersion;
        String maxHostVersion;

        public boolean isBounded() {
            return minHostVersion != null || maxHostVersion != null;
        }
    }

    /**
     * 插件对沙箱的诉求
     * requires 仅用于白名单比对（告警），不做强制隔离
     */
    @Value
    public static class SandboxRequirements {

        public static final SandboxRequirements NONE = new SandboxRequirements(List.of(), null, null);

        List<String> requires;
        Integer timeoutMs;
        String maxMemory;
    }
}
