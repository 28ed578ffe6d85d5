package com.vibescout.core.plugin;

import com.vibescout.core.manifest.PluginManifest;
import lombok.Getter;
import lombok.Setter;

import java.nio.file.Path;

/**
 * 插件描述符：已发现但未必已加载的插件记录
 * <p>
 * 来源与覆盖信息由 Discovery 写入；enabled / loaded / lastError 由 Loader 与 Registry 在加载过程中更新。
 * 每个插件名称只有一个描述符。
 */
@Getter
@Setter
public class PluginDescriptor {

    private final PluginManifest manifest;

    private final PluginOrigin origin;

    private final Path installPath;

    private volatile boolean enabled = true;

    private volatile boolean loaded = false;

    private volatile String lastError;

    // 被本描述符覆盖的同名插件路径
    private Path overriddenPath;

    private String incompatibilityReason;

    public PluginDescriptor(PluginManifest manifest, PluginOrigin origin, Path installPath) {
        this.manifest = manifest;
        this.origin = origin;
        this.installPath = installPath;
    }

    public String getName() {
        return manifest.getName();
    }

    public String getVersion() {
        return manifest.getVersion();
    }

    public boolean isIncompatible() {
        return incompatibilityReason != null && !incompatibilityReason.isEmpty();
    }

    /**
     * 是否允许进入加载流程
     */
    public boolean isLoadable() {
        return enabled && !isIncompatible();
    }

    /**
     * 标记禁用（兼容性不满足）
     */
    public void markIncompatible(String reason) {
        this.enabled = false;
        this.incompatibilityReason = reason;
    }

    public void markLoaded() {
        this.loaded = true;
        this.lastError = null;
    }

    public void markFailed(String error) {
        this.loaded = false;
        this.lastError = error;
    }

    public PluginStatus getStatus() {
        if (isIncompatible()) {
            return PluginStatus.INCOMPATIBLE;
        }
        if (!enabled) {
            return PluginStatus.DISABLED;
        }
        if (loaded) {
            return PluginStatus.LOADED;
        }
        if (lastError != null) {
            return PluginStatus.ERRORED;
        }
        return PluginStatus.DISCOVERED;
    }

    @Override
    public String toString() {
        return String.format("PluginDescriptor{name='%s', version='%s', origin=%s, status=%s}",
                getName(), getVersion(), origin, getStatus());
    }
}
