package com.vibescout.core.loader;

import com.vibescout.core.config.HostVersion;
import com.vibescout.core.config.PluginHostConfig;
import com.vibescout.core.manifest.PluginManifest;
import com.vibescout.core.plugin.PluginDescriptor;
import com.vibescout.core.plugin.PluginOrigin;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 插件自动发现服务
 * <p>
 * 职责：
 * 1. 按固定优先级扫描三类来源：内置 → 用户本地 → 外部安装包
 * 2. 预解析 plugin.yml 获取元数据
 * 3. 同名插件后者覆盖前者，并记录被覆盖的路径
 * 4. 兼容性校验：宿主版本不满足约束的插件直接禁用
 * <p>
 * 单个插件的任何问题只打印日志，不会中断扫描。
 */
@Slf4j
@RequiredArgsConstructor
public class PluginDiscoveryService {

    private final PluginHostConfig config;

    /**
     * 执行扫描
     *
     * @return 全部描述符（包括被禁用、不兼容的），按合并顺序排列
     */
    public List<PluginDescriptor> discover() {
        // 名称 -> 描述符，保持插入顺序
        Map<String, PluginDescriptor> merged = new LinkedHashMap<>();

        merge(merged, discoverBuiltin());
        merge(merged, discoverLocal());
        merge(merged, discoverPackaged());

        // 兼容性校验（合并后对每个名称只做一次）
        for (PluginDescriptor descriptor : merged.values()) {
            checkCompatibility(descriptor.getManifest()).ifPresent(reason -> {
                log.warn("[{}] Plugin is incompatible and will be disabled: {}", descriptor.getName(), reason);
                descriptor.markIncompatible(reason);
            });
        }

        log.info("Plugin discovery finished. Total discovered: {}", merged.size());
        return new ArrayList<>(merged.values());
    }

    /**
     * 用户本地插件目录
     */
    public Path getLocalPluginsDir() {
        return config.getLocalRoot();
    }

    /**
     * 确保用户本地插件目录存在
     */
    public Path ensureLocalPluginsDir() throws IOException {
        return Files.createDirectories(config.getLocalRoot());
    }

    // ==================== 合并与兼容性 ====================

    private void merge(Map<String, PluginDescriptor> merged, List<PluginDescriptor> batch) {
        for (PluginDescriptor descriptor : batch) {
            PluginDescriptor existing = merged.get(descriptor.getName());
            if (existing != null) {
                log.warn("[{}] Override detected: {} plugin overrides {} plugin. Existing: {}, New: {}",
                        descriptor.getName(), descriptor.getOrigin(), existing.getOrigin(),
                        existing.getInstallPath(), descriptor.getInstallPath());
                descriptor.setOverriddenPath(existing.getInstallPath());
            }
            merged.put(descriptor.getName(), descriptor);
        }
    }

    /**
     * 校验宿主版本是否落在清单声明的闭区间内
     *
     * @return 不兼容原因；兼容时为空
     */
    public Optional<String> checkCompatibility(PluginManifest manifest) {
        PluginManifest.Compatibility compat = manifest.getCompatibility();
        if (compat == null || !compat.isBounded()) {
            return Optional.empty();
        }
        String hostVersion = config.getHostVersion();

        String min = compat.getMinHostVersion();
        if (min != null && HostVersion.compare(hostVersion, min) < 0) {
            return Optional.of("Requires VibeScout >= " + min + " (current: " + hostVersion + ")");
        }
        String max = compat.getMaxHostVersion();
        if (max != null && HostVersion.compare(hostVersion, max) > 0) {
            return Optional.of("Requires VibeScout <= " + max + " (current: " + hostVersion + ")");
        }
        return Optional.empty();
    }

    // ==================== 三类来源 ====================

    /**
     * 内置插件：&lt;builtinRoot&gt;/&lt;name&gt;/&lt;version&gt;/plugin.yml
     * 以清单中的 builtin 标记识别，而不是以目录位置识别
     */
    List<PluginDescriptor> discoverBuiltin() {
        List<PluginDescriptor> result = new ArrayList<>();
        Path root = config.getBuiltinRoot();
        if (!Files.isDirectory(root)) {
            log.debug("Builtin plugin root does not exist: {}", root.toAbsolutePath());
            return result;
        }
        for (Path pluginDir : listDirectories(root)) {
            for (Path versionDir : listDirectories(pluginDir)) {
                readManifest(versionDir).ifPresent(manifest -> {
                    if (manifest.isBuiltin()) {
                        result.add(new PluginDescriptor(manifest, PluginOrigin.BUILTIN, versionDir));
                    } else {
                        log.debug("Skipping {}: manifest is not flagged builtin", versionDir);
                    }
                });
            }
        }
        log.info("Discovered {} builtin plugin(s) under {}", result.size(), root);
        return result;
    }

    /**
     * 用户本地插件：&lt;localRoot&gt;/&lt;dir&gt;/plugin.yml
     */
    List<PluginDescriptor> discoverLocal() {
        List<PluginDescriptor> result = new ArrayList<>();
        Path root;
        try {
            root = ensureLocalPluginsDir();
        } catch (IOException e) {
            log.error("Cannot create local plugin directory: {}", config.getLocalRoot(), e);
            return result;
        }
        for (Path pluginDir : listDirectories(root)) {
            readManifest(pluginDir).ifPresent(manifest ->
                    result.add(new PluginDescriptor(manifest, PluginOrigin.LOCAL, pluginDir)));
        }
        log.info("Discovered {} local plugin(s) under {}", result.size(), root);
        return result;
    }

    /**
     * 外部安装包：在第一个存在的安装根目录下，查找名称匹配前缀的目录
     */
    List<PluginDescriptor> discoverPackaged() {
        List<PluginDescriptor> result = new ArrayList<>();
        Optional<Path> root = config.getPackageRoots().stream()
                .filter(Files::isDirectory)
                .findFirst();
        if (root.isEmpty()) {
            log.debug("No package root exists among {}", config.getPackageRoots());
            return result;
        }
        String prefix = config.getPackagePrefix();
        for (Path packageDir : listDirectories(root.get())) {
            if (!packageDir.getFileName().toString().startsWith(prefix)) {
                continue;
            }
            readManifest(packageDir).ifPresent(manifest ->
                    result.add(new PluginDescriptor(manifest, PluginOrigin.PACKAGED, packageDir)));
        }
        log.info("Discovered {} packaged plugin(s) under {}", result.size(), root.get());
        return result;
    }

    // ==================== 辅助方法 ====================

    private Optional<PluginManifest> readManifest(Path dir) {
        Path manifestFile = dir.resolve(PluginManifestLoader.MANIFEST_FILE);
        if (!Files.isRegularFile(manifestFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(PluginManifestLoader.load(manifestFile));
        } catch (Exception e) {
            // 坏清单只打印日志，不影响其他插件
            log.warn("Invalid plugin manifest in {}: {}", dir, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 按名称排序列出子目录，保证扫描顺序稳定
     */
    private List<Path> listDirectories(Path dir) {
        if (!Files.isReadable(dir)) {
            log.error("Plugin root is not readable: {}", dir.toAbsolutePath());
            return Collections.emptyList();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isDirectory)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to list plugin directory: {}", dir.toAbsolutePath(), e);
            return Collections.emptyList();
        }
    }
}
