package com.vibescout.core.config;

import com.vibescout.api.exception.ScoutException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 从宿主配置文件 (YAML) 构建 {@link PluginHostConfig}
 * <p>
 * 只解释 {@code plugins:} 段，整份文档作为配置快照下发给插件：
 * <pre>
 * plugins:
 *   enabled: true
 *   sandboxed: true
 *   disabled: [legacy-plugin]
 *   timeout: 10000
 *   maxMemory: 256MB
 *   allowedModules: [java.base, java.net.http]
 *   localRoot: ~/.vibescout/plugins
 *   packageRoots: [./lib/plugins]
 * </pre>
 */
@Slf4j
public class PluginHostConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "config.yml";

    private PluginHostConfigLoader() {
    }

    /**
     * 加载 ~/.vibescout/config.yml，文件不存在时返回默认配置
     */
    public static PluginHostConfig loadDefault() {
        return load(PluginHostConfig.vibescoutHome().resolve(DEFAULT_CONFIG_FILE));
    }

    public static PluginHostConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            log.info("Host config {} not found, using defaults", file);
            return PluginHostConfig.defaults();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new ScoutException("Cannot read host config " + file + ": " + e.getMessage(), e);
        }
    }

    public static PluginHostConfig load(InputStream in) {
        Map<String, Object> document;
        try {
            Object root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
            document = root == null ? Collections.emptyMap() : asMap(root, "<root>");
        } catch (YAMLException e) {
            throw new ScoutException("Malformed host config: " + e.getMessage(), e);
        }
        return fromMap(document);
    }

    static PluginHostConfig fromMap(Map<String, Object> document) {
        PluginHostConfig.PluginHostConfigBuilder builder = PluginHostConfig.builder()
                .properties(Collections.unmodifiableMap(new LinkedHashMap<>(document)));

        Object section = document.get("plugins");
        if (section == null) {
            return builder.build();
        }
        Map<String, Object> plugins = asMap(section, "plugins");

        if (plugins.containsKey("enabled")) {
            builder.enabled(asBoolean(plugins.get("enabled")));
        }
        if (plugins.containsKey("sandboxed")) {
            builder.sandboxed(asBoolean(plugins.get("sandboxed")));
        }
        if (plugins.containsKey("disabled")) {
            builder.disabledPlugins(new LinkedHashSet<>(asStrings(plugins.get("disabled"))));
        }
        if (plugins.containsKey("hostVersion")) {
            builder.hostVersion(String.valueOf(plugins.get("hostVersion")));
        }
        if (plugins.containsKey("builtinRoot")) {
            builder.builtinRoot(toPath(plugins.get("builtinRoot")));
        }
        if (plugins.containsKey("localRoot")) {
            builder.localRoot(toPath(plugins.get("localRoot")));
        }
        if (plugins.containsKey("packageRoots")) {
            builder.packageRoots(asStrings(plugins.get("packageRoots")).stream()
                    .map(PluginHostConfigLoader::toPath)
                    .collect(Collectors.toList()));
        }
        if (plugins.containsKey("packagePrefix")) {
            builder.packagePrefix(String.valueOf(plugins.get("packagePrefix")));
        }

        SandboxConfig.SandboxConfigBuilder sandbox = SandboxConfig.defaults().toBuilder();
        if (plugins.containsKey("sandboxed")) {
            sandbox.enabled(asBoolean(plugins.get("sandboxed")));
        }
        if (plugins.containsKey("timeout")) {
            sandbox.timeoutMs(asLong(plugins.get("timeout")));
        }
        if (plugins.containsKey("maxMemory")) {
            sandbox.maxMemory(String.valueOf(plugins.get("maxMemory")));
        }
        if (plugins.containsKey("allowedModules")) {
            sandbox.clearAllowedModules().allowedModules(asStrings(plugins.get("allowedModules")));
        }
        return builder.sandbox(sandbox.build()).build();
    }

    // ==================== 类型转换 ====================

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new ScoutException("Config key '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static boolean asBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(String.valueOf(value));
    }

    private static long asLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ScoutException("Invalid number in host config: " + value, e);
        }
    }

    private static List<String> asStrings(Object value) {
        if (value instanceof Collection<?> c) {
            return c.stream().map(String::valueOf).collect(Collectors.toList());
        }
        return List.of(String.valueOf(value));
    }

    private static Path toPath(Object value) {
        String raw = String.valueOf(value).trim();
        if (raw.equals("~") || raw.startsWith("~/")) {
            raw = System.getProperty("user.home") + raw.substring(1);
        }
        return Paths.get(raw);
    }
}
