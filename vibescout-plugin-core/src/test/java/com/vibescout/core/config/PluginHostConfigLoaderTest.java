package com.vibescout.core.config;

import com.vibescout.api.exception.ScoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginHostConfigLoader 单元测试")
class PluginHostConfigLoaderTest {

    private static PluginHostConfig parse(String yaml) {
        return PluginHostConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("文件不存在时返回默认配置")
    void missingFileFallsBackToDefaults(@TempDir Path dir) {
        PluginHostConfig config = PluginHostConfigLoader.load(dir.resolve("config.yml"));

        assertTrue(config.isEnabled());
        assertTrue(config.isSandboxed());
        assertEquals(SandboxConfig.DEFAULT_TIMEOUT_MS, config.getSandbox().getTimeoutMs());
        assertEquals(PluginHostConfig.DEFAULT_PACKAGE_PREFIX, config.getPackagePrefix());
        assertEquals(3, config.getPackageRoots().size());
    }

    @Test
    @DisplayName("解析 plugins 段")
    void parsesPluginsSection() {
        PluginHostConfig config = parse("""
                provider: local
                plugins:
                  enabled: true
                  sandboxed: false
                  disabled: [legacy, broken]
                  hostVersion: 1.2.0
                  timeout: 10000
                  maxMemory: 256MB
                  allowedModules: [java.base]
                  localRoot: /opt/vibescout/plugins
                  packageRoots: [/opt/packages]
                """);

        assertFalse(config.isSandboxed());
        assertFalse(config.getSandbox().isEnabled());
        assertEquals(Set.of("legacy", "broken"), config.getDisabledPlugins());
        assertEquals("1.2.0", config.getHostVersion());
        assertEquals(10000, config.getSandbox().getTimeoutMs());
        assertEquals("256MB", config.getSandbox().getMaxMemory());
        assertEquals(Set.of("java.base"), config.getSandbox().getAllowedModules());
        assertEquals(Paths.get("/opt/vibescout/plugins"), config.getLocalRoot());
        assertEquals(List.of(Paths.get("/opt/packages")), config.getPackageRoots());
        assertEquals("local", config.getProperties().get("provider"));
    }

    @Test
    @DisplayName("~ 展开为用户目录")
    void expandsHome() {
        PluginHostConfig config = parse("plugins:\n  localRoot: ~/custom/plugins\n");

        assertEquals(Paths.get(System.getProperty("user.home"), "custom", "plugins"), config.getLocalRoot());
    }

    @Test
    @DisplayName("没有 plugins 段时全部使用默认值")
    void noSectionUsesDefaults() {
        PluginHostConfig config = parse("provider: bedrock\n");

        assertTrue(config.isEnabled());
        assertEquals(SandboxConfig.DEFAULT_ALLOWED_MODULES.size(), config.getSandbox().getAllowedModules().size());
        assertEquals("bedrock", config.getProperties().get("provider"));
    }

    @Test
    @DisplayName("非法配置抛出 ScoutException")
    void invalidConfigFails() {
        assertThrows(ScoutException.class, () -> parse("plugins: [a, b]\n"));
        assertThrows(ScoutException.class, () -> parse("plugins:\n  timeout: soon\n"));
    }
}
