package com.vibescout.core.loader;

import com.vibescout.api.PluginApi;
import com.vibescout.core.exception.ManifestException;
import com.vibescout.core.manifest.Capability;
import com.vibescout.core.manifest.PluginManifest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginManifestLoader 单元测试")
class PluginManifestLoaderTest {

    private static PluginManifest parse(String yaml) {
        return PluginManifestLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("完整清单")
    class FullManifestTests {

        @Test
        @DisplayName("应解析全部字段")
        void shouldParseAllFields() {
            PluginManifest manifest = parse("""
                    name: nextjs
                    version: 1.0.0
                    main: lib/nextjs.jar
                    mainClass: com.acme.NextJsPlugin
                    description: Next.js support
                    author: acme
                    vibescout:
                      apiVersion: 1.0.0
                      capabilities: [extractors, commands]
                      builtin: true
                      compatibility: { minHostVersion: 1.0.0, maxHostVersion: 2.0.0 }
                      sandbox: { requires: [java.net.http], timeoutMs: 10000, maxMemory: 256MB }
                    """);

            assertEquals("nextjs", manifest.getName());
            assertEquals("1.0.0", manifest.getVersion());
            assertEquals("lib/nextjs.jar", manifest.getMain());
            assertEquals("com.acme.NextJsPlugin", manifest.getMainClass());
            assertEquals("acme", manifest.getAuthor());
            assertTrue(manifest.hasCapability(Capability.EXTRACTORS));
            assertTrue(manifest.hasCapability(Capability.COMMANDS));
            assertFalse(manifest.hasCapability(Capability.PROVIDERS));
            assertTrue(manifest.isBuiltin());
            assertEquals("1.0.0", manifest.getCompatibility().getMinHostVersion());
            assertEquals("2.0.0", manifest.getCompatibility().getMaxHostVersion());
            assertEquals(List.of("java.net.http"), manifest.getSandbox().getRequires());
            assertEquals(10000, manifest.getSandbox().getTimeoutMs());
            assertEquals("256MB", manifest.getSandbox().getMaxMemory());
        }

        @Test
        @DisplayName("未知字段应被忽略")
        void shouldIgnoreUnknownFields() {
            PluginManifest manifest = parse("""
                    name: demo
                    version: 0.2.0
                    license: MIT
                    vibescout:
                      capabilities: [providers]
                      futureFlag: true
                    """);

            assertEquals("demo", manifest.getName());
            assertEquals(Capability.PROVIDERS, manifest.getCapabilities().iterator().next());
        }
    }

    @Nested
    @DisplayName("默认值")
    class DefaultTests {

        @Test
        @DisplayName("缺少 vibescout 段时使用当前 API 版本和 extractors 能力")
        void shouldApplyDefaultsWithoutScoutSection() {
            PluginManifest manifest = parse("name: demo\nversion: 1.0.0\n");

            assertEquals(PluginApi.VERSION, manifest.getApiVersion());
            assertEquals(PluginManifest.DEFAULT_MAIN, manifest.getMain());
            assertNull(manifest.getMainClass());
            assertTrue(manifest.hasCapability(Capability.EXTRACTORS));
            assertFalse(manifest.isBuiltin());
            assertFalse(manifest.getCompatibility().isBounded());
            assertNotNull(manifest.getSandbox());
        }
    }

    @Nested
    @DisplayName("非法清单")
    class MalformedTests {

        @Test
        @DisplayName("缺少 name 应抛出 ManifestException")
        void missingNameShouldFail() {
            ManifestException e = assertThrows(ManifestException.class, () -> parse("version: 1.0.0\n"));
            assertTrue(e.getMessage().contains("name"));
        }

        @Test
        @DisplayName("缺少 version 应抛出 ManifestException")
        void missingVersionShouldFail() {
            assertThrows(ManifestException.class, () -> parse("name: demo\n"));
        }

        @Test
        @DisplayName("空文档应抛出 ManifestException")
        void emptyDocumentShouldFail() {
            assertThrows(ManifestException.class, () -> parse(""));
        }

        @Test
        @DisplayName("未知能力应抛出 ManifestException")
        void unknownCapabilityShouldFail() {
            assertThrows(ManifestException.class, () -> parse("""
                    name: demo
                    version: 1.0.0
                    vibescout:
                      capabilities: [themes]
                    """));
        }

        @Test
        @DisplayName("语法错误应抛出 ManifestException")
        void brokenYamlShouldFail() {
            assertThrows(ManifestException.class, () -> parse("name: [demo\nversion: 1.0.0\n"));
        }

        @Test
        @DisplayName("不可读文件应抛出 ManifestException")
        void missingFileShouldFail(@TempDir Path dir) {
            Path missing = dir.resolve("plugin.yml");
            assertFalse(Files.exists(missing));
            assertThrows(ManifestException.class, () -> PluginManifestLoader.load(missing));
        }
    }
}
