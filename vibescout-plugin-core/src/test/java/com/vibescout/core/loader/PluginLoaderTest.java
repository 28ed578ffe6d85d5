package com.vibescout.core.loader;

import com.vibescout.api.PluginApi;
import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.core.classloader.PluginClassLoader;
import com.vibescout.core.fixtures.ExtractorFixturePlugin;
import com.vibescout.core.fixtures.FixtureExtractor;
import com.vibescout.core.fixtures.NoCapabilityPlugin;
import com.vibescout.core.fixtures.NotAPlugin;
import com.vibescout.core.fixtures.PluginJars;
import com.vibescout.core.fixtures.WrongApiVersionPlugin;
import com.vibescout.core.manifest.PluginManifest;
import com.vibescout.core.plugin.PluginDescriptor;
import com.vibescout.core.plugin.PluginOrigin;
import com.vibescout.core.plugin.PluginStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginLoader 单元测试")
class PluginLoaderTest {

    @TempDir
    Path tempDir;

    private final PluginLoader loader = new PluginLoader();

    private PluginDescriptor descriptor(String name, String mainClass, Class<?>... classes) throws IOException {
        Path dir = tempDir.resolve(name);
        if (classes.length > 0) {
            PluginJars.jar(dir.resolve(PluginManifest.DEFAULT_MAIN), null, classes);
        }
        PluginManifest manifest = PluginManifest.builder()
                .name(name)
                .version("1.0.0")
                .mainClass(mainClass)
                .build();
        return new PluginDescriptor(manifest, PluginOrigin.LOCAL, dir);
    }

    @Nested
    @DisplayName("成功加载")
    class SuccessTests {

        @Test
        @DisplayName("通过 mainClass 加载 jar 插件")
        void loadsJarByMainClass() throws IOException {
            PluginDescriptor descriptor = descriptor("fixture", ExtractorFixturePlugin.class.getName(),
                    ExtractorFixturePlugin.class, FixtureExtractor.class);

            Optional<ScoutPlugin> plugin = loader.load(descriptor);

            assertTrue(plugin.isPresent());
            assertEquals("fixture-extractor", plugin.get().getName());
            assertInstanceOf(PluginClassLoader.class, plugin.get().getClass().getClassLoader());
            assertTrue(descriptor.isLoaded());
            assertNull(descriptor.getLastError());
            assertEquals(PluginStatus.LOADED, descriptor.getStatus());
            assertEquals(1, plugin.get().getExtractors().size());
        }

        @Test
        @DisplayName("未声明 mainClass 时通过 ServiceLoader 查找")
        void loadsByServiceLoader() throws IOException {
            Path dir = tempDir.resolve("service");
            PluginJars.jar(dir.resolve(PluginManifest.DEFAULT_MAIN), ExtractorFixturePlugin.class,
                    ExtractorFixturePlugin.class, FixtureExtractor.class);
            PluginDescriptor descriptor = new PluginDescriptor(
                    PluginManifest.builder().name("service").version("1.0.0").build(), PluginOrigin.LOCAL, dir);

            Optional<ScoutPlugin> plugin = loader.load(descriptor);

            assertTrue(plugin.isPresent(), () -> "lastError: " + descriptor.getLastError());
            assertEquals(ExtractorFixturePlugin.class.getName(), plugin.get().getClass().getName());
        }

        @Test
        @DisplayName("入口可以是 classes 目录")
        void loadsExplodedClassesDirectory() throws IOException {
            Path dir = tempDir.resolve("exploded");
            PluginJars.classesDir(dir.resolve("classes"), ExtractorFixturePlugin.class, FixtureExtractor.class);
            PluginManifest manifest = PluginManifest.builder()
                    .name("exploded")
                    .version("1.0.0")
                    .main("classes")
                    .mainClass(ExtractorFixturePlugin.class.getName())
                    .build();
            PluginDescriptor descriptor = new PluginDescriptor(manifest, PluginOrigin.LOCAL, dir);

            assertTrue(loader.load(descriptor).isPresent(), () -> "lastError: " + descriptor.getLastError());
        }
    }

    @Nested
    @DisplayName("加载失败")
    class FailureTests {

        @Test
        @DisplayName("入口不存在时记录 lastError")
        void missingEntryPoint() throws IOException {
            PluginDescriptor descriptor = descriptor("missing", ExtractorFixturePlugin.class.getName());

            assertTrue(loader.load(descriptor).isEmpty());
            assertFalse(descriptor.isLoaded());
            assertTrue(descriptor.getLastError().startsWith("Entry point not found"));
            assertEquals(PluginStatus.ERRORED, descriptor.getStatus());
        }

        @Test
        @DisplayName("入口路径不能逃出插件目录")
        void entryPointEscape() {
            PluginManifest manifest = PluginManifest.builder()
                    .name("escape").version("1.0.0").main("../../etc/passwd").build();
            PluginDescriptor descriptor = new PluginDescriptor(manifest, PluginOrigin.LOCAL, tempDir.resolve("escape"));

            assertTrue(loader.load(descriptor).isEmpty());
            assertTrue(descriptor.getLastError().contains("escapes"));
        }

        @Test
        @DisplayName("API 版本不一致时错误信息包含双方版本")
        void apiVersionMismatch() throws IOException {
            PluginDescriptor descriptor = descriptor("old", WrongApiVersionPlugin.class.getName(),
                    WrongApiVersionPlugin.class);

            assertTrue(loader.load(descriptor).isEmpty());
            assertEquals("Plugin API version mismatch: plugin requires 0.9.0, but VibeScout provides "
                    + PluginApi.VERSION, descriptor.getLastError());
        }

        @Test
        @DisplayName("未声明任何能力的插件校验失败")
        void noCapability() throws IOException {
            PluginDescriptor descriptor = descriptor("empty", NoCapabilityPlugin.class.getName(),
                    NoCapabilityPlugin.class);

            assertTrue(loader.load(descriptor).isEmpty());
            assertNotNull(descriptor.getLastError());
        }

        @Test
        @DisplayName("入口类未实现 ScoutPlugin 时校验失败")
        void notAPlugin() throws IOException {
            PluginDescriptor descriptor = descriptor("bogus", NotAPlugin.class.getName(), NotAPlugin.class);

            assertTrue(loader.load(descriptor).isEmpty());
            assertTrue(descriptor.getLastError().contains("ScoutPlugin"));
        }

        @Test
        @DisplayName("入口类不存在时记录 lastError")
        void classNotFound() throws IOException {
            PluginDescriptor descriptor = descriptor("ghost", "com.example.Ghost", NoCapabilityPlugin.class);

            assertTrue(loader.load(descriptor).isEmpty());
            assertNotNull(descriptor.getLastError());
        }

        @Test
        @DisplayName("被禁用的插件直接跳过，不记录错误")
        void disabledIsSkipped() throws IOException {
            PluginDescriptor descriptor = descriptor("fixture", ExtractorFixturePlugin.class.getName(),
                    ExtractorFixturePlugin.class, FixtureExtractor.class);
            descriptor.markIncompatible("Requires VibeScout >= 9.0.0 (current: 1.2.0)");

            assertTrue(loader.load(descriptor).isEmpty());
            assertFalse(descriptor.isLoaded());
            assertNull(descriptor.getLastError());
        }
    }

    @Nested
    @DisplayName("批量加载")
    class BatchTests {

        @Test
        @DisplayName("单个插件失败不影响后续插件")
        void batchContinuesPastFailures() throws IOException {
            PluginDescriptor broken = descriptor("broken", ExtractorFixturePlugin.class.getName());
            PluginDescriptor old = descriptor("old", WrongApiVersionPlugin.class.getName(),
                    WrongApiVersionPlugin.class);
            PluginDescriptor good = descriptor("good", ExtractorFixturePlugin.class.getName(),
                    ExtractorFixturePlugin.class, FixtureExtractor.class);

            Map<String, ScoutPlugin> loaded = loader.loadAll(List.of(broken, old, good));

            assertEquals(List.of("good"), List.copyOf(loaded.keySet()));
            assertNotNull(broken.getLastError());
            assertNotNull(old.getLastError());
            assertTrue(good.isLoaded());
        }
    }
}
