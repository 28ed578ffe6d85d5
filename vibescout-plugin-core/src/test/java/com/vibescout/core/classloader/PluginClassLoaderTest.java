package com.vibescout.core.classloader;

import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.core.fixtures.ExtractorFixturePlugin;
import com.vibescout.core.fixtures.FixtureExtractor;
import com.vibescout.core.fixtures.PluginJars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URL;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginClassLoader 单元测试")
class PluginClassLoaderTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("类加载隔离")
    class IsolationTests {

        @Test
        @DisplayName("插件类应由插件自己的加载器加载 (Child-First)")
        void pluginClassesAreChildFirst() throws Exception {
            Path jar = PluginJars.jar(tempDir.resolve("plugin.jar"), null,
                    ExtractorFixturePlugin.class, FixtureExtractor.class);

            try (PluginClassLoader loader = new PluginClassLoader("fixture",
                    new URL[]{jar.toUri().toURL()}, PluginClassLoaderTest.class.getClassLoader())) {
                Class<?> type = loader.loadClass(ExtractorFixturePlugin.class.getName());

                assertSame(loader, type.getClassLoader());
                assertNotSame(ExtractorFixturePlugin.class, type);
            }
        }

        @Test
        @DisplayName("API 契约包必须委派给父加载器")
        void contractPackagesAreShared() throws Exception {
            try (PluginClassLoader loader = new PluginClassLoader("fixture", new URL[]{},
                    PluginClassLoaderTest.class.getClassLoader())) {
                assertSame(ScoutPlugin.class, loader.loadClass(ScoutPlugin.class.getName()));
                assertSame(org.slf4j.Logger.class, loader.loadClass("org.slf4j.Logger"));
            }
        }

        @Test
        @DisplayName("不同插件之间应隔离类加载")
        void pluginsAreIsolated() throws Exception {
            Path jar = PluginJars.jar(tempDir.resolve("plugin.jar"), null, ExtractorFixturePlugin.class);
            URL[] urls = {jar.toUri().toURL()};
            ClassLoader parent = PluginClassLoaderTest.class.getClassLoader();

            try (PluginClassLoader pc1 = new PluginClassLoader("plugin-1", urls, parent);
                 PluginClassLoader pc2 = new PluginClassLoader("plugin-2", urls, parent)) {
                Class<?> c1 = pc1.loadClass(ExtractorFixturePlugin.class.getName());
                Class<?> c2 = pc2.loadClass(ExtractorFixturePlugin.class.getName());
                assertNotSame(c1, c2);
                assertThrows(ClassNotFoundException.class, () -> pc1.loadClass("com.example.NonExistentClass"));
            }
        }
    }

    @Nested
    @DisplayName("生命周期状态")
    class LifecycleTests {

        @Test
        @DisplayName("关闭后不应能加载类或资源")
        void testClosedState() throws Exception {
            PluginClassLoader pcl = new PluginClassLoader("plugin-closed", new URL[]{},
                    ClassLoader.getSystemClassLoader());
            pcl.close();
            assertTrue(pcl.isClosed());

            assertThrows(ClassNotFoundException.class, () -> pcl.loadClass("java.lang.String"));
            assertNull(pcl.getResource("any/resource"));
            assertFalse(pcl.getResources("any/resource").hasMoreElements());
        }
    }
}
