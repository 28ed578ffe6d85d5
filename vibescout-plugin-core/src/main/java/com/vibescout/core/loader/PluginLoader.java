package com.vibescout.core.loader;

import com.vibescout.api.PluginApi;
import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.core.classloader.DefaultPluginLoaderFactory;
import com.vibescout.core.exception.PluginLoadException;
import com.vibescout.core.manifest.PluginManifest;
import com.vibescout.core.plugin.PluginDescriptor;
import com.vibescout.core.spi.PluginLoaderFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 插件加载器
 * <p>
 * 职责：把一个描述符变成可运行的插件实例
 * 1. 解析入口 (jar 或 classes 目录)
 * 2. 以入口的真实路径创建独立类加载器并实例化入口类
 * 3. 形态校验 + API 版本严格相等校验
 * <p>
 * 任何失败都记录到描述符的 lastError，不向上抛出。
 */
@Slf4j
public class PluginLoader {

    private final PluginLoaderFactory loaderFactory;

    private final String hostApiVersion;

    // 插件名 -> 类加载器，卸载时释放
    private final Map<String, ClassLoader> classLoaders = new ConcurrentHashMap<>();

    public PluginLoader() {
        this(new DefaultPluginLoaderFactory(), PluginApi.VERSION);
    }

    public PluginLoader(PluginLoaderFactory loaderFactory, String hostApiVersion) {
        this.loaderFactory = loaderFactory != null ? loaderFactory : new DefaultPluginLoaderFactory();
        this.hostApiVersion = hostApiVersion;
    }

    /**
     * 加载单个插件
     *
     * @return 插件实例；被禁用、不兼容或加载失败时为空
     */
    public Optional<ScoutPlugin> load(PluginDescriptor descriptor) {
        String name = descriptor.getName();
        if (!descriptor.isLoadable()) {
            log.debug("[{}] Plugin is disabled, skip loading", name);
            return Optional.empty();
        }

        ClassLoader classLoader = null;
        try {
            Path entryPoint = resolveEntryPoint(descriptor);

            classLoader = loaderFactory.create(name, entryPoint, ScoutPlugin.class.getClassLoader());
            Object instance = instantiate(descriptor.getManifest(), classLoader);

            ValidationResult result = PluginValidator.validate(instance);
            if (result instanceof ValidationResult.Invalid invalid) {
                throw new PluginLoadException(name, invalid.reason());
            }
            ScoutPlugin plugin = ((ValidationResult.Valid) result).plugin();

            // API 版本必须严格相等：插件契约不保证跨版本兼容
            if (!hostApiVersion.equals(plugin.getApiVersion())) {
                throw new PluginLoadException(name, "Plugin API version mismatch: plugin requires "
                        + plugin.getApiVersion() + ", but VibeScout provides " + hostApiVersion);
            }

            ClassLoader previous = classLoaders.put(name, classLoader);
            if (previous != null && previous != classLoader) {
                closeQuietly(name, previous);
            }
            descriptor.markLoaded();
            log.info("[{}] Plugin loaded v{} from {}", name, plugin.getVersion(), entryPoint);
            return Optional.of(plugin);
        } catch (Exception | LinkageError e) {
            String message = describe(e);
            descriptor.markFailed(message);
            if (classLoader != null) {
                closeQuietly(name, classLoader);
            }
            log.error("[{}] Failed to load plugin: {}", name, message);
            return Optional.empty();
        }
    }

    /**
     * 批量加载，单个失败不影响后续插件
     *
     * @return 插件名 -> 实例 (按输入顺序)
     */
    public Map<String, ScoutPlugin> loadAll(List<PluginDescriptor> descriptors) {
        Map<String, ScoutPlugin> loaded = new LinkedHashMap<>();
        for (PluginDescriptor descriptor : descriptors) {
            load(descriptor).ifPresent(plugin -> loaded.put(descriptor.getName(), plugin));
        }
        return loaded;
    }

    /**
     * 释放插件的类加载器
     */
    public void release(String pluginName) {
        ClassLoader classLoader = classLoaders.remove(pluginName);
        if (classLoader != null) {
            closeQuietly(pluginName, classLoader);
        }
    }

    // ==================== 内部方法 ====================

    private Path resolveEntryPoint(PluginDescriptor descriptor) {
        Path installPath = descriptor.getInstallPath().toAbsolutePath().normalize();
        Path entryPoint = installPath.resolve(descriptor.getManifest().getMain()).normalize();
        if (!entryPoint.startsWith(installPath)) {
            throw new PluginLoadException(descriptor.getName(),
                    "Entry point escapes plugin directory: " + entryPoint);
        }
        if (!Files.exists(entryPoint)) {
            throw new PluginLoadException(descriptor.getName(), "Entry point not found: " + entryPoint);
        }
        return entryPoint;
    }

    private Object instantiate(PluginManifest manifest, ClassLoader classLoader) throws Exception {
        String mainClass = manifest.getMainClass();
        if (mainClass != null) {
            Class<?> type = Class.forName(mainClass, true, classLoader);
            try {
                return type.getDeclaredConstructor().newInstance();
            } catch (InvocationTargetException e) {
                Throwable cause = e.getCause();
                throw new PluginLoadException(manifest.getName(),
                        "Plugin constructor failed: " + describe(cause), cause);
            }
        }

        // 未声明入口类：通过 ServiceLoader 查找，只接受插件自身类加载器定义的实现
        ClassLoader own = classLoader;
        return ServiceLoader.load(ScoutPlugin.class, classLoader).stream()
                .filter(provider -> provider.type().getClassLoader() == own)
                .findFirst()
                .map(ServiceLoader.Provider::get)
                .orElseThrow(() -> new PluginLoadException(manifest.getName(),
                        "No mainClass declared and no " + ScoutPlugin.class.getName()
                                + " service found in entry point"));
    }

    private static String describe(Throwable e) {
        if (e == null) {
            return "unknown error";
        }
        if (e instanceof PluginLoadException) {
            return e.getMessage();
        }
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
                : e.getClass().getName();
    }

    private void closeQuietly(String pluginName, ClassLoader classLoader) {
        if (classLoader instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                log.warn("[{}] Failed to close plugin classloader", pluginName, e);
            }
        }
    }
}
