package com.vibescout.core.plugin;

import com.vibescout.api.command.CommandPlugin;
import com.vibescout.api.extractor.ExtractorPlugin;
import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.api.provider.ProviderPlugin;
import com.vibescout.api.provider.ProviderType;
import com.vibescout.core.config.PluginHostConfig;
import com.vibescout.core.config.SandboxConfig;
import com.vibescout.core.context.ExecutionContext;
import com.vibescout.core.debug.DebugStore;
import com.vibescout.core.loader.PluginDiscoveryService;
import com.vibescout.core.loader.PluginLoader;
import com.vibescout.core.sandbox.PluginSandbox;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * 插件注册表
 * 职责：
 * 1. 驱动 发现 -> 加载 -> 沙箱包装 -> 初始化 -> 激活 的完整流程
 * 2. 维护 Extractor / Provider / Command 三类能力的注册表，并记录每个条目的所属插件
 * 3. 插件卸载与全局关闭
 * <p>
 * 由宿主显式创建并注入给使用方。所有查询返回副本，内部 Map 不对外暴露。
 */
@Slf4j
public class PluginRegistry {

    private final PluginHostConfig config;

    private final PluginDiscoveryService discoveryService;

    private final PluginLoader pluginLoader;

    private final Supplier<PluginSandbox> sandboxFactory;

    private volatile PluginSandbox sandbox;

    @Getter
    private final DebugStore debugStore;

    // 已加载插件：Key=插件名
    private final Map<String, LoadedPlugin> plugins = new ConcurrentHashMap<>();

    // Key=name:ext1,ext2
    private final Map<String, RegisteredCapability<ExtractorPlugin>> extractors = new ConcurrentHashMap<>();

    // Key=type:name
    private final Map<String, RegisteredCapability<ProviderPlugin>> providers = new ConcurrentHashMap<>();

    // Key=name
    private final Map<String, RegisteredCapability<CommandPlugin>> commands = new ConcurrentHashMap<>();

    // 最近一次发现结果（包含未加载的插件）
    private volatile List<PluginDescriptor> lastDiscovery = List.of();

    private final AtomicBoolean loading = new AtomicBoolean(false);

    // shutdown 之后沙箱线程池已停止，只有 reset 可以恢复
    private volatile boolean shutdown;

    public PluginRegistry(PluginHostConfig config) {
        this(config,
                new PluginDiscoveryService(config),
                new PluginLoader(),
                () -> new PluginSandbox(config.getSandbox()),
                new DebugStore());
    }

    public PluginRegistry(PluginHostConfig config,
                          PluginDiscoveryService discoveryService,
                          PluginLoader pluginLoader,
                          Supplier<PluginSandbox> sandboxFactory,
                          DebugStore debugStore) {
        this.config = config != null ? config : PluginHostConfig.defaults();
        this.discoveryService = discoveryService;
        this.pluginLoader = pluginLoader;
        this.sandboxFactory = sandboxFactory;
        this.sandbox = sandboxFactory.get();
        this.debugStore = debugStore != null ? debugStore : new DebugStore();
    }

    // ==================== 加载 ====================

    /**
     * 按宿主配置加载全部插件
     */
    public void loadAll() {
        loadAll(LoadOptions.from(config));
    }

    /**
     * 发现并加载全部插件
     * 所有插件的 initialize 完成之后才开始 activate，因此 activate 中可以使用其他插件注册的能力
     *
     * @throws IllegalStateException 已有 loadAll 正在执行，或注册表已关闭
     */
    public void loadAll(LoadOptions options) {
        if (shutdown) {
            throw new IllegalStateException("PluginRegistry has been shut down, call reset() before loading again");
        }
        if (!options.isEnabled()) {
            log.info("Plugins are disabled globally, skip loading");
            return;
        }
        if (!loading.compareAndSet(false, true)) {
            throw new IllegalStateException("loadAll is already in progress on this registry");
        }
        try {
            List<PluginDescriptor> discovered = discoveryService.discover();
            this.lastDiscovery = List.copyOf(discovered);
            log.info("Discovered {} plugin(s)", discovered.size());

            List<LoadedPlugin> initialized = new ArrayList<>();
            for (PluginDescriptor descriptor : discovered) {
                if (options.getDisabledNames().contains(descriptor.getName())) {
                    descriptor.setEnabled(false);
                    log.info("[{}] Plugin is disabled by configuration", descriptor.getName());
                    continue;
                }
                loadPlugin(descriptor, options.isSandboxed()).ifPresent(initialized::add);
            }

            activateAll(initialized);
            log.info("Plugin loading finished. Loaded: {}/{}", plugins.size(), discovered.size());
        } finally {
            loading.set(false);
        }
    }

    /**
     * 加载并初始化单个插件
     * 任何失败都写入描述符并返回空，不影响其他插件
     */
    private Optional<LoadedPlugin> loadPlugin(PluginDescriptor descriptor, boolean sandboxed) {
        String name = descriptor.getName();
        if (plugins.containsKey(name)) {
            log.warn("[{}] Plugin is already loaded, skip", name);
            return Optional.empty();
        }

        Optional<ScoutPlugin> instance = pluginLoader.load(descriptor);
        if (instance.isEmpty()) {
            return Optional.empty();
        }

        ExecutionContext context = null;
        try {
            SandboxConfig sandboxConfig = sandbox.resolveConfig(config.getSandbox(), descriptor.getManifest());
            boolean wrap = sandboxed && sandboxConfig.isEnabled();
            ScoutPlugin plugin = wrap ? sandbox.wrap(instance.get(), sandboxConfig) : instance.get();

            context = new ExecutionContext(name, config.getProperties(), debugStore, this,
                    wrap ? sandbox : null, sandboxConfig);

            plugin.initialize(context);
            registerDeclaredCapabilities(name, plugin, context);

            LoadedPlugin loaded = new LoadedPlugin(descriptor, plugin, context);
            plugins.put(name, loaded);
            log.info("[{}] Plugin initialized v{}{}", name, descriptor.getVersion(), wrap ? " (sandboxed)" : "");
            return Optional.of(loaded);
        } catch (Exception | LinkageError e) {
            log.error("[{}] Plugin initialize failed: {}", name, e.getMessage(), e);
            descriptor.markFailed("initialize failed: " + describe(e));
            if (context != null) {
                context.close();
            }
            removeCapabilities(name);
            pluginLoader.release(name);
            return Optional.empty();
        }
    }

    /**
     * 注册插件通过 getExtractors / getProviders / getCommands 声明的能力
     */
    private void registerDeclaredCapabilities(String name, ScoutPlugin plugin, ExecutionContext context) {
        PluginShape shape = PluginShape.of(plugin);
        if (shape.extractors()) {
            nullSafe(plugin.getExtractors()).forEach(context::registerExtractor);
        }
        if (shape.providers()) {
            nullSafe(plugin.getProviders()).forEach(context::registerProvider);
        }
        if (shape.commands()) {
            nullSafe(plugin.getCommands()).forEach(context::registerCommand);
        }
        log.debug("[{}] Declared capabilities registered", name);
    }

    private void activateAll(List<LoadedPlugin> initialized) {
        for (LoadedPlugin loaded : initialized) {
            try {
                loaded.plugin().activate(loaded.context());
                log.debug("[{}] Plugin activated", loaded.getName());
            } catch (Exception | LinkageError e) {
                // activate 失败只记录日志，插件保持已加载
                log.error("[{}] Plugin activate failed: {}", loaded.getName(), e.getMessage(), e);
            }
        }
    }

    // ==================== 注册 ====================

    /**
     * 注册提取器，同键覆盖
     */
    public void registerExtractor(String owner, ExtractorPlugin extractor) {
        String key = extractor.getName() + ":" + String.join(",", nullSafe(extractor.getExtensions()));
        extractors.put(key, new RegisteredCapability<>(owner, extractor));
        log.debug("[{}] Registered extractor {}", owner, key);
    }

    public void registerProvider(String owner, ProviderPlugin provider) {
        ProviderType type = provider.getType();
        String key = (type != null ? type.getId() : "unknown") + ":" + provider.getName();
        providers.put(key, new RegisteredCapability<>(owner, provider));
        log.debug("[{}] Registered provider {}", owner, key);
    }

    public void registerCommand(String owner, CommandPlugin command) {
        commands.put(command.getName(), new RegisteredCapability<>(owner, command));
        log.debug("[{}] Registered command {}", owner, command.getName());
    }

    // ==================== 查询 ====================

    public List<ExtractorPlugin> getExtractors() {
        return capabilities(extractors.values());
    }

    public List<ExtractorPlugin> getExtractorsForExtension(String extension) {
        return getExtractors().stream()
                .filter(extractor -> nullSafe(extractor.getExtensions()).contains(extension))
                .collect(Collectors.toList());
    }

    public List<ProviderPlugin> getProviders() {
        return capabilities(providers.values());
    }

    public List<ProviderPlugin> getProvidersByType(ProviderType type) {
        return getProviders().stream()
                .filter(provider -> provider.getType() == type)
                .collect(Collectors.toList());
    }

    /**
     * 按名称查找 Provider，存在多个同名时返回任意一个
     */
    public Optional<ProviderPlugin> getProvider(String name) {
        return getProviders().stream()
                .filter(provider -> name.equals(provider.getName()))
                .findFirst();
    }

    public Optional<ProviderPlugin> getProvider(String name, ProviderType type) {
        if (type == null) {
            return getProvider(name);
        }
        return Optional.ofNullable(providers.get(type.getId() + ":" + name))
                .map(RegisteredCapability::capability);
    }

    public List<CommandPlugin> getCommands() {
        return capabilities(commands.values());
    }

    public Optional<CommandPlugin> getCommand(String name) {
        return Optional.ofNullable(commands.get(name)).map(RegisteredCapability::capability);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public List<LoadedPlugin> getPlugins() {
        return new ArrayList<>(plugins.values());
    }

    public Optional<LoadedPlugin> getPlugin(String name) {
        return Optional.ofNullable(plugins.get(name));
    }

    /**
     * 全部插件及其状态（包括被禁用、不兼容和加载失败的插件）
     * 尚未执行过 loadAll 时重新扫描一次
     */
    public List<PluginDescriptor> getPluginInfo() {
        List<PluginDescriptor> snapshot = lastDiscovery;
        if (snapshot.isEmpty()) {
            return discoveryService.discover();
        }
        return new ArrayList<>(snapshot);
    }

    // ==================== 卸载 ====================

    /**
     * 卸载插件
     * deactivate 失败只记录日志，状态照常清理
     *
     * @return 插件未加载时返回 false
     */
    public boolean unloadPlugin(String name) {
        LoadedPlugin loaded = plugins.get(name);
        if (loaded == null) {
            return false;
        }

        try {
            loaded.plugin().deactivate();
        } catch (Exception | LinkageError e) {
            log.error("[{}] Plugin deactivate failed: {}", name, e.getMessage(), e);
        }

        loaded.context().close();
        removeCapabilities(name);
        plugins.remove(name);
        loaded.descriptor().setLoaded(false);
        pluginLoader.release(name);
        log.info("[{}] Plugin unloaded", name);
        return true;
    }

    /**
     * 全局关闭
     * 逐个卸载插件（互不影响），最后停止沙箱线程池。
     * 关闭后 loadAll 会被拒绝，直到调用 reset
     */
    public void shutdown() {
        shutdown = true;
        log.info("Shutting down PluginRegistry...");
        for (String name : new ArrayList<>(plugins.keySet())) {
            try {
                unloadPlugin(name);
            } catch (RuntimeException e) {
                log.error("[{}] Error unloading plugin during shutdown", name, e);
            }
        }
        sandbox.shutdown();
        log.info("PluginRegistry shutdown complete.");
    }

    /**
     * 重置为初始状态（测试使用）
     */
    public void reset() {
        shutdown();
        extractors.clear();
        providers.clear();
        commands.clear();
        lastDiscovery = List.of();
        sandbox = sandboxFactory.get();
        shutdown = false;
    }

    // ==================== 内部方法 ====================

    private void removeCapabilities(String owner) {
        extractors.values().removeIf(entry -> owner.equals(entry.owner()));
        providers.values().removeIf(entry -> owner.equals(entry.owner()));
        commands.values().removeIf(entry -> owner.equals(entry.owner()));
    }

    private static <T> List<T> capabilities(Collection<RegisteredCapability<T>> entries) {
        return entries.stream()
                .map(RegisteredCapability::capability)
                .collect(Collectors.toList());
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
