package com.vibescout.core.context;

import com.vibescout.api.command.CommandPlugin;
import com.vibescout.api.context.DebugSink;
import com.vibescout.api.context.PluginContext;
import com.vibescout.api.extractor.ExtractorPlugin;
import com.vibescout.api.provider.ProviderPlugin;
import com.vibescout.core.config.SandboxConfig;
import com.vibescout.core.plugin.PluginRegistry;
import com.vibescout.core.sandbox.PluginSandbox;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 插件上下文实现
 * <p>
 * 注册回调直接写入 PluginRegistry，并以当前插件作为所属者。
 * 插件处于沙箱中时，经由上下文注册的能力同样会被包装。
 * <p>
 * 插件初始化失败或被卸载时上下文随之关闭，此后的注册请求被丢弃：
 * 超时后仍在后台运行的插件代码不能再向注册表写入能力。
 */
@Slf4j
public class ExecutionContext implements PluginContext {

    public static final String LOGGER_PREFIX = "vibescout.plugin.";

    private final String pluginName;

    private final Map<String, Object> config;

    private final Logger logger;

    private final DebugSink debugSink;

    /**
     * 向 Core 内部暴露注册表
     * 注意：此方法不在 PluginContext API 接口中，仅供框架内部使用
     */
    @Getter
    private final PluginRegistry registry;

    // 为 null 表示插件未启用沙箱
    private final PluginSandbox sandbox;
    private final SandboxConfig sandboxConfig;

    private volatile boolean closed;

    public ExecutionContext(String pluginName,
                            Map<String, Object> config,
                            DebugSink debugSink,
                            PluginRegistry registry,
                            PluginSandbox sandbox,
                            SandboxConfig sandboxConfig) {
        this.pluginName = pluginName;
        this.config = config != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(config))
                : Collections.emptyMap();
        this.logger = LoggerFactory.getLogger(LOGGER_PREFIX + pluginName);
        this.debugSink = debugSink;
        this.registry = registry;
        this.sandbox = sandbox;
        this.sandboxConfig = sandboxConfig;
    }

    @Override
    public String getPluginName() {
        return pluginName;
    }

    @Override
    public Map<String, Object> getConfig() {
        return config;
    }

    @Override
    public Optional<Object> getProperty(String key) {
        return Optional.ofNullable(config.get(key));
    }

    @Override
    public Logger getLogger() {
        return logger;
    }

    @Override
    public DebugSink getDebugSink() {
        return debugSink;
    }

    public boolean isSandboxed() {
        return sandbox != null && sandboxConfig != null && sandboxConfig.isEnabled();
    }

    @Override
    public void registerExtractor(ExtractorPlugin extractor) {
        if (extractor == null) {
            throw new IllegalArgumentException("Extractor cannot be null");
        }
        synchronized (this) {
            if (rejectIfClosed("extractor", extractor.getName())) {
                return;
            }
            registry.registerExtractor(pluginName,
                    isSandboxed() ? sandbox.wrapExtractor(extractor, pluginName, sandboxConfig) : extractor);
        }
    }

    @Override
    public void registerProvider(ProviderPlugin provider) {
        if (provider == null) {
            throw new IllegalArgumentException("Provider cannot be null");
        }
        synchronized (this) {
            if (rejectIfClosed("provider", provider.getName())) {
                return;
            }
            registry.registerProvider(pluginName,
                    isSandboxed() ? sandbox.wrapProvider(provider, pluginName, sandboxConfig) : provider);
        }
    }

    @Override
    public void registerCommand(CommandPlugin command) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        synchronized (this) {
            if (rejectIfClosed("command", command.getName())) {
                return;
            }
            registry.registerCommand(pluginName,
                    isSandboxed() ? sandbox.wrapCommand(command, pluginName, sandboxConfig) : command);
        }
    }

    /**
     * 关闭上下文
     * 返回时不会再有进行中的注册，调用方随后清理该插件的能力即可
     */
    public synchronized void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private boolean rejectIfClosed(String kind, String name) {
        if (closed) {
            log.warn("[{}] Context is closed, dropping late {} registration: {}", pluginName, kind, name);
            return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return "ExecutionContext{plugin='" + pluginName + "', sandboxed=" + isSandboxed() + ", closed=" + closed + "}";
    }
}
