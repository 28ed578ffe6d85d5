package com.vibescout.core.sandbox;

import com.vibescout.api.command.CommandPlugin;
import com.vibescout.api.context.PluginContext;
import com.vibescout.api.extractor.ExtractorPlugin;
import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.api.provider.ProviderPlugin;
import com.vibescout.core.config.SandboxConfig;
import com.vibescout.core.plugin.PluginShape;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 沙箱插件 (装饰器)
 * <p>
 * 与原插件共享名称、版本等全部字段；只有原插件声明的生命周期钩子与能力方法会被替换为带超时的适配器，
 * 未声明的方法保持原样，因此包装前后的插件形态一致。
 */
public class SandboxedPlugin implements ScoutPlugin {

    @Getter
    private final ScoutPlugin delegate;

    private final PluginSandbox sandbox;

    @Getter
    private final SandboxConfig config;

    private final PluginShape shape;

    private final List<ExtractorPlugin> extractors;
    private final List<ProviderPlugin> providers;
    private final List<CommandPlugin> commands;

    SandboxedPlugin(ScoutPlugin delegate, PluginSandbox sandbox, SandboxConfig config) {
        this.delegate = delegate;
        this.sandbox = sandbox;
        this.config = config;
        this.shape = PluginShape.of(delegate);

        String name = delegate.getName();
        this.extractors = shape.extractors()
                ? nullSafe(delegate.getExtractors()).stream()
                .map(e -> sandbox.wrapExtractor(e, name, config))
                .collect(Collectors.toUnmodifiableList())
                : delegate.getExtractors();
        this.providers = shape.providers()
                ? nullSafe(delegate.getProviders()).stream()
                .map(p -> sandbox.wrapProvider(p, name, config))
                .collect(Collectors.toUnmodifiableList())
                : delegate.getProviders();
        this.commands = shape.commands()
                ? nullSafe(delegate.getCommands()).stream()
                .map(c -> sandbox.wrapCommand(c, name, config))
                .collect(Collectors.toUnmodifiableList())
                : delegate.getCommands();
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public String getVersion() {
        return delegate.getVersion();
    }

    @Override
    public String getApiVersion() {
        return delegate.getApiVersion();
    }

    @Override
    public String getDescription() {
        return delegate.getDescription();
    }

    @Override
    public List<ExtractorPlugin> getExtractors() {
        return extractors;
    }

    @Override
    public List<ProviderPlugin> getProviders() {
        return providers;
    }

    @Override
    public List<CommandPlugin> getCommands() {
        return commands;
    }

    @Override
    public void initialize(PluginContext context) throws Exception {
        if (!shape.initialize()) {
            delegate.initialize(context);
            return;
        }
        sandbox.execute(() -> delegate.initialize(context), config.getTimeoutMs(),
                "Plugin " + getName() + ".initialize");
    }

    @Override
    public void activate(PluginContext context) throws Exception {
        if (!shape.activate()) {
            delegate.activate(context);
            return;
        }
        sandbox.execute(() -> delegate.activate(context), config.getTimeoutMs(),
                "Plugin " + getName() + ".activate");
    }

    @Override
    public void deactivate() throws Exception {
        if (!shape.deactivate()) {
            delegate.deactivate();
            return;
        }
        sandbox.execute(delegate::deactivate, config.getTimeoutMs(),
                "Plugin " + getName() + ".deactivate");
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }
}
