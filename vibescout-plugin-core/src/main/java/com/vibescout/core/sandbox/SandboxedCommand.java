package com.vibescout.core.sandbox;

import com.vibescout.api.command.CommandPlugin;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 沙箱命令：execute 带超时
 */
public class SandboxedCommand implements CommandPlugin {

    @Getter
    private final CommandPlugin delegate;
    private final String pluginName;
    private final PluginSandbox sandbox;
    private final long timeoutMs;

    SandboxedCommand(CommandPlugin delegate, String pluginName, PluginSandbox sandbox, long timeoutMs) {
        this.delegate = delegate;
        this.pluginName = pluginName;
        this.sandbox = sandbox;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public String getDescription() {
        return delegate.getDescription();
    }

    @Override
    public String getArguments() {
        return delegate.getArguments();
    }

    @Override
    public void execute(List<String> args, Map<String, Object> options) throws Exception {
        sandbox.execute(() -> delegate.execute(args, options), timeoutMs,
                "Command " + pluginName + ":" + getName() + ".execute");
    }
}
