package com.vibescout.core.sandbox;

import com.vibescout.api.provider.ProviderPlugin;
import com.vibescout.api.provider.ProviderType;
import com.vibescout.core.plugin.PluginShape;
import lombok.Getter;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * 沙箱 Provider
 * 只有 Provider 实现类覆写过的方法才走超时包装，未实现的方法直接透传（保持原有的不支持语义）
 */
public class SandboxedProvider implements ProviderPlugin {

    // 可包装的方法签名
    private static final Map<String, Class<?>[]> SANDBOXED_METHODS = Map.of(
            "initialize", new Class<?>[]{Map.class},
            "generateEmbedding", new Class<?>[]{String.class},
            "generateEmbeddingsBatch", new Class<?>[]{List.class},
            "summarize", new Class<?>[]{String.class, Integer.class},
            "generateResponse", new Class<?>[]{String.class, String.class},
            "generateBestQuestion", new Class<?>[]{String.class, String.class},
            "isAvailable", new Class<?>[]{});

    @Getter
    private final ProviderPlugin delegate;
    private final String pluginName;
    private final PluginSandbox sandbox;
    private final long timeoutMs;

    // 实际被包装的方法名
    @Getter
    private final Set<String> sandboxedMethods = new HashSet<>();

    SandboxedProvider(ProviderPlugin delegate, String pluginName, PluginSandbox sandbox, long timeoutMs) {
        this.delegate = delegate;
        this.pluginName = pluginName;
        this.sandbox = sandbox;
        this.timeoutMs = timeoutMs;
        SANDBOXED_METHODS.forEach((method, params) -> {
            if (PluginShape.overrides(delegate.getClass(), ProviderPlugin.class, method, params)) {
                sandboxedMethods.add(method);
            }
        });
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public ProviderType getType() {
        return delegate.getType();
    }

    @Override
    public void initialize(Map<String, Object> config) throws Exception {
        call("initialize", () -> {
            delegate.initialize(config);
            return null;
        });
    }

    @Override
    public float[] generateEmbedding(String text) throws Exception {
        return call("generateEmbedding", () -> delegate.generateEmbedding(text));
    }

    @Override
    public List<float[]> generateEmbeddingsBatch(List<String> texts) throws Exception {
        return call("generateEmbeddingsBatch", () -> delegate.generateEmbeddingsBatch(texts));
    }

    @Override
    public String summarize(String text, Integer maxLength) throws Exception {
        return call("summarize", () -> delegate.summarize(text, maxLength));
    }

    @Override
    public String generateResponse(String prompt, String context) throws Exception {
        return call("generateResponse", () -> delegate.generateResponse(prompt, context));
    }

    @Override
    public String generateBestQuestion(String code, String summary) throws Exception {
        return call("generateBestQuestion", () -> delegate.generateBestQuestion(code, summary));
    }

    @Override
    public boolean isAvailable() throws Exception {
        return call("isAvailable", delegate::isAvailable);
    }

    private <T> T call(String method, Callable<T> invocation) throws Exception {
        if (!sandboxedMethods.contains(method)) {
            return invocation.call();
        }
        return sandbox.run(invocation, timeoutMs,
                "Provider " + pluginName + ":" + getName() + "." + method);
    }
}
