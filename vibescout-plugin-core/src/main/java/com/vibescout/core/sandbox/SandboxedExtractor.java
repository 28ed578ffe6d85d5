package com.vibescout.core.sandbox;

import com.vibescout.api.extractor.ExtractionResult;
import com.vibescout.api.extractor.ExtractorPlugin;
import lombok.Getter;

import java.util.List;

/**
 * 沙箱提取器：extract 带超时，其余字段透传
 */
public class SandboxedExtractor implements ExtractorPlugin {

    @Getter
    private final ExtractorPlugin delegate;
    private final String pluginName;
    private final PluginSandbox sandbox;
    private final long timeoutMs;

    SandboxedExtractor(ExtractorPlugin delegate, String pluginName, PluginSandbox sandbox, long timeoutMs) {
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
    public List<String> getExtensions() {
        return delegate.getExtensions();
    }

    @Override
    public int getPriority() {
        return delegate.getPriority();
    }

    @Override
    public ExtractionResult extract(String code, String filePath) throws Exception {
        return sandbox.run(() -> delegate.extract(code, filePath), timeoutMs,
                "Extractor " + pluginName + ":" + getName() + ".extract");
    }
}
