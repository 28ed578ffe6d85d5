package com.vibescout.core.fixtures;

import com.vibescout.api.PluginApi;
import com.vibescout.api.extractor.ExtractorPlugin;
import com.vibescout.api.plugin.ScoutPlugin;

import java.util.List;

/**
 * 声明一个提取器的插件，打包进测试 jar 使用
 */
public class ExtractorFixturePlugin implements ScoutPlugin {

    @Override
    public String getName() {
        return "fixture-extractor";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public String getApiVersion() {
        return PluginApi.VERSION;
    }

    @Override
    public List<ExtractorPlugin> getExtractors() {
        return List.of(new FixtureExtractor());
    }
}
