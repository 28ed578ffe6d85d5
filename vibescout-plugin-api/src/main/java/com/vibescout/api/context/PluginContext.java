package com.vibescout.api.context;

import com.vibescout.api.command.CommandPlugin;
import com.vibescout.api.extractor.ExtractorPlugin;
import com.vibescout.api.provider.ProviderPlugin;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * 插件上下文
 * 宿主向插件注入能力的唯一入口：配置快照、独立命名空间的日志、调试记录以及能力注册回调
 *
 * @author VibeScout
 */
public interface PluginContext {

    /**
     * 获取当前插件名称
     */
    String getPluginName();

    /**
     * 宿主配置快照 (只读)
     */
    Map<String, Object> getConfig();

    /**
     * 读取单个配置项
     *
     * @param key 配置键
     * @return 配置值
     */
    Optional<Object> getProperty(String key);

    /**
     * 插件专属日志，名称为 {@code vibescout.plugin.<name>}
     */
    Logger getLogger();

    /**
     * 宿主共享的调试记录器
     */
    DebugSink getDebugSink();

    /**
     * 注册代码提取器
     */
    void registerExtractor(ExtractorPlugin extractor);

    /**
     * 注册 AI Provider
     */
    void registerProvider(ProviderPlugin provider);

    /**
     * 注册 CLI 命令
     */
    void registerCommand(CommandPlugin command);
}
