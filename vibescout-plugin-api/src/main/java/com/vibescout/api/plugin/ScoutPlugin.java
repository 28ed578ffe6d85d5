package com.vibescout.api.plugin;

import com.vibescout.api.command.CommandPlugin;
import com.vibescout.api.context.PluginContext;
import com.vibescout.api.extractor.ExtractorPlugin;
import com.vibescout.api.provider.ProviderPlugin;

import java.util.Collections;
import java.util.List;

/**
 * 插件主入口接口
 * 所有插件的入口类必须实现此接口，并提供公共无参构造器。
 * <p>
 * 能力列表与生命周期钩子均为可选：宿主通过插件类是否<b>覆写</b>对应的默认方法来判断插件声明了哪些能力。
 * 一个合法插件至少要声明 extractors / providers / commands / initialize / activate 之一。
 *
 * @author VibeScout
 */
public interface ScoutPlugin {

    /**
     * 插件唯一名称 (kebab-case)
     */
    String getName();

    /**
     * 插件版本
     */
    String getVersion();

    /**
     * 插件编译时所依赖的 API 版本，必须等于 {@link com.vibescout.api.PluginApi#VERSION}
     */
    String getApiVersion();

    default String getDescription() {
        return null;
    }

    /**
     * 代码提取能力
     */
    default List<ExtractorPlugin> getExtractors() {
        return Collections.emptyList();
    }

    /**
     * Embedding / LLM 能力
     */
    default List<ProviderPlugin> getProviders() {
        return Collections.emptyList();
    }

    /**
     * CLI 命令扩展
     */
    default List<CommandPlugin> getCommands() {
        return Collections.emptyList();
    }

    /**
     * 插件加载后调用
     * 用于准备资源、校验配置，或通过 context 注册能力
     *
     * @param context 插件上下文
     */
    default void initialize(PluginContext context) throws Exception {
        // Default empty implementation
    }

    /**
     * 所有插件都完成 initialize 后调用
     * 此时其他插件的能力已全部注册，可以安全地依赖它们
     *
     * @param context 插件上下文
     */
    default void activate(PluginContext context) throws Exception {
        // Default empty implementation
    }

    /**
     * 插件卸载时调用，用于释放资源
     */
    default void deactivate() throws Exception {
        // Default empty implementation
    }
}
