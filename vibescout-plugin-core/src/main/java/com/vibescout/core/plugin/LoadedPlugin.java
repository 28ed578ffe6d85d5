package com.vibescout.core.plugin;

import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.core.context.ExecutionContext;

/**
 * 已加载的插件
 *
 * @param descriptor 描述符
 * @param plugin     插件实例（启用沙箱时为包装后的实例）
 * @param context    插件上下文
 */
public record LoadedPlugin(PluginDescriptor descriptor, ScoutPlugin plugin, ExecutionContext context) {

    public String getName() {
        return descriptor.getName();
    }
}
