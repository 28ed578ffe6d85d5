package com.vibescout.core.plugin;

import com.vibescout.api.context.PluginContext;
import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.core.sandbox.SandboxedPlugin;

import java.lang.reflect.Method;

/**
 * 插件形态：插件类实际声明（覆写）了哪些能力和生命周期钩子
 * <p>
 * 接口中的默认方法代表"未声明"，只有插件类自己覆写的方法才算存在。
 */
public record PluginShape(boolean extractors,
                          boolean providers,
                          boolean commands,
                          boolean initialize,
                          boolean activate,
                          boolean deactivate) {

    public static PluginShape of(ScoutPlugin plugin) {
        // 沙箱包装不改变形态
        if (plugin instanceof SandboxedPlugin sandboxed) {
            return of(sandboxed.getDelegate());
        }
        Class<?> type = plugin.getClass();
        return new PluginShape(
                overrides(type, ScoutPlugin.class, "getExtractors"),
                overrides(type, ScoutPlugin.class, "getProviders"),
                overrides(type, ScoutPlugin.class, "getCommands"),
                overrides(type, ScoutPlugin.class, "initialize", PluginContext.class),
                overrides(type, ScoutPlugin.class, "activate", PluginContext.class),
                overrides(type, ScoutPlugin.class, "deactivate"));
    }

    /**
     * 是否至少声明了一项能力或 initialize / activate 钩子
     */
    public boolean hasAnyCapability() {
        return extractors || providers || commands || initialize || activate;
    }

    /**
     * 判断 type 是否覆写了 contract 中的默认方法
     */
    public static boolean overrides(Class<?> type, Class<?> contract, String methodName, Class<?>... parameterTypes) {
        try {
            Method method = type.getMethod(methodName, parameterTypes);
            return method.getDeclaringClass() != contract;
        } catch (NoSuchMethodException e) {
            return false;
        }
    }
}
