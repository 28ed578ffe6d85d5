package com.vibescout.core.exception;

import com.vibescout.api.exception.ScoutException;
import lombok.Getter;

/**
 * 插件加载失败
 * 由 PluginLoader 捕获并写入描述符的 lastError，不会向上传播
 */
@Getter
public class PluginLoadException extends ScoutException {

    private final String pluginName;

    public PluginLoadException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public PluginLoadException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
    }
}
