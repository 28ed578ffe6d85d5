package com.vibescout.core.plugin;

/**
 * 插件来源，顺序即发现优先级（后者覆盖前者）
 */
public enum PluginOrigin {
    BUILTIN,
    LOCAL,
    PACKAGED
}
