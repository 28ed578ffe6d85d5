package com.vibescout.core.loader;

import com.vibescout.api.plugin.ScoutPlugin;

/**
 * 插件形态校验结果
 */
public sealed interface ValidationResult {

    static ValidationResult valid(ScoutPlugin plugin) {
        return new Valid(plugin);
    }

    static ValidationResult invalid(String reason) {
        return new Invalid(reason);
    }

    default boolean isValid() {
        return this instanceof Valid;
    }

    /**
     * 校验通过，携带类型化的插件实例
     */
    record Valid(ScoutPlugin plugin) implements ValidationResult {
    }

    /**
     * 校验失败原因
     */
    record Invalid(String reason) implements ValidationResult {
    }
}
