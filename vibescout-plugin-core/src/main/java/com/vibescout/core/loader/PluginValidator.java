package com.vibescout.core.loader;

import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.core.plugin.PluginShape;

/**
 * 插件形态校验
 * 只检查字段与能力声明，不做额外的反射探测
 */
public final class PluginValidator {

    private PluginValidator() {
    }

    public static ValidationResult validate(Object candidate) {
        if (candidate == null) {
            return ValidationResult.invalid("Plugin entry produced no instance");
        }
        if (!(candidate instanceof ScoutPlugin plugin)) {
            return ValidationResult.invalid("Plugin does not implement " + ScoutPlugin.class.getName()
                    + ": " + candidate.getClass().getName());
        }
        if (plugin.getName() == null) {
            return ValidationResult.invalid("Plugin name is missing");
        }
        if (plugin.getVersion() == null) {
            return ValidationResult.invalid("Plugin version is missing");
        }
        if (plugin.getApiVersion() == null) {
            return ValidationResult.invalid("Plugin apiVersion is missing");
        }
        if (!PluginShape.of(plugin).hasAnyCapability()) {
            return ValidationResult.invalid("Plugin declares no extractors, providers, commands, "
                    + "initialize or activate hook");
        }
        return ValidationResult.valid(plugin);
    }
}
