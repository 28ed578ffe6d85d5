package com.vibescout.core.manifest;

import java.util.Locale;

/**
 * 插件能力类型 (对应 plugin.yml 中 vibescout.capabilities)
 */
public enum Capability {
    EXTRACTORS,
    PROVIDERS,
    COMMANDS;

    public static Capability parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Capability cannot be blank");
        }
        return Capability.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
