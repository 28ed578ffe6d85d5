package com.vibescout.core.plugin;

/**
 * 注册表条目：能力实例及其所属插件
 *
 * @param owner      所属插件名称
 * @param capability 能力实例
 */
public record RegisteredCapability<T>(String owner, T capability) {
}
