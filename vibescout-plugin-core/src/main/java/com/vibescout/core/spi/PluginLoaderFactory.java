package com.vibescout.core.spi;

import java.nio.file.Path;

/**
 * 插件类加载器工厂 SPI
 */
public interface PluginLoaderFactory {

    /**
     * 为插件入口创建独立的类加载器
     *
     * @param pluginName 插件名称
     * @param entryPoint 入口文件 (jar) 或 classes 目录的绝对路径
     * @param parent     父加载器
     */
    ClassLoader create(String pluginName, Path entryPoint, ClassLoader parent);
}
