package com.vibescout.core.classloader;

import com.vibescout.core.spi.PluginLoaderFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;

public class DefaultPluginLoaderFactory implements PluginLoaderFactory {

    @Override
    public ClassLoader create(String pluginName, Path entryPoint, ClassLoader parent) {
        try {
            // 按入口的真实路径加载，而不是按名称在 classpath 上解析
            return new PluginClassLoader(pluginName, new URL[]{entryPoint.toUri().toURL()}, parent);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid plugin entry point: " + entryPoint, e);
        }
    }
}
