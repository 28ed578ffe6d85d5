package com.vibescout.core.classloader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * 插件类加载器
 * 特性：
 * 1. Child-First (优先加载插件自身的类，避免与其他已安装插件的同名类冲突)
 * 2. 强制委派白名单 (API 契约、日志门面、JDK 必须走父加载器)
 * 3. 资源加载 Child-First (防止读取到宿主的配置)
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    // 必须强制走父加载器的包（契约包 + JDK）
    private static final List<String> FORCE_PARENT_PACKAGES = List.of(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.vibescout.api.", // API 契约必须共享，否则 ScoutPlugin 类型不一致
            "org.slf4j."          // 日志门面共享
    );

    @Getter
    private final String pluginName;

    @Getter
    private volatile boolean closed = false;

    public PluginClassLoader(String pluginName, URL[] urls, ClassLoader parent) {
        super("plugin-" + pluginName, urls, parent);
        this.pluginName = pluginName;
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (closed) {
            throw new ClassNotFoundException("ClassLoader of plugin [" + pluginName + "] is closed: " + name);
        }
        synchronized (getClassLoadingLock(name)) {
            // 1. 检查缓存
            Class<?> c = findLoadedClass(name);
            if (c != null) return c;

            // 2. 白名单强制委派给父加载器
            if (shouldDelegateToParent(name)) {
                c = getParent().loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }

            // 3. Child-First: 优先自己加载
            try {
                c = findClass(name);
            } catch (ClassNotFoundException ignored) {
                // 插件内没有，交给父加载器
            }

            // 4. 兜底: 自己没有，再找父亲
            if (c == null) {
                c = super.loadClass(name, false);
            }

            if (resolve) resolveClass(c);
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        if (closed) {
            return null;
        }
        // 资源加载也必须 Child-First
        URL url = findResource(name);
        if (url != null) return url;
        return super.getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        if (closed) {
            return Collections.emptyEnumeration();
        }
        // 组合资源：自己的 + 父加载器的
        List<URL> urls = new ArrayList<>(Collections.list(findResources(name)));
        if (getParent() != null) {
            urls.addAll(Collections.list(getParent().getResources(name)));
        }
        return Collections.enumeration(urls);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        super.close();
        log.debug("[{}] Plugin classloader closed", pluginName);
    }

    private boolean shouldDelegateToParent(String name) {
        for (String pkg : FORCE_PARENT_PACKAGES) {
            if (name.startsWith(pkg)) return true;
        }
        return false;
    }
}
