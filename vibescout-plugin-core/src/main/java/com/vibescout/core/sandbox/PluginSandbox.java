package com.vibescout.core.sandbox;

import com.vibescout.api.command.CommandPlugin;
import com.vibescout.api.exception.SandboxTimeoutException;
import com.vibescout.api.exception.ScoutException;
import com.vibescout.api.extractor.ExtractorPlugin;
import com.vibescout.api.plugin.ScoutPlugin;
import com.vibescout.api.provider.ProviderPlugin;
import com.vibescout.core.config.SandboxConfig;
import com.vibescout.core.manifest.PluginManifest;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 插件沙箱
 * <p>
 * 职责：限制插件代码的执行时间，并（尽力）观测其资源占用。
 * 没有操作系统级别的隔离：
 * 1. 超时只限制调用方的等待时间。超时后向工作线程发送中断，不响应中断的插件代码会继续在后台执行完毕，
 *    其副作用仍可能在超时之后发生
 * 2. 模块白名单只做比对和告警，不阻止使用
 * 3. 内存只做观测，超限不会中止执行
 * <p>
 * 线程池按需扩容：超时后仍未结束的工作线程不会占用其他调用所需的线程，
 * 一个插件卡死不会拖慢其他插件。
 */
@Slf4j
public class PluginSandbox {

    // ================= 线程池配置 =================
    private static final int CORE_POOL_SIZE = 0;
    private static final int MAX_POOL_SIZE = Integer.MAX_VALUE;
    private static final long KEEP_ALIVE_TIME = 60L;

    private final AtomicInteger threadNumber = new AtomicInteger(1);

    private final ExecutorService executor;

    @Getter
    private final SandboxConfig defaultConfig;

    public PluginSandbox(SandboxConfig defaultConfig) {
        this.defaultConfig = defaultConfig != null ? defaultConfig : SandboxConfig.defaults();
        this.executor = new ThreadPoolExecutor(
                CORE_POOL_SIZE,
                MAX_POOL_SIZE,
                KEEP_ALIVE_TIME, TimeUnit.SECONDS,
                // 直接移交，不排队：每个调用都立即拿到线程
                new SynchronousQueue<>(),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("vibescout-sandbox-" + threadNumber.getAndIncrement());
                    // 守护线程，超时未结束的插件代码不阻止 JVM 退出
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy() // 已关闭时快速失败
        );
    }

    public PluginSandbox(SandboxConfig defaultConfig, ExecutorService executor) {
        this.defaultConfig = defaultConfig != null ? defaultConfig : SandboxConfig.defaults();
        this.executor = executor;
    }

    // ==================== 包装 ====================

    /**
     * 为插件创建沙箱版本
     * 新对象与原插件共享所有字段，仅将插件声明的方法替换为带超时的适配器
     */
    public ScoutPlugin wrap(ScoutPlugin plugin, SandboxConfig config) {
        if (!config.isEnabled() || plugin instanceof SandboxedPlugin) {
            return plugin;
        }
        return new SandboxedPlugin(plugin, this, config);
    }

    public ExtractorPlugin wrapExtractor(ExtractorPlugin extractor, String pluginName, SandboxConfig config) {
        if (!config.isEnabled() || extractor instanceof SandboxedExtractor) {
            return extractor;
        }
        return new SandboxedExtractor(extractor, pluginName, this, config.getTimeoutMs());
    }

    public ProviderPlugin wrapProvider(ProviderPlugin provider, String pluginName, SandboxConfig config) {
        if (!config.isEnabled() || provider instanceof SandboxedProvider) {
            return provider;
        }
        return new SandboxedProvider(provider, pluginName, this, config.getTimeoutMs());
    }

    public CommandPlugin wrapCommand(CommandPlugin command, String pluginName, SandboxConfig config) {
        if (!config.isEnabled() || command instanceof SandboxedCommand) {
            return command;
        }
        return new SandboxedCommand(command, pluginName, this, config.getTimeoutMs());
    }

    /**
     * 计算插件的沙箱配置：全局模板 + 清单中的 sandbox 覆盖项
     * 同时对清单声明的 requires 做白名单比对（仅告警）
     */
    public SandboxConfig resolveConfig(SandboxConfig base, PluginManifest manifest) {
        SandboxConfig effective = base != null ? base : defaultConfig;
        PluginManifest.SandboxRequirements requirements = manifest.getSandbox();
        if (requirements == null) {
            return effective;
        }

        SandboxConfig.SandboxConfigBuilder builder = effective.toBuilder();
        if (requirements.getTimeoutMs() != null && requirements.getTimeoutMs() > 0) {
            builder.timeoutMs(requirements.getTimeoutMs());
        }
        if (requirements.getMaxMemory() != null) {
            builder.maxMemory(requirements.getMaxMemory());
        }

        List<String> disallowed = checkModuleAccess(requirements.getRequires(), effective.getAllowedModules());
        if (!disallowed.isEmpty()) {
            log.warn("[{}] Plugin requested modules outside the allow list (advisory only): {}",
                    manifest.getName(), disallowed);
        }
        return builder.build();
    }

    /**
     * 模块白名单比对
     * 仅用于告警，不构成隔离边界
     *
     * @return 不在白名单内的模块（全部允许时为空）
     */
    public static List<String> checkModuleAccess(Collection<String> requested, Collection<String> allowed) {
        if (requested == null || requested.isEmpty()) {
            return List.of();
        }
        List<String> disallowed = requested.stream()
                .filter(module -> allowed == null || !allowed.contains(module))
                .collect(Collectors.toList());
        if (!disallowed.isEmpty()) {
            log.warn("[Sandbox] Plugin requested disallowed modules: {}", String.join(", ", disallowed));
        }
        return disallowed;
    }

    /**
     * 开启一次内存观测会话
     */
    public SandboxSession openSession() {
        return new SandboxSession(new MemoryTracker());
    }

    // ==================== 执行 ====================

    /**
     * 在沙箱中执行任务
     *
     * @param task      插件代码
     * @param timeoutMs 超时时间，&lt;= 0 表示不限制
     * @param context   调用位置描述，例如 {@code Provider my-plugin:openai.summarize}
     * @throws SandboxTimeoutException 超时
     * @throws ScoutException          沙箱已关闭，任务未被执行
     * @throws Exception               插件自身抛出的异常原样抛出
     */
    public <T> T run(Callable<T> task, long timeoutMs, String context) throws Exception {
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            log.error("[Sandbox] Execution rejected, sandbox is shut down: {}", context);
            throw new ScoutException("Sandbox rejected execution (shut down): " + context, e);
        }
        try {
            return timeoutMs > 0
                    ? future.get(timeoutMs, TimeUnit.MILLISECONDS)
                    : future.get();
        } catch (TimeoutException e) {
            // 尽力取消：只发送中断，无法强制终止插件线程
            future.cancel(true);
            log.error("[Sandbox] Execution timeout ({}ms): {}", timeoutMs, context);
            throw new SandboxTimeoutException(context, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ScoutException("Sandboxed execution failed: " + context, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ScoutException("Sandboxed execution interrupted: " + context, e);
        }
    }

    /**
     * 无返回值版本
     */
    public void execute(ThrowingRunnable task, long timeoutMs, String context) throws Exception {
        run(() -> {
            task.run();
            return null;
        }, timeoutMs, context);
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    @FunctionalInterface
    public interface ThrowingRunnable {
        void run() throws Exception;
    }
}
