package com.vibescout.api.exception;

import lombok.Getter;

/**
 * 沙箱超时异常
 * 插件方法在限定时间内没有返回时抛给调用方。与插件自身抛出的业务异常区分开。
 * <p>
 * 注意：超时只限制调用方的等待时间，插件代码可能仍在后台执行。
 *
 * @author VibeScout
 */
@Getter
public class SandboxTimeoutException extends ScoutException {

    /**
     * 调用位置，例如 {@code Provider my-plugin:openai.summarize}
     */
    private final String context;

    private final long timeoutMs;

    public SandboxTimeoutException(String context, long timeoutMs) {
        super("Sandbox timeout: " + context + " exceeded " + timeoutMs + "ms");
        this.context = context;
        this.timeoutMs = timeoutMs;
    }
}
