package com.vibescout.api.context;

/**
 * 调试/追踪记录接口
 * Provider 可以把请求与响应写入这里，供宿主的调试面板查看
 */
public interface DebugSink {

    /**
     * 记录一次请求
     *
     * @return 记录ID，用于后续补充响应或错误
     */
    String logRequest(String provider, String model, Object payload, Object response, String error);

    default String logRequest(String provider, String model, Object payload) {
        return logRequest(provider, model, payload, null, null);
    }

    void updateResponse(String id, Object response);

    void updateError(String id, String error);
}
