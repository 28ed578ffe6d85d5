package com.vibescout.core.exception;

import com.vibescout.api.exception.ScoutException;

/**
 * 插件清单无法解析或缺少必填字段
 */
public class ManifestException extends ScoutException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
