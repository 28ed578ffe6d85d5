package com.vibescout.api.exception;

/**
 * VibeScout 基础异常
 *
 * @author VibeScout
 */
public class ScoutException extends RuntimeException {

    public ScoutException(String message) {
        super(message);
    }

    public ScoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
