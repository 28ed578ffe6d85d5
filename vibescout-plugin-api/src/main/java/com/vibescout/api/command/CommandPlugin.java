package com.vibescout.api.command;

import java.util.List;
import java.util.Map;

/**
 * CLI 命令扩展
 */
public interface CommandPlugin {

    String getName();

    /**
     * 帮助信息中展示的描述
     */
    String getDescription();

    /**
     * 参数说明（用于帮助信息）
     */
    default String getArguments() {
        return null;
    }

    /**
     * 执行命令
     *
     * @param args    解析后的参数
     * @param options 命令选项 (flags)
     */
    void execute(List<String> args, Map<String, Object> options) throws Exception;
}
