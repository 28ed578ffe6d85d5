package com.vibescout.api.extractor;

import java.util.List;

/**
 * 代码提取器
 * 解析源码文件，产出代码块与元数据
 */
public interface ExtractorPlugin {

    /**
     * 提取器唯一名称
     */
    String getName();

    /**
     * 处理的文件扩展名，带点号，例如 [".tsx", ".jsx"]
     */
    List<String> getExtensions();

    /**
     * 优先级，越大越优先。内置提取器为 0
     * 插件可以用更高的优先级覆盖内置提取器
     */
    default int getPriority() {
        return 0;
    }

    /**
     * 提取代码块与元数据
     *
     * @param code     源码内容
     * @param filePath 文件绝对路径
     * @return 提取结果
     */
    ExtractionResult extract(String code, String filePath) throws Exception;
}
