package com.vibescout.api.extractor;

import java.util.List;

/**
 * 导入依赖
 *
 * @param source  模块来源，如 'next/link'、'./component'
 * @param symbols 导入的符号
 * @param runtime 是否为运行时依赖（非静态导入）
 */
public record ImportInfo(String source, List<String> symbols, boolean runtime) {

    public ImportInfo(String source, List<String> symbols) {
        this(source, symbols, false);
    }
}
