package com.vibescout.api.extractor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 代码块 (函数、类、方法、文档片段等)
 * 行号从 1 开始
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeBlock {

    private String name;

    /**
     * function / class / method / chunk / file
     */
    private String type;

    /**
     * code / documentation
     */
    @Builder.Default
    private String category = "code";

    private int startLine;

    private int endLine;

    @Builder.Default
    private String comments = "";

    private String content;

    private String filePath;

    // 分片时的父符号
    private String parentName;
}
