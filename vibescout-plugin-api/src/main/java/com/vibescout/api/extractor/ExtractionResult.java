package com.vibescout.api.extractor;

import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 提取结果
 * metadata 中常见的键：imports (List&lt;ImportInfo&gt;)、exports (List&lt;String&gt;)、framework (String)
 */
@Getter
public class ExtractionResult {

    private final List<CodeBlock> blocks;

    private final Map<String, Object> metadata;

    public ExtractionResult(List<CodeBlock> blocks, Map<String, Object> metadata) {
        this.blocks = blocks != null ? new ArrayList<>(blocks) : new ArrayList<>();
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
    }

    public static ExtractionResult of(List<CodeBlock> blocks) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("imports", new ArrayList<ImportInfo>());
        metadata.put("exports", new ArrayList<String>());
        return new ExtractionResult(blocks, metadata);
    }
}
