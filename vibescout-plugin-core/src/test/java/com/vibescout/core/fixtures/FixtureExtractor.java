package com.vibescout.core.fixtures;

import com.vibescout.api.extractor.CodeBlock;
import com.vibescout.api.extractor.ExtractionResult;
import com.vibescout.api.extractor.ExtractorPlugin;

import java.util.List;

public class FixtureExtractor implements ExtractorPlugin {

    @Override
    public String getName() {
        return "fixture-ts";
    }

    @Override
    public List<String> getExtensions() {
        return List.of(".ts", ".tsx");
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public ExtractionResult extract(String code, String filePath) {
        return ExtractionResult.of(List.of(CodeBlock.builder()
                .name("fixture")
                .type("chunk")
                .startLine(1)
                .endLine(1)
                .content(code)
                .filePath(filePath)
                .build()));
    }
}
