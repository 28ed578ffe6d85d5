package com.vibescout.core.strategy;

import com.vibescout.api.extractor.CodeBlock;
import com.vibescout.api.extractor.ExtractionResult;
import com.vibescout.api.extractor.ExtractorPlugin;
import com.vibescout.core.plugin.PluginRegistry;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 提取策略分发器
 * <p>
 * 内置提取器 + 插件提取器合并后按扩展名选择唯一的提取器：
 * 优先级高者优先，同优先级按名称字典序。插件可以用更高的优先级覆盖内置实现。
 */
@Slf4j
public class ExtractionStrategyDispatcher {

    static final Comparator<ExtractorPlugin> PRIORITY_ORDER =
            Comparator.comparingInt(ExtractorPlugin::getPriority).reversed()
                    .thenComparing(ExtractorPlugin::getName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<ExtractorPlugin> builtins;

    // 可为 null，此时只使用内置提取器
    private final PluginRegistry registry;

    public ExtractionStrategyDispatcher(List<ExtractorPlugin> builtins, PluginRegistry registry) {
        this.builtins = builtins != null ? List.copyOf(builtins) : List.of();
        this.registry = registry;
    }

    /**
     * 全部候选提取器（内置在前）
     */
    public List<ExtractorPlugin> getAllExtractors() {
        List<ExtractorPlugin> all = new ArrayList<>(builtins);
        if (registry != null) {
            try {
                all.addAll(registry.getExtractors());
            } catch (RuntimeException e) {
                log.debug("Plugin registry unavailable, using built-in extractors only: {}", e.getMessage());
            }
        }
        return all;
    }

    /**
     * 为扩展名选择提取器
     *
     * @param extension 带点号的扩展名，例如 ".ts"
     */
    public Optional<ExtractorPlugin> resolve(String extension) {
        return getAllExtractors().stream()
                .filter(extractor -> extractor.getExtensions() != null
                        && extractor.getExtensions().contains(extension))
                .min(PRIORITY_ORDER);
    }

    /**
     * 提取文件内容
     * 没有匹配的提取器时，整个文件作为一个 file 类型的代码块
     */
    public ExtractionResult extract(String filePath, String code) throws Exception {
        Optional<ExtractorPlugin> extractor = resolve(extensionOf(filePath));
        if (extractor.isPresent()) {
            log.debug("Extracting {} with {}", filePath, extractor.get().getName());
            return extractor.get().extract(code, filePath);
        }
        return wholeFile(filePath, code);
    }

    /**
     * 小写、带点号的扩展名；没有扩展名时为空字符串
     */
    static String extensionOf(String filePath) {
        Path fileName = Paths.get(filePath).getFileName();
        String name = fileName != null ? fileName.toString() : filePath;
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static ExtractionResult wholeFile(String filePath, String code) {
        Path fileName = Paths.get(filePath).getFileName();
        String text = code != null ? code : "";
        CodeBlock block = CodeBlock.builder()
                .name(fileName != null ? fileName.toString() : filePath)
                .type("file")
                .startLine(1)
                .endLine(text.split("\n", -1).length)
                .content(text)
                .filePath(filePath)
                .build();
        return ExtractionResult.of(List.of(block));
    }
}
