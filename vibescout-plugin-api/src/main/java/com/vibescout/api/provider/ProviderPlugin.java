package com.vibescout.api.provider;

import java.util.List;
import java.util.Map;

/**
 * AI Provider
 * <p>
 * 提供 embedding 生成或 LLM 文本能力。五个能力方法都是可选的：
 * 未覆写的方法视为不支持，默认抛出 {@link UnsupportedOperationException}。
 */
public interface ProviderPlugin {

    /**
     * Provider 唯一名称
     */
    String getName();

    ProviderType getType();

    /**
     * 使用宿主配置初始化
     *
     * @param config 该 Provider 的配置
     */
    default void initialize(Map<String, Object> config) throws Exception {
        // Default empty implementation
    }

    /**
     * 单条文本 embedding
     */
    default float[] generateEmbedding(String text) throws Exception {
        throw unsupported("generateEmbedding");
    }

    /**
     * 批量 embedding
     */
    default List<float[]> generateEmbeddingsBatch(List<String> texts) throws Exception {
        throw unsupported("generateEmbeddingsBatch");
    }

    /**
     * 文本摘要
     *
     * @param maxLength 最大长度，可为 null
     */
    default String summarize(String text, Integer maxLength) throws Exception {
        throw unsupported("summarize");
    }

    /**
     * 根据提示词生成回复
     *
     * @param context 额外上下文，可为 null
     */
    default String generateResponse(String prompt, String context) throws Exception {
        throw unsupported("generateResponse");
    }

    /**
     * 为代码块生成最佳提问
     */
    default String generateBestQuestion(String code, String summary) throws Exception {
        throw unsupported("generateBestQuestion");
    }

    /**
     * Provider 是否已配置且可用
     */
    default boolean isAvailable() throws Exception {
        return true;
    }

    private UnsupportedOperationException unsupported(String method) {
        return new UnsupportedOperationException(
                "Provider [" + getName() + "] does not support " + method);
    }
}
