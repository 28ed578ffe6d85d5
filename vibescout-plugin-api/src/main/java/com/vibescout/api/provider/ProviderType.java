package com.vibescout.api.provider;

/**
 * Provider 类型
 */
public enum ProviderType {
    EMBEDDING("embedding"),
    LLM("llm");

    private final String id;

    ProviderType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
