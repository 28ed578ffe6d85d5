package com.vibescout.core.debug;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DebugStore 单元测试")
class DebugStoreTest {

    private DebugStore store;

    @BeforeEach
    void setUp() {
        store = new DebugStore();
    }

    @Test
    @DisplayName("最新的记录在前，超出容量时淘汰最旧的")
    void keepsNewestFirstWithinCapacity() {
        for (int i = 0; i < DebugStore.DEFAULT_MAX_REQUESTS + 5; i++) {
            store.logRequest("openai", "model-" + i, "payload");
        }

        List<DebugStore.DebugEntry> requests = store.getRequests();
        assertEquals(DebugStore.DEFAULT_MAX_REQUESTS, requests.size());
        assertEquals("model-54", requests.get(0).getModel());
        assertEquals("model-5", requests.get(requests.size() - 1).getModel());
    }

    @Test
    @DisplayName("超长字符串被截断")
    void truncatesLongStrings() {
        String id = store.logRequest("bedrock", "claude", "x".repeat(6000));

        String payload = (String) store.getRequests().get(0).getPayload();
        assertEquals(DebugStore.MAX_STRING_LENGTH + DebugStore.TRUNCATED_SUFFIX.length(), payload.length());
        assertTrue(payload.endsWith("... [truncated]"));
        assertNotNull(id);
    }

    @Test
    @DisplayName("嵌套过深的结构替换为占位符")
    void replacesDeepNesting() {
        Object nested = "leaf";
        for (int i = 0; i < 7; i++) {
            nested = Map.of("k", nested);
        }

        Object truncated = DebugStore.truncate(nested);

        Object cursor = truncated;
        for (int i = 0; i < 6; i++) {
            cursor = ((Map<?, ?>) cursor).get("k");
        }
        assertEquals("[Max Depth]", cursor);
    }

    @Test
    @DisplayName("按 ID 补充响应和错误")
    void updatesById() {
        String id = store.logRequest("local", "nomic", List.of("a", "b"));

        store.updateResponse(id, Map.of("tokens", 12));
        store.updateError(id, "rate limited");
        store.updateError("unknown", "ignored");

        DebugStore.DebugEntry entry = store.getRequests().get(0);
        assertEquals(Map.of("tokens", 12), entry.getResponse());
        assertEquals("rate limited", entry.getError());
        assertEquals(List.of("a", "b"), entry.getPayload());
        assertNotNull(entry.getTimestamp());
    }

    @Test
    @DisplayName("clear 清空全部记录")
    void clearRemovesEverything() {
        store.logRequest("local", "nomic", "payload");
        store.clear();
        assertTrue(store.getRequests().isEmpty());
    }
}
