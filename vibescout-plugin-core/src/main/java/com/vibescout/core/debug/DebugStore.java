package com.vibescout.core.debug;

import com.vibescout.api.context.DebugSink;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 调试记录仓库
 * <p>
 * 保存最近的 Provider 请求（最新的在前），用于调试面板展示。
 * 写入时会对载荷做截断：超长字符串截断，嵌套过深的结构替换为占位符。
 */
@Slf4j
public class DebugStore implements DebugSink {

    public static final int DEFAULT_MAX_REQUESTS = 50;
    static final int MAX_STRING_LENGTH = 5000;
    static final int MAX_DEPTH = 5;
    static final String TRUNCATED_SUFFIX = "... [truncated]";
    static final String MAX_DEPTH_MARKER = "[Max Depth]";

    private final int maxRequests;

    private final Deque<DebugEntry> requests = new ConcurrentLinkedDeque<>();

    public DebugStore() {
        this(DEFAULT_MAX_REQUESTS);
    }

    public DebugStore(int maxRequests) {
        this.maxRequests = maxRequests;
    }

    @Override
    public synchronized String logRequest(String provider, String model, Object payload, Object response, String error) {
        DebugEntry entry = DebugEntry.builder()
                .id(UUID.randomUUID().toString().substring(0, 8))
                .timestamp(Instant.now())
                .provider(provider)
                .model(model)
                .payload(truncate(payload))
                .response(response)
                .error(error)
                .build();

        requests.addFirst(entry);
        while (requests.size() > maxRequests) {
            requests.pollLast();
        }
        log.debug("[{}] Recorded debug request {} (model: {})", provider, entry.getId(), model);
        return entry.getId();
    }

    @Override
    public void updateResponse(String id, Object response) {
        find(id).ifPresent(entry -> entry.setResponse(truncate(response)));
    }

    @Override
    public void updateError(String id, String error) {
        find(id).ifPresent(entry -> entry.setError(error));
    }

    /**
     * 最近的请求快照，最新的在前
     */
    public List<DebugEntry> getRequests() {
        return new ArrayList<>(requests);
    }

    public void clear() {
        requests.clear();
    }

    private Optional<DebugEntry> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return requests.stream().filter(entry -> id.equals(entry.getId())).findFirst();
    }

    static Object truncate(Object value) {
        return truncate(value, 0);
    }

    private static Object truncate(Object value, int depth) {
        if (depth > MAX_DEPTH) {
            return MAX_DEPTH_MARKER;
        }
        if (value instanceof CharSequence text) {
            String s = text.toString();
            return s.length() > MAX_STRING_LENGTH ? s.substring(0, MAX_STRING_LENGTH) + TRUNCATED_SUFFIX : s;
        }
        if (value instanceof Collection<?> items) {
            List<Object> result = new ArrayList<>(items.size());
            for (Object item : items) {
                result.add(truncate(item, depth + 1));
            }
            return result;
        }
        if (value instanceof Object[] array) {
            return truncate(Arrays.asList(array), depth);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), truncate(v, depth + 1)));
            return result;
        }
        return value;
    }

    /**
     * 一条调试记录
     */
    @Getter
    @Builder
    public static class DebugEntry {
        private final String id;
        private final Instant timestamp;
        private final String provider;
        private final String model;
        private final Object payload;
        @Setter
        private volatile Object response;
        @Setter
        private volatile String error;
    }
}
