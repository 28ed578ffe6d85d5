package com.vibescout.core.sandbox;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 内存限制字符串解析，例如 "512MB"、"1.5 GB"、"1024"
 */
public final class MemoryLimits {

    private static final Pattern LIMIT_PATTERN =
            Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*(B|KB|MB|GB)?$", Pattern.CASE_INSENSITIVE);

    private MemoryLimits() {
    }

    /**
     * @return 字节数，缺省单位为 B
     * @throws IllegalArgumentException 格式不合法
     */
    public static long parse(String limit) {
        if (limit == null) {
            throw new IllegalArgumentException("Invalid memory limit format: null");
        }
        Matcher matcher = LIMIT_PATTERN.matcher(limit.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid memory limit format: " + limit);
        }
        double value = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2) != null ? matcher.group(2).toUpperCase(Locale.ROOT) : "B";
        long multiplier = switch (unit) {
            case "KB" -> 1024L;
            case "MB" -> 1024L * 1024;
            case "GB" -> 1024L * 1024 * 1024;
            default -> 1L;
        };
        return (long) (value * multiplier);
    }
}
