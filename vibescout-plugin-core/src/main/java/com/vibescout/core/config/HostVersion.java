package com.vibescout.core.config;

/**
 * 宿主版本工具
 * 版本号为简化的三段式：逐段按整数比较，缺失段视为 0，不支持 pre-release / build metadata
 */
public final class HostVersion {

    public static final String UNKNOWN = "0.0.0";

    private HostVersion() {
    }

    /**
     * 读取 core jar MANIFEST 中的 Implementation-Version
     */
    public static String detect() {
        String version = HostVersion.class.getPackage() != null
                ? HostVersion.class.getPackage().getImplementationVersion()
                : null;
        return version != null && !version.isBlank() ? version : UNKNOWN;
    }

    /**
     * 比较两个版本
     *
     * @return 正数表示 v1 &gt; v2，负数表示 v1 &lt; v2，0 表示相等
     */
    public static int compare(String v1, String v2) {
        int[] p1 = parse(v1);
        int[] p2 = parse(v2);
        for (int i = 0; i < 3; i++) {
            if (p1[i] != p2[i]) {
                return Integer.compare(p1[i], p2[i]);
            }
        }
        return 0;
    }

    static int[] parse(String version) {
        int[] parts = new int[3];
        if (version == null) {
            return parts;
        }
        String[] tokens = version.trim().split("\\.");
        for (int i = 0; i < 3 && i < tokens.length; i++) {
            try {
                parts[i] = Integer.parseInt(tokens[i].trim());
            } catch (NumberFormatException e) {
                // 非数字段按 0 处理
                parts[i] = 0;
            }
        }
        return parts;
    }
}
