package com.vibescout.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HostVersion 单元测试")
class HostVersionTest {

    @Test
    @DisplayName("逐段按整数比较")
    void shouldCompareNumerically() {
        assertTrue(HostVersion.compare("1.10.0", "1.9.0") > 0);
        assertTrue(HostVersion.compare("1.2.0", "1.3.0") < 0);
        assertEquals(0, HostVersion.compare("2.0.0", "2.0.0"));
    }

    @Test
    @DisplayName("缺失段视为 0")
    void missingComponentsAreZero() {
        assertEquals(0, HostVersion.compare("1.2", "1.2.0"));
        assertEquals(0, HostVersion.compare("1", "1.0.0"));
        assertTrue(HostVersion.compare("1", "1.0.1") < 0);
    }

    @Test
    @DisplayName("非数字段视为 0")
    void nonNumericComponentsAreZero() {
        assertArrayEquals(new int[]{1, 0, 0}, HostVersion.parse("1.x.beta"));
        assertEquals(0, HostVersion.compare("1.0.0-rc1", "1.0.0"));
        assertArrayEquals(new int[]{0, 0, 0}, HostVersion.parse(null));
    }

    @Test
    @DisplayName("未打包运行时版本为 0.0.0")
    void detectShouldFallBackToUnknown() {
        // 测试环境下没有 jar MANIFEST
        assertEquals(HostVersion.UNKNOWN, HostVersion.detect());
    }
}
