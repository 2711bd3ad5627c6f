package com.openforge.mnemo.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StartupInfoRunnerTest {

    @Test
    void keysAreMaskedBeforeLogging() {
        assertThat(StartupInfoRunner.maskKey(null)).isEqualTo("(not set)");
        assertThat(StartupInfoRunner.maskKey("  ")).isEqualTo("(not set)");
        assertThat(StartupInfoRunner.maskKey("short")).isEqualTo("***");
        assertThat(StartupInfoRunner.maskKey("sk-abcdefghijklmnop1234")).isEqualTo("sk-abc...1234");
    }
}
