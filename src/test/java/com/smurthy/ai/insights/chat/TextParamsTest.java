package com.smurthy.ai.insights.chat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextParamsTest {

    @Test
    @DisplayName("Should trim whitespace and trailing punctuation from names")
    void testCleanName() {
        assertThat(TextParams.cleanName("  Tyrone Hospital?! ")).isEqualTo("Tyrone Hospital");
        assertThat(TextParams.cleanName("St. Mary's Medical Center.")).isEqualTo("St. Mary's Medical Center");
        assertThat(TextParams.cleanName(null)).isEmpty();
    }

    @Test
    @DisplayName("Should default and clamp requested counts")
    void testClampedCount() {
        assertThat(TextParams.clampedCount(null, 5, 20)).isEqualTo(5);
        assertThat(TextParams.clampedCount("3", 5, 20)).isEqualTo(3);
        assertThat(TextParams.clampedCount("50", 5, 20)).isEqualTo(20);
        assertThat(TextParams.clampedCount("0", 5, 20)).isEqualTo(1);
        assertThat(TextParams.clampedCount("99999999999999", 5, 20)).isEqualTo(20);
    }
}
