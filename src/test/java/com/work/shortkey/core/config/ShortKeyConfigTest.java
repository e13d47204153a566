package com.work.shortkey.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ShortKeyConfigTest {

    @Test
    public void capacity_applies_reserved_margin_and_utilization() {
        ShortKeyConfig config = ShortKeyConfig.defaultConfig();
        // floor(62^4 * 0.999 * 0.85)
        assertEquals(12_547_325L, config.capacityOf(4));
        assertTrue(config.capacityOf(5) > config.capacityOf(4));
    }

    @Test
    public void capacity_is_capped_at_long_max() {
        assertEquals(Long.MAX_VALUE, ShortKeyConfig.defaultConfig().capacityOf(12));
    }

    @Test
    public void override_wins_and_is_at_least_one() {
        ShortKeyConfig config = ShortKeyConfig.builder()
                .capacityOverride(4, 2L)
                .capacityOverride(5, 0L)
                .build();
        assertEquals(2L, config.capacityOf(4));
        assertEquals(1L, config.capacityOf(5));
    }

    @Test
    public void invalid_settings_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ShortKeyConfig.builder().charset("aab").build());
        assertThrows(IllegalArgumentException.class,
                () -> ShortKeyConfig.builder().minLength(6).maxLength(5).build());
        assertThrows(IllegalArgumentException.class, () -> ShortKeyConfig.builder().maxUtilization(0).build());
        assertThrows(IllegalArgumentException.class, () -> ShortKeyConfig.builder().reservedMargin(1.0).build());
    }
}
