package com.bit.reputation.integrity;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SpotCheckSamplerTest {

    private final SpotCheckSampler sampler = new SpotCheckSampler(new Random(7));

    @Test
    void testEmptyChainHasNoPositions() {
        assertTrue(sampler.sample(0, 3, true).isEmpty());
    }

    @Test
    void testBoundariesAlwaysIncluded() {
        for (int round = 0; round < 20; round++) {
            List<Long> positions = sampler.sample(1000, 3, true);
            assertEquals(5, positions.size(), "首尾 + 3个随机位置");
            assertEquals(0L, positions.get(0));
            assertEquals(999L, positions.get(positions.size() - 1));
            for (int i = 1; i < positions.size(); i++) {
                assertTrue(positions.get(i) > positions.get(i - 1), "位置应去重且升序");
            }
        }
    }

    @Test
    void testSmallChainIsFullySampled() {
        assertEquals(List.of(0L), sampler.sample(1, 3, true));
        assertEquals(List.of(0L, 1L, 2L, 3L), sampler.sample(4, 3, true));
    }

    @Test
    void testWithoutBoundaries() {
        List<Long> positions = sampler.sample(50, 4, false);
        assertEquals(4, positions.size());
        positions.forEach(p -> assertTrue(p >= 0 && p < 50));
        assertTrue(sampler.sample(50, 0, false).isEmpty());
    }
}
