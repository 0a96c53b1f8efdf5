package common.consts;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("性能评级测试")
class PerformanceRatingEnumTest {

    @Test
    @DisplayName("评级边界")
    void testRatingBoundaries() {
        assertEquals(PerformanceRatingEnum.EXCELLENT, PerformanceRatingEnum.rate(0.90, 0.05));
        assertEquals(PerformanceRatingEnum.GOOD, PerformanceRatingEnum.rate(0.90, 0.06));
        assertEquals(PerformanceRatingEnum.GOOD, PerformanceRatingEnum.rate(0.80, 0.10));
        assertEquals(PerformanceRatingEnum.ACCEPTABLE, PerformanceRatingEnum.rate(0.80, 0.11));
        assertEquals(PerformanceRatingEnum.ACCEPTABLE, PerformanceRatingEnum.rate(0.70, 0.90));
        assertEquals(PerformanceRatingEnum.NEEDS_IMPROVEMENT, PerformanceRatingEnum.rate(0.69, 0.0));
    }
}
