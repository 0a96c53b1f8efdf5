package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 检测性能评级
 */
@Getter
@AllArgsConstructor
public enum PerformanceRatingEnum {
    EXCELLENT("excellent"),
    GOOD("good"),
    ACCEPTABLE("acceptable"),
    NEEDS_IMPROVEMENT("needs improvement");

    private final String label;

    /**
     * 按检测率与误报率评级
     */
    public static PerformanceRatingEnum rate(double detectionRate, double falsePositiveRate) {
        if (detectionRate >= 0.90 && falsePositiveRate <= 0.05) {
            return EXCELLENT;
        }
        if (detectionRate >= 0.80 && falsePositiveRate <= 0.10) {
            return GOOD;
        }
        if (detectionRate >= 0.70) {
            return ACCEPTABLE;
        }
        return NEEDS_IMPROVEMENT;
    }
}
