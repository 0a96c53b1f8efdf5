package model.dto.response;

import common.consts.PerformanceRatingEnum;
import lombok.Data;

/**
 * 分级检测相对基线的改进
 */
@Data
public class ComparisonSummary {
    private double falsePositiveRateReduction;      // baseline.fpr - fpr
    private double detectionRateChange;             // dr - baseline.dr
    private double falsePositiveImprovementPercent; // 相对基线误报的降幅 (%)
    private PerformanceRatingEnum rating;
    private String conclusion;
}
