package model.dto.response;

import lombok.Data;

/**
 * 朴素基线（单阈值、无分级、无网络）
 */
@Data
public class BaselineSummary {
    private double threshold;
    private double detectionRate;
    private double falsePositiveRate;
    private int totalDetections;
}
