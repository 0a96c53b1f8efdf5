package model.dto.response;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 检测质量指标（基于去重后的唯一检测）
 */
@Data
public class MetricsSummary {
    //  真值
    private int totalEvents;
    private int totalIntruders;
    private int totalNoise;

    //  检测
    private int totalDetections;       // 去重前的记录总数
    private int uniqueDetections;      // 每个事件取最早一条
    private int truePositives;
    private int falsePositives;
    private double falsePositiveRate;
    private double detectionRate;

    //  时延 (秒)
    private double meanLatencySeconds;
    private double maxLatencySeconds;
    private double p95LatencySeconds;

    //  P2P 开销
    private double meanP2pMessages;
    private long totalP2pMessages;

    //  网关中断
    private int detectionsDuringOutage;
    private double outageDetectionRate;

    // 原始序列（供外部绘图）
    private List<Double> latencies = new ArrayList<>();
    private List<Integer> p2pMessagesList = new ArrayList<>();
}
