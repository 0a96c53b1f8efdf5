package service.metrics;

import model.dto.response.BaselineSummary;
import model.dto.response.ComparisonSummary;
import model.dto.response.MetricsSummary;
import model.entity.DetectionRecord;
import model.entity.SensorEvent;
import service.workload.ConfidenceClassifier;

import java.util.List;

/**
 * 仿真结束后的指标聚合（纯函数，不修改输入）
 */
public interface MetricsService {

    /**
     * 朴素基线的固定阈值
     */
    double NAIVE_THRESHOLD = 0.50;

    MetricsSummary computeMetrics(List<SensorEvent> events, List<DetectionRecord> detections);

    /**
     * 每个事件最早的一条检测记录，按检测时间升序
     */
    List<DetectionRecord> uniqueDetections(List<DetectionRecord> detections);

    /**
     * 基线：每个事件重新抽一次置信度，超过固定阈值即视为检测
     * 调用方负责在调用前把随机流重置为原始种子
     */
    BaselineSummary computeBaseline(List<SensorEvent> events, ConfidenceClassifier classifier);

    ComparisonSummary compare(MetricsSummary metrics, BaselineSummary baseline);
}
