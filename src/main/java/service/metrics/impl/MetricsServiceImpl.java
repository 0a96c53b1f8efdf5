package service.metrics.impl;

import common.consts.PerformanceRatingEnum;
import common.util.StatsUtil;
import model.dto.response.BaselineSummary;
import model.dto.response.ComparisonSummary;
import model.dto.response.MetricsSummary;
import model.entity.DetectionRecord;
import model.entity.SensorEvent;
import org.springframework.stereotype.Service;
import service.metrics.MetricsService;
import service.workload.ConfidenceClassifier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Service
public class MetricsServiceImpl implements MetricsService {

    @Override
    public MetricsSummary computeMetrics(List<SensorEvent> events, List<DetectionRecord> detections) {
        // 真值
        int totalIntruders = (int) events.stream().filter(SensorEvent::isIntruder).count();
        int totalNoise = events.size() - totalIntruders;

        List<DetectionRecord> unique = uniqueDetections(detections);
        int truePositives = (int) unique.stream().filter(DetectionRecord::isTruePositive).count();
        int falsePositives = unique.size() - truePositives;

        // 时延
        List<Double> latencies = new ArrayList<>();
        for (DetectionRecord d : unique) {
            latencies.add(d.getLatency());
        }

        // P2P 开销（仅统计走过校验的检测）
        List<Integer> p2pMessages = new ArrayList<>();
        long totalP2p = 0L;
        for (DetectionRecord d : unique) {
            if (d.isUsedP2p()) {
                p2pMessages.add(d.getP2pMessagesSent());
            }
            totalP2p += d.getP2pMessagesSent();
        }

        // 网关中断期间的检测
        int duringOutage = (int) unique.stream().filter(d -> !d.isGatewayWasUp()).count();

        MetricsSummary summary = new MetricsSummary();
        summary.setTotalEvents(events.size());
        summary.setTotalIntruders(totalIntruders);
        summary.setTotalNoise(totalNoise);
        summary.setTotalDetections(detections.size());
        summary.setUniqueDetections(unique.size());
        summary.setTruePositives(truePositives);
        summary.setFalsePositives(falsePositives);
        summary.setFalsePositiveRate(StatsUtil.round(StatsUtil.ratio(falsePositives, totalNoise), 4));
        summary.setDetectionRate(StatsUtil.round(StatsUtil.ratio(truePositives, totalIntruders), 4));
        summary.setMeanLatencySeconds(StatsUtil.round(StatsUtil.mean(latencies), 4));
        summary.setMaxLatencySeconds(StatsUtil.round(StatsUtil.max(latencies), 4));
        summary.setP95LatencySeconds(StatsUtil.round(StatsUtil.percentile(latencies, 95), 4));
        summary.setMeanP2pMessages(StatsUtil.round(StatsUtil.mean(p2pMessages), 2));
        summary.setTotalP2pMessages(totalP2p);
        summary.setDetectionsDuringOutage(duringOutage);
        summary.setOutageDetectionRate(StatsUtil.round(StatsUtil.ratio(duringOutage, unique.size()), 4));
        summary.setLatencies(latencies);
        summary.setP2pMessagesList(p2pMessages);
        return summary;
    }

    @Override
    public List<DetectionRecord> uniqueDetections(List<DetectionRecord> detections) {
        // 稳定排序：同一时刻的记录保持上报顺序
        List<DetectionRecord> sorted = new ArrayList<>(detections);
        sorted.sort(Comparator.comparingDouble(DetectionRecord::getDetectionTime));

        Set<Long> seen = new HashSet<>();
        List<DetectionRecord> unique = new ArrayList<>();
        for (DetectionRecord d : sorted) {
            if (seen.add(d.getEventId())) {
                unique.add(d);
            }
        }
        return unique;
    }

    @Override
    public BaselineSummary computeBaseline(List<SensorEvent> events, ConfidenceClassifier classifier) {
        int totalIntruders = 0;
        int truePositives = 0;
        int detections = 0;
        for (SensorEvent event : events) {
            if (event.isIntruder()) {
                totalIntruders++;
            }
            double confidence = classifier.analyze(event.getKind());
            if (confidence > NAIVE_THRESHOLD) {
                detections++;
                if (event.isIntruder()) {
                    truePositives++;
                }
            }
        }
        int totalNoise = events.size() - totalIntruders;
        int falsePositives = detections - truePositives;

        BaselineSummary baseline = new BaselineSummary();
        baseline.setThreshold(NAIVE_THRESHOLD);
        baseline.setDetectionRate(StatsUtil.round(StatsUtil.ratio(truePositives, totalIntruders), 4));
        baseline.setFalsePositiveRate(StatsUtil.round(StatsUtil.ratio(falsePositives, totalNoise), 4));
        baseline.setTotalDetections(detections);
        return baseline;
    }

    @Override
    public ComparisonSummary compare(MetricsSummary metrics, BaselineSummary baseline) {
        double dr = metrics.getDetectionRate();
        double fpr = metrics.getFalsePositiveRate();
        double baseFpr = baseline.getFalsePositiveRate();

        double improvement = baseFpr > 0 ? (baseFpr - fpr) / baseFpr * 100.0 : 0.0;
        PerformanceRatingEnum rating = PerformanceRatingEnum.rate(dr, fpr);

        ComparisonSummary comparison = new ComparisonSummary();
        comparison.setFalsePositiveRateReduction(StatsUtil.round(baseFpr - fpr, 4));
        comparison.setDetectionRateChange(StatsUtil.round(dr - baseline.getDetectionRate(), 4));
        comparison.setFalsePositiveImprovementPercent(StatsUtil.round(improvement, 2));
        comparison.setRating(rating);
        comparison.setConclusion(String.format(Locale.ROOT,
                "The cascaded detection system achieved %s performance with %.1f%% detection rate "
                        + "and %.1f%% false positive rate. Compared to the naive baseline, "
                        + "false positives were reduced by %.0f%%.",
                rating.getLabel(), dr * 100, fpr * 100, improvement));
        return comparison;
    }
}
