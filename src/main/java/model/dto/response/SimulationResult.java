package model.dto.response;

import common.consts.DecisionOutcomeEnum;
import lombok.Data;
import model.dto.request.SimulationConfigReq;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 仿真入口的返回值
 * 失败时只有 success=false、runId 与 errors
 */
@Data
public class SimulationResult {
    private boolean success;
    private String runId;
    private List<String> errors;

    private SimulationConfigReq config;
    private MetricsSummary metrics;
    private BaselineSummary baseline;
    private ComparisonSummary comparison;
    private TopologySummary topology;
    private Map<DecisionOutcomeEnum, Integer> decisionOutcomes;
    private NetworkStatsDto networkStats;
    private Integer uplinkAttempts;

    // 墙钟信息 仅供参考 不参与确定性比较
    private Double executionTimeSeconds;
    private Instant startedAt;

    public static SimulationResult failure(String runId, List<String> errors) {
        SimulationResult result = new SimulationResult();
        result.setSuccess(false);
        result.setRunId(runId);
        result.setErrors(new ArrayList<>(errors));
        return result;
    }
}
