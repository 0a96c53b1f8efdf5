package service.impl;

import common.Result;
import common.config.EngineConfig;
import common.consts.DecisionOutcomeEnum;
import common.consts.ErrorCodes;
import common.consts.RingEnum;
import common.util.TimeUtil;
import engine.SimulationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.bo.NodePlacement;
import model.bo.SimulationContext;
import model.bo.Topology;
import model.dto.request.SimulationConfig;
import model.dto.request.SimulationConfigReq;
import model.dto.response.BaselineSummary;
import model.dto.response.MetricsSummary;
import model.dto.response.SimulationResult;
import model.dto.response.TopologySummary;
import model.entity.Gateway;
import model.entity.SensorNode;
import org.springframework.stereotype.Service;
import service.SimulationService;
import service.metrics.MetricsService;
import service.network.P2pNetwork;
import service.network.TopologyService;
import service.validation.SimulationConfigValidator;
import service.workload.WorkloadGenerator;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 单次仿真编排：校验 -> 拓扑 -> 网关 -> 网络 -> 节点 -> 工作负载 -> 推进时钟 -> 指标 -> 基线
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimulationServiceImpl implements SimulationService {

    private final EngineConfig engineConfig;
    private final SimulationConfigValidator validator;
    private final TopologyService topologyService;
    private final MetricsService metricsService;

    @Override
    public SimulationResult run(SimulationConfig config) {
        List<String> errors = validator.validate(config);
        if (!errors.isEmpty()) {
            log.warn("仿真配置非法: RunId={}, Errors={}", config.getRunId(), errors);
            return SimulationResult.failure(config.getRunId(), errors);
        }

        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();
        log.info("仿真开始: RunId={}, Seed={}, Events={}, Nodes={}",
                config.getRunId(), config.getRandomSeed(), config.getEventCount(), config.totalNodes());

        SimulationContext context = simulate(config);
        double executionTime = TimeUtil.nanosToSeconds(System.nanoTime() - startNanos);

        MetricsSummary metrics = metricsService.computeMetrics(context.getEvents(), context.getDetections());

        // 基线：随机流重置为原始种子后只重抽置信度
        context.getRandom().setSeed(config.getRandomSeed());
        BaselineSummary baseline = metricsService.computeBaseline(context.getEvents(), context.getClassifier());

        SimulationResult result = new SimulationResult();
        result.setSuccess(true);
        result.setRunId(config.getRunId());
        result.setConfig(SimulationConfigReq.from(config));
        result.setMetrics(metrics);
        result.setBaseline(baseline);
        result.setComparison(metricsService.compare(metrics, baseline));
        result.setTopology(summarize(context.getTopology()));
        result.setDecisionOutcomes(collectOutcomes(context));
        result.setNetworkStats(context.getNetwork().getStats());
        result.setUplinkAttempts(context.getGateway().getUplinkAttempts().size());
        result.setExecutionTimeSeconds(executionTime);
        result.setStartedAt(startedAt);

        log.info("仿真结束: RunId={}, DetectionRate={}, FalsePositiveRate={}, MeanLatency={}s, 耗时={}s",
                config.getRunId(), metrics.getDetectionRate(), metrics.getFalsePositiveRate(),
                metrics.getMeanLatencySeconds(), String.format("%.3f", executionTime));
        return result;
    }

    @Override
    public Result runJob(SimulationConfig config) {
        try {
            SimulationResult result = run(config);
            if (!result.isSuccess()) {
                return Result.invalid(ErrorCodes.VALIDATION_FAILED, result.getErrors());
            }
            return Result.success("仿真完成", result);
        } catch (RuntimeException e) {
            log.error("仿真异常: RunId={}", config.getRunId(), e);
            return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    @Override
    public SimulationContext simulate(SimulationConfig config) {
        SimulationEngine engine = new SimulationEngine(
                engineConfig.maxEventsPerTimestampFor(config.totalNodes()), engineConfig.getEventLogCapacity());
        SimulationContext context = new SimulationContext(config, engine);

        // 拓扑
        Topology topology = topologyService.computeTopology(config);
        context.setTopology(topology);

        // 网关（常驻进程）
        Gateway gateway = new Gateway();
        context.setGateway(gateway);
        gateway.start(context);

        // 网络
        context.setNetwork(new P2pNetwork(context));

        // 节点
        for (NodePlacement placement : topology.getPlacements()) {
            SensorNode node = new SensorNode(placement.getNodeId(), placement.getRing(), placement.getPosition());
            node.assignNeighbors(topology.neighborsOf(placement.getNodeId()));
            context.addNode(node);
        }

        // 工作负载
        WorkloadGenerator generator = new WorkloadGenerator(context);
        generator.start();

        double horizon = config.getEventCount() * config.getEventIntervalMean() + engineConfig.getHorizonMargin();
        engine.runUntil(horizon);

        log.debug("时钟推进完毕: Horizon={}, 处理条目={}, 剩余条目={}, 事件={}, 检测记录={}",
                TimeUtil.formatSimTime(horizon), engine.getProcessedCount(), engine.pendingCount(),
                context.getEvents().size(), context.getDetections().size());
        return context;
    }

    private TopologySummary summarize(Topology topology) {
        TopologySummary summary = new TopologySummary();
        summary.setTotalNodes(topology.size());
        summary.setOuterNodes((int) topology.getPlacements().stream()
                .filter(p -> p.getRing() == RingEnum.OUTER).count());
        summary.setInnerNodes(topology.size() - summary.getOuterNodes());
        summary.setNeighborLinks(topology.linkCount());
        summary.setIsolatedNodes(topology.isolatedCount());
        return summary;
    }

    private Map<DecisionOutcomeEnum, Integer> collectOutcomes(SimulationContext context) {
        Map<DecisionOutcomeEnum, Integer> totals = new EnumMap<>(DecisionOutcomeEnum.class);
        for (DecisionOutcomeEnum outcome : DecisionOutcomeEnum.values()) {
            totals.put(outcome, 0);
        }
        for (SensorNode node : context.getNodes().values()) {
            node.getOutcomeCounts().forEach((outcome, count) -> totals.merge(outcome, count, Integer::sum));
        }
        return totals;
    }
}
