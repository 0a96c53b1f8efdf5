package application;

import common.consts.ErrorCodes;
import common.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import model.dto.request.SimulationConfig;
import model.dto.response.MetricsSummary;
import model.dto.response.SimulationResult;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.stereotype.Component;
import service.SimulationService;
import service.config.SimulationConfigLoader;

import java.nio.file.Path;
import java.util.List;

/**
 * 命令行入口
 *
 * --config=<file>  分段式 JSON 配置文件
 * --events=<n>     覆盖 event_count
 * --seed=<n>       覆盖 random_seed
 *
 * 不带任何参数启动时不执行仿真
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SimulationCommandLineRunner implements CommandLineRunner {

    static final String OPT_CONFIG = "config";
    static final String OPT_EVENTS = "events";
    static final String OPT_SEED = "seed";

    private final SimulationService simulationService;
    private final SimulationConfigLoader configLoader;

    @Override
    public void run(String... args) {
        ApplicationArguments arguments = new DefaultApplicationArguments(args);
        if (!arguments.containsOption(OPT_CONFIG) && !arguments.containsOption(OPT_EVENTS)
                && !arguments.containsOption(OPT_SEED)) {
            return;
        }

        SimulationConfig config = resolveConfig(arguments);
        SimulationResult result = simulationService.run(config);
        if (!result.isSuccess()) {
            log.error("仿真未执行: RunId={}, Errors={}", result.getRunId(), result.getErrors());
            return;
        }
        report(result);
    }

    SimulationConfig resolveConfig(ApplicationArguments arguments) {
        String configFile = lastValue(arguments, OPT_CONFIG);
        SimulationConfig config = configFile != null
                ? configLoader.fromFile(Path.of(configFile))
                : SimulationConfig.defaults();

        SimulationConfig.SimulationConfigBuilder builder = config.toBuilder();
        String events = lastValue(arguments, OPT_EVENTS);
        if (events != null) {
            builder.eventCount(parseInt(OPT_EVENTS, events));
        }
        String seed = lastValue(arguments, OPT_SEED);
        if (seed != null) {
            builder.randomSeed(parseLong(OPT_SEED, seed));
        }
        return builder.build();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCodes.ARGUMENT_INVALID + ": --" + name + "=" + value, e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCodes.ARGUMENT_INVALID + ": --" + name + "=" + value, e);
        }
    }

    private static String lastValue(ApplicationArguments arguments, String name) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private void report(SimulationResult result) {
        MetricsSummary m = result.getMetrics();
        log.info("========== 仿真结果 RunId={} ==========", result.getRunId());
        log.info("事件: 总数={}, 入侵={}, 噪声={}", m.getTotalEvents(), m.getTotalIntruders(), m.getTotalNoise());
        log.info("检测: 记录={}, 唯一={}, TP={}, FP={}",
                m.getTotalDetections(), m.getUniqueDetections(), m.getTruePositives(), m.getFalsePositives());
        log.info("检测率={}, 误报率={}", m.getDetectionRate(), m.getFalsePositiveRate());
        log.info("时延: 平均={}s, P95={}s, 最大={}s",
                m.getMeanLatencySeconds(), m.getP95LatencySeconds(), m.getMaxLatencySeconds());
        log.info("P2P: 平均={}, 总计={}", m.getMeanP2pMessages(), m.getTotalP2pMessages());
        log.info("网关中断期间检测={} ({})", m.getDetectionsDuringOutage(), m.getOutageDetectionRate());
        log.info("基线(>{}): 检测率={}, 误报率={}", result.getBaseline().getThreshold(),
                result.getBaseline().getDetectionRate(), result.getBaseline().getFalsePositiveRate());
        log.info("评级: {}", result.getComparison().getRating());
        log.info(result.getComparison().getConclusion());
    }
}
