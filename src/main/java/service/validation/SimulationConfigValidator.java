package service.validation;

import common.consts.ErrorCodes;
import model.dto.request.SimulationConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 仿真配置校验
 * 收集全部错误后一次性返回，不抛异常；列表为空表示配置合法
 */
@Component
public class SimulationConfigValidator {

    public static final int MAX_EVENT_COUNT = 100_000;
    public static final int MAX_RING_NODES = 10_000;

    // 时间类参数上限 (秒)：指数抽样最多放大约 37 倍，终止时刻与条目时刻都保持有限
    public static final double MAX_DURATION = 1e12;
    // 空间类参数上限 (米)
    public static final double MAX_DISTANCE = 1e9;

    public List<String> validate(SimulationConfig config) {
        List<String> errors = new ArrayList<>();

        //  仿真规模
        if (config.getEventCount() < 0 || config.getEventCount() > MAX_EVENT_COUNT) {
            errors.add(ErrorCodes.EVENT_COUNT_RANGE);
        }
        checkProbability(errors, "intruder_probability", config.getIntruderProbability());
        checkPositive(errors, "event_interval_mean", config.getEventIntervalMean());
        checkAtMost(errors, "event_interval_mean", config.getEventIntervalMean(), MAX_DURATION);

        //  拓扑
        if (config.getOuterRingNodes() < 1 || config.getInnerRingNodes() < 1) {
            errors.add(ErrorCodes.RING_NODES_MIN);
        }
        if (config.getOuterRingNodes() > MAX_RING_NODES || config.getInnerRingNodes() > MAX_RING_NODES) {
            errors.add(ErrorCodes.RING_NODES_MAX);
        }
        if (!(config.getOuterRingRadius() > config.getInnerRingRadius())) {
            errors.add(ErrorCodes.RADIUS_ORDER);
        }
        checkNonNegative(errors, "inner_ring_radius", config.getInnerRingRadius());
        checkAtMost(errors, "outer_ring_radius", config.getOuterRingRadius(), MAX_DISTANCE);
        checkFinite(errors, "inner_ring_offset_deg", config.getInnerRingOffsetDeg());
        checkNonNegative(errors, "sensor_range", config.getSensorRange());
        checkNonNegative(errors, "p2p_range", config.getP2pRange());
        checkAtMost(errors, "sensor_range", config.getSensorRange(), MAX_DISTANCE);
        checkAtMost(errors, "p2p_range", config.getP2pRange(), MAX_DISTANCE);

        //  决策阈值
        checkProbability(errors, "confirm_threshold", config.getConfirmThreshold());
        checkProbability(errors, "verify_threshold", config.getVerifyThreshold());
        if (config.getVerifyThreshold() > config.getConfirmThreshold()) {
            errors.add(ErrorCodes.THRESHOLD_ORDER);
        }
        checkNonNegative(errors, "verification_timeout", config.getVerificationTimeout());
        checkAtMost(errors, "verification_timeout", config.getVerificationTimeout(), MAX_DURATION);

        //  置信度模型
        checkFinite(errors, "true_confidence_mean", config.getTrueConfidenceMean());
        checkNonNegative(errors, "true_confidence_std", config.getTrueConfidenceStd());
        checkFinite(errors, "false_confidence_mean", config.getFalseConfidenceMean());
        checkNonNegative(errors, "false_confidence_std", config.getFalseConfidenceStd());

        //  通信模型
        checkProbability(errors, "loss_base", config.getLossBase());
        checkNonNegative(errors, "loss_per_meter", config.getLossPerMeter());
        checkNonNegative(errors, "delay_base", config.getDelayBase());
        checkNonNegative(errors, "delay_per_meter", config.getDelayPerMeter());
        checkNonNegative(errors, "delay_jitter", config.getDelayJitter());
        checkAtMost(errors, "delay_base", config.getDelayBase(), MAX_DURATION);
        checkAtMost(errors, "delay_per_meter", config.getDelayPerMeter(), MAX_DURATION);
        checkAtMost(errors, "delay_jitter", config.getDelayJitter(), MAX_DURATION);
        if (config.getMsgSizeVerifyReq() <= 0 || config.getMsgSizeVerifyResp() <= 0 || config.getMsgSizeUplink() <= 0) {
            errors.add("message sizes must be positive");
        }

        //  网关
        checkPositive(errors, "gateway_up_duration_mean", config.getGatewayUpDurationMean());
        checkPositive(errors, "gateway_down_duration_mean", config.getGatewayDownDurationMean());
        checkAtMost(errors, "gateway_up_duration_mean", config.getGatewayUpDurationMean(), MAX_DURATION);
        checkAtMost(errors, "gateway_down_duration_mean", config.getGatewayDownDurationMean(), MAX_DURATION);

        return errors;
    }

    private static void checkProbability(List<String> errors, String name, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            errors.add(name + " must be between 0 and 1");
        }
    }

    private static void checkPositive(List<String> errors, String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            errors.add(name + " must be a positive finite number");
        }
    }

    private static void checkNonNegative(List<String> errors, String name, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            errors.add(name + " must be a non-negative finite number");
        }
    }

    // 只检查上限：NaN 与负数由前面的规则报告
    private static void checkAtMost(List<String> errors, String name, double value, double max) {
        if (value > max) {
            errors.add(name + " must not exceed " + max);
        }
    }

    private static void checkFinite(List<String> errors, String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            errors.add(name + " must be a finite number");
        }
    }
}
