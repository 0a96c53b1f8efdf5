package model.entity;

import common.consts.DecisionOutcomeEnum;
import common.consts.MessageKindEnum;
import common.consts.NodeStateEnum;
import common.consts.RingEnum;
import engine.SimSignal;
import engine.WaitOutcome;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import model.bo.SimulationContext;
import model.dto.request.SimulationConfig;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 围界节点：三级决策状态机 + P2P 校验协议
 *
 * 一级 置信度 >= confirm_threshold：立即上报网关
 * 二级 verify_threshold <= 置信度 < confirm_threshold：广播校验请求，等待邻居确认
 * 三级 置信度 < verify_threshold：忽略
 *
 * 每个感知事件启动一个独立的决策进程，同一节点可同时存在多个进程。
 */
@Slf4j
@Getter
public class SensorNode {

    private final String id;
    private final RingEnum ring;
    private final Point position;

    // 拓扑计算后固定
    private final Set<String> neighborIds = new LinkedHashSet<>();

    // 当前等待中的校验会合句柄（每节点仅一个槽位，新校验覆盖旧校验）
    private SimSignal pendingVerification;

    private final Map<DecisionOutcomeEnum, Integer> outcomeCounts = new EnumMap<>(DecisionOutcomeEnum.class);

    private int activeProcesses = 0;

    public SensorNode(String id, RingEnum ring, Point position) {
        this.id = id;
        this.ring = ring;
        this.position = position;
    }

    public void assignNeighbors(Set<String> ids) {
        neighborIds.clear();
        neighborIds.addAll(ids);
    }

    public Set<String> getNeighborIds() {
        return Collections.unmodifiableSet(neighborIds);
    }

    /**
     * 感知到环境事件：启动一个独立的决策进程
     */
    public void handleSensorEvent(SensorEvent event, SimulationContext context) {
        context.getEngine().spawn(id, () -> runDecision(event, context));
    }

    private void runDecision(SensorEvent event, SimulationContext context) {
        SimulationConfig config = context.getConfig();
        activeProcesses++;

        // 1. 图像分析抽象
        double confidence = context.getClassifier().analyze(event.getKind());
        log.trace("节点 {} 事件 {} {}: 置信度 {}", id, event.getId(), NodeStateEnum.ANALYZING.getDesc(), confidence);

        // 2. 决策策略
        if (confidence >= config.getConfirmThreshold()) {
            sendUplink(event, confidence, false, 0, context);
            finish(event, NodeStateEnum.UPLINKED, DecisionOutcomeEnum.TIER1_UPLINK);
        } else if (confidence >= config.getVerifyThreshold()) {
            runVerification(event, confidence, context);
        } else {
            finish(event, NodeStateEnum.IGNORED, DecisionOutcomeEnum.IGNORED);
        }
    }

    /**
     * 二级：广播 VERIFY_REQ，占用信道结束后等待确认或超时
     */
    private void runVerification(SensorEvent event, double confidence, SimulationContext context) {
        log.trace("节点 {} 事件 {} {}", id, event.getId(), NodeStateEnum.VERIFYING.getDesc());
        context.getNetwork().p2pBroadcast(this, MessageKindEnum.VERIFY_REQ, event, () -> {
            SimSignal signal = new SimSignal(id + "#verify#" + event.getId());
            this.pendingVerification = signal;
            double timeout = context.getConfig().getVerificationTimeout();

            context.getEngine().awaitAny(signal, timeout, id, outcome -> {
                if (this.pendingVerification == signal) {
                    this.pendingVerification = null;
                }
                if (outcome == WaitOutcome.SIGNALLED) {
                    sendUplink(event, confidence, true, 1, context);
                    finish(event, NodeStateEnum.UPLINKED, DecisionOutcomeEnum.VERIFIED_UPLINK);
                } else {
                    finish(event, NodeStateEnum.TIMED_OUT, DecisionOutcomeEnum.VERIFICATION_TIMEOUT);
                }
            });
        });
    }

    /**
     * 收到 P2P 报文
     */
    public void receiveP2pMessage(P2pMessage message, SimulationContext context) {
        switch (message.getKind()) {
            case VERIFY_REQ -> {
                // 用自己的摄像头独立判断一次
                double myReading = context.getClassifier().analyze(message.getPayload().getKind());
                if (myReading >= context.getConfig().getConfirmThreshold()) {
                    context.getEngine().spawn(id, () ->
                            context.getNetwork().p2pBroadcast(this, MessageKindEnum.VERIFY_RESP, message.getPayload(), null));
                }
            }
            case VERIFY_RESP -> {
                // 只有第一条确认生效
                if (pendingVerification != null && !pendingVerification.isTriggered()) {
                    pendingVerification.trigger();
                }
            }
        }
    }

    /**
     * 上报网关：检测对指标可见的唯一入口
     */
    private void sendUplink(SensorEvent event, double confidence, boolean usedP2p, int p2pMessages,
                            SimulationContext context) {
        double detectionTime = context.now();
        boolean gatewayUp = context.getGateway().receiveUplink(id, event.getId(), detectionTime);

        DetectionRecord record = DetectionRecord.builder()
                .eventId(event.getId())
                .nodeId(id)
                .detectionTime(detectionTime)
                .usedP2p(usedP2p)
                .p2pMessagesSent(p2pMessages)
                .gatewayWasUp(gatewayUp)
                .latency(detectionTime - event.getTime())
                .truePositive(event.isIntruder())
                .confidence(confidence)
                .build();
        context.recordDetection(record);
    }

    private void finish(SensorEvent event, NodeStateEnum state, DecisionOutcomeEnum outcome) {
        activeProcesses--;
        outcomeCounts.merge(outcome, 1, Integer::sum);
        if (log.isDebugEnabled()) {
            log.debug("节点 {} 事件 {} 结束: State={}, Outcome={}",
                    id, event.getId(), state.getDesc(), outcome);
        }
    }

    public int getOutcomeCount(DecisionOutcomeEnum outcome) {
        return outcomeCounts.getOrDefault(outcome, 0);
    }

    @Override
    public String toString() {
        return "SensorNode{" + id + ", " + ring.getCode() + ", neighbors=" + neighborIds.size() + "}";
    }
}
