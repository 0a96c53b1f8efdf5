package model.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 分段式 JSON 配置（外部任务的输入格式，也用于结果中的配置回显）
 *
 * {
 *   "run_id": "...", "random_seed": 42,
 *   "simulation": {...}, "topology": {...}, "decision_logic": {...},
 *   "image_model": {...}, "communication": {...}, "gateway": {...}
 * }
 *
 * 缺失的字段保持 SimulationConfig 的缺省值
 */
@Data
public class SimulationConfigReq {

    @JsonProperty("run_id")
    private String runId;

    @JsonProperty("random_seed")
    private Long randomSeed;

    private SimulationSection simulation;
    private TopologySection topology;

    @JsonProperty("decision_logic")
    private DecisionLogicSection decisionLogic;

    @JsonProperty("image_model")
    private ImageModelSection imageModel;

    private CommunicationSection communication;
    private GatewaySection gateway;

    @Data
    public static class SimulationSection {
        @JsonProperty("event_count")
        private Integer eventCount;
        @JsonProperty("intruder_probability")
        private Double intruderProbability;
        @JsonProperty("event_interval_mean")
        private Double eventIntervalMean;
    }

    @Data
    public static class TopologySection {
        @JsonProperty("outer_ring_nodes")
        private Integer outerRingNodes;
        @JsonProperty("inner_ring_nodes")
        private Integer innerRingNodes;
        @JsonProperty("outer_ring_radius")
        private Double outerRingRadius;
        @JsonProperty("inner_ring_radius")
        private Double innerRingRadius;
        @JsonProperty("inner_ring_offset_deg")
        private Double innerRingOffsetDeg;
        @JsonProperty("sensor_range")
        private Double sensorRange;
        @JsonProperty("p2p_range")
        private Double p2pRange;
    }

    @Data
    public static class DecisionLogicSection {
        @JsonProperty("confirm_threshold")
        private Double confirmThreshold;
        @JsonProperty("verify_threshold")
        private Double verifyThreshold;
        @JsonProperty("verification_timeout")
        private Double verificationTimeout;
    }

    // 兼容旧字段名 boar_confidence_* (真实入侵) / noise_confidence_* (噪声)
    @Data
    public static class ImageModelSection {
        @JsonProperty("true_confidence_mean")
        @JsonAlias("boar_confidence_mean")
        private Double trueConfidenceMean;
        @JsonProperty("true_confidence_std")
        @JsonAlias("boar_confidence_std")
        private Double trueConfidenceStd;
        @JsonProperty("false_confidence_mean")
        @JsonAlias("noise_confidence_mean")
        private Double falseConfidenceMean;
        @JsonProperty("false_confidence_std")
        @JsonAlias("noise_confidence_std")
        private Double falseConfidenceStd;
    }

    @Data
    public static class CommunicationSection {
        @JsonProperty("loss_base")
        private Double lossBase;
        @JsonProperty("loss_per_meter")
        private Double lossPerMeter;
        @JsonProperty("delay_base")
        private Double delayBase;
        @JsonProperty("delay_per_meter")
        private Double delayPerMeter;
        @JsonProperty("delay_jitter")
        private Double delayJitter;
        @JsonProperty("msg_size_verify_req")
        private Integer msgSizeVerifyReq;
        @JsonProperty("msg_size_verify_resp")
        private Integer msgSizeVerifyResp;
        @JsonProperty("msg_size_uplink")
        private Integer msgSizeUplink;
    }

    @Data
    public static class GatewaySection {
        @JsonProperty("up_duration_mean")
        private Double upDurationMean;
        @JsonProperty("down_duration_mean")
        private Double downDurationMean;
    }

    /**
     * 合并到缺省配置之上
     */
    public SimulationConfig toConfig() {
        SimulationConfig.SimulationConfigBuilder b = SimulationConfig.builder();
        if (runId != null) b.runId(runId);
        if (randomSeed != null) b.randomSeed(randomSeed);

        if (simulation != null) {
            if (simulation.getEventCount() != null) b.eventCount(simulation.getEventCount());
            if (simulation.getIntruderProbability() != null) b.intruderProbability(simulation.getIntruderProbability());
            if (simulation.getEventIntervalMean() != null) b.eventIntervalMean(simulation.getEventIntervalMean());
        }
        if (topology != null) {
            if (topology.getOuterRingNodes() != null) b.outerRingNodes(topology.getOuterRingNodes());
            if (topology.getInnerRingNodes() != null) b.innerRingNodes(topology.getInnerRingNodes());
            if (topology.getOuterRingRadius() != null) b.outerRingRadius(topology.getOuterRingRadius());
            if (topology.getInnerRingRadius() != null) b.innerRingRadius(topology.getInnerRingRadius());
            if (topology.getInnerRingOffsetDeg() != null) b.innerRingOffsetDeg(topology.getInnerRingOffsetDeg());
            if (topology.getSensorRange() != null) b.sensorRange(topology.getSensorRange());
            if (topology.getP2pRange() != null) b.p2pRange(topology.getP2pRange());
        }
        if (decisionLogic != null) {
            if (decisionLogic.getConfirmThreshold() != null) b.confirmThreshold(decisionLogic.getConfirmThreshold());
            if (decisionLogic.getVerifyThreshold() != null) b.verifyThreshold(decisionLogic.getVerifyThreshold());
            if (decisionLogic.getVerificationTimeout() != null) b.verificationTimeout(decisionLogic.getVerificationTimeout());
        }
        if (imageModel != null) {
            if (imageModel.getTrueConfidenceMean() != null) b.trueConfidenceMean(imageModel.getTrueConfidenceMean());
            if (imageModel.getTrueConfidenceStd() != null) b.trueConfidenceStd(imageModel.getTrueConfidenceStd());
            if (imageModel.getFalseConfidenceMean() != null) b.falseConfidenceMean(imageModel.getFalseConfidenceMean());
            if (imageModel.getFalseConfidenceStd() != null) b.falseConfidenceStd(imageModel.getFalseConfidenceStd());
        }
        if (communication != null) {
            if (communication.getLossBase() != null) b.lossBase(communication.getLossBase());
            if (communication.getLossPerMeter() != null) b.lossPerMeter(communication.getLossPerMeter());
            if (communication.getDelayBase() != null) b.delayBase(communication.getDelayBase());
            if (communication.getDelayPerMeter() != null) b.delayPerMeter(communication.getDelayPerMeter());
            if (communication.getDelayJitter() != null) b.delayJitter(communication.getDelayJitter());
            if (communication.getMsgSizeVerifyReq() != null) b.msgSizeVerifyReq(communication.getMsgSizeVerifyReq());
            if (communication.getMsgSizeVerifyResp() != null) b.msgSizeVerifyResp(communication.getMsgSizeVerifyResp());
            if (communication.getMsgSizeUplink() != null) b.msgSizeUplink(communication.getMsgSizeUplink());
        }
        if (gateway != null) {
            if (gateway.getUpDurationMean() != null) b.gatewayUpDurationMean(gateway.getUpDurationMean());
            if (gateway.getDownDurationMean() != null) b.gatewayDownDurationMean(gateway.getDownDurationMean());
        }
        return b.build();
    }

    /**
     * 配置回显：平铺配置转回分段格式
     */
    public static SimulationConfigReq from(SimulationConfig config) {
        SimulationConfigReq req = new SimulationConfigReq();
        req.setRunId(config.getRunId());
        req.setRandomSeed(config.getRandomSeed());

        SimulationSection sim = new SimulationSection();
        sim.setEventCount(config.getEventCount());
        sim.setIntruderProbability(config.getIntruderProbability());
        sim.setEventIntervalMean(config.getEventIntervalMean());
        req.setSimulation(sim);

        TopologySection topo = new TopologySection();
        topo.setOuterRingNodes(config.getOuterRingNodes());
        topo.setInnerRingNodes(config.getInnerRingNodes());
        topo.setOuterRingRadius(config.getOuterRingRadius());
        topo.setInnerRingRadius(config.getInnerRingRadius());
        topo.setInnerRingOffsetDeg(config.getInnerRingOffsetDeg());
        topo.setSensorRange(config.getSensorRange());
        topo.setP2pRange(config.getP2pRange());
        req.setTopology(topo);

        DecisionLogicSection decision = new DecisionLogicSection();
        decision.setConfirmThreshold(config.getConfirmThreshold());
        decision.setVerifyThreshold(config.getVerifyThreshold());
        decision.setVerificationTimeout(config.getVerificationTimeout());
        req.setDecisionLogic(decision);

        ImageModelSection img = new ImageModelSection();
        img.setTrueConfidenceMean(config.getTrueConfidenceMean());
        img.setTrueConfidenceStd(config.getTrueConfidenceStd());
        img.setFalseConfidenceMean(config.getFalseConfidenceMean());
        img.setFalseConfidenceStd(config.getFalseConfidenceStd());
        req.setImageModel(img);

        CommunicationSection comm = new CommunicationSection();
        comm.setLossBase(config.getLossBase());
        comm.setLossPerMeter(config.getLossPerMeter());
        comm.setDelayBase(config.getDelayBase());
        comm.setDelayPerMeter(config.getDelayPerMeter());
        comm.setDelayJitter(config.getDelayJitter());
        comm.setMsgSizeVerifyReq(config.getMsgSizeVerifyReq());
        comm.setMsgSizeVerifyResp(config.getMsgSizeVerifyResp());
        comm.setMsgSizeUplink(config.getMsgSizeUplink());
        req.setCommunication(comm);

        GatewaySection gw = new GatewaySection();
        gw.setUpDurationMean(config.getGatewayUpDurationMean());
        gw.setDownDurationMean(config.getGatewayDownDurationMean());
        req.setGateway(gw);

        return req;
    }
}
