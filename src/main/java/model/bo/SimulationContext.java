package model.bo;

import engine.SimulationEngine;
import lombok.Getter;
import lombok.Setter;
import model.dto.request.SimulationConfig;
import model.entity.DetectionRecord;
import model.entity.Gateway;
import model.entity.SensorEvent;
import model.entity.SensorNode;
import service.network.P2pNetwork;
import service.workload.ConfidenceClassifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 单次仿真的上下文
 * 每次仿真新建一份，不同仿真之间不共享任何可变状态。
 * 所有进程在同一线程上逐个执行，因此这里的集合无需加锁。
 */
@Getter
public class SimulationContext {

    private final SimulationConfig config;
    private final SimulationEngine engine;

    // 唯一的随机流 抽样顺序即复现契约
    private final Random random;
    private final ConfidenceClassifier classifier;

    @Setter
    private Topology topology;
    @Setter
    private Gateway gateway;
    @Setter
    private P2pNetwork network;

    // 节点（按拓扑顺序）
    private final Map<String, SensorNode> nodes = new LinkedHashMap<>();

    // 事件日志与检测日志
    private final List<SensorEvent> events = new ArrayList<>();
    private final List<DetectionRecord> detections = new ArrayList<>();

    public SimulationContext(SimulationConfig config, SimulationEngine engine) {
        this.config = config;
        this.engine = engine;
        this.random = new Random(config.getRandomSeed());
        this.classifier = new ConfidenceClassifier(config, random);
    }

    public double now() {
        return engine.now();
    }

    public void addNode(SensorNode node) {
        nodes.put(node.getId(), node);
    }

    public SensorNode getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public void recordEvent(SensorEvent event) {
        events.add(event);
    }

    public void recordDetection(DetectionRecord record) {
        detections.add(record);
    }
}
