package service.network;

import common.consts.EventKindEnum;
import common.consts.EventTypeEnum;
import common.consts.MessageKindEnum;
import engine.SimulationEngine;
import model.bo.NodePlacement;
import model.bo.SimulationContext;
import model.bo.Topology;
import model.dto.request.SimulationConfig;
import model.dto.response.NetworkStatsDto;
import model.entity.Gateway;
import model.entity.Point;
import model.entity.SensorEvent;
import model.entity.SensorNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import service.network.impl.TopologyServiceImpl;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("P2P 网络测试")
class P2pNetworkTest {

    private SimulationContext context;

    private void setUp(SimulationConfig config) {
        context = new SimulationContext(config, new SimulationEngine(1000, 100));
        Topology topology = new TopologyServiceImpl().computeTopology(config);
        context.setTopology(topology);
        context.setGateway(new Gateway());
        context.setNetwork(new P2pNetwork(context));
        for (NodePlacement p : topology.getPlacements()) {
            SensorNode node = new SensorNode(p.getNodeId(), p.getRing(), p.getPosition());
            node.assignNeighbors(topology.neighborsOf(p.getNodeId()));
            context.addNode(node);
        }
    }

    private static SensorEvent noise() {
        return new SensorEvent(0L, EventKindEnum.NOISE, 0.0, new Point(0, 0), 1.0);
    }

    @Test
    @DisplayName("发送方只阻塞信道占用时间")
    void testTimeOnAir() {
        setUp(SimulationConfig.builder().falseConfidenceMean(0.0).falseConfidenceStd(0.0).build());
        P2pNetwork network = context.getNetwork();
        SensorNode sender = context.getNode("outer_0");
        List<Double> resumedAt = new ArrayList<>();

        network.p2pBroadcast(sender, MessageKindEnum.VERIFY_REQ, noise(), () -> resumedAt.add(context.now()));
        assertEquals(1, network.getActiveTransmissions());
        context.getEngine().runUntil(10.0);

        assertEquals(1, resumedAt.size());
        assertEquals(64 * P2pNetwork.TIME_PER_BYTE, resumedAt.get(0), 1e-12);
        assertEquals(0, network.getActiveTransmissions());
    }

    @Test
    @DisplayName("信道占用期间的广播计入碰撞")
    void testCollisionCounted() {
        setUp(SimulationConfig.builder().falseConfidenceMean(0.0).falseConfidenceStd(0.0).build());
        P2pNetwork network = context.getNetwork();

        network.p2pBroadcast(context.getNode("outer_0"), MessageKindEnum.VERIFY_REQ, noise(), null);
        network.p2pBroadcast(context.getNode("outer_4"), MessageKindEnum.VERIFY_REQ, noise(), null);
        context.getEngine().runUntil(10.0);

        NetworkStatsDto stats = network.getStats();
        assertEquals(2, stats.getBroadcasts());
        assertEquals(1, stats.getCollidedBroadcasts());
        assertEquals(stats.getDeliveriesScheduled(), stats.getDeliveriesCompleted());
    }

    @Test
    @DisplayName("无丢包时每个邻居都收到，送达时延不小于下限")
    void testLosslessDelivery() {
        setUp(SimulationConfig.builder()
                .lossBase(0.0).lossPerMeter(0.0)
                .delayBase(0.0).delayPerMeter(0.0).delayJitter(0.0)
                .falseConfidenceMean(0.0).falseConfidenceStd(0.0)
                .build());
        P2pNetwork network = context.getNetwork();
        SensorNode sender = context.getNode("inner_0");

        network.p2pBroadcast(sender, MessageKindEnum.VERIFY_RESP, noise(), null);
        context.getEngine().runUntil(32 * P2pNetwork.TIME_PER_BYTE + P2pNetwork.MIN_DELAY / 2);
        assertEquals(0, network.getStats().getDeliveriesCompleted(), "最小时延之前不会送达");

        context.getEngine().runUntil(10.0);
        assertEquals(sender.getNeighborIds().size(), network.getStats().getDeliveriesScheduled());
        assertEquals(sender.getNeighborIds().size(), network.getStats().getDeliveriesCompleted());
        assertEquals(0, network.getStats().getPacketsDropped());
    }

    @Test
    @DisplayName("环境事件只分发给感知范围内的节点")
    void testDispatchBySensorRange() {
        setUp(SimulationConfig.builder().sensorRange(5.0).falseConfidenceMean(0.0).falseConfidenceStd(0.0).build());
        SensorEvent nearOuter0 = new SensorEvent(0L, EventKindEnum.NOISE, 0.0, new Point(24.0, 0.0), 1.0);

        context.getNetwork().dispatchEventToNodes(nearOuter0);
        context.getEngine().runUntil(10.0);

        int decided = 0;
        for (SensorNode node : context.getNodes().values()) {
            int n = node.getOutcomeCounts().values().stream().mapToInt(Integer::intValue).sum();
            if (n > 0) {
                assertEquals("outer_0", node.getId());
            }
            decided += n;
        }
        assertEquals(1, decided);
    }

    // 外环 2 个、内环 1 个：outer_1 孤立，inner_0 与 outer_0 互为唯一邻居
    private static SimulationConfig lossyTriangle() {
        return SimulationConfig.builder()
                .outerRingNodes(2).innerRingNodes(1)
                .lossBase(0.8).lossPerMeter(0.0)
                .falseConfidenceMean(0.0).falseConfidenceStd(0.0)
                .build();
    }

    @Test
    @DisplayName("碰撞惩罚进入丢包概率：与其他传输重叠的广播全部丢失")
    void testCollisionPenaltyDropsOverlappingBroadcast() {
        setUp(lossyTriangle());
        P2pNetwork network = context.getNetwork();
        SensorNode blocker = context.getNode("outer_1");
        SensorNode sender = context.getNode("inner_0");
        assertTrue(blocker.getNeighborIds().isEmpty());
        assertEquals(1, sender.getNeighborIds().size());

        for (int i = 0; i < 50; i++) {
            context.getEngine().scheduleEvent(i, EventTypeEnum.SENSOR_EVENT, "round", () -> {
                network.p2pBroadcast(blocker, MessageKindEnum.VERIFY_REQ, noise(), null);
                network.p2pBroadcast(sender, MessageKindEnum.VERIFY_REQ, noise(), null);
            });
        }
        context.getEngine().runUntil(100.0);

        NetworkStatsDto stats = network.getStats();
        assertEquals(50, stats.getCollidedBroadcasts());
        assertEquals(50, stats.getPacketsDropped(), "0.8 + 0.2 的丢包概率必然丢失");
        assertEquals(0, stats.getDeliveriesScheduled());
    }

    @Test
    @DisplayName("无碰撞时同样的基础丢包率仍有报文送达")
    void testNoCollisionDeliversSome() {
        setUp(lossyTriangle());
        P2pNetwork network = context.getNetwork();
        SensorNode sender = context.getNode("inner_0");

        for (int i = 0; i < 50; i++) {
            context.getEngine().scheduleEvent(i, EventTypeEnum.SENSOR_EVENT, "round",
                    () -> network.p2pBroadcast(sender, MessageKindEnum.VERIFY_REQ, noise(), null));
        }
        context.getEngine().runUntil(100.0);

        NetworkStatsDto stats = network.getStats();
        assertEquals(0, stats.getCollidedBroadcasts());
        assertTrue(stats.getDeliveriesScheduled() > 0);
        assertEquals(50, stats.getDeliveriesScheduled() + stats.getPacketsDropped());
    }
}
