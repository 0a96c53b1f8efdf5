package service.network.impl;

import common.consts.RingEnum;
import common.util.GisUtil;
import model.bo.NodePlacement;
import model.bo.Topology;
import model.dto.request.SimulationConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("双环拓扑测试")
class TopologyServiceImplTest {

    private final TopologyServiceImpl topologyService = new TopologyServiceImpl();

    @Test
    @DisplayName("节点编号与位置")
    void testPlacements() {
        Topology topology = topologyService.computeTopology(SimulationConfig.defaults());

        assertEquals(16, topology.size());
        assertEquals("outer_0", topology.getPlacements().get(0).getNodeId());
        assertEquals("inner_7", topology.getPlacements().get(15).getNodeId());

        NodePlacement outer0 = topology.getPlacement("outer_0");
        assertEquals(RingEnum.OUTER, outer0.getRing());
        assertEquals(23.0, outer0.getPosition().getX(), 1e-9);
        assertEquals(0.0, outer0.getPosition().getY(), 1e-9);

        // 内环节点 0 位于 22.5 度
        NodePlacement inner0 = topology.getPlacement("inner_0");
        assertEquals(RingEnum.INNER, inner0.getRing());
        assertEquals(14.0 * Math.cos(Math.toRadians(22.5)), inner0.getPosition().getX(), 1e-9);
        assertEquals(14.0 * Math.sin(Math.toRadians(22.5)), inner0.getPosition().getY(), 1e-9);

        for (NodePlacement p : topology.getPlacements()) {
            double expectedRadius = p.getRing() == RingEnum.OUTER ? 23.0 : 14.0;
            assertEquals(expectedRadius, Math.hypot(p.getPosition().getX(), p.getPosition().getY()), 1e-9);
        }
    }

    @Test
    @DisplayName("邻接关系对称且只包含通信半径内的节点")
    void testNeighborsSymmetricAndInRange() {
        SimulationConfig config = SimulationConfig.defaults();
        Topology topology = topologyService.computeTopology(config);

        assertTrue(topology.isSymmetric());
        for (NodePlacement a : topology.getPlacements()) {
            Set<String> neighbors = topology.neighborsOf(a.getNodeId());
            assertFalse(neighbors.contains(a.getNodeId()), "不包含自身");
            for (NodePlacement b : topology.getPlacements()) {
                if (a == b) {
                    continue;
                }
                boolean inRange = GisUtil.getDistance(a.getPosition(), b.getPosition()) <= config.getP2pRange();
                assertEquals(inRange, neighbors.contains(b.getNodeId()), a.getNodeId() + " -> " + b.getNodeId());
            }
        }
        assertEquals(0, topology.isolatedCount());
    }

    @Test
    @DisplayName("通信半径极小时所有节点孤立")
    void testIsolatedNodes() {
        SimulationConfig config = SimulationConfig.builder().p2pRange(0.001).build();
        Topology topology = topologyService.computeTopology(config);

        assertEquals(16, topology.isolatedCount());
        assertEquals(0, topology.linkCount());
    }

    @Test
    @DisplayName("自定义节点数量")
    void testCustomRingSizes() {
        SimulationConfig config = SimulationConfig.builder()
                .outerRingNodes(4).innerRingNodes(1).innerRingOffsetDeg(0.0).build();
        Topology topology = topologyService.computeTopology(config);

        assertEquals(5, topology.size());
        NodePlacement outer1 = topology.getPlacement("outer_1");
        assertEquals(0.0, outer1.getPosition().getX(), 1e-9);
        assertEquals(23.0, outer1.getPosition().getY(), 1e-9);
        assertNotNull(topology.getPlacement("inner_0"));
        assertNull(topology.getPlacement("inner_1"));
    }
}
