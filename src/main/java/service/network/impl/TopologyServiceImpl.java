package service.network.impl;

import common.consts.RingEnum;
import common.util.GisUtil;
import model.bo.NodePlacement;
import model.bo.Topology;
import model.dto.request.SimulationConfig;
import org.springframework.stereotype.Service;
import service.network.TopologyService;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 双环拓扑
 * 外环节点 i：角度 i * 360 / n_outer
 * 内环节点 i：角度 i * 360 / n_inner + offset
 * 邻接：两两比较，距离 <= p2p_range 即连一条无向边
 */
@Service
public class TopologyServiceImpl implements TopologyService {

    @Override
    public Topology computeTopology(SimulationConfig config) {
        List<NodePlacement> placements = computePlacements(config);
        return new Topology(placements, computeNeighbors(placements, config.getP2pRange()));
    }

    private List<NodePlacement> computePlacements(SimulationConfig config) {
        List<NodePlacement> placements = new ArrayList<>();

        // 外环
        int outer = config.getOuterRingNodes();
        for (int i = 0; i < outer; i++) {
            double angleDeg = i * (360.0 / outer);
            placements.add(new NodePlacement(RingEnum.OUTER.nodeId(i), RingEnum.OUTER,
                    GisUtil.pointOnCircle(config.getOuterRingRadius(), angleDeg)));
        }

        // 内环
        int inner = config.getInnerRingNodes();
        for (int i = 0; i < inner; i++) {
            double angleDeg = i * (360.0 / inner) + config.getInnerRingOffsetDeg();
            placements.add(new NodePlacement(RingEnum.INNER.nodeId(i), RingEnum.INNER,
                    GisUtil.pointOnCircle(config.getInnerRingRadius(), angleDeg)));
        }
        return placements;
    }

    private Map<String, Set<String>> computeNeighbors(List<NodePlacement> placements, double p2pRange) {
        Map<String, Set<String>> neighbors = new LinkedHashMap<>();
        for (NodePlacement p : placements) {
            neighbors.put(p.getNodeId(), new LinkedHashSet<>());
        }

        // 节点数量很小 O(n^2) 全量比较即可
        for (int i = 0; i < placements.size(); i++) {
            NodePlacement a = placements.get(i);
            for (int j = i + 1; j < placements.size(); j++) {
                NodePlacement b = placements.get(j);
                if (GisUtil.getDistance(a.getPosition(), b.getPosition()) <= p2pRange) {
                    neighbors.get(a.getNodeId()).add(b.getNodeId());
                    neighbors.get(b.getNodeId()).add(a.getNodeId());
                }
            }
        }
        return neighbors;
    }
}
