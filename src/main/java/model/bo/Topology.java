package model.bo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 网络拓扑：节点位置 + 对称邻接关系
 * 构建一次，此后只读。遍历顺序即节点创建顺序（外环在前，内环在后）。
 */
public class Topology {

    private final List<NodePlacement> placements;
    private final Map<String, NodePlacement> placementById;
    private final Map<String, Set<String>> neighbors;

    public Topology(List<NodePlacement> placements, Map<String, Set<String>> neighbors) {
        this.placements = List.copyOf(placements);
        Map<String, NodePlacement> byId = new LinkedHashMap<>();
        for (NodePlacement p : placements) {
            byId.put(p.getNodeId(), p);
        }
        this.placementById = Collections.unmodifiableMap(byId);
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        for (NodePlacement p : placements) {
            Set<String> ids = neighbors.getOrDefault(p.getNodeId(), Collections.emptySet());
            copy.put(p.getNodeId(), Collections.unmodifiableSet(new LinkedHashSet<>(ids)));
        }
        this.neighbors = Collections.unmodifiableMap(copy);
    }

    public List<NodePlacement> getPlacements() {
        return placements;
    }

    public NodePlacement getPlacement(String nodeId) {
        return placementById.get(nodeId);
    }

    public Set<String> neighborsOf(String nodeId) {
        return neighbors.getOrDefault(nodeId, Collections.emptySet());
    }

    public Map<String, Set<String>> getNeighbors() {
        return neighbors;
    }

    public int size() {
        return placements.size();
    }

    /**
     * 无向边数
     */
    public int linkCount() {
        int degreeSum = 0;
        for (Set<String> ids : neighbors.values()) {
            degreeSum += ids.size();
        }
        return degreeSum / 2;
    }

    public int isolatedCount() {
        int count = 0;
        for (Set<String> ids : neighbors.values()) {
            if (ids.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    /**
     * B ∈ neighbors(A) ⇔ A ∈ neighbors(B)
     */
    public boolean isSymmetric() {
        for (Map.Entry<String, Set<String>> entry : neighbors.entrySet()) {
            for (String other : entry.getValue()) {
                if (!neighborsOf(other).contains(entry.getKey())) {
                    return false;
                }
            }
        }
        return true;
    }
}
