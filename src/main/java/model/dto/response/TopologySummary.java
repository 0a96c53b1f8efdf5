package model.dto.response;

import lombok.Data;

@Data
public class TopologySummary {
    private int totalNodes;
    private int outerNodes;
    private int innerNodes;
    private int neighborLinks;     // 无向邻接边数
    private int isolatedNodes;     // 无邻居的节点数
}
