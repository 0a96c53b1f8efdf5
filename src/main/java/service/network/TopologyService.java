package service.network;

import model.bo.Topology;
import model.dto.request.SimulationConfig;

/**
 * 拓扑计算
 */
public interface TopologyService {

    /**
     * 按双环几何计算节点位置与对称邻接关系
     * @param config 已校验的仿真配置
     * @return 只读拓扑
     */
    Topology computeTopology(SimulationConfig config);
}
