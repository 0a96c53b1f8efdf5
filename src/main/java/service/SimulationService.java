package service;

import common.Result;
import model.bo.SimulationContext;
import model.dto.request.SimulationConfig;
import model.dto.response.SimulationResult;

/**
 * 仿真入口
 * 无状态：每次调用独立构建引擎、网关、网络与节点，可被多个调用方同时使用
 */
public interface SimulationService {

    /**
     * 校验配置并执行一次完整仿真
     * @return 配置非法时 success=false 且只带错误列表
     */
    SimulationResult run(SimulationConfig config);

    /**
     * 外部任务执行器使用的包装：成功时 data 为 SimulationResult，失败时只有一条描述性错误信息
     */
    Result runJob(SimulationConfig config);

    /**
     * 只运行仿真内核到终止时刻，返回原始上下文（事件日志、检测日志、节点状态）
     * 调用方需保证配置已通过校验
     */
    SimulationContext simulate(SimulationConfig config);
}
