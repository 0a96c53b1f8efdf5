package common.consts;

/**
 * 调度队列中的条目类型（仅用于事件日志与诊断，不参与排序）
 */
public enum EventTypeEnum {
    // 进程生命周期
    PROCESS_START,     // 新进程在当前时刻启动
    SIGNAL_RESUME,     // 等待的信号被触发后恢复
    WAIT_EXPIRY,       // wait_any 超时分支

    // 业务来源
    SENSOR_EVENT,      // 工作负载发生器产生环境事件
    GATEWAY_TOGGLE,    // 网关可用性切换
    TIME_ON_AIR,       // 广播占用信道结束
    P2P_DELIVERY       // 点对点报文送达
}
