package model.entity;

import lombok.Builder;
import lombok.Value;

/**
 * 检测记录：节点上报网关时生成，每个节点每个事件最多一条
 */
@Value
@Builder
public class DetectionRecord {
    long eventId;
    String nodeId;
    double detectionTime;
    @Builder.Default
    boolean confirmed = true;
    boolean usedP2p;           // 是否经过 P2P 校验
    int p2pMessagesSent;       // 本节点视角发出的逻辑广播数
    boolean gatewayWasUp;      // 上报瞬间网关是否可用
    double latency;            // detectionTime - event.time
    boolean truePositive;      // 事件是否为真实入侵
    double confidence;         // [0, 1]
}
