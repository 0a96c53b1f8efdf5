package model.dto.response;

import lombok.Data;

/**
 * P2P 网络诊断计数
 */
@Data
public class NetworkStatsDto {
    private long broadcasts;          // 逻辑广播次数
    private long collidedBroadcasts;  // 发生碰撞惩罚的广播次数
    private long deliveriesScheduled; // 成功调度的送达
    private long packetsDropped;      // 丢包
    private long deliveriesCompleted; // 在终止时刻前实际送达
}
