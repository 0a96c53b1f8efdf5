package service.network;

import common.consts.EventTypeEnum;
import common.consts.MessageKindEnum;
import common.util.GisUtil;
import common.util.RandomUtil;
import lombok.extern.slf4j.Slf4j;
import model.bo.SimulationContext;
import model.dto.request.SimulationConfig;
import model.dto.response.NetworkStatsDto;
import model.entity.P2pMessage;
import model.entity.SensorEvent;
import model.entity.SensorNode;

import java.util.Random;

/**
 * 无线网络抽象（无射频物理）：P2P 组播 + 环境事件分发
 *
 * 信道占用用一个全局计数器表示，广播开始时若已有其他传输在进行，
 * 本次广播的每个接收方都附加固定的碰撞丢包概率。
 */
@Slf4j
public class P2pNetwork {

    // 每字节占用信道时间 (秒)
    public static final double TIME_PER_BYTE = 0.002;
    // 碰撞附加丢包概率
    public static final double COLLISION_PENALTY = 0.20;
    // 最小送达时延 (秒)
    public static final double MIN_DELAY = 0.01;

    private final SimulationContext context;

    private int activeTransmissions = 0;
    private final NetworkStatsDto stats = new NetworkStatsDto();

    public P2pNetwork(SimulationContext context) {
        this.context = context;
    }

    /**
     * 把环境事件分发给感知范围内的所有节点（扇出，不是独占分配）
     */
    public void dispatchEventToNodes(SensorEvent event) {
        double sensorRange = context.getConfig().getSensorRange();
        for (SensorNode node : context.getNodes().values()) {
            if (GisUtil.getDistance(event.getPosition(), node.getPosition()) <= sensorRange) {
                node.handleSensorEvent(event, context);
            }
        }
    }

    /**
     * 一次组播：发送方只阻塞信道占用时间，各邻居的送达异步进行
     *
     * @param afterTransmit 信道占用结束后发送方的续体，可为 null（即发即忘）
     */
    public void p2pBroadcast(SensorNode sender, MessageKindEnum kind, SensorEvent payload, Runnable afterTransmit) {
        SimulationConfig config = context.getConfig();
        int size = messageSize(kind, config);

        double collisionPenalty = activeTransmissions > 0 ? COLLISION_PENALTY : 0.0;
        stats.setBroadcasts(stats.getBroadcasts() + 1);
        if (collisionPenalty > 0.0) {
            stats.setCollidedBroadcasts(stats.getCollidedBroadcasts() + 1);
        }

        activeTransmissions++;
        double timeOnAir = size * TIME_PER_BYTE;
        context.getEngine().sleep(timeOnAir, EventTypeEnum.TIME_ON_AIR, sender.getId(), () -> {
            activeTransmissions--;
            fanOut(sender, kind, payload, collisionPenalty);
            if (afterTransmit != null) {
                afterTransmit.run();
            }
        });
    }

    private void fanOut(SensorNode sender, MessageKindEnum kind, SensorEvent payload, double collisionPenalty) {
        SimulationConfig config = context.getConfig();
        Random random = context.getRandom();

        for (String neighborId : sender.getNeighborIds()) {
            SensorNode receiver = context.getNode(neighborId);
            if (receiver == null) {
                // 拓扑不一致 跳过而不是中断仿真
                log.debug("邻居 {} 不存在，跳过: Sender={}", neighborId, sender.getId());
                continue;
            }

            double distance = GisUtil.getDistance(sender.getPosition(), receiver.getPosition());

            // 丢包模型
            double lossProbability = config.getLossBase() + config.getLossPerMeter() * distance + collisionPenalty;
            if (random.nextDouble() < lossProbability) {
                stats.setPacketsDropped(stats.getPacketsDropped() + 1);
                continue;
            }

            // 时延模型
            double delay = config.getDelayBase() + config.getDelayPerMeter() * distance
                    + RandomUtil.uniform(random, -config.getDelayJitter(), config.getDelayJitter());
            delay = Math.max(MIN_DELAY, delay);

            P2pMessage message = new P2pMessage(kind, payload, sender.getId(), context.now() + delay);
            stats.setDeliveriesScheduled(stats.getDeliveriesScheduled() + 1);
            scheduleDelivery(receiver, message, delay);
        }
    }

    private void scheduleDelivery(SensorNode receiver, P2pMessage message, double delay) {
        context.getEngine().spawn(receiver.getId(), () ->
                context.getEngine().sleep(delay, EventTypeEnum.P2P_DELIVERY, receiver.getId(), () -> {
                    stats.setDeliveriesCompleted(stats.getDeliveriesCompleted() + 1);
                    receiver.receiveP2pMessage(message, context);
                }));
    }

    private static int messageSize(MessageKindEnum kind, SimulationConfig config) {
        return switch (kind) {
            case VERIFY_REQ -> config.getMsgSizeVerifyReq();
            case VERIFY_RESP -> config.getMsgSizeVerifyResp();
        };
    }

    public int getActiveTransmissions() {
        return activeTransmissions;
    }

    public NetworkStatsDto getStats() {
        return stats;
    }
}
