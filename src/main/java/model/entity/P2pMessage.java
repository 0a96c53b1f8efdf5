package model.entity;

import common.consts.MessageKindEnum;
import lombok.Value;

/**
 * P2P 报文 仅作为送达续体的参数存在，不持久化
 */
@Value
public class P2pMessage {
    MessageKindEnum kind;
    SensorEvent payload;
    String senderId;
    double scheduledDeliveryTime;
}
