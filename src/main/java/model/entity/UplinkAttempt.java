package model.entity;

import lombok.Value;

/**
 * 网关收到的上报尝试（无论是否送达都记录）
 */
@Value
public class UplinkAttempt {
    String nodeId;
    long eventId;
    double time;
    boolean delivered;
}
