package model.entity;

import common.consts.EventKindEnum;
import lombok.Value;

/**
 * 环境事件（入侵或噪声）
 * 仅由工作负载发生器创建，创建后不可变
 */
@Value
public class SensorEvent {
    long id;             // 单调递增的事件序号
    EventKindEnum kind;  // 事件类别
    double time;         // 发生时刻 (虚拟时间)
    Point position;      // 发生位置
    double duration;     // 持续时长 (秒)

    public boolean isIntruder() {
        return kind == EventKindEnum.INTRUDER;
    }
}
