package model.entity;

import common.consts.EventTypeEnum;
import common.util.RandomUtil;
import common.util.TimeUtil;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import model.bo.SimulationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * 网关：交替可用/不可用的常驻进程，同步接收节点上报
 */
@Slf4j
@Getter
public class Gateway {

    public static final String SUBJECT = "gateway";

    private boolean up = true;

    // 上报尝试日志（诊断用，指标计算使用检测记录上的 gatewayWasUp）
    private final List<UplinkAttempt> uplinkAttempts = new ArrayList<>();

    private long outageCount = 0L;

    /**
     * 启动可用性进程：up 阶段 -> down 阶段 -> up ... 永不结束
     */
    public void start(SimulationContext context) {
        context.getEngine().spawn(SUBJECT, () -> upPhase(context));
    }

    private void upPhase(SimulationContext context) {
        double upDuration = RandomUtil.exponential(context.getRandom(), context.getConfig().getGatewayUpDurationMean());
        context.getEngine().sleep(upDuration, EventTypeEnum.GATEWAY_TOGGLE, SUBJECT, () -> {
            this.up = false;
            this.outageCount++;
            log.debug("网关中断: Time={}", TimeUtil.formatSimTime(context.now()));
            downPhase(context);
        });
    }

    private void downPhase(SimulationContext context) {
        double downDuration = RandomUtil.exponential(context.getRandom(), context.getConfig().getGatewayDownDurationMean());
        context.getEngine().sleep(downDuration, EventTypeEnum.GATEWAY_TOGGLE, SUBJECT, () -> {
            this.up = true;
            log.debug("网关恢复: Time={}", TimeUtil.formatSimTime(context.now()));
            upPhase(context);
        });
    }

    /**
     * 接收上报：返回当前是否可用，无论结果都记录一次尝试
     */
    public boolean receiveUplink(String nodeId, long eventId, double time) {
        boolean delivered = this.up;
        uplinkAttempts.add(new UplinkAttempt(nodeId, eventId, time, delivered));
        return delivered;
    }
}
