package service.workload;

import common.consts.EventKindEnum;
import common.consts.EventTypeEnum;
import common.util.GisUtil;
import common.util.RandomUtil;
import lombok.extern.slf4j.Slf4j;
import model.bo.SimulationContext;
import model.dto.request.SimulationConfig;
import model.entity.Point;
import model.entity.SensorEvent;

import java.util.Random;

/**
 * 工作负载发生器：按泊松过程产生 event_count 个环境事件
 *
 * 每个事件的抽样顺序固定：间隔 -> 类别 -> 角度 -> 半径 -> 持续时长
 */
@Slf4j
public class WorkloadGenerator {

    public static final String SUBJECT = "workload";

    // 事件分布区域略大于外环
    public static final double AREA_MARGIN = 5.0;

    private final SimulationContext context;
    private long eventCounter = 0L;

    public WorkloadGenerator(SimulationContext context) {
        this.context = context;
    }

    public void start() {
        int count = context.getConfig().getEventCount();
        context.getEngine().spawn(SUBJECT, () -> next(count));
    }

    private void next(int remaining) {
        if (remaining <= 0) {
            log.debug("工作负载生成完毕: 共 {} 个事件", eventCounter);
            return;
        }
        SimulationConfig config = context.getConfig();
        double interval = RandomUtil.exponential(context.getRandom(), config.getEventIntervalMean());
        context.getEngine().sleep(interval, EventTypeEnum.SENSOR_EVENT, SUBJECT, () -> {
            SensorEvent event = createEvent(config);
            context.recordEvent(event);
            context.getNetwork().dispatchEventToNodes(event);
            next(remaining - 1);
        });
    }

    private SensorEvent createEvent(SimulationConfig config) {
        Random random = context.getRandom();
        boolean intruder = RandomUtil.bernoulli(random, config.getIntruderProbability());
        EventKindEnum kind = intruder ? EventKindEnum.INTRUDER : EventKindEnum.NOISE;

        // 圆盘内面积均匀分布
        double maxRadius = config.getOuterRingRadius() + AREA_MARGIN;
        double angle = RandomUtil.uniform(random, 0.0, 2 * Math.PI);
        double radius = maxRadius * Math.sqrt(random.nextDouble());
        Point position = GisUtil.fromPolar(radius, angle);

        double duration = RandomUtil.uniform(random, 1.0, 5.0);
        return new SensorEvent(eventCounter++, kind, context.now(), position, duration);
    }
}
