package common.exception;

import common.util.TimeUtil;

/**
 * 仿真死循环异常 同一虚拟时刻处理的条目数超过阈值时抛出
 * 属于内部故障：说明某个进程在不推进时钟的情况下反复调度自身
 */
public class SimulationDeadLoopException extends RuntimeException {
    private final double simTime;
    private final int eventCount;
    private final int threshold;
    private final String lastSubject;

    public SimulationDeadLoopException(double simTime, int eventCount, int threshold, String lastSubject) {
        super(String.format("仿真死循环检测: 时刻 %s 已处理 %d 个条目，超过阈值 %d，最后主体 %s",
                TimeUtil.formatSimTime(simTime), eventCount, threshold, lastSubject));
        this.simTime = simTime;
        this.eventCount = eventCount;
        this.threshold = threshold;
        this.lastSubject = lastSubject;
    }

    public double getSimTime() {
        return simTime;
    }

    public int getEventCount() {
        return eventCount;
    }

    public int getThreshold() {
        return threshold;
    }

    public String getLastSubject() {
        return lastSubject;
    }
}
