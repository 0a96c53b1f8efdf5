package engine;

import common.consts.EventTypeEnum;
import lombok.Getter;

/**
 * 调度队列中的一个唤醒条目
 * 排序键：(触发时刻, 阶段, 创建序号)
 */
@Getter
public class SimEvent implements Comparable<SimEvent> {

    /**
     * 同一时刻内的执行阶段
     * EXPIRY 在同一时刻的所有 NORMAL 条目之后执行，用于 wait_any 的超时分支
     */
    public enum Phase {
        NORMAL,
        EXPIRY
    }

    private final double triggerTime;       // 绝对虚拟时间 (秒)
    private final Phase phase;              // 同一时刻内的阶段
    private final long creationSequence;    // 创建序号 同一时刻同一阶段按 FIFO
    private final EventTypeEnum type;       // 条目类型 (诊断用)
    private final String subject;           // 相关主体，如节点ID
    private final Runnable action;          // 续体
    private boolean cancelled;              // 组合等待已被另一分支解决

    SimEvent(double triggerTime, Phase phase, long creationSequence,
             EventTypeEnum type, String subject, Runnable action) {
        this.triggerTime = triggerTime;
        this.phase = phase;
        this.creationSequence = creationSequence;
        this.type = type;
        this.subject = subject;
        this.action = action;
        this.cancelled = false;
    }

    void cancel() {
        this.cancelled = true;
    }

    @Override
    public int compareTo(SimEvent other) {
        //  按时间早晚排
        int timeCompare = Double.compare(this.triggerTime, other.triggerTime);
        if (timeCompare != 0) {
            return timeCompare;
        }
        //  时间相同 超时分支排在普通条目之后
        int phaseCompare = this.phase.compareTo(other.phase);
        if (phaseCompare != 0) {
            return phaseCompare;
        }
        //  按创建顺序排 确保先调度的先执行
        return Long.compare(this.creationSequence, other.creationSequence);
    }
}
