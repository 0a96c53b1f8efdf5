package engine;

import common.consts.EventTypeEnum;
import common.exception.SimulationDeadLoopException;
import common.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;
import model.dto.snapshot.EventLogEntryDto;

import java.util.PriorityQueue;
import java.util.function.Consumer;

/**
 * 离散事件仿真内核：虚拟时钟 + 唤醒队列 + 进程挂起原语
 *
 * 所有“并发”的网关、网络、节点进程都复用这一条队列，单线程逐个执行。
 * 进程以续体（Runnable）表示，挂起点只有 sleep / await / awaitAny。
 * 每次仿真独享一个引擎实例，不得跨仿真复用。
 */
@Slf4j
public class SimulationEngine {

    private final PriorityQueue<SimEvent> eventQueue = new PriorityQueue<>();
    private final SimulationEventLog eventLog;
    private final int maxEventsPerTimestamp;

    // 虚拟时钟 (秒) 只能通过处理条目向前推进
    private double now = 0.0;
    // 创建序号 解决同一时刻的排序
    private long sequenceGenerator = 0L;
    private long processedCount = 0L;

    public SimulationEngine(int maxEventsPerTimestamp, int eventLogCapacity) {
        this.maxEventsPerTimestamp = maxEventsPerTimestamp;
        this.eventLog = new SimulationEventLog(eventLogCapacity);
    }

    public double now() {
        return now;
    }

    /**
     * 注入新条目：在 now + delay 时刻执行 action
     */
    public SimEvent scheduleEvent(double delay, EventTypeEnum type, String subject, Runnable action) {
        return schedule(delay, SimEvent.Phase.NORMAL, type, subject, action);
    }

    private SimEvent schedule(double delay, SimEvent.Phase phase, EventTypeEnum type, String subject, Runnable action) {
        if (!(delay >= 0.0) || Double.isInfinite(delay)) {
            throw new IllegalArgumentException("调度延迟必须为非负有限值: " + delay);
        }
        SimEvent event = new SimEvent(now + delay, phase, sequenceGenerator++, type, subject, action);
        eventQueue.add(event);
        return event;
    }

    /**
     * 取消尚未执行的条目
     * @return 是否成功取消（条目存在且未被处理）
     */
    public boolean cancelEvent(SimEvent event) {
        if (event == null || event.isCancelled()) {
            return false;
        }
        event.cancel();
        return eventQueue.remove(event);
    }

    // ------------------------------------------------------------------
    // 进程原语
    // ------------------------------------------------------------------

    /**
     * 启动新进程：在当前时刻排队执行（不抢占当前续体）
     */
    public void spawn(String subject, Runnable process) {
        scheduleEvent(0.0, EventTypeEnum.PROCESS_START, subject, process);
    }

    /**
     * sleep(d)：在 now + d 恢复
     */
    public void sleep(double duration, EventTypeEnum type, String subject, Runnable then) {
        scheduleEvent(duration, type, subject, then);
    }

    /**
     * wait(signal)：信号触发后在触发时刻恢复
     */
    public void await(SimSignal signal, String subject, Runnable then) {
        if (signal.isTriggered()) {
            scheduleEvent(0.0, EventTypeEnum.SIGNAL_RESUME, subject, then);
            return;
        }
        signal.addWaiter(() -> scheduleEvent(0.0, EventTypeEnum.SIGNAL_RESUME, subject, then));
    }

    /**
     * wait_any(signal, timeout)：信号触发或超时，先到者恢复，且只恢复一次
     *
     * 超时分支排在 EXPIRY 阶段：若信号恰好在超时时刻触发，信号优先，
     * 即边界时刻到达的确认视为确认而不是超时。
     */
    public void awaitAny(SimSignal signal, double timeout, String subject, Consumer<WaitOutcome> then) {
        if (signal.isTriggered()) {
            scheduleEvent(0.0, EventTypeEnum.SIGNAL_RESUME, subject, () -> then.accept(WaitOutcome.SIGNALLED));
            return;
        }
        AnyOfWait wait = new AnyOfWait();
        wait.expiry = schedule(timeout, SimEvent.Phase.EXPIRY, EventTypeEnum.WAIT_EXPIRY, subject, () -> {
            if (wait.resolved) {
                return;
            }
            wait.resolved = true;
            then.accept(WaitOutcome.TIMED_OUT);
        });
        signal.addWaiter(() -> {
            if (wait.resolved) {
                return;
            }
            wait.resolved = true;
            cancelEvent(wait.expiry);
            scheduleEvent(0.0, EventTypeEnum.SIGNAL_RESUME, subject, () -> then.accept(WaitOutcome.SIGNALLED));
        });
    }

    /**
     * 组合等待的解决状态
     */
    private static final class AnyOfWait {
        private boolean resolved;
        private SimEvent expiry;
    }

    // ------------------------------------------------------------------
    // 时钟推进
    // ------------------------------------------------------------------

    /**
     * 处理下一个条目（单步推进）
     *
     * @return 处理的条目，如果没有条目则返回null
     */
    public SimEvent stepNextEvent() {
        SimEvent nextEvent = pollLive();
        if (nextEvent == null) {
            return null;
        }
        processEvent(nextEvent);
        return nextEvent;
    }

    /**
     * 推进仿真到指定时刻：依次处理所有触发时刻不晚于 horizon 的条目
     * 超过 horizon 的条目保留在队列中，不再执行
     */
    public void runUntil(double horizon) {
        int sameTimeEventCount = 0;
        double lastProcessedTime = Double.NaN;

        while (true) {
            SimEvent nextEvent = peekLive();
            if (nextEvent == null || nextEvent.getTriggerTime() > horizon) {
                break;
            }

            // 死循环检测：检查同一时刻的条目数量
            if (nextEvent.getTriggerTime() == lastProcessedTime) {
                sameTimeEventCount++;
                if (sameTimeEventCount > maxEventsPerTimestamp) {
                    throw new SimulationDeadLoopException(lastProcessedTime, sameTimeEventCount,
                            maxEventsPerTimestamp, nextEvent.getSubject());
                }
            } else {
                lastProcessedTime = nextEvent.getTriggerTime();
                sameTimeEventCount = 1;
            }

            eventQueue.poll();
            processEvent(nextEvent);
        }

        // 队列耗尽或下一个条目超过终止时刻 时钟停在终止时刻
        if (horizon > now) {
            now = horizon;
        }
    }

    private SimEvent peekLive() {
        SimEvent head = eventQueue.peek();
        while (head != null && head.isCancelled()) {
            eventQueue.poll();
            head = eventQueue.peek();
        }
        return head;
    }

    private SimEvent pollLive() {
        SimEvent head = peekLive();
        if (head != null) {
            eventQueue.poll();
        }
        return head;
    }

    private void processEvent(SimEvent nextEvent) {
        // 时钟严格按条目时间推进
        now = nextEvent.getTriggerTime();
        processedCount++;

        EventLogEntryDto logEntry = new EventLogEntryDto();
        logEntry.setSimTime(now);
        logEntry.setType(nextEvent.getType());
        logEntry.setSequence(nextEvent.getCreationSequence());
        logEntry.setExpiryPhase(nextEvent.getPhase() == SimEvent.Phase.EXPIRY);
        logEntry.setSubject(nextEvent.getSubject());
        eventLog.append(logEntry);

        if (log.isTraceEnabled()) {
            log.trace("执行条目: Time={}, Type={}, Seq={}, Subject={}",
                    TimeUtil.formatSimTime(now), nextEvent.getType(),
                    nextEvent.getCreationSequence(), nextEvent.getSubject());
        }

        try {
            nextEvent.getAction().run();
        } catch (RuntimeException e) {
            log.error("条目处理异常: Type={}, Seq={}, Time={}, Subject={}",
                    nextEvent.getType(), nextEvent.getCreationSequence(),
                    TimeUtil.formatSimTime(now), nextEvent.getSubject(), e);
            throw e;
        }
    }

    /**
     * 队列中尚未执行的条目数
     */
    public int pendingCount() {
        return (int) eventQueue.stream().filter(e -> !e.isCancelled()).count();
    }

    public long getProcessedCount() {
        return processedCount;
    }

    public SimulationEventLog getEventLog() {
        return eventLog;
    }
}
