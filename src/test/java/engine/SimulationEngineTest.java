package engine;

import common.consts.EventTypeEnum;
import common.exception.SimulationDeadLoopException;
import model.dto.snapshot.EventLogEntryDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 仿真内核测试：时钟推进、同刻排序、挂起原语
 */
@DisplayName("仿真内核测试")
@Timeout(10)
class SimulationEngineTest {

    private SimulationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SimulationEngine(100, 50);
    }

    @Test
    @DisplayName("单步推进：时钟跳到条目时刻")
    void testSingleEventStepping() {
        List<String> executed = new ArrayList<>();
        engine.scheduleEvent(10.0, EventTypeEnum.SENSOR_EVENT, "A", () -> executed.add("A"));
        engine.scheduleEvent(20.0, EventTypeEnum.SENSOR_EVENT, "B", () -> executed.add("B"));

        assertEquals(0.0, engine.now(), "初始时钟应该是0");

        SimEvent first = engine.stepNextEvent();
        assertNotNull(first);
        assertEquals("A", first.getSubject());
        assertEquals(10.0, engine.now());

        SimEvent second = engine.stepNextEvent();
        assertNotNull(second);
        assertEquals(20.0, engine.now());

        assertNull(engine.stepNextEvent(), "队列已空");
        assertEquals(List.of("A", "B"), executed);
        assertEquals(2L, engine.getProcessedCount());
    }

    @Test
    @DisplayName("同一时刻按调度顺序执行（FIFO）")
    void testSameTimeFifo() {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int index = i;
            engine.scheduleEvent(1.0, EventTypeEnum.SENSOR_EVENT, "N" + i, () -> order.add(index));
        }
        engine.runUntil(5.0);
        assertEquals(List.of(0, 1, 2, 3, 4), order);
    }

    @Test
    @DisplayName("spawn 不抢占当前续体，在同一时刻之后执行")
    void testSpawnRunsAfterCurrentContinuation() {
        List<String> order = new ArrayList<>();
        engine.scheduleEvent(2.0, EventTypeEnum.SENSOR_EVENT, "parent", () -> {
            engine.spawn("child", () -> order.add("child@" + engine.now()));
            order.add("parent");
        });
        engine.runUntil(10.0);
        assertEquals(List.of("parent", "child@2.0"), order);
    }

    @Test
    @DisplayName("runUntil：超过终止时刻的条目不执行，时钟停在终止时刻")
    void testRunUntilHorizon() {
        List<String> executed = new ArrayList<>();
        engine.scheduleEvent(10.0, EventTypeEnum.SENSOR_EVENT, "in", () -> executed.add("in"));
        engine.scheduleEvent(15.0, EventTypeEnum.SENSOR_EVENT, "edge", () -> executed.add("edge"));
        engine.scheduleEvent(20.0, EventTypeEnum.SENSOR_EVENT, "out", () -> executed.add("out"));

        engine.runUntil(15.0);

        assertEquals(List.of("in", "edge"), executed, "等于终止时刻的条目仍然执行");
        assertEquals(15.0, engine.now());
        assertEquals(1, engine.pendingCount());
    }

    @Test
    @DisplayName("负延迟被拒绝")
    void testNegativeDelayRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.scheduleEvent(-1.0, EventTypeEnum.SENSOR_EVENT, "X", () -> { }));
        assertThrows(IllegalArgumentException.class,
                () -> engine.scheduleEvent(Double.NaN, EventTypeEnum.SENSOR_EVENT, "X", () -> { }));
    }

    @Test
    @DisplayName("信号触发幂等")
    void testSignalTriggerIdempotent() {
        SimSignal signal = new SimSignal("s");
        List<Double> resumed = new ArrayList<>();
        engine.await(signal, "W", () -> resumed.add(engine.now()));

        engine.scheduleEvent(4.0, EventTypeEnum.SENSOR_EVENT, "T", () -> {
            assertTrue(signal.trigger());
            assertFalse(signal.trigger(), "第二次触发无效");
        });
        engine.runUntil(10.0);

        assertTrue(signal.isTriggered());
        assertEquals(List.of(4.0), resumed, "等待者只恢复一次，且在触发时刻恢复");
    }

    @Test
    @DisplayName("awaitAny：信号先到则取消超时")
    void testAwaitAnySignalled() {
        SimSignal signal = new SimSignal("s");
        List<String> outcomes = new ArrayList<>();
        engine.awaitAny(signal, 3.0, "W", outcome -> outcomes.add(outcome + "@" + engine.now()));
        engine.scheduleEvent(1.5, EventTypeEnum.SENSOR_EVENT, "T", signal::trigger);

        engine.runUntil(10.0);

        assertEquals(List.of("SIGNALLED@1.5"), outcomes);
        assertEquals(0, engine.pendingCount(), "超时条目已从队列移除");
    }

    @Test
    @DisplayName("awaitAny：超时先到，之后的触发不再恢复")
    void testAwaitAnyTimedOut() {
        SimSignal signal = new SimSignal("s");
        List<String> outcomes = new ArrayList<>();
        engine.awaitAny(signal, 3.0, "W", outcome -> outcomes.add(outcome + "@" + engine.now()));
        engine.scheduleEvent(3.5, EventTypeEnum.SENSOR_EVENT, "T", signal::trigger);

        engine.runUntil(10.0);

        assertEquals(List.of("TIMED_OUT@3.0"), outcomes);
    }

    @Test
    @DisplayName("awaitAny：信号恰好在超时时刻触发，按信号处理")
    void testAwaitAnyBoundaryTieGoesToSignal() {
        SimSignal signal = new SimSignal("s");
        List<WaitOutcome> outcomes = new ArrayList<>();
        // 超时条目先于触发条目创建
        engine.awaitAny(signal, 3.0, "W", outcomes::add);
        engine.scheduleEvent(3.0, EventTypeEnum.P2P_DELIVERY, "T", signal::trigger);

        engine.runUntil(10.0);

        assertEquals(List.of(WaitOutcome.SIGNALLED), outcomes);
    }

    @Test
    @DisplayName("awaitAny：等待开始前信号已触发，立即恢复")
    void testAwaitAnyAlreadyTriggered() {
        SimSignal signal = new SimSignal("s");
        signal.trigger();
        List<WaitOutcome> outcomes = new ArrayList<>();
        engine.awaitAny(signal, 3.0, "W", outcomes::add);
        engine.runUntil(10.0);
        assertEquals(List.of(WaitOutcome.SIGNALLED), outcomes);
    }

    @Test
    @DisplayName("死循环检测：同一时刻条目数超过阈值")
    void testDeadLoopGuard() {
        Runnable[] loop = new Runnable[1];
        loop[0] = () -> engine.spawn("loop", loop[0]);
        engine.spawn("loop", loop[0]);

        SimulationDeadLoopException e = assertThrows(SimulationDeadLoopException.class, () -> engine.runUntil(1.0));
        assertEquals(0.0, e.getSimTime());
        assertTrue(e.getEventCount() > 100);
        assertEquals(100, e.getThreshold());
        assertEquals("loop", e.getLastSubject());
    }

    @Test
    @DisplayName("条目异常原样抛出")
    void testActionFailurePropagates() {
        engine.scheduleEvent(1.0, EventTypeEnum.SENSOR_EVENT, "bad", () -> {
            throw new IllegalStateException("boom");
        });
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> engine.runUntil(5.0));
        assertEquals("boom", e.getMessage());
    }

    @Test
    @DisplayName("事件日志只保留最近 N 条")
    void testEventLogCapacity() {
        for (int i = 1; i <= 60; i++) {
            engine.scheduleEvent(i, EventTypeEnum.SENSOR_EVENT, "E" + i, () -> { });
        }
        engine.runUntil(100.0);

        SimulationEventLog eventLog = engine.getEventLog();
        assertEquals(50, eventLog.size());
        List<EventLogEntryDto> all = eventLog.listAll();
        assertEquals(11.0, all.get(0).getSimTime());
        assertEquals(60.0, all.get(all.size() - 1).getSimTime());
        assertEquals(6, eventLog.listSince(55.0).size());
    }
}
