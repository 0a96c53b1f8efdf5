package engine;

import java.util.ArrayList;
import java.util.List;

/**
 * 会合信号（事件句柄）
 * trigger() 幂等：重复触发无任何效果
 */
public class SimSignal {

    private final String name;
    private boolean triggered;
    private final List<Runnable> waiters = new ArrayList<>();

    public SimSignal(String name) {
        this.name = name;
    }

    /**
     * 触发信号，唤醒所有等待者
     * @return 本次调用是否真正触发（已触发过返回 false）
     */
    public boolean trigger() {
        if (triggered) {
            return false;
        }
        triggered = true;
        List<Runnable> pending = new ArrayList<>(waiters);
        waiters.clear();
        for (Runnable waiter : pending) {
            waiter.run();
        }
        return true;
    }

    public boolean isTriggered() {
        return triggered;
    }

    public String getName() {
        return name;
    }

    void addWaiter(Runnable waiter) {
        waiters.add(waiter);
    }

    @Override
    public String toString() {
        return "SimSignal{" + name + (triggered ? ", triggered" : "") + "}";
    }
}
