package common.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 仿真内核配置
 * 与单次仿真参数（SimulationConfig）无关的引擎级常量，统一从这里集中管理。
 *
 * 可以通过 Spring 配置文件覆盖：
 *
 * sim.engine.max-events-per-timestamp
 * sim.engine.horizon-margin
 * sim.engine.event-log-capacity
 */
@Configuration
@ConfigurationProperties(prefix = "sim.engine")
@Data
public class EngineConfig {

    // 死循环阈值中 n^3 项的系数
    public static final long PER_NODE_CUBE = 4L;

    /**
     * 单一虚拟时刻允许处理的最大条目数量基数（防止死循环）
     * 实际阈值随节点数放大，见 maxEventsPerTimestampFor
     */
    private int maxEventsPerTimestamp = 10_000;

    /**
     * 仿真终止时刻 = event_count * event_interval_mean + horizonMargin (秒)
     */
    private double horizonMargin = 200.0;

    /**
     * 内存事件日志保留的最近条目数
     */
    private int eventLogCapacity = 1000;

    /**
     * 单次仿真的死循环阈值
     *
     * 合法仿真在同一时刻的条目数有上界：一个环境事件最多让 n 个节点同时广播请求，
     * 每个请求送达后最多引出一次回复广播，每次回复再扇出到 n-1 个邻居，
     * 因此同刻条目数不超过 PER_NODE_CUBE * n^3。阈值取 基数 + 该上界。
     */
    public int maxEventsPerTimestampFor(int totalNodes) {
        long n = Math.max(1, totalNodes);
        long bound = (long) maxEventsPerTimestamp + PER_NODE_CUBE * n * n * n;
        return (int) Math.min(Integer.MAX_VALUE, bound);
    }
}
