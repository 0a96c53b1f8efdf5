package common.util;

import java.util.Random;

/**
 * 随机抽样工具
 * 每个方法只从传入的随机流中取固定次数，调用顺序即复现契约的一部分
 */
public final class RandomUtil {

    private RandomUtil() {}

    /**
     * 指数分布（给定均值），消耗一次均匀抽样
     */
    public static double exponential(Random random, double mean) {
        return -Math.log(1.0 - random.nextDouble()) * mean;
    }

    /**
     * [low, high) 均匀分布，消耗一次均匀抽样
     */
    public static double uniform(Random random, double low, double high) {
        return low + (high - low) * random.nextDouble();
    }

    /**
     * 伯努利试验，消耗一次均匀抽样
     */
    public static boolean bernoulli(Random random, double probability) {
        return random.nextDouble() < probability;
    }

    /**
     * 正态分布
     */
    public static double gaussian(Random random, double mean, double std) {
        return mean + std * random.nextGaussian();
    }

    /**
     * 截断到 [0, 1]
     */
    public static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
