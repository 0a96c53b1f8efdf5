package common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 统计工具：均值、最大值、线性插值分位数、四舍五入
 * 空集合一律返回 0.0
 */
public final class StatsUtil {

    private StatsUtil() {}

    public static double mean(List<? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Number v : values) {
            sum += v.doubleValue();
        }
        return sum / values.size();
    }

    public static double max(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        return Collections.max(values);
    }

    /**
     * 线性插值分位数，percentile 取值 [0, 100]
     */
    public static double percentile(List<Double> values, double percentile) {
        if (values.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        double rank = (sorted.size() - 1) * (percentile / 100.0);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double lowerValue = sorted.get(lower);
        double upperValue = sorted.get(upper);
        return lowerValue + (upperValue - lowerValue) * (rank - lower);
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * 安全除法 分母为 0 时返回 0.0
     */
    public static double ratio(long numerator, long denominator) {
        return denominator > 0 ? (double) numerator / denominator : 0.0;
    }
}
