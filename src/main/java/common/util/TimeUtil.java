package common.util;

import java.util.Locale;

/**
 * 仿真时间格式化工具
 * 虚拟时钟以秒为单位的 double 表示，与系统时间无关
 */
public final class TimeUtil {

    private TimeUtil() {}

    /** 虚拟时间戳转可读时间 */
    public static String formatSimTime(double simTimeSec) {
        return String.format(Locale.ROOT, "%.3fs", simTimeSec);
    }

    /** 纳秒耗时转秒 */
    public static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }
}
