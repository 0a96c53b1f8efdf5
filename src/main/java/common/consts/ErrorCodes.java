package common.consts;

/**
 * 全局错误信息常量池
 */
public class ErrorCodes {
    // 基础错误
    public static final String SYSTEM_ERROR = "系统内部错误";
    public static final String VALIDATION_FAILED = "仿真配置校验失败";

    // 配置文件
    public static final String CONFIG_FILE_NOT_FOUND = "配置文件不存在";
    public static final String CONFIG_FILE_INVALID = "配置文件格式错误";
    public static final String ARGUMENT_INVALID = "命令行参数格式错误";

    //  参数错误
    public static final String EVENT_COUNT_RANGE = "event_count must be between 0 and 100000";
    public static final String RING_NODES_MIN = "Ring nodes must be at least 1";
    public static final String RING_NODES_MAX = "Ring nodes must be at most 10000";
    public static final String RADIUS_ORDER = "outer_ring_radius must be greater than inner_ring_radius";
    public static final String THRESHOLD_ORDER = "verify_threshold should be less than or equal to confirm_threshold";
}
