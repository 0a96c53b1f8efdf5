package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一次决策流程的最终结果
 */
@Getter
@AllArgsConstructor
public enum DecisionOutcomeEnum {
    TIER1_UPLINK("一级：高置信度直接上报"),
    VERIFIED_UPLINK("二级：邻居确认后上报"),
    VERIFICATION_TIMEOUT("二级：校验超时丢弃"),
    IGNORED("三级：低置信度忽略");

    private final String desc;
}
