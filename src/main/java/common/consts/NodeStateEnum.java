package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 节点单次决策流程的状态
 * Analyzing -> {Uplinked | Ignored | Verifying -> {Uplinked | TimedOut}}
 */
@Getter
@AllArgsConstructor
public enum NodeStateEnum {
    ANALYZING("01", "图像分析"),
    VERIFYING("02", "P2P 校验中"),
    UPLINKED("03", "已上报网关"),
    TIMED_OUT("04", "校验超时"),
    IGNORED("05", "低置信度忽略");

    private final String code;
    private final String desc;
}
