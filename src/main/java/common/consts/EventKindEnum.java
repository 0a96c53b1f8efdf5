package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 环境事件类别：真实入侵或噪声
 */
@Getter
@AllArgsConstructor
public enum EventKindEnum {
    INTRUDER("intruder", "入侵目标"),
    NOISE("noise", "噪声/误触发");

    private final String code;
    private final String desc;
}
