package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 节点所在的环
 */
@Getter
@AllArgsConstructor
public enum RingEnum {
    OUTER("outer", "外环"),
    INNER("inner", "内环");

    private final String code;
    private final String desc;

    /**
     * 节点ID前缀，如 outer_0
     */
    public String nodeId(int index) {
        return code + "_" + index;
    }
}
