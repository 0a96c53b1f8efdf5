package common.consts;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * P2P 报文类型
 */
@Getter
@AllArgsConstructor
public enum MessageKindEnum {
    VERIFY_REQ("VERIFY_REQ", "校验请求"),
    VERIFY_RESP("VERIFY_RESP", "校验确认");

    private final String code;
    private final String desc;
}
