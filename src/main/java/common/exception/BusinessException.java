package common.exception;

/**
 * 业务异常（配置文件读取、参数非法等可预期错误）
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
