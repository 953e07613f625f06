package common.exception;

/**
 * 业务异常
 * 调用方参数或配置错误时抛出，由 GlobalExceptionHandler 统一转换为 Result
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }

    public BusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
