package common.exception;

import common.Result;
import common.consts.ErrorCodes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import service.impl.DiagnosticLog;

/**
 * 全局异常处理器
 * 捕获所有异常，记录日志并写入诊断日志
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private final DiagnosticLog diagnosticLog;

    public GlobalExceptionHandler(DiagnosticLog diagnosticLog) {
        this.diagnosticLog = diagnosticLog;
    }

    /**
     * 处理业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public Result handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        diagnosticLog.recordError("业务异常: " + e.getMessage(), e);
        return Result.error(400, e.getMessage());
    }

    /**
     * 请求体无法反序列化
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("请求体格式错误: {}", e.getMessage());
        diagnosticLog.recordError("请求体格式错误", e);
        return Result.error(400, "请求体格式错误");
    }

    /**
     * 处理所有其他异常
     */
    @ExceptionHandler(Exception.class)
    public Result handleException(Exception e) {
        log.error("系统异常", e);
        diagnosticLog.recordError("系统异常: " + e.getClass().getSimpleName(), e);
        return Result.error(ErrorCodes.SYSTEM_ERROR + ": " + e.getMessage());
    }
}
