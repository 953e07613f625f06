package model.bo;

import common.consts.DiagnosticTypeEnum;
import lombok.Value;

/**
 * 解析诊断记录
 */
@Value
public class Diagnostic {
    DiagnosticTypeEnum type;
    Integer stackNumber;   // 相关堆栈号 (可为空)
    String containerId;    // 相关箱号 (可为空)
    String message;
}
